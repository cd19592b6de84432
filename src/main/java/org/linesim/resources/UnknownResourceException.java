package org.linesim.resources;

/**
 * Thrown when a reservation is asked to release a resource it never reserved.
 */
public class UnknownResourceException extends CapacityViolationException {

    public UnknownResourceException(String resourceName) {
        super(resourceName, String.format("Resource '%s' is not part of this reservation.", resourceName));
    }
}
