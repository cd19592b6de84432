package org.linesim.resources;

/**
 * Thrown when a reservation is asked to release more of a resource than it holds.
 */
public class OverReleaseException extends CapacityViolationException {

    public OverReleaseException(String resourceName, double requested, double held) {
        super(resourceName, String.format("Trying to release %s of '%s' but only %s is reserved.", requested, resourceName, held));
    }
}
