package org.linesim.resources;

/**
 * Thrown when a change to the resource pools would break their accounting: reducing a pool's
 * capacity below zero or giving back more than a reservation holds.
 */
public class CapacityViolationException extends RuntimeException {

    private final String resourceName;

    /**
     * Creates a new CapacityViolationException.
     *
     * @param resourceName resource the violation concerns
     * @param message      description of the violation
     */
    public CapacityViolationException(String resourceName, String message) {
        super(message);
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
