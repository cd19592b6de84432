package org.linesim.runtime;

/**
 * Signals that an engine invariant was broken, e.g. a processing cycle finishing on a device
 * that is not operational. These are never recovered from: the running event fails and the
 * clock aborts the run.
 */
public class StateViolationException extends RuntimeException {

    /**
     * Creates a new StateViolationException.
     *
     * @param message description of the broken invariant, including the offending asset
     */
    public StateViolationException(String message) {
        super(message);
    }
}
