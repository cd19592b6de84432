package org.linesim.runtime;

/**
 * Thrown when an event is scheduled before the current simulation time.
 */
public class InvalidScheduleException extends RuntimeException {

    private final double requestedTime;
    private final double now;

    /**
     * Creates a new InvalidScheduleException.
     *
     * @param requestedTime the time the caller asked for
     * @param now           the current simulation time
     * @param label         label of the rejected event
     */
    public InvalidScheduleException(double requestedTime, double now, String label) {
        super(String.format("Cannot schedule events in the past: now=%s, time=%s, label='%s'", now, requestedTime, label));
        this.requestedTime = requestedTime;
        this.now = now;
    }

    public double getRequestedTime() {
        return requestedTime;
    }

    public double getNow() {
        return now;
    }
}
