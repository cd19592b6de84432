package org.linesim.runtime;

/**
 * Wraps any exception thrown by an event action, adding the event's context. The original
 * exception is always available as the cause.
 */
public class EventExecutionException extends RuntimeException {

    private final double time;
    private final long actorId;
    private final String label;
    private final EventType type;

    EventExecutionException(Event event, Throwable cause) {
        super(String.format("Event failed at time=%s actor=%d type=%s label='%s': %s",
                event.getTime(), event.getActorId(), event.getType(), event.getLabel(), cause.getMessage()), cause);
        this.time = event.getTime();
        this.actorId = event.getActorId();
        this.label = event.getLabel();
        this.type = event.getType();
    }

    public double getTime() {
        return time;
    }

    public long getActorId() {
        return actorId;
    }

    public String getLabel() {
        return label;
    }

    public EventType getType() {
        return type;
    }
}
