package org.linesim.runtime;

import java.util.Comparator;

/**
 * A single scheduled action of the {@link Clock}.
 * <p>
 * Everything except the due time and the cancel/pause markers is fixed at creation. The due
 * time only moves when a paused event is resumed.
 * </p>
 */
public final class Event {

    /**
     * Execution order: time, then kind, then the random tie-break, then the actor id. The
     * insertion sequence only separates events that are equal in all of those.
     */
    static final Comparator<Event> ORDER = Comparator
            .comparingDouble(Event::getTime)
            .thenComparing(Event::getType)
            .thenComparingDouble(Event::getTieBreak)
            .thenComparingLong(Event::getActorId)
            .thenComparingLong(e -> e.sequence);

    private double time;
    private final long actorId;
    private final Runnable action;
    private final EventType type;
    private final String label;
    private final double tieBreak;
    private final long sequence;

    private boolean cancelled;
    private boolean executed;
    private Double pausedAt;

    Event(double time, long actorId, Runnable action, EventType type, String label, double tieBreak, long sequence) {
        this.time = time;
        this.actorId = actorId;
        this.action = action;
        this.type = type;
        this.label = label;
        this.tieBreak = tieBreak;
        this.sequence = sequence;
    }

    public double getTime() {
        return time;
    }

    public long getActorId() {
        return actorId;
    }

    public EventType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public double getTieBreak() {
        return tieBreak;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExecuted() {
        return executed;
    }

    /**
     * Returns the simulation time at which this event was paused, or {@code null} if it is not paused.
     *
     * @return pause time or null
     */
    public Double getPausedAt() {
        return pausedAt;
    }

    void cancel() {
        this.cancelled = true;
    }

    void pause(double now) {
        this.pausedAt = now;
    }

    void resume(double now) {
        this.time += now - pausedAt;
        this.pausedAt = null;
    }

    void execute() {
        if (cancelled || executed) {
            return;
        }
        executed = true;
        action.run();
    }

    @Override
    public String toString() {
        return String.format("Event[time=%s, actor=%d, type=%s, label='%s', cancelled=%s, pausedAt=%s]",
                time, actorId, type, label, cancelled, pausedAt);
    }
}
