package org.linesim.runtime;

import org.linesim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * The simulation timeline. Holds pending actions, advances simulation time and executes the
 * single highest-priority action that is due.
 * <p>
 * Events are ordered by time, then {@link EventType} (declaration order is execution order),
 * then a random tie-break drawn from the injected {@link IRandomProvider}, then the actor id.
 * With the same provider seed two identical configurations execute identical event sequences.
 * </p>
 * <p>
 * A clock is confined to one thread. Independent replications each need their own clock.
 * </p>
 */
public class Clock {

    private static final Logger LOG = LoggerFactory.getLogger(Clock.class);

    /**
     * Actor id used for events owned by the engine itself. Matching operations ignore it.
     */
    public static final long ENGINE_ACTOR_ID = -1L;

    private final IRandomProvider tieBreaks;
    private final PriorityQueue<Event> events = new PriorityQueue<>(Event.ORDER);
    private final List<Event> pausedEvents = new ArrayList<>();
    private final List<EventTrace> trace = new ArrayList<>();

    private double now = 0.0;
    private long nextSequence = 0L;
    private boolean terminated = false;
    private boolean running = false;
    private boolean aborted = false;
    private boolean traceEnabled = false;

    /**
     * Creates a clock at time 0.
     *
     * @param tieBreaks source of the per-event random tie-break values
     */
    public Clock(IRandomProvider tieBreaks) {
        this.tieBreaks = Objects.requireNonNull(tieBreaks, "Tie-break provider cannot be null");
    }

    /**
     * Returns the current simulation time.
     * @return the current time
     */
    public double getNow() {
        return now;
    }

    /**
     * Enables or disables recording of executed events, see {@link #getTrace()}.
     * @param enabled true to record
     */
    public void setTraceEnabled(boolean enabled) {
        this.traceEnabled = enabled;
    }

    /**
     * Returns the executed events recorded while tracing was enabled, in execution order.
     * @return an unmodifiable copy of the trace
     */
    public List<EventTrace> getTrace() {
        return Collections.unmodifiableList(new ArrayList<>(trace));
    }

    /**
     * Schedules an action with {@link EventType#OTHER_LOW_PRIORITY} and an empty label.
     *
     * @see #schedule(double, long, Runnable, EventType, String)
     */
    public void schedule(double time, long actorId, Runnable action) {
        schedule(time, actorId, action, EventType.OTHER_LOW_PRIORITY, "");
    }

    /**
     * Schedules an action to run at the given simulation time.
     *
     * @param time    when to run the action, never earlier than {@link #getNow()}
     * @param actorId id of the asset that owns the action; pausing or cancelling this actor affects the event
     * @param action  the action to run
     * @param type    kind of the event, decides order among events at the same time
     * @param label   free-form text kept with the event for diagnostics
     * @throws InvalidScheduleException if {@code time} is before the current time
     */
    public void schedule(double time, long actorId, Runnable action, EventType type, String label) {
        Objects.requireNonNull(action, "Event action cannot be null");
        Objects.requireNonNull(type, "Event type cannot be null");
        if (Double.isNaN(time)) {
            throw new IllegalArgumentException("Event time cannot be NaN, label='" + label + "'");
        }
        if (time < now) {
            throw new InvalidScheduleException(time, now, label);
        }
        events.add(new Event(time, actorId, action, type, label == null ? "" : label,
                tieBreaks.nextDouble(), nextSequence++));
    }

    /**
     * Executes the next due event. Cancelled events met on the way are discarded without moving
     * the clock.
     *
     * @return false if no executable event was left
     * @throws EventExecutionException if the event's action threw
     */
    public boolean step() {
        Event next = events.poll();
        while (next != null && next.isCancelled()) {
            next = events.poll();
        }
        if (next == null) {
            return false;
        }

        now = next.getTime();
        if (traceEnabled) {
            trace.add(new EventTrace(next.getTime(), next.getActorId(), next.getLabel(), next.getType()));
        }
        LOG.trace("t={} actor={} type={} label='{}'", next.getTime(), next.getActorId(), next.getType(), next.getLabel());

        try {
            next.execute();
        } catch (RuntimeException e) {
            aborted = true;
            LOG.error("Event failed: time={} actor={} type={} label='{}': {}",
                    next.getTime(), next.getActorId(), next.getType(), next.getLabel(), e.getMessage());
            throw new EventExecutionException(next, e);
        }
        return true;
    }

    /**
     * Runs the simulation for the given duration. A terminate marker is scheduled at
     * {@code now + duration} as the last event of that instant and events are executed until
     * it fires or nothing is left to execute. A finished run can be continued with another call.
     *
     * @param duration how long to run, in simulation time
     * @throws IllegalStateException if called from inside a running action or after a failed event aborted the clock
     */
    public void run(double duration) {
        if (aborted) {
            throw new IllegalStateException("Clock was aborted by a failed event and cannot run again.");
        }
        if (running) {
            throw new IllegalStateException("Clock is already running; run() cannot be called from an event action.");
        }
        if (Double.isNaN(duration) || duration < 0) {
            throw new IllegalArgumentException("Simulation duration must be >= 0, got " + duration);
        }

        terminated = false;
        running = true;
        schedule(now + duration, ENGINE_ACTOR_ID, () -> terminated = true, EventType.TERMINATE, "terminate");
        try {
            while (!terminated && step()) {
                // keep stepping
            }
        } finally {
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * Marks every queued and paused event of the actor as cancelled. Executed events are unaffected.
     *
     * @param actorId actor whose events to cancel
     */
    public void cancelMatching(long actorId) {
        if (actorId < 0) return;
        for (Event e : events) {
            if (e.getActorId() == actorId) {
                e.cancel();
            }
        }
        Iterator<Event> it = pausedEvents.iterator();
        while (it.hasNext()) {
            Event e = it.next();
            if (e.getActorId() == actorId) {
                e.cancel();
                it.remove();
            }
        }
    }

    /**
     * Moves every queued event of the actor out of the timeline, remembering the current time.
     *
     * @param actorId actor whose events to pause
     */
    public void pauseMatching(long actorId) {
        if (actorId < 0) return;
        List<Event> matching = new ArrayList<>();
        for (Event e : events) {
            if (e.getActorId() == actorId && !e.isCancelled()) {
                matching.add(e);
            }
        }
        events.removeAll(matching);
        for (Event e : matching) {
            e.pause(now);
            pausedEvents.add(e);
        }
    }

    /**
     * Puts the actor's paused events back on the timeline, each delayed by how long it was paused.
     *
     * @param actorId actor whose events to resume
     */
    public void resumeMatching(long actorId) {
        if (actorId < 0) return;
        Iterator<Event> it = pausedEvents.iterator();
        while (it.hasNext()) {
            Event e = it.next();
            if (e.getActorId() == actorId) {
                it.remove();
                e.resume(now);
                events.add(e);
            }
        }
    }

    /**
     * Returns the number of queued events, cancelled ones included until they are popped.
     * @return queued event count
     */
    public int getPendingEventCount() {
        return events.size();
    }

    public int getPausedEventCount() {
        return pausedEvents.size();
    }
}
