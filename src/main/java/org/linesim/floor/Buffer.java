package org.linesim.floor;

import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Stores up to {@code capacity} parts and passes them on in the order they arrived.
 * <p>
 * With a minimum delay a part stays in the buffer for at least that long, even if a downstream
 * device is free earlier. A blocked head part holds back every part behind it.
 * </p>
 */
public class Buffer extends PartHandler {

    private record StoredPart(Part part, double readyAt) {
    }

    private final int capacity;
    private final double minimumDelay;
    private final Deque<StoredPart> stored = new ArrayDeque<>();
    private boolean retryScheduled = false;

    /**
     * Creates a buffer.
     *
     * @param simulation   simulation the buffer belongs to
     * @param name         name of the buffer, or null for a generated one
     * @param capacity     maximum number of stored parts, at least 1
     * @param minimumDelay minimum time a part stays in the buffer, at least 0
     */
    public Buffer(Simulation simulation, String name, int capacity, double minimumDelay) {
        super(simulation, name, 0.0);
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be >= 1, got " + capacity);
        }
        if (Double.isNaN(minimumDelay) || minimumDelay < 0) {
            throw new IllegalArgumentException("Minimum delay must be >= 0, got " + minimumDelay);
        }
        this.capacity = capacity;
        this.minimumDelay = minimumDelay;
    }

    public Buffer(Simulation simulation, String name, int capacity) {
        this(simulation, name, capacity, 0.0);
    }

    @Override
    protected void onInitialize() {
        super.onInitialize();
        stored.clear();
        retryScheduled = false;
    }

    public int getCapacity() {
        return capacity;
    }

    public double getMinimumDelay() {
        return minimumDelay;
    }

    /**
     * Returns how many parts the buffer holds.
     * @return number of stored parts
     */
    public int level() {
        return stored.size();
    }

    /**
     * Returns the stored parts, next to leave first.
     * @return a copy of the contents
     */
    public List<Part> getStoredParts() {
        List<Part> parts = new ArrayList<>();
        for (StoredPart s : stored) {
            parts.add(s.part());
        }
        return parts;
    }

    @Override
    protected boolean canAcceptPart(Part part) {
        return part != null && isAcceptingParts() && stored.size() < capacity;
    }

    @Override
    protected void acceptPart(Part part) {
        double now = getSimulation().getNow();
        stored.addLast(new StoredPart(part, now + minimumDelay));
        part.addRoutingHistory(this);
        setWaitingSince(null);
        announceReceivedPart(part);
        schedulePassPartDownstream();
        if (stored.size() < capacity) {
            notifyUpstreamOfAvailableSpace();
        }
    }

    @Override
    public void notifyUpstreamOfAvailableSpace() {
        if (stored.size() < capacity) {
            super.notifyUpstreamOfAvailableSpace();
        }
    }

    @Override
    protected void passPartDownstream() {
        if (!isOperational()) {
            return;
        }
        boolean passedAny = false;
        while (!stored.isEmpty()) {
            StoredPart head = stored.peekFirst();
            if (!isReady(head.readyAt())) {
                scheduleRetry(head.readyAt());
                break;
            }
            if (!offerDownstream(head.part())) {
                setWaitingForDownstreamSpace(true);
                break;
            }
            stored.pollFirst();
            passedAny = true;
            onPartPassed(head.part());
        }
        if (passedAny) {
            notifyUpstreamOfAvailableSpace();
        }
    }

    private boolean offerDownstream(Part part) {
        for (PartFlowController d : getSortedDownstream()) {
            if (d.givePart(part)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The retry for a waiting head part is scheduled at exactly its {@code readyAt}, so the clock
     * time equals the stored value when it fires. A delay below the time resolution at
     * {@code now} rounds {@code readyAt} down to {@code now} and the part is ready at once.
     */
    private boolean isReady(double readyAt) {
        return getSimulation().getNow() >= readyAt;
    }

    private void scheduleRetry(double readyAt) {
        if (retryScheduled) {
            return;
        }
        retryScheduled = true;
        clock().schedule(readyAt, getId(), () -> {
            retryScheduled = false;
            passPartDownstream();
        }, EventType.PASS_PART, "Delayed from " + getName());
    }

    /**
     * A buffer keeps its stored parts when it fails; only pending events are lost.
     */
    @Override
    protected void onShutdown(boolean failure, Part lostPart) {
        if (failure) {
            retryScheduled = false;
        }
    }

    @Override
    protected void resumeFlow() {
        if (!stored.isEmpty()) {
            schedulePassPartDownstream();
        }
        notifyUpstreamOfAvailableSpace();
    }
}
