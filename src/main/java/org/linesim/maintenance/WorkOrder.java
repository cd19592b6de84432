package org.linesim.maintenance;

import java.util.Objects;

/**
 * A maintenance request for one target and tag. Queued on creation, active once the maintainer
 * admits it, and dropped when the work is finished.
 */
public final class WorkOrder {

    private final Maintainable target;
    private final Object tag;
    private final double neededCapacity;
    private final double queuedAt;
    private Double startedAt;

    WorkOrder(Maintainable target, Object tag, double neededCapacity, double queuedAt) {
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.tag = tag;
        this.neededCapacity = neededCapacity;
        this.queuedAt = queuedAt;
    }

    public Maintainable getTarget() {
        return target;
    }

    public Object getTag() {
        return tag;
    }

    public double getNeededCapacity() {
        return neededCapacity;
    }

    public double getQueuedAt() {
        return queuedAt;
    }

    /**
     * Returns when the work started, or null while the work order is queued or admitted but not
     * started yet.
     * @return start time or null
     */
    public Double getStartedAt() {
        return startedAt;
    }

    void markStarted(double time) {
        this.startedAt = time;
    }

    boolean matches(Maintainable otherTarget, Object otherTag) {
        return target == otherTarget && Objects.equals(tag, otherTag);
    }

    @Override
    public String toString() {
        return "WorkOrder[target=" + target.getName() + ", tag=" + tag + ", capacity=" + neededCapacity + "]";
    }
}
