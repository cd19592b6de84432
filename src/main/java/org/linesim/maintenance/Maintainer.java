package org.linesim.maintenance;

import org.linesim.runtime.Asset;
import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Works on maintenance requests with a limited capacity.
 * <p>
 * Requests are served first come first served, with one exception: when the capacity left is
 * too small for the oldest queued request, later requests that do fit are admitted ahead of it.
 * Admitted work starts with a {@link EventType#START_WORK} event at the same time and finishes
 * with a {@link EventType#FINISH_WORK} event after the target's work order duration. Finishing
 * frees the capacity and scans the queue again right away.
 * </p>
 */
public class Maintainer extends Asset {

    private static final Logger LOG = LoggerFactory.getLogger(Maintainer.class);

    private final double capacity;
    private final List<WorkOrder> queue = new ArrayList<>();
    private final List<WorkOrder> active = new ArrayList<>();
    private double utilization = 0.0;

    /**
     * Creates a maintainer.
     *
     * @param simulation simulation the maintainer belongs to
     * @param name       name of the maintainer, or null for a generated one
     * @param capacity   total capacity, may be {@link Double#POSITIVE_INFINITY}
     */
    public Maintainer(Simulation simulation, String name, double capacity) {
        super(simulation, name, 0.0, false);
        if (Double.isNaN(capacity) || capacity < 0) {
            throw new IllegalArgumentException("Maintainer capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
    }

    public Maintainer(Simulation simulation, String name) {
        this(simulation, name, Double.POSITIVE_INFINITY);
    }

    @Override
    protected void onInitialize() {
        utilization = 0.0;
        queue.clear();
        active.clear();
    }

    public double getTotalCapacity() {
        return capacity;
    }

    public double getAvailableCapacity() {
        return capacity - utilization;
    }

    /**
     * Returns the capacity occupied by active work orders.
     * @return used capacity
     */
    public double getUtilization() {
        return utilization;
    }

    public List<WorkOrder> getQueuedWorkOrders() {
        return Collections.unmodifiableList(new ArrayList<>(queue));
    }

    public List<WorkOrder> getActiveWorkOrders() {
        return Collections.unmodifiableList(new ArrayList<>(active));
    }

    public boolean createWorkOrder(Maintainable target) {
        return createWorkOrder(target, null);
    }

    /**
     * Queues a work order and tries to admit queued work right away.
     *
     * @param target what to work on
     * @param tag    which work to do, may be null
     * @return false if the same target and tag is already queued or active
     */
    public boolean createWorkOrder(Maintainable target, Object tag) {
        Objects.requireNonNull(target, "Target cannot be null");
        if (isRequested(target, tag)) {
            return false;
        }
        double needed = target.getWorkOrderCapacity(tag);
        if (Double.isNaN(needed) || needed < 0) {
            throw new IllegalArgumentException(String.format(
                    "Work order capacity of '%s' for tag %s must be >= 0, got %s", target.getName(), tag, needed));
        }
        double now = getSimulation().getNow();
        record("enter_queue", Arrays.asList(now, target.getName(), tag));
        queue.add(new WorkOrder(target, tag, needed, now));
        tryWorkingRequests();
        return true;
    }

    private boolean isRequested(Maintainable target, Object tag) {
        for (WorkOrder w : queue) {
            if (w.matches(target, tag)) {
                return true;
            }
        }
        for (WorkOrder w : active) {
            if (w.matches(target, tag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Admits every queued work order that fits into the remaining capacity, scanning the queue in
     * order. Called automatically when work orders are created or finished.
     */
    public void tryWorkingRequests() {
        Iterator<WorkOrder> it = queue.iterator();
        while (it.hasNext()) {
            WorkOrder order = it.next();
            if (utilization <= capacity - order.getNeededCapacity()) {
                it.remove();
                active.add(order);
                utilization += order.getNeededCapacity();
                LOG.debug("{} admitted {} at t={}", getName(), order, getSimulation().getNow());
                clock().schedule(getSimulation().getNow(), getId(), () -> startWorkOrder(order),
                        EventType.START_WORK, "Start work order: " + order.getTarget().getName());
            }
        }
    }

    private void startWorkOrder(WorkOrder order) {
        Maintainable target = order.getTarget();
        double now = getSimulation().getNow();
        double duration = target.getWorkOrderDuration(order.getTag());
        order.markStarted(now);
        record("start_work_order", Arrays.asList(now, target.getName(), order.getTag()));
        addCost("work order - tag:" + order.getTag() + " target:" + target.getName(),
                target.getWorkOrderCost(order.getTag()));

        target.startWork(order.getTag());
        clock().schedule(now + duration, getId(), () -> finishWorkOrder(order),
                EventType.FINISH_WORK, "End work order: " + target.getName());
    }

    private void finishWorkOrder(WorkOrder order) {
        order.getTarget().endWork(order.getTag());
        utilization -= order.getNeededCapacity();
        active.remove(order);
        record("finish_work_order", Arrays.asList(getSimulation().getNow(), order.getTarget().getName(), order.getTag()));
        LOG.debug("{} finished {} at t={}", getName(), order, getSimulation().getNow());
        tryWorkingRequests();
    }
}
