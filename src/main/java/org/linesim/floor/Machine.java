package org.linesim.floor;

import org.linesim.maintenance.Maintainable;
import org.linesim.resources.ReservedResources;
import org.linesim.resources.ResourceManager;
import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.ToDoubleFunction;

/**
 * A processing station. Extends {@link PartHandler} with finish-processing callbacks, scheduled
 * failures, uptime and utilization accounting, optional processing resources and maintenance
 * support.
 * <p>
 * If processing resources are configured they are reserved before a part is accepted. When they
 * are not available the machine registers a waiter with the {@link ResourceManager} and rejects
 * the part; once the waiter fires the machine asks its upstream devices for a part again. After a
 * cycle the resources are released by a {@link EventType#RELEASE_RESERVED_RESOURCES} event unless
 * the machine has already received its next part, in which case it keeps them.
 * </p>
 * <p>
 * As a {@link Maintainable} a machine shuts down when work starts and is restored when it ends.
 * Work orders take no time, capacity or money unless a {@link WorkOrderPolicy} says otherwise.
 * </p>
 */
public class Machine extends PartHandler implements Maintainable {

    /**
     * Work order parameters of a machine, each computed from the work order tag.
     *
     * @param duration how long a work order takes
     * @param capacity how much maintainer capacity it needs
     * @param cost     one-time cost charged to the maintainer
     */
    public record WorkOrderPolicy(ToDoubleFunction<Object> duration,
                                  ToDoubleFunction<Object> capacity,
                                  ToDoubleFunction<Object> cost) {

        public static final WorkOrderPolicy NONE = fixed(0.0, 0.0, 0.0);

        public WorkOrderPolicy {
            Objects.requireNonNull(duration, "Duration function cannot be null");
            Objects.requireNonNull(capacity, "Capacity function cannot be null");
            Objects.requireNonNull(cost, "Cost function cannot be null");
        }

        /**
         * Same parameters for every tag.
         */
        public static WorkOrderPolicy fixed(double duration, double capacity, double cost) {
            return new WorkOrderPolicy(tag -> duration, tag -> capacity, tag -> cost);
        }
    }

    private final Map<String, Double> resourcesForProcessing;
    private final List<BiConsumer<Machine, Part>> finishProcessingCallbacks = new ArrayList<>();
    private WorkOrderPolicy workOrderPolicy = WorkOrderPolicy.NONE;
    private ReservedResources reservedResources;
    private boolean waitingForResources = false;

    private double uptime = 0.0;
    private Double lastRestore;
    private double timeInUse = 0.0;
    private Double lastUseStart;

    /**
     * Creates a machine.
     *
     * @param simulation             simulation the machine belongs to
     * @param name                   name of the machine, or null for a generated one
     * @param cycleTime              processing time per part
     * @param value                  starting value
     * @param resourcesForProcessing resources to hold while processing a part, may be empty
     */
    public Machine(Simulation simulation, String name, double cycleTime, double value,
                   Map<String, Double> resourcesForProcessing) {
        super(simulation, name, cycleTime, value);
        this.resourcesForProcessing = new LinkedHashMap<>(
                Objects.requireNonNull(resourcesForProcessing, "Resources cannot be null, use an empty map"));
    }

    public Machine(Simulation simulation, String name, double cycleTime) {
        this(simulation, name, cycleTime, 0.0, Map.of());
    }

    @Override
    protected void onInitialize() {
        super.onInitialize();
        lastRestore = getSimulation().getNow();
    }

    /**
     * Returns how long the machine has been operational so far.
     * @return total uptime
     */
    public double getUptime() {
        return lastRestore == null ? uptime : uptime + (getSimulation().getNow() - lastRestore);
    }

    /**
     * Returns how long the machine has been processing parts so far.
     * @return total processing time
     */
    public double getUtilizationTime() {
        return lastUseStart == null ? timeInUse : timeInUse + (getSimulation().getNow() - lastUseStart);
    }

    public Map<String, Double> getResourcesForProcessing() {
        return Map.copyOf(resourcesForProcessing);
    }

    /**
     * Returns the resources the machine currently holds.
     * @return the reservation, or empty
     */
    public Optional<ReservedResources> getReservedResources() {
        return Optional.ofNullable(reservedResources);
    }

    public WorkOrderPolicy getWorkOrderPolicy() {
        return workOrderPolicy;
    }

    public void setWorkOrderPolicy(WorkOrderPolicy workOrderPolicy) {
        this.workOrderPolicy = Objects.requireNonNull(workOrderPolicy, "Work order policy cannot be null");
    }

    @Override
    protected boolean canAcceptPart(Part part) {
        if (!super.canAcceptPart(part)) {
            return false;
        }
        if (!resourcesForProcessing.isEmpty() && reservedResources == null) {
            ResourceManager manager = getSimulation().getResourceManager();
            Optional<ReservedResources> reservation = manager.reserve(resourcesForProcessing);
            if (reservation.isEmpty()) {
                if (!waitingForResources) {
                    waitingForResources = true;
                    manager.reserveWithCallback(resourcesForProcessing, (rm, request) -> onResourcesAvailable());
                }
                return false;
            }
            reservedResources = reservation.get();
        }
        return true;
    }

    private void onResourcesAvailable() {
        waitingForResources = false;
        notifyUpstreamOfAvailableSpace();
    }

    @Override
    protected void onCycleStarted() {
        lastUseStart = getSimulation().getNow();
    }

    @Override
    protected void finishCycle() {
        super.finishCycle();
        if (lastUseStart != null) {
            timeInUse += getSimulation().getNow() - lastUseStart;
            lastUseStart = null;
        }
        if (reservedResources != null) {
            clock().schedule(getSimulation().getNow(), getId(), this::releaseResourcesIfIdle,
                    EventType.RELEASE_RESERVED_RESOURCES, "By " + getName());
        }
        for (BiConsumer<Machine, Part> c : finishProcessingCallbacks) {
            c.accept(this, output);
        }
        record("produced_part", partDatapoint(output));
    }

    private void releaseResourcesIfIdle() {
        if (!isOperational() || input == null) {
            releaseReservedResources();
        }
    }

    private void releaseReservedResources() {
        if (reservedResources != null) {
            reservedResources.release();
            reservedResources = null;
        }
    }

    /**
     * Schedules a failure of this machine.
     *
     * @param time  simulation time of the failure
     * @param label label of the failure event
     */
    public void scheduleFailure(double time, String label) {
        clock().schedule(time, getId(), this::fail, EventType.FAIL, label == null ? "" : label);
    }

    @Override
    protected void onShutdown(boolean failure, Part lostPart) {
        if (failure) {
            releaseReservedResources();
        }
        double now = getSimulation().getNow();
        if (lastRestore != null) {
            uptime += now - lastRestore;
            lastRestore = null;
        }
        if (lastUseStart != null) {
            timeInUse += now - lastUseStart;
            lastUseStart = null;
        }
    }

    @Override
    protected void onRestored() {
        double now = getSimulation().getNow();
        lastRestore = now;
        if (input != null) {
            lastUseStart = now;
        }
    }

    /**
     * Registers a callback for every finished part. It runs before the part is passed on, so it
     * may modify the part.
     *
     * @param callback receives this machine and the processed part
     */
    public void addFinishProcessingCallback(BiConsumer<Machine, Part> callback) {
        finishProcessingCallbacks.add(Objects.requireNonNull(callback, "Callback cannot be null"));
    }

    @Override
    public double getWorkOrderDuration(Object tag) {
        return workOrderPolicy.duration().applyAsDouble(tag);
    }

    @Override
    public double getWorkOrderCapacity(Object tag) {
        return workOrderPolicy.capacity().applyAsDouble(tag);
    }

    @Override
    public double getWorkOrderCost(Object tag) {
        return workOrderPolicy.cost().applyAsDouble(tag);
    }

    @Override
    public void startWork(Object tag) {
        shutdown();
    }

    @Override
    public void endWork(Object tag) {
        restore();
    }
}
