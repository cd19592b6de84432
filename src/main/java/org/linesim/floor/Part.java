package org.linesim.floor;

import org.linesim.runtime.Asset;
import org.linesim.runtime.Simulation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * An item moving through the production line. Besides the value inherited from {@link Asset} a
 * part carries a quality and the list of devices it passed through, in visitation order.
 * <p>
 * Parts are transitory: they do not register with the simulation and are initialized by whoever
 * creates them, usually a {@link Source}.
 * </p>
 */
public class Part extends Asset {

    private final double initialQuality;
    private final List<PartFlowController> routingHistory = new ArrayList<>();
    private final Deque<GroupPath> groupPathStack = new ArrayDeque<>();
    private double quality;
    private int copyCounter = 0;

    public Part(Simulation simulation) {
        this(simulation, null, 0.0, 1.0);
    }

    /**
     * Creates a part.
     *
     * @param simulation simulation the part belongs to
     * @param name       name of the part, or null for {@code Part_<id>}
     * @param value      starting value
     * @param quality    starting quality
     */
    public Part(Simulation simulation, String name, double value, double quality) {
        super(simulation, name, value, true);
        this.initialQuality = quality;
        this.quality = quality;
    }

    @Override
    protected void onInitialize() {
        quality = initialQuality;
        routingHistory.clear();
        groupPathStack.clear();
        copyCounter = 0;
    }

    public double getQuality() {
        return quality;
    }

    public void setQuality(double quality) {
        this.quality = quality;
    }

    /**
     * Returns the devices the part passed through, first visited first.
     * @return a copy of the routing history
     */
    public List<PartFlowController> getRoutingHistory() {
        return Collections.unmodifiableList(new ArrayList<>(routingHistory));
    }

    /**
     * Appends a device to the routing history.
     *
     * @param device the device the part is entering
     */
    public void addRoutingHistory(PartFlowController device) {
        routingHistory.add(Objects.requireNonNull(device, "Device cannot be null"));
    }

    /**
     * Removes the most recent routing history entry. Used when a device tentatively accepted the
     * part but could not hand it on.
     */
    public void removeLastRoutingHistory() {
        if (routingHistory.isEmpty()) {
            throw new IllegalStateException("Routing history of part '" + getName() + "' is empty.");
        }
        routingHistory.remove(routingHistory.size() - 1);
    }

    /**
     * Returns the return addresses of the groups the part is currently inside.
     * @return a copy, innermost group path first
     */
    public List<GroupPath> getGroupPathStack() {
        return List.copyOf(groupPathStack);
    }

    Deque<GroupPath> groupPaths() {
        return groupPathStack;
    }

    /**
     * Creates an uninitialized copy with the current value and quality, a fresh id and an empty
     * routing history. Copies are named {@code <name>_<n>}.
     *
     * @return the copy
     */
    public Part makeCopy() {
        return new Part(getSimulation(), nextCopyName(), getValue(), quality);
    }

    protected String nextCopyName() {
        copyCounter++;
        return getName() + "_" + copyCounter;
    }
}
