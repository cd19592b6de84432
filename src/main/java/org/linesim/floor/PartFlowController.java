package org.linesim.floor;

import org.linesim.runtime.Asset;
import org.linesim.runtime.Simulation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Base device of a production line. A flow controller holds no parts and adds no delay: it
 * accepts a part only if one of its downstream devices takes it right away.
 * <p>
 * Edges are kept on both ends. {@link #setUpstream(List)} is the only way to wire devices; it
 * registers this device as a downstream of every new upstream and removes it from the old ones.
 * </p>
 * <p>
 * Backpressure works with two signals. A device that has room calls
 * {@link #notifyUpstreamOfAvailableSpace()}, which calls {@link #spaceAvailableDownstream()} on
 * every upstream. An upstream holding a finished part then retries handing it over.
 * </p>
 */
public class PartFlowController extends Asset {

    private List<PartFlowController> upstream = new ArrayList<>();
    private final List<PartFlowController> downstream = new ArrayList<>();
    private final List<Group> joinedGroups = new ArrayList<>();
    private DownstreamPrioritizer prioritizer;
    private DeviceSchedule schedule;
    private boolean inputBlocked = false;
    private boolean resolvingWaitTime = false;

    /**
     * Creates an unwired device.
     *
     * @param simulation simulation the device belongs to
     * @param name       name of the device, or null for a generated one
     * @param value      starting value
     */
    public PartFlowController(Simulation simulation, String name, double value) {
        super(simulation, name, value, false);
    }

    public PartFlowController(Simulation simulation, String name) {
        this(simulation, name, 0.0);
    }

    /**
     * Returns true if the device can currently handle parts.
     * @return whether the device is operational
     */
    public boolean isOperational() {
        return true;
    }

    public List<PartFlowController> getUpstream() {
        return Collections.unmodifiableList(new ArrayList<>(upstream));
    }

    /**
     * Returns the downstream devices. They are derived from the upstream settings of other
     * devices and cannot be set directly.
     *
     * @return a copy in wiring order
     */
    public List<PartFlowController> getDownstream() {
        return Collections.unmodifiableList(new ArrayList<>(downstream));
    }

    public void setUpstream(PartFlowController... newUpstream) {
        setUpstream(Arrays.asList(newUpstream));
    }

    /**
     * Replaces the upstream devices. The whole list is validated before anything is rewired, so a
     * rejected list leaves the graph as it was.
     *
     * @param newUpstream devices that may pass parts to this one; null means none
     * @throws TopologyException if the list contains this device, a device of a different
     *                           group, or a device that cannot have downstreams
     */
    public void setUpstream(List<? extends PartFlowController> newUpstream) {
        List<PartFlowController> candidates = new ArrayList<>();
        if (newUpstream != null) {
            for (PartFlowController up : newUpstream) {
                Objects.requireNonNull(up, "Upstream device cannot be null");
                if (!candidates.contains(up)) {
                    candidates.add(up);
                }
            }
        }
        for (PartFlowController up : candidates) {
            if (up == this) {
                throw new TopologyException("Device '" + getName() + "' cannot be its own upstream.");
            }
            if (!new HashSet<>(up.joinedGroups).equals(new HashSet<>(joinedGroups))) {
                throw new TopologyException(String.format(
                        "Upstream '%s' is not a member of the same groups as '%s': %s vs %s",
                        up.getName(), getName(), up.joinedGroups, joinedGroups));
            }
            up.validateNewDownstream(this);
        }

        for (PartFlowController up : upstream) {
            up.downstream.remove(this);
        }
        upstream = candidates;
        for (PartFlowController up : upstream) {
            up.addDownstream(this);
        }
    }

    /**
     * Called before {@code candidate} is wired as a downstream of this device.
     *
     * @param candidate the future downstream device
     * @throws TopologyException if this device cannot feed {@code candidate}
     */
    protected void validateNewDownstream(PartFlowController candidate) {
    }

    private void addDownstream(PartFlowController device) {
        if (downstream.contains(device)) {
            return;
        }
        downstream.add(device);
        if (getSimulation().isStarted()) {
            spaceAvailableDownstream();
        }
    }

    /**
     * Returns since when this device has been waiting for a part, or null if it is not waiting.
     * A flow controller does not hold parts, it reports the earliest value of its downstream
     * devices.
     *
     * @return simulation time or null
     */
    public Double getWaitingSince() {
        if (resolvingWaitTime) {
            return null;
        }
        resolvingWaitTime = true;
        try {
            Double earliest = null;
            for (PartFlowController d : getDownstream()) {
                Double since = d.getWaitingSince();
                if (since != null && (earliest == null || since < earliest)) {
                    earliest = since;
                }
            }
            return earliest;
        } finally {
            resolvingWaitTime = false;
        }
    }

    public boolean isInputBlocked() {
        return inputBlocked;
    }

    /**
     * Manually stops or resumes accepting parts. Unblocking notifies the upstream devices.
     *
     * @param blocked true to stop accepting parts
     */
    public void blockInput(boolean blocked) {
        if (inputBlocked == blocked) {
            return;
        }
        inputBlocked = blocked;
        if (!blocked) {
            notifyUpstreamOfAvailableSpace();
        }
    }

    public List<Group> getJoinedGroups() {
        return Collections.unmodifiableList(new ArrayList<>(joinedGroups));
    }

    void joinGroup(Group group) {
        if (!joinedGroups.contains(group)) {
            joinedGroups.add(group);
        }
    }

    /**
     * Returns the prioritizer of this device, falling back to the simulation default.
     * @return the prioritizer in effect
     */
    public DownstreamPrioritizer getPrioritizer() {
        return prioritizer != null ? prioritizer : getSimulation().getDefaultPrioritizer();
    }

    /**
     * Sets the prioritizer used to order the downstream devices.
     * @param prioritizer the prioritizer, or null to use the simulation default
     */
    public void setPrioritizer(DownstreamPrioritizer prioritizer) {
        this.prioritizer = prioritizer;
    }

    /**
     * Returns the downstream devices in the order parts should be offered to them.
     * @return prioritized downstream devices
     */
    public List<PartFlowController> getSortedDownstream() {
        return getPrioritizer().prioritize(getDownstream());
    }

    public DeviceSchedule getSchedule() {
        return schedule;
    }

    /**
     * Binds the device to an operating schedule. While the schedule is inactive the device does
     * not accept parts.
     *
     * @param newSchedule the schedule, or null to always accept
     */
    public void setSchedule(DeviceSchedule newSchedule) {
        if (schedule != null) {
            schedule.removeDevice(this);
        }
        schedule = newSchedule;
        if (schedule != null) {
            schedule.addDevice(this);
        }
    }

    /**
     * Tells every upstream device that this device can take a part.
     */
    public void notifyUpstreamOfAvailableSpace() {
        for (PartFlowController up : upstream) {
            up.spaceAvailableDownstream();
        }
    }

    /**
     * Tells this device that a downstream device may have room now. A flow controller forwards
     * the signal to its own upstream devices.
     */
    public void spaceAvailableDownstream() {
        if (isOperational()) {
            notifyUpstreamOfAvailableSpace();
        }
    }

    /**
     * Offers a part to this device.
     *
     * @param part the part
     * @return true if the part was accepted
     */
    public boolean givePart(Part part) {
        return passThrough(part, true);
    }

    /**
     * Hands a part straight to the first downstream device that accepts it. The device is added
     * to the part's routing history up front and removed again if no downstream device takes it.
     *
     * @param part          the part
     * @param recordRouting whether to add this device to the routing history
     * @return true if a downstream device accepted the part
     */
    protected boolean passThrough(Part part, boolean recordRouting) {
        if (!canAcceptPart(part)) {
            return false;
        }
        if (recordRouting) {
            part.addRoutingHistory(this);
        }
        for (PartFlowController d : getSortedDownstream()) {
            if (d.givePart(part)) {
                return true;
            }
        }
        if (recordRouting) {
            part.removeLastRoutingHistory();
        }
        return false;
    }

    /**
     * Returns true if the device would take this part now.
     *
     * @param part the offered part
     * @return whether to accept
     */
    protected boolean canAcceptPart(Part part) {
        return part != null && isAcceptingParts();
    }

    /**
     * Checks the conditions shared by every device: operational, input not blocked and the
     * bound schedule, if any, active.
     *
     * @return whether parts may enter at all
     */
    protected final boolean isAcceptingParts() {
        return isOperational() && !inputBlocked && (schedule == null || schedule.isActive());
    }
}
