package org.linesim.floor;

import org.linesim.runtime.StateViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A set of devices used at several places of a production line.
 * <p>
 * Each place is a {@link GroupPath}. A part entering through a path has that path pushed onto its
 * return-address stack; when the part leaves the group's output devices it is handed to the
 * downstream of the path on top of the stack, and the entry is popped once the handoff succeeded.
 * Nested groups work the same way, the innermost path is always on top.
 * </p>
 * <p>
 * Members may only be wired to other members. The group adds an internal input device upstream of
 * its input devices and an internal output device downstream of its output devices.
 * </p>
 */
public class Group {

    private final String name;
    private final List<PartFlowController> devices;
    private final List<GroupPath> paths = new ArrayList<>();
    private final GroupInput inputDevice;
    private final GroupOutput outputDevice;

    public Group(String name, List<? extends PartFlowController> devices) {
        this(name, devices, null, null);
    }

    /**
     * Creates a group.
     *
     * @param name           name of the group
     * @param devices        member devices; by default the first is the input and the last the output
     * @param inputOverride  input devices to use instead of the first member, or null
     * @param outputOverride output devices to use instead of the last member, or null
     * @throws TopologyException if a member is wired to a device outside the group
     */
    public Group(String name, List<? extends PartFlowController> devices,
                 List<? extends PartFlowController> inputOverride,
                 List<? extends PartFlowController> outputOverride) {
        this.name = Objects.requireNonNull(name, "Group name cannot be null");
        if (devices == null || devices.isEmpty()) {
            throw new IllegalArgumentException("Group '" + name + "' needs at least one device.");
        }
        Set<PartFlowController> members = new LinkedHashSet<>(devices);
        if (inputOverride != null) {
            members.addAll(inputOverride);
        }
        if (outputOverride != null) {
            members.addAll(outputOverride);
        }
        for (PartFlowController device : members) {
            for (PartFlowController d : device.getDownstream()) {
                if (!members.contains(d)) {
                    throw new TopologyException(String.format("Device '%s' of group '%s' has downstream '%s' outside of the group.",
                            device.getName(), name, d.getName()));
                }
            }
            for (PartFlowController u : device.getUpstream()) {
                if (!members.contains(u)) {
                    throw new TopologyException(String.format("Device '%s' of group '%s' has upstream '%s' outside of the group.",
                            device.getName(), name, u.getName()));
                }
            }
        }
        for (PartFlowController device : members) {
            device.joinGroup(this);
        }
        this.devices = List.copyOf(members);

        List<PartFlowController> inputs = inputOverride != null ? List.copyOf(inputOverride) : List.of(devices.get(0));
        List<PartFlowController> outputs = outputOverride != null
                ? List.copyOf(outputOverride) : List.of(devices.get(devices.size() - 1));
        this.inputDevice = new GroupInput(this, inputs);
        this.outputDevice = new GroupOutput(this, outputs);
    }

    public String getName() {
        return name;
    }

    public List<PartFlowController> getDevices() {
        return devices;
    }

    public List<GroupPath> getPaths() {
        return Collections.unmodifiableList(paths);
    }

    /**
     * Creates a new place where the group is used in the line.
     *
     * @param pathName name of the path device, or null for a generated one
     * @return the path; wire it like any other device
     */
    public GroupPath newGroupPath(String pathName) {
        return new GroupPath(this, pathName);
    }

    void addPath(GroupPath path) {
        paths.add(path);
    }

    GroupInput getInputDevice() {
        return inputDevice;
    }

    GroupOutput getOutputDevice() {
        return outputDevice;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Entry of the group. Its upstream devices are the upstream devices of all paths.
     */
    static final class GroupInput extends PartFlowController {

        private final Group group;

        GroupInput(Group group, List<PartFlowController> inputDevices) {
            super(inputDevices.get(0).getSimulation(), group.getName() + "_input");
            this.group = group;
            joinGroup(group);
            for (PartFlowController d : inputDevices) {
                d.setUpstream(this);
            }
        }

        @Override
        public List<PartFlowController> getUpstream() {
            List<PartFlowController> all = new ArrayList<>();
            for (GroupPath path : group.paths) {
                for (PartFlowController u : path.getUpstream()) {
                    if (!all.contains(u)) {
                        all.add(u);
                    }
                }
            }
            return Collections.unmodifiableList(all);
        }

        @Override
        public void setUpstream(List<? extends PartFlowController> newUpstream) {
            if (newUpstream != null && !newUpstream.isEmpty()) {
                throw new TopologyException("The input of group '" + group.getName() + "' is fed through its group paths.");
            }
            super.setUpstream(newUpstream);
        }

        @Override
        public boolean givePart(Part part) {
            return passThrough(part, false);
        }

        @Override
        public void spaceAvailableDownstream() {
            notifyUpstreamOfAvailableSpace();
        }

        @Override
        public void notifyUpstreamOfAvailableSpace() {
            for (GroupPath path : group.paths) {
                path.notifyUpstreamOfAvailableSpace();
            }
        }
    }

    /**
     * Exit of the group. Routes each part to the downstream of the path it entered through.
     */
    static final class GroupOutput extends PartFlowController {

        private final Group group;

        GroupOutput(Group group, List<PartFlowController> outputDevices) {
            super(outputDevices.get(0).getSimulation(), group.getName() + "_output");
            this.group = group;
            joinGroup(group);
            setUpstream(outputDevices);
        }

        @Override
        public List<PartFlowController> getDownstream() {
            List<PartFlowController> all = new ArrayList<>();
            for (GroupPath path : group.paths) {
                for (PartFlowController d : path.getDownstream()) {
                    if (!all.contains(d)) {
                        all.add(d);
                    }
                }
            }
            return Collections.unmodifiableList(all);
        }

        @Override
        protected void validateNewDownstream(PartFlowController candidate) {
            throw new TopologyException("The output of group '" + group.getName() + "' leads to the downstream of its group paths.");
        }

        @Override
        public void spaceAvailableDownstream() {
            notifyUpstreamOfAvailableSpace();
        }

        /**
         * @throws StateViolationException if the part carries no return address
         */
        @Override
        public boolean givePart(Part part) {
            GroupPath path = part.groupPaths().poll();
            if (path == null) {
                throw new StateViolationException(String.format(
                        "Part '%s' is leaving group '%s' but does not know which group path it entered through.",
                        part.getName(), group.getName()));
            }
            // Popped while passing so an enclosing group's output sees its own path on top.
            boolean passed = path.passToDownstream(part);
            if (!passed) {
                part.groupPaths().push(path);
            }
            return passed;
        }
    }
}
