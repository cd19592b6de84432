package org.linesim.floor;

/**
 * One place in the line where a {@link Group} is used. Parts given to the path enter the group;
 * when they leave it they are passed to the downstream devices of this path.
 */
public class GroupPath extends PartFlowController {

    private final Group group;

    GroupPath(Group group, String name) {
        super(group.getDevices().get(0).getSimulation(), name);
        this.group = group;
        group.addPath(this);
    }

    public Group getGroup() {
        return group;
    }

    /**
     * Reports the waiting time of the group's input devices.
     */
    @Override
    public Double getWaitingSince() {
        return group.getInputDevice().getWaitingSince();
    }

    @Override
    public void spaceAvailableDownstream() {
        group.getOutputDevice().spaceAvailableDownstream();
    }

    @Override
    public boolean givePart(Part part) {
        if (!canAcceptPart(part)) {
            return false;
        }
        part.groupPaths().push(this);
        part.addRoutingHistory(this);
        boolean passed = group.getInputDevice().givePart(part);
        if (!passed) {
            part.groupPaths().pop();
            part.removeLastRoutingHistory();
        }
        return passed;
    }

    boolean passToDownstream(Part part) {
        for (PartFlowController d : getSortedDownstream()) {
            if (d.givePart(part)) {
                return true;
            }
        }
        return false;
    }
}
