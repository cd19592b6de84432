package org.linesim.floor;

import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;

import java.util.List;
import java.util.Objects;

/**
 * Start of a production line. Every cycle it makes a copy of a template part and passes it
 * downstream; the next cycle starts only after the previous part was taken. The value of each
 * supplied part is charged to the source as a cost.
 */
public class Source extends PartHandler {

    /** Budget meaning "no limit". */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final Part templatePart;
    private long remainingParts;
    private long producedParts = 0;
    private double costOfProducedParts = 0.0;
    private boolean cyclePending = false;
    private boolean idle = false;

    /**
     * Creates a source.
     *
     * @param simulation     simulation the source belongs to
     * @param name           name of the source, or null for a generated one
     * @param templatePart   part to copy; it is never passed on itself
     * @param cycleTime      time to produce one part
     * @param remainingParts how many parts to supply, {@link #UNLIMITED} for no limit
     */
    public Source(Simulation simulation, String name, Part templatePart, double cycleTime, long remainingParts) {
        super(simulation, name, cycleTime);
        this.templatePart = Objects.requireNonNull(templatePart, "Template part cannot be null");
        if (remainingParts < 0) {
            throw new IllegalArgumentException("Remaining parts must be >= 0, got " + remainingParts);
        }
        this.remainingParts = remainingParts;
    }

    public Source(Simulation simulation, String name, double cycleTime) {
        this(simulation, name, new Part(simulation), cycleTime, UNLIMITED);
    }

    @Override
    protected void onInitialize() {
        super.onInitialize();
        if (!templatePart.isInitialized()) {
            templatePart.initialize();
        }
        producedParts = 0;
        costOfProducedParts = 0.0;
        idle = false;
        cyclePending = false;
        scheduleNextPart();
    }

    /**
     * A source has no upstream.
     *
     * @throws TopologyException if the list is not empty
     */
    @Override
    public void setUpstream(List<? extends PartFlowController> newUpstream) {
        if (newUpstream != null && !newUpstream.isEmpty()) {
            throw new TopologyException("Source '" + getName() + "' cannot have an upstream.");
        }
        super.setUpstream(newUpstream);
    }

    @Override
    protected boolean canAcceptPart(Part part) {
        return false;
    }

    @Override
    public Double getWaitingSince() {
        return null;
    }

    public Part getTemplatePart() {
        return templatePart;
    }

    public long getRemainingParts() {
        return remainingParts;
    }

    /**
     * Changes how many more parts the source supplies. A cycle in progress is not affected; an
     * idle source starts producing again if the budget becomes positive.
     *
     * @param remainingParts new budget, {@link #UNLIMITED} for no limit
     */
    public void setRemainingParts(long remainingParts) {
        if (remainingParts < 0) {
            throw new IllegalArgumentException("Remaining parts must be >= 0, got " + remainingParts);
        }
        this.remainingParts = remainingParts;
        if (idle && remainingParts > 0 && isInitialized()) {
            idle = false;
            scheduleNextPart();
        }
    }

    public long getProducedParts() {
        return producedParts;
    }

    /**
     * Returns the summed value of the parts supplied so far.
     * @return cost of supplied parts
     */
    public double getCostOfProducedParts() {
        return costOfProducedParts;
    }

    private void scheduleNextPart() {
        cyclePending = true;
        clock().schedule(getSimulation().getNow() + nextCycleDuration(), getId(), this::prepareNextPart,
                EventType.FINISH_PROCESSING, "By " + getName());
    }

    private void prepareNextPart() {
        cyclePending = false;
        if (remainingParts <= 0) {
            idle = true;
            return;
        }
        Part part = templatePart.makeCopy();
        part.initialize();
        part.addRoutingHistory(this);
        output = part;
        schedulePassPartDownstream();
    }

    @Override
    protected void onPartPassed(Part part) {
        producedParts++;
        if (remainingParts != UNLIMITED && remainingParts > 0) {
            remainingParts--;
        }
        costOfProducedParts += part.getValue();
        record("supplied_new_part", List.of(getSimulation().getNow(), part.getId()));
        addCost("supplied_part", part.getValue());
        scheduleNextPart();
    }

    @Override
    protected void onShutdown(boolean failure, Part lostPart) {
        if (failure) {
            cyclePending = false;
        }
    }

    @Override
    protected void resumeFlow() {
        if (output != null) {
            schedulePassPartDownstream();
        } else if (!cyclePending && !idle) {
            scheduleNextPart();
        }
    }
}
