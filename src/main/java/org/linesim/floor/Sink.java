package org.linesim.floor;

import org.linesim.runtime.Simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * End of a production line. Accepts parts without passing them anywhere and adds their value
 * to its own; the sink's value is the output value of the line.
 */
public class Sink extends PartHandler {

    private final boolean collectParts;
    private final List<Part> collectedParts = new ArrayList<>();
    private long receivedPartsCount = 0;
    private double valueOfReceivedParts = 0.0;

    /**
     * Creates a sink.
     *
     * @param simulation   simulation the sink belongs to
     * @param name         name of the sink, or null for a generated one
     * @param cycleTime    minimum time between two received parts
     * @param collectParts whether to keep every received part
     */
    public Sink(Simulation simulation, String name, double cycleTime, boolean collectParts) {
        super(simulation, name, cycleTime);
        this.collectParts = collectParts;
    }

    public Sink(Simulation simulation, String name) {
        this(simulation, name, 0.0, false);
    }

    @Override
    protected void onInitialize() {
        super.onInitialize();
        collectedParts.clear();
        receivedPartsCount = 0;
        valueOfReceivedParts = 0.0;
    }

    /**
     * @throws TopologyException always, a sink has no downstream
     */
    @Override
    protected void validateNewDownstream(PartFlowController candidate) {
        throw new TopologyException("Sink '" + getName() + "' cannot have a downstream, tried to add '"
                + candidate.getName() + "'.");
    }

    /**
     * Returns how many parts arrived. A batch counts as the number of parts it contains.
     * @return received part count
     */
    public long getReceivedPartsCount() {
        return receivedPartsCount;
    }

    public double getValueOfReceivedParts() {
        return valueOfReceivedParts;
    }

    /**
     * Returns the received parts, if the sink collects them.
     * @return collected parts in arrival order
     */
    public List<Part> getCollectedParts() {
        return Collections.unmodifiableList(collectedParts);
    }

    @Override
    protected void onReceivedPart(Part part) {
        receivedPartsCount += part instanceof Batch batch ? batch.size() : 1;
        double value = part.getValue();
        valueOfReceivedParts += value;
        addValue("collected_part", value);
        if (collectParts) {
            collectedParts.add(part);
        }
        record("collected_part", List.of(getSimulation().getNow(), part.getId(), value));
        super.onReceivedPart(part);
    }

    @Override
    protected void finishCycle() {
        super.finishCycle();
        output = null;
        notifyUpstreamOfAvailableSpace();
    }

    @Override
    protected void schedulePassPartDownstream() {
        // parts end here
    }
}
