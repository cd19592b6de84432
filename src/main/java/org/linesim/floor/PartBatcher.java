package org.linesim.floor;

import org.linesim.runtime.Simulation;

import java.util.List;

/**
 * Re-packs incoming parts and batches into batches of a fixed size, or unpacks them into single
 * parts. Incoming batches are always dissolved; output batches are new. Parts that do not fill a
 * batch yet wait inside the batcher.
 */
public class PartBatcher extends PartHandler {

    private final int outputBatchSize;
    private Batch inProgressBatch;

    /**
     * Creates a batcher.
     *
     * @param simulation      simulation the batcher belongs to
     * @param name            name of the batcher, or null for a generated one
     * @param outputBatchSize parts per output batch, or 0 to output single parts
     */
    public PartBatcher(Simulation simulation, String name, int outputBatchSize) {
        super(simulation, name, 0.0);
        if (outputBatchSize < 0) {
            throw new IllegalArgumentException("Output batch size must be >= 0, got " + outputBatchSize);
        }
        this.outputBatchSize = outputBatchSize;
    }

    @Override
    protected void onInitialize() {
        super.onInitialize();
        inProgressBatch = null;
    }

    public int getOutputBatchSize() {
        return outputBatchSize;
    }

    /**
     * Returns how many parts wait for their batch to fill up.
     * @return parts in the incomplete batch
     */
    public int getPendingPartCount() {
        return inProgressBatch == null ? 0 : inProgressBatch.size();
    }

    @Override
    protected void tryMoveToOutput() {
        if (!isOperational() || input == null || output != null) {
            return;
        }
        while (output == null && input != null) {
            Part next = takeFromInput();
            if (next != null) {
                addToOutput(next);
            }
        }
        if (output != null) {
            schedulePassPartDownstream();
        } else {
            notifyUpstreamOfAvailableSpace();
        }
    }

    private Part takeFromInput() {
        if (input instanceof Batch batch) {
            if (batch.isEmpty()) {
                input = null;
                return null;
            }
            Part part = batch.removeFirstPart();
            if (batch.isEmpty()) {
                input = null;
            }
            return part;
        }
        Part part = input;
        input = null;
        return part;
    }

    private void addToOutput(Part part) {
        if (outputBatchSize == 0) {
            output = part;
            return;
        }
        if (inProgressBatch == null) {
            inProgressBatch = new Batch(getSimulation(), null, List.of());
            inProgressBatch.initialize();
        }
        inProgressBatch.addPart(part);
        if (inProgressBatch.size() >= outputBatchSize) {
            output = inProgressBatch;
            inProgressBatch = null;
        }
    }

    @Override
    protected void onPartPassed(Part part) {
        tryMoveToOutput();
    }
}
