package org.linesim.floor;

import org.linesim.runtime.Simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A part that groups other parts so they move together. A batch has no value of its own; its
 * value is the sum of its members and routing history is recorded on every member as well.
 */
public class Batch extends Part {

    private final List<Part> parts = new ArrayList<>();

    public Batch(Simulation simulation) {
        this(simulation, null, List.of());
    }

    /**
     * Creates a batch.
     *
     * @param simulation simulation the batch belongs to
     * @param name       name of the batch, or null for {@code Batch_<id>}
     * @param parts      initial members
     */
    public Batch(Simulation simulation, String name, List<? extends Part> parts) {
        super(simulation, name, 0.0, 0.0);
        for (Part p : parts) {
            addPart(p);
        }
    }

    @Override
    protected void onInitialize() {
        super.onInitialize();
        for (Part p : parts) {
            if (!p.isInitialized()) {
                p.initialize();
            }
        }
    }

    public List<Part> getParts() {
        return Collections.unmodifiableList(parts);
    }

    public int size() {
        return parts.size();
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    public void addPart(Part part) {
        if (part == this) {
            throw new IllegalArgumentException("A batch cannot contain itself.");
        }
        parts.add(Objects.requireNonNull(part, "Part cannot be null"));
    }

    /**
     * Takes the first member out of the batch.
     * @return the removed part
     */
    public Part removeFirstPart() {
        if (parts.isEmpty()) {
            throw new IllegalStateException("Batch '" + getName() + "' is empty.");
        }
        return parts.remove(0);
    }

    @Override
    public double getValue() {
        double sum = 0.0;
        for (Part p : parts) {
            sum += p.getValue();
        }
        return sum;
    }

    /**
     * Not supported, the value of a batch is derived from its members.
     */
    @Override
    public void addValue(String label, double delta) {
        throw new UnsupportedOperationException("Batch has no value of its own, change the value of its parts.");
    }

    @Override
    public void addRoutingHistory(PartFlowController device) {
        super.addRoutingHistory(device);
        for (Part p : parts) {
            p.addRoutingHistory(device);
        }
    }

    @Override
    public void removeLastRoutingHistory() {
        super.removeLastRoutingHistory();
        for (Part p : parts) {
            p.removeLastRoutingHistory();
        }
    }

    /**
     * Copies the batch together with a copy of every member.
     */
    @Override
    public Batch makeCopy() {
        Batch copy = new Batch(getSimulation(), nextCopyName(), List.of());
        for (Part p : parts) {
            copy.addPart(p.makeCopy());
        }
        return copy;
    }
}
