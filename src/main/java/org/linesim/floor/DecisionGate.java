package org.linesim.floor;

import org.linesim.runtime.Simulation;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Pass-through device that only lets parts through if a predicate accepts them. A rejected part
 * stays with the upstream device, which may offer it to its next downstream candidate.
 */
public class DecisionGate extends PartFlowController {

    private final Predicate<Part> shouldPass;

    public DecisionGate(Simulation simulation, String name, Predicate<Part> shouldPass) {
        super(simulation, name);
        this.shouldPass = Objects.requireNonNull(shouldPass, "Predicate cannot be null");
    }

    @Override
    protected boolean canAcceptPart(Part part) {
        return super.canAcceptPart(part) && shouldPass.test(part);
    }
}
