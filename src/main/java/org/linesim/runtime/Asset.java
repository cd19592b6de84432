package org.linesim.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of everything that takes part in a simulation: devices, parts, maintainers and
 * schedules. An asset has an id that is unique within its {@link Simulation}, a name and a
 * monetary value whose changes are kept in a history.
 * <p>
 * Non-transitory assets register with their simulation on construction and are initialized by
 * it. Transitory assets such as parts are initialized by whoever creates them.
 * </p>
 */
public abstract class Asset {

    private final Simulation simulation;
    private final long id;
    private final String name;
    private final double initialValue;
    private final List<ValueChange> valueHistory = new ArrayList<>();
    private double value;
    private boolean initialized = false;

    /**
     * One change of an asset's value.
     *
     * @param label    what the change was for
     * @param time     simulation time of the change
     * @param delta    by how much the value changed
     * @param newValue value after the change
     */
    public record ValueChange(String label, double time, double delta, double newValue) {
    }

    /**
     * Creates an asset.
     *
     * @param simulation  simulation the asset belongs to
     * @param name        name of the asset, or null for {@code <ClassName>_<id>}
     * @param value       starting value
     * @param transitory  if false the asset registers with the simulation
     */
    protected Asset(Simulation simulation, String name, double value, boolean transitory) {
        this.simulation = Objects.requireNonNull(simulation, "Simulation cannot be null");
        this.id = simulation.nextAssetId();
        this.name = name != null ? name : getClass().getSimpleName() + "_" + id;
        this.initialValue = value;
        this.value = value;
        if (!transitory) {
            simulation.register(this);
        }
    }

    /**
     * Prepares the asset for simulation. Called once by the simulation for registered assets,
     * or by the creator for transitory ones.
     *
     * @throws StateViolationException if the asset was already initialized
     */
    public final void initialize() {
        if (initialized) {
            throw new StateViolationException("Asset '" + name + "' (id " + id + ") is already initialized.");
        }
        initialized = true;
        value = initialValue;
        valueHistory.clear();
        onInitialize();
    }

    /**
     * Hook for subclasses; runs once when the asset is initialized.
     */
    protected void onInitialize() {
    }

    public boolean isInitialized() {
        return initialized;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    /**
     * Returns every value change in the order it happened.
     * @return an unmodifiable view of the history
     */
    public List<ValueChange> getValueHistory() {
        return Collections.unmodifiableList(valueHistory);
    }

    /**
     * Increases the value of the asset and records the change.
     *
     * @param label what the change is for
     * @param delta amount to add, may be negative
     */
    public void addValue(String label, double delta) {
        value += delta;
        valueHistory.add(new ValueChange(label, simulation.getNow(), delta, value));
    }

    /**
     * Decreases the value of the asset and records the change.
     *
     * @param label what the cost is for
     * @param cost  amount to subtract
     */
    public void addCost(String label, double cost) {
        addValue(label, -cost);
    }

    /**
     * Shorthand for the owning simulation's clock.
     * @return the clock
     */
    protected Clock clock() {
        return simulation.getClock();
    }

    /**
     * Shorthand for {@link Simulation#addDatapoint(String, String, Object)} with this asset's name as subject.
     *
     * @param category datapoint category
     * @param payload  datapoint payload
     */
    protected void record(String category, Object payload) {
        simulation.addDatapoint(category, name, payload);
    }

    @Override
    public String toString() {
        return name;
    }
}
