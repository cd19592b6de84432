package org.linesim.floor;

import org.linesim.runtime.Asset;
import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Steps through {@code (duration, state)} entries and performs an action on every registered
 * object each time the state changes, in registration order. Objects registered without an
 * action of their own get {@link #defaultAction(Object, double, Object)}.
 *
 * @param <S> type of the states
 */
public class ActionScheduler<S> extends Asset {

    /**
     * Action performed on a registered object when the state changes.
     *
     * @param <S> type of the states
     */
    @FunctionalInterface
    public interface Action<S> {
        void perform(ActionScheduler<S> scheduler, Object target, double time, S newState);
    }

    /**
     * One step of the schedule.
     *
     * @param duration how long the state lasts
     * @param state    the state
     */
    public record Entry<S>(double duration, S state) {
        public Entry {
            if (Double.isNaN(duration) || duration < 0) {
                throw new IllegalArgumentException("Schedule entry duration must be >= 0, got " + duration);
            }
        }
    }

    private final List<Entry<S>> entries;
    private final boolean cyclical;
    private final Map<Object, Action<S>> registered = new LinkedHashMap<>();
    private int index = 0;
    private S state;

    /**
     * Creates an action scheduler.
     *
     * @param simulation simulation the scheduler belongs to
     * @param name       name of the scheduler, or null for a generated one
     * @param entries    the steps, at least one
     * @param cyclical   whether to start over after the last entry; otherwise the last state stays
     */
    public ActionScheduler(Simulation simulation, String name, List<Entry<S>> entries, boolean cyclical) {
        super(simulation, name, 0.0, false);
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("A schedule needs at least one entry.");
        }
        if (cyclical && entries.stream().mapToDouble(Entry::duration).sum() <= 0) {
            throw new IllegalArgumentException("A cyclical schedule needs a positive total duration.");
        }
        this.entries = new ArrayList<>(entries);
        this.cyclical = cyclical;
    }

    @Override
    protected void onInitialize() {
        index = 0;
        applyCurrentEntry();
    }

    public S getCurrentState() {
        return state;
    }

    /**
     * Registers an object for state change actions.
     *
     * @param target         the object
     * @param overrideAction action to perform instead of the default one, or null
     * @return false if the object was already registered
     */
    public boolean registerObject(Object target, Action<S> overrideAction) {
        Objects.requireNonNull(target, "Target cannot be null");
        if (registered.containsKey(target)) {
            return false;
        }
        registered.put(target, overrideAction);
        return true;
    }

    public boolean registerObject(Object target) {
        return registerObject(target, null);
    }

    /**
     * Stops performing actions for an object.
     *
     * @param target a registered object
     * @return false if it was not registered
     */
    public boolean unregisterObject(Object target) {
        if (!registered.containsKey(target)) {
            return false;
        }
        registered.remove(target);
        return true;
    }

    /**
     * Action for objects registered without their own. Does nothing unless overridden.
     *
     * @param target   the registered object
     * @param time     time of the state change
     * @param newState the new state
     */
    protected void defaultAction(Object target, double time, S newState) {
    }

    private void advance() {
        index++;
        if (index >= entries.size()) {
            if (!cyclical) {
                return;
            }
            index = 0;
        }
        applyCurrentEntry();
    }

    private void applyCurrentEntry() {
        Entry<S> entry = entries.get(index);
        state = entry.state();
        double now = getSimulation().getNow();
        record("schedule_update", Arrays.asList(now, state));
        for (Map.Entry<Object, Action<S>> r : new ArrayList<>(registered.entrySet())) {
            if (r.getValue() == null) {
                defaultAction(r.getKey(), now, state);
            } else {
                r.getValue().perform(this, r.getKey(), now, state);
            }
        }
        clock().schedule(now + entry.duration(), getId(), this::advance,
                EventType.OTHER_HIGH_PRIORITY, "Schedule update: " + getName());
    }
}
