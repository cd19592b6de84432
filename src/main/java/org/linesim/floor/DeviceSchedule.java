package org.linesim.floor;

import org.linesim.runtime.Asset;
import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Operating hours for devices. The schedule steps through {@code (duration, active)} entries;
 * while it is inactive the devices bound to it do not accept new parts but finish the ones they
 * hold. Becoming active asks the upstream devices of every bound device for parts.
 */
public class DeviceSchedule extends Asset {

    /**
     * One step of a schedule.
     *
     * @param duration how long the state lasts
     * @param active   whether bound devices accept parts meanwhile
     */
    public record Entry(double duration, boolean active) {
        public Entry {
            if (Double.isNaN(duration) || duration < 0) {
                throw new IllegalArgumentException("Schedule entry duration must be >= 0, got " + duration);
            }
        }
    }

    private final List<Entry> entries;
    private final boolean cyclical;
    private final List<PartFlowController> devices = new ArrayList<>();
    private int index = 0;
    private boolean active = true;

    /**
     * Creates a schedule.
     *
     * @param simulation simulation the schedule belongs to
     * @param name       name of the schedule, or null for a generated one
     * @param entries    the steps, at least one
     * @param cyclical   whether to start over after the last entry; otherwise the last state stays
     */
    public DeviceSchedule(Simulation simulation, String name, List<Entry> entries, boolean cyclical) {
        super(simulation, name, 0.0, false);
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("A schedule needs at least one entry.");
        }
        if (cyclical && entries.size() > 1 && entries.stream().mapToDouble(Entry::duration).sum() <= 0) {
            throw new IllegalArgumentException("A cyclical schedule needs a positive total duration.");
        }
        this.entries = List.copyOf(entries);
        this.cyclical = cyclical;
    }

    @Override
    protected void onInitialize() {
        index = 0;
        applyCurrentEntry();
    }

    public boolean isActive() {
        return active;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public List<PartFlowController> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    void addDevice(PartFlowController device) {
        Objects.requireNonNull(device, "Device cannot be null");
        if (!devices.contains(device)) {
            devices.add(device);
        }
    }

    void removeDevice(PartFlowController device) {
        devices.remove(device);
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
        Entry entry = entries.get(index);
        active = entry.active();
        if (active) {
            for (PartFlowController d : new ArrayList<>(devices)) {
                d.notifyUpstreamOfAvailableSpace();
            }
        }
        record("schedule_update", List.of(getSimulation().getNow(), active));
        // A single entry never changes.
        if (entries.size() > 1) {
            clock().schedule(getSimulation().getNow() + entry.duration(), getId(), this::advance,
                    EventType.OTHER_HIGH_PRIORITY, "Schedule update: " + getName());
        }
    }
}
