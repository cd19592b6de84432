package org.linesim.floor;

import org.linesim.junit.extensions.logging.LogWatchExtension;
import org.linesim.runtime.Simulation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DeviceScheduleTest {

    @Test
    @DisplayName("Devices accept parts only while their schedule is active")
    void inactiveScheduleStopsIntake() {
        Simulation sim = new Simulation(42L);
        Source source = new Source(sim, "source", 1.0);
        PartHandler station = new PartHandler(sim, "station", 0.0);
        station.setUpstream(source);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(station);
        List<Double> arrivals = new ArrayList<>();
        sink.addReceivePartCallback((device, part) -> arrivals.add(sim.getNow()));

        DeviceSchedule shift = new DeviceSchedule(sim, "shift", List.of(
                new DeviceSchedule.Entry(5.0, false),
                new DeviceSchedule.Entry(5.0, true)), true);
        station.setSchedule(shift);

        sim.simulate(12.0);

        assertThat(arrivals).containsExactly(5.0, 6.0, 7.0, 8.0, 9.0);
        assertThat(shift.isActive()).isFalse();
        assertThat(shift.getDevices()).containsExactly(station);
    }

    @Test
    @DisplayName("A non-cyclical schedule keeps its last state")
    void nonCyclicalKeepsLastState() {
        Simulation sim = new Simulation(42L);
        DeviceSchedule schedule = new DeviceSchedule(sim, "once", List.of(
                new DeviceSchedule.Entry(2.0, true),
                new DeviceSchedule.Entry(2.0, false)), false);

        sim.simulate(10.0);

        assertThat(schedule.isActive()).isFalse();
    }

    @Test
    void rebindingMovesTheDevice() {
        Simulation sim = new Simulation(42L);
        PartHandler station = new PartHandler(sim, "station", 0.0);
        DeviceSchedule first = new DeviceSchedule(sim, "first", List.of(new DeviceSchedule.Entry(1.0, true)), false);
        DeviceSchedule second = new DeviceSchedule(sim, "second", List.of(new DeviceSchedule.Entry(1.0, true)), false);

        station.setSchedule(first);
        station.setSchedule(second);

        assertThat(first.getDevices()).isEmpty();
        assertThat(second.getDevices()).containsExactly(station);

        station.setSchedule(null);
        assertThat(second.getDevices()).isEmpty();
    }

    @Test
    void invalidSchedulesAreRejected() {
        Simulation sim = new Simulation(42L);

        assertThatThrownBy(() -> new DeviceSchedule(sim, "empty", List.of(), true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeviceSchedule.Entry(-1.0, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeviceSchedule(sim, "zero", List.of(
                new DeviceSchedule.Entry(0.0, true), new DeviceSchedule.Entry(0.0, false)), true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
