package org.linesim.floor;

import org.linesim.junit.extensions.logging.LogWatchExtension;
import org.linesim.runtime.Simulation;
import org.junit.jupiter.api.BeforeEach;
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
class BufferTest {

    private Simulation sim;
    private List<Double> arrivals;

    @BeforeEach
    void setUp() {
        sim = new Simulation(42L);
        arrivals = new ArrayList<>();
    }

    @Test
    @DisplayName("A part stays in the buffer for at least the minimum delay")
    void minimumDelayHoldsParts() {
        Source source = new Source(sim, "source", new Part(sim), 3.0, 1);
        Buffer buffer = new Buffer(sim, "buffer", 5, 5.0);
        buffer.setUpstream(source);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(buffer);
        sink.addReceivePartCallback((device, part) -> arrivals.add(sim.getNow()));

        sim.simulate(7.0);
        assertThat(buffer.level()).isEqualTo(1);

        sim.simulate(3.0);
        assertThat(arrivals).containsExactly(8.0);
        assertThat(buffer.level()).isZero();
    }

    @Test
    @DisplayName("A short minimum delay is kept late in a long run")
    void shortDelayAtLargeSimulationTime() {
        double start = 1.0e7;
        Source source = new Source(sim, "source", new Part(sim), start, 1);
        Buffer buffer = new Buffer(sim, "buffer", 5, 0.005);
        buffer.setUpstream(source);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(buffer);
        sink.addReceivePartCallback((device, part) -> arrivals.add(sim.getNow()));

        sim.simulate(start + 1.0);

        assertThat(arrivals).containsExactly(start + 0.005);
        assertThat(arrivals.get(0)).isGreaterThan(start);
    }

    @Test
    @DisplayName("The buffer fills up to its capacity and releases parts in arrival order")
    void capacityAndFifoOrder() {
        Source source = new Source(sim, "source", new Part(sim, "p", 0.0, 1.0), 0.0, Source.UNLIMITED);
        Buffer buffer = new Buffer(sim, "buffer", 3);
        buffer.setUpstream(source);
        Machine machine = new Machine(sim, "m", 10.0);
        machine.setUpstream(buffer);
        Sink sink = new Sink(sim, "sink", 0.0, true);
        sink.setUpstream(machine);

        sim.simulate(1.0);

        assertThat(buffer.level()).isEqualTo(3);
        assertThat(buffer.getStoredParts()).extracting(Part::getName).containsExactly("p_2", "p_3", "p_4");
        assertThat(machine.getInputPart().getName()).isEqualTo("p_1");

        sim.simulate(34.0);

        assertThat(sink.getCollectedParts()).extracting(Part::getName).containsExactly("p_1", "p_2", "p_3");
        assertThat(buffer.level()).isEqualTo(3);
    }

    @Test
    @DisplayName("A failed buffer keeps its stored parts and passes them on after restore")
    void failureKeepsStoredParts() {
        Source source = new Source(sim, "source", new Part(sim), 0.0, 2);
        Buffer buffer = new Buffer(sim, "buffer", 5);
        buffer.setUpstream(source);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(buffer);
        sink.blockInput(true);

        sim.simulate(1.0);
        buffer.fail();

        assertThat(buffer.getState()).isEqualTo(DeviceState.FAILED);
        assertThat(buffer.level()).isEqualTo(2);

        sink.blockInput(false);
        sim.simulate(1.0);
        assertThat(sink.getReceivedPartsCount()).isZero();

        buffer.restore();
        sim.simulate(1.0);
        assertThat(sink.getReceivedPartsCount()).isEqualTo(2);
        assertThat(buffer.level()).isZero();
    }

    @Test
    void invalidParametersAreRejected() {
        assertThatThrownBy(() -> new Buffer(sim, "b", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Buffer(sim, "b", 1, -1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
