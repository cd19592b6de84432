package org.linesim.floor;

import org.linesim.junit.extensions.logging.ExpectLog;
import org.linesim.junit.extensions.logging.LogLevel;
import org.linesim.junit.extensions.logging.LogWatchExtension;
import org.linesim.runtime.Clock;
import org.linesim.runtime.EventExecutionException;
import org.linesim.runtime.EventType;
import org.linesim.runtime.Simulation;
import org.linesim.runtime.StateViolationException;
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
class PartHandlerTest {

    private Simulation sim;
    private List<Double> arrivals;

    @BeforeEach
    void setUp() {
        sim = new Simulation(42L);
        arrivals = new ArrayList<>();
    }

    private Sink recordingSink(String name, PartFlowController upstream) {
        Sink sink = new Sink(sim, name, 0.0, true);
        sink.setUpstream(upstream);
        sink.addReceivePartCallback((device, part) -> arrivals.add(sim.getNow()));
        return sink;
    }

    @Test
    @DisplayName("Backpressure: an instant source feeding two one-unit stations delivers one part per unit after the pipeline fills")
    void backpressureLimitsThroughput() {
        Source source = new Source(sim, "source", 0.0);
        PartHandler a = new PartHandler(sim, "a", 1.0);
        PartHandler b = new PartHandler(sim, "b", 1.0);
        a.setUpstream(source);
        b.setUpstream(a);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(b);

        sim.simulate(100.0);

        assertThat(sink.getReceivedPartsCount()).isEqualTo(99);
        assertThat(source.getProducedParts()).isEqualTo(101);
    }

    @Test
    @DisplayName("Zero cycle times pass a part through the whole chain in the same instant")
    void zeroCycleChain() {
        Source source = new Source(sim, "source", 1.0);
        PartHandler m1 = new PartHandler(sim, "m1", 0.0);
        PartHandler m2 = new PartHandler(sim, "m2", 0.0);
        m1.setUpstream(source);
        m2.setUpstream(m1);
        recordingSink("sink", m2);

        sim.simulate(3.0);

        assertThat(arrivals).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    @DisplayName("A pass-through device that cannot hand a part on leaves no trace in the routing history")
    void routingHistoryRollsBack() {
        Source source = new Source(sim, "S", new Part(sim), 1.0, 1);
        PartFlowController router = new PartFlowController(sim, "F");
        PartHandler station = new PartHandler(sim, "M", 1.0);
        router.setUpstream(source);
        station.setUpstream(router);
        Sink sink = recordingSink("sink", station);
        station.blockInput(true);

        sim.simulate(3.0);

        assertThat(source.getOutputPart()).isNotNull();
        assertThat(source.getOutputPart().getRoutingHistory()).containsExactly(source);

        station.blockInput(false);
        sim.simulate(7.0);

        assertThat(arrivals).containsExactly(4.0);
        assertThat(sink.getCollectedParts()).singleElement()
                .satisfies(p -> assertThat(p.getRoutingHistory()).containsExactly(source, router, station, sink));
    }

    @Test
    @DisplayName("Shutdown pauses the running cycle and restore continues it")
    void shutdownPausesCycle() {
        Source source = new Source(sim, "source", new Part(sim), 0.0, 1);
        Machine machine = new Machine(sim, "m", 10.0);
        machine.setUpstream(source);
        recordingSink("sink", machine);

        sim.simulate(4.0);
        machine.shutdown();
        assertThat(machine.getState()).isEqualTo(DeviceState.SHUTDOWN);
        assertThat(machine.isOperational()).isFalse();

        sim.simulate(2.0);
        machine.restore();
        sim.simulate(14.0);

        assertThat(arrivals).containsExactly(12.0);
        assertThat(machine.getUptime()).isEqualTo(18.0);
        assertThat(machine.getUtilizationTime()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("A failure loses the part being processed; after restore the next part is accepted")
    void failureLosesInputPart() {
        Source source = new Source(sim, "source", new Part(sim, "p", 0.0, 1.0), 0.0, 2);
        Machine machine = new Machine(sim, "m", 10.0);
        machine.setUpstream(source);
        Sink sink = recordingSink("sink", machine);
        List<Part> lost = new ArrayList<>();
        machine.addShutdownCallback((device, failure, lostPart) -> {
            if (failure) {
                lost.add(lostPart);
            }
        });
        machine.scheduleFailure(4.0, "breakdown");

        sim.simulate(5.0);

        assertThat(machine.getState()).isEqualTo(DeviceState.FAILED);
        assertThat(machine.getInputPart()).isNull();
        assertThat(lost).extracting(Part::getName).containsExactly("p_1");

        machine.restore();
        sim.simulate(15.0);

        assertThat(arrivals).containsExactly(15.0);
        assertThat(sink.getCollectedParts()).extracting(Part::getName).containsExactly("p_2");
        assertThat(machine.getUptime()).isEqualTo(19.0);
    }

    @Test
    @DisplayName("Failing a shut down device cancels its paused events")
    void failAfterShutdownCancelsPausedEvents() {
        Source source = new Source(sim, "source", new Part(sim), 0.0, 1);
        Machine machine = new Machine(sim, "m", 10.0);
        machine.setUpstream(source);
        recordingSink("sink", machine);

        sim.simulate(2.0);
        machine.shutdown();
        assertThat(sim.getClock().getPausedEventCount()).isEqualTo(1);

        machine.fail();
        assertThat(machine.getState()).isEqualTo(DeviceState.FAILED);
        assertThat(sim.getClock().getPausedEventCount()).isZero();

        machine.restore();
        sim.simulate(20.0);
        assertThat(arrivals).isEmpty();
    }

    @Test
    @DisplayName("A one-shot offset changes only the next cycle")
    void cycleTimeOffsetAppliesOnce() {
        Source source = new Source(sim, "source", new Part(sim), 0.0, 2);
        PartHandler station = new PartHandler(sim, "m", 0.0);
        station.setCycleTime(() -> 2.0);
        station.offsetNextCycleTime(3.0);
        station.setUpstream(source);
        recordingSink("sink", station);

        sim.simulate(10.0);

        assertThat(arrivals).containsExactly(5.0, 7.0);
    }

    @Test
    @DisplayName("A cycle time set by a receive callback already applies to the received part")
    void receiveCallbackCanChangeCycleTime() {
        Source source = new Source(sim, "source", new Part(sim), 0.0, 1);
        PartHandler station = new PartHandler(sim, "m", 1.0);
        station.addReceivePartCallback((device, part) -> device.setCycleTime(4.0));
        station.setUpstream(source);
        recordingSink("sink", station);

        sim.simulate(10.0);

        assertThat(arrivals).containsExactly(4.0);
    }

    @Test
    @DisplayName("Negative offsets never make a cycle shorter than zero")
    void cycleNeverNegative() {
        Source source = new Source(sim, "source", new Part(sim), 1.0, 1);
        PartHandler station = new PartHandler(sim, "m", 2.0);
        station.offsetNextCycleTime(-5.0);
        station.setUpstream(source);
        recordingSink("sink", station);

        sim.simulate(3.0);

        assertThat(arrivals).containsExactly(1.0);
    }

    @Test
    void invalidCycleTimeIsRejected() {
        PartHandler station = new PartHandler(sim, "m", 1.0);

        assertThatThrownBy(() -> station.setCycleTime(-1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartHandler(sim, "n", Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A sink with a cycle time limits how often it accepts parts")
    void sinkCycleTimeLimitsRate() {
        Source source = new Source(sim, "source", 0.0);
        Sink sink = new Sink(sim, "sink", 2.0, false);
        sink.setUpstream(source);

        sim.simulate(10.0);

        assertThat(sink.getReceivedPartsCount()).isEqualTo(6);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Event failed.*Cycle finished on device 'm'.*SHUTDOWN.*")
    @DisplayName("A cycle finishing on a shut down device aborts the run")
    void finishOnShutdownDeviceAbortsRun() {
        Source source = new Source(sim, "source", new Part(sim), 0.0, 1);
        PartHandler station = new PartHandler(sim, "m", 10.0);
        station.setUpstream(source);
        recordingSink("sink", station);

        sim.simulate(2.0);
        station.shutdown();
        sim.getClock().schedule(3.0, Clock.ENGINE_ACTOR_ID, station::finishCycle,
                EventType.FINISH_PROCESSING, "stray finish");

        assertThatThrownBy(() -> sim.simulate(5.0))
                .isInstanceOfSatisfying(EventExecutionException.class, e -> {
                    assertThat(e.getLabel()).isEqualTo("stray finish");
                    assertThat(e.getTime()).isEqualTo(3.0);
                    assertThat(e.getCause()).isInstanceOf(StateViolationException.class)
                            .hasMessageContaining("'m'")
                            .hasMessageContaining("SHUTDOWN");
                });
        assertThat(sim.getClock().isAborted()).isTrue();
        assertThat(arrivals).isEmpty();
    }
}
