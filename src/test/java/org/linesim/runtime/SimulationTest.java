package org.linesim.runtime;

import org.linesim.config.SimulationSettings;
import org.linesim.floor.Buffer;
import org.linesim.floor.Machine;
import org.linesim.floor.Part;
import org.linesim.floor.Sink;
import org.linesim.floor.Source;
import org.linesim.junit.extensions.logging.LogWatchExtension;
import org.linesim.runtime.internal.services.InMemoryDataRecorder;
import org.linesim.runtime.internal.services.SeededRandomProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SimulationTest {

    @Test
    @DisplayName("Asset ids are unique and increasing within a simulation, and independent between simulations")
    void assetIdsArePerSimulation() {
        Simulation first = new Simulation(1L);
        Simulation second = new Simulation(1L);

        Sink a = new Sink(first, "a");
        Sink b = new Sink(first, "b");
        Sink c = new Sink(second, "c");

        assertThat(b.getId()).isGreaterThan(a.getId());
        assertThat(c.getId()).isEqualTo(a.getId());
        assertThat(first.getAssets()).containsExactly(a, b);
        assertThat(second.getAssets()).containsExactly(c);
    }

    @Test
    @DisplayName("Parts are transitory and do not register")
    void partsDoNotRegister() {
        Simulation sim = new Simulation(1L);

        Part part = new Part(sim);

        assertThat(sim.getAssets()).isEmpty();
        assertThat(part.isInitialized()).isFalse();
        assertThat(part.getName()).isEqualTo("Part_" + part.getId());
    }

    @Test
    @DisplayName("simulate() initializes registered assets once, later calls continue the run")
    void simulateInitializesAssetsAndContinues() {
        Simulation sim = new Simulation(3L);
        Source source = new Source(sim, "source", 1.0);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(source);

        assertThat(sim.isStarted()).isFalse();
        sim.simulate(5.0);

        assertThat(sim.isStarted()).isTrue();
        assertThat(source.isInitialized()).isTrue();
        assertThat(sink.getReceivedPartsCount()).isEqualTo(5);

        sim.simulate(5.0);
        assertThat(sim.getNow()).isEqualTo(10.0);
        assertThat(sim.getPartCountInSinks()).isEqualTo(10);
    }

    @Test
    void findsAssetsByTypeAndName() {
        Simulation sim = new Simulation(1L);
        Source source = new Source(sim, "source", 1.0);
        Sink sink = new Sink(sim, "sink");

        assertThat(sim.findAssets(Sink.class)).containsExactly(sink);
        assertThat(sim.findAsset("source")).containsSame(source);
        assertThat(sim.findAsset("missing")).isEmpty();
    }

    @Test
    @DisplayName("Settings configure seed, tracing, datapoint storage and resource pools")
    void settingsConfigureTheSimulation() {
        Map<String, Double> pools = new LinkedHashMap<>();
        pools.put("operator", 2.0);
        Simulation sim = new Simulation(new SimulationSettings(11L, true, DataStorageType.MEMORY, pools));

        new Sink(sim, "sink");
        sim.simulate(1.0);

        assertThat(sim.getRecorder()).isInstanceOf(InMemoryDataRecorder.class);
        assertThat(sim.getResourceManager().getAvailable("operator")).isEqualTo(2.0);
        assertThat(sim.getClock().getTrace()).isNotEmpty();
        assertThat(((SeededRandomProvider) sim.getRandomProvider()).getSeed()).isEqualTo(11L);
    }

    @Test
    @DisplayName("Datapoints are recorded with the asset name as subject")
    void datapointsUseAssetNameAsSubject() {
        InMemoryDataRecorder recorder = new InMemoryDataRecorder();
        Simulation sim = new Simulation(new SeededRandomProvider(5L), recorder);
        Source source = new Source(sim, "source", 2.0);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(source);

        sim.simulate(4.0);

        List<Object> collected = recorder.get("collected_part", "sink");
        assertThat(collected).hasSize(2);
        assertThat(recorder.subjects("supplied_new_part")).containsExactly("source");
    }

    @Test
    void netValueSumsAllAssets() {
        Simulation sim = new Simulation(1L);
        Source source = new Source(sim, "source", new Part(sim, "p", 3.0, 1.0), 1.0, 2);
        Sink sink = new Sink(sim, "sink");
        sink.setUpstream(source);

        sim.simulate(10.0);

        assertThat(source.getValue()).isEqualTo(-6.0);
        assertThat(sink.getValue()).isEqualTo(6.0);
        assertThat(sim.getNetValueOfAssets()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Two simulations of the same line with the same seed execute the same events")
    void sameSeedReplaysTheSameLine() {
        List<EventTrace> first = traceOfLine(11L);

        assertThat(first).isNotEmpty();
        assertThat(first).extracting(EventTrace::type)
                .contains(EventType.FINISH_PROCESSING, EventType.PASS_PART, EventType.FAIL);
        assertThat(traceOfLine(11L)).isEqualTo(first);
        assertThat(traceOfLine(12L)).isNotEqualTo(first);
    }

    /**
     * Source, two parallel machines with random cycle times, a delaying buffer and a sink. One
     * machine breaks down and is repaired halfway.
     */
    private static List<EventTrace> traceOfLine(long seed) {
        Simulation sim = new Simulation(seed);
        sim.getClock().setTraceEnabled(true);
        SeededRandomProvider timings = new SeededRandomProvider(seed);

        Source source = new Source(sim, "source", 0.0);
        source.setCycleTime(timings.exponential(1.0));
        Machine m1 = new Machine(sim, "m1", 0.0);
        m1.setCycleTime(timings.exponential(2.0));
        m1.setUpstream(source);
        Machine m2 = new Machine(sim, "m2", 0.0);
        m2.setCycleTime(timings.exponential(2.0));
        m2.setUpstream(source);
        Buffer buffer = new Buffer(sim, "buffer", 3, 0.5);
        buffer.setUpstream(m1, m2);
        new Sink(sim, "sink").setUpstream(buffer);
        m1.scheduleFailure(20.0, "breakdown");
        sim.getClock().schedule(25.0, Clock.ENGINE_ACTOR_ID, m1::restore, EventType.OTHER_LOW_PRIORITY, "repair");

        sim.simulate(50.0);

        return sim.getClock().getTrace();
    }
}
