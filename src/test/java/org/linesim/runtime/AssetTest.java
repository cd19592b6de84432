package org.linesim.runtime;

import org.linesim.floor.Sink;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AssetTest {

    @Test
    void valueChangesAreKeptInHistory() {
        Simulation sim = new Simulation(1L);
        Sink sink = new Sink(sim, "sink");

        sink.addValue("sold", 5.0);
        sink.addCost("energy", 2.0);

        assertThat(sink.getValue()).isEqualTo(3.0);
        assertThat(sink.getValueHistory()).containsExactly(
                new Asset.ValueChange("sold", 0.0, 5.0, 5.0),
                new Asset.ValueChange("energy", 0.0, -2.0, 3.0));
    }

    @Test
    void initializeResetsValueAndCanOnlyRunOnce() {
        Simulation sim = new Simulation(1L);
        Sink sink = new Sink(sim, "sink");
        sink.addValue("before start", 4.0);

        sink.initialize();

        assertThat(sink.getValue()).isZero();
        assertThat(sink.getValueHistory()).isEmpty();
        assertThatThrownBy(sink::initialize).isInstanceOf(StateViolationException.class);
    }

    @Test
    void generatedNamesUseClassNameAndId() {
        Simulation sim = new Simulation(1L);

        Sink sink = new Sink(sim, null);

        assertThat(sink.getName()).isEqualTo("Sink_" + sink.getId());
        assertThat(sink).hasToString(sink.getName());
    }
}
