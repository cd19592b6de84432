package org.linesim.floor;

import org.linesim.junit.extensions.logging.LogWatchExtension;
import org.linesim.runtime.Simulation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PartBatcherTest {

    private Simulation sim;

    @BeforeEach
    void setUp() {
        sim = new Simulation(42L);
    }

    @Test
    @DisplayName("Single parts are packed into batches of the configured size")
    void packsParts() {
        Source source = new Source(sim, "source", new Part(sim, "p", 1.0, 1.0), 1.0, Source.UNLIMITED);
        PartBatcher batcher = new PartBatcher(sim, "batcher", 3);
        batcher.setUpstream(source);
        Sink sink = new Sink(sim, "sink", 0.0, true);
        sink.setUpstream(batcher);

        sim.simulate(4.0);

        assertThat(sink.getReceivedPartsCount()).isEqualTo(3);
        assertThat(sink.getCollectedParts()).singleElement().isInstanceOfSatisfying(Batch.class, batch -> {
            assertThat(batch.getParts()).extracting(Part::getName).containsExactly("p_1", "p_2", "p_3");
            assertThat(batch.getValue()).isEqualTo(3.0);
        });
        assertThat(batcher.getPendingPartCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A batch is unpacked into its parts, which leave one after another")
    void unpacksBatches() {
        Batch tray = new Batch(sim, "tray", List.of(new Part(sim, "a", 1.0, 1.0), new Part(sim, "b", 2.0, 1.0)));
        Source source = new Source(sim, "source", tray, 1.0, 2);
        PartBatcher batcher = new PartBatcher(sim, "batcher", 0);
        batcher.setUpstream(source);
        Sink sink = new Sink(sim, "sink", 0.0, true);
        sink.setUpstream(batcher);

        sim.simulate(5.0);

        assertThat(sink.getCollectedParts()).extracting(Part::getName).containsExactly("a_1", "b_1", "a_2", "b_2");
        assertThat(sink.getCollectedParts()).allSatisfy(p -> assertThat(p).isNotInstanceOf(Batch.class));
        assertThat(sink.getValueOfReceivedParts()).isEqualTo(6.0);
        assertThat(source.getCostOfProducedParts()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Incoming batches are dissolved and their parts repacked")
    void repacksBatches() {
        Batch pair = new Batch(sim, "pair", List.of(new Part(sim, "x", 0.0, 1.0), new Part(sim, "y", 0.0, 1.0)));
        Source source = new Source(sim, "source", pair, 1.0, 3);
        PartBatcher batcher = new PartBatcher(sim, "batcher", 3);
        batcher.setUpstream(source);
        Sink sink = new Sink(sim, "sink", 0.0, true);
        sink.setUpstream(batcher);

        sim.simulate(5.0);

        assertThat(sink.getCollectedParts()).hasSize(2)
                .allSatisfy(p -> assertThat(((Batch) p).size()).isEqualTo(3));
        assertThat(batcher.getPendingPartCount()).isZero();
    }

    @Test
    void negativeBatchSizeIsRejected() {
        assertThatThrownBy(() -> new PartBatcher(sim, "b", -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
