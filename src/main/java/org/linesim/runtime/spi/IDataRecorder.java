package org.linesim.runtime.spi;

/**
 * Sink for the labeled datapoints that devices emit while a simulation runs.
 * <p>
 * The engine only produces datapoints; it never reads them back, so an implementation may keep
 * them in memory, forward them somewhere else or drop them.
 * </p>
 */
public interface IDataRecorder {

    /**
     * Records one datapoint.
     *
     * @param category theme of the datapoint, e.g. {@code "produced_part"}
     * @param subject  usually the name of the emitting asset
     * @param payload  the datapoint itself, opaque to the engine
     */
    void addDatapoint(String category, String subject, Object payload);
}
