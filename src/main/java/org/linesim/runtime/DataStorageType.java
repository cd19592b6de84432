package org.linesim.runtime;

/**
 * Where a simulation keeps the datapoints emitted by its assets.
 */
public enum DataStorageType {
    /** Datapoints are discarded. */
    NONE,
    /** Datapoints are kept in memory, see {@link org.linesim.runtime.internal.services.InMemoryDataRecorder}. */
    MEMORY
}
