package org.linesim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.linesim.runtime.DataStorageType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of one simulation, read from the {@code linesim.simulation} block.
 *
 * @param seed        seed of the root random provider
 * @param traceEvents whether the clock records executed events
 * @param dataStorage where datapoints go
 * @param resources   initial resource pools, name to capacity
 */
public record SimulationSettings(long seed, boolean traceEvents, DataStorageType dataStorage,
                                 Map<String, Double> resources) {

    public static final String PATH = "linesim.simulation";

    public SimulationSettings {
        Objects.requireNonNull(dataStorage, "Data storage cannot be null");
        resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }

    /**
     * Reads the settings from a loaded configuration.
     *
     * @param config configuration containing a {@code linesim.simulation} block
     * @return the settings
     * @throws ConfigException if a value is missing or has the wrong type
     */
    public static SimulationSettings fromConfig(Config config) {
        Config sim = config.getConfig(PATH);
        DataStorageType storage = sim.getEnum(DataStorageType.class, "data-storage");
        Map<String, Double> resources = new LinkedHashMap<>();
        if (sim.hasPath("resources")) {
            Config pools = sim.getConfig("resources");
            for (Map.Entry<String, ConfigValue> entry : pools.root().entrySet()) {
                resources.put(entry.getKey(), pools.getDouble(ConfigUtil.joinPath(entry.getKey())));
            }
        }
        return new SimulationSettings(sim.getLong("seed"), sim.getBoolean("trace-events"), storage, resources);
    }
}
