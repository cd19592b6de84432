package org.linesim.runtime;

import org.linesim.config.SimulationSettings;
import org.linesim.floor.DownstreamPrioritizer;
import org.linesim.floor.Sink;
import org.linesim.resources.ResourceManager;
import org.linesim.runtime.internal.services.InMemoryDataRecorder;
import org.linesim.runtime.internal.services.NullDataRecorder;
import org.linesim.runtime.internal.services.SeededRandomProvider;
import org.linesim.runtime.spi.IDataRecorder;
import org.linesim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One simulation run: owns the {@link Clock}, the {@link ResourceManager}, the datapoint
 * recorder and the registry of assets. Every asset is constructed against a simulation and
 * reaches the clock and the resources only through it, so several simulations can exist side
 * by side (one per thread) without sharing state.
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final IRandomProvider randomProvider;
    private final Clock clock;
    private final IDataRecorder recorder;
    private final ResourceManager resourceManager;
    private final List<Asset> assets = new ArrayList<>();
    private long nextAssetId = 1;
    private boolean started = false;
    private DownstreamPrioritizer defaultPrioritizer = DownstreamPrioritizer.longestWaitingFirst();

    /**
     * Constructs a simulation.
     *
     * @param randomProvider root random provider; the clock's tie-breaks are derived from it
     * @param recorder       receiver of the datapoints emitted by assets
     */
    public Simulation(IRandomProvider randomProvider, IDataRecorder recorder) {
        this.randomProvider = Objects.requireNonNull(randomProvider, "Random provider cannot be null");
        this.recorder = Objects.requireNonNull(recorder, "Recorder cannot be null");
        this.clock = new Clock(randomProvider.deriveFor("clock", 0));
        this.resourceManager = new ResourceManager(clock, recorder);
    }

    /**
     * Constructs a simulation that discards datapoints.
     *
     * @param seed seed of the root random provider
     */
    public Simulation(long seed) {
        this(new SeededRandomProvider(seed), new NullDataRecorder());
    }

    /**
     * Constructs a simulation from loaded settings: seed, event tracing, datapoint storage and
     * the initial resource pools.
     *
     * @param settings the settings
     */
    public Simulation(SimulationSettings settings) {
        this(new SeededRandomProvider(settings.seed()),
                settings.dataStorage() == DataStorageType.MEMORY ? new InMemoryDataRecorder() : new NullDataRecorder());
        clock.setTraceEnabled(settings.traceEvents());
        for (Map.Entry<String, Double> pool : settings.resources().entrySet()) {
            resourceManager.addResources(pool.getKey(), pool.getValue());
        }
    }

    long nextAssetId() {
        return nextAssetId++;
    }

    void register(Asset asset) {
        assets.add(asset);
    }

    /**
     * Runs the simulation for the given duration. Registered assets that are not initialized
     * yet are initialized first, in registration order; later calls continue where the previous
     * one stopped. Assets created from inside a running event must be initialized by their creator.
     *
     * @param duration simulation time to run for
     */
    public void simulate(double duration) {
        started = true;
        // Initialization may register further assets, iterate over a snapshot.
        for (Asset asset : new ArrayList<>(assets)) {
            if (!asset.isInitialized()) {
                asset.initialize();
            }
        }
        long before = getPartCountInSinks();
        long wallStart = System.nanoTime();
        clock.run(duration);
        LOG.info("Simulated until t={} in {} ms, parts received by sinks: {}",
                clock.getNow(), (System.nanoTime() - wallStart) / 1_000_000, getPartCountInSinks() - before);
    }

    public boolean isStarted() {
        return started;
    }

    public double getNow() {
        return clock.getNow();
    }

    public Clock getClock() {
        return clock;
    }

    public ResourceManager getResourceManager() {
        return resourceManager;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    public IDataRecorder getRecorder() {
        return recorder;
    }

    /**
     * Forwards a datapoint to the recorder.
     *
     * @param category datapoint category
     * @param subject  datapoint subject, usually an asset name
     * @param payload  datapoint payload
     */
    public void addDatapoint(String category, String subject, Object payload) {
        recorder.addDatapoint(category, subject, payload);
    }

    /**
     * Returns the prioritizer used by devices that have no prioritizer of their own.
     * @return the default prioritizer
     */
    public DownstreamPrioritizer getDefaultPrioritizer() {
        return defaultPrioritizer;
    }

    public void setDefaultPrioritizer(DownstreamPrioritizer prioritizer) {
        this.defaultPrioritizer = Objects.requireNonNull(prioritizer, "Prioritizer cannot be null");
    }

    /**
     * Returns the registered assets in registration order.
     * @return an unmodifiable view
     */
    public List<Asset> getAssets() {
        return Collections.unmodifiableList(assets);
    }

    /**
     * Finds the registered assets of a type, subclasses included.
     *
     * @param type asset type
     * @param <T>  asset type
     * @return matching assets in registration order
     */
    public <T extends Asset> List<T> findAssets(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Asset a : assets) {
            if (type.isInstance(a)) {
                result.add(type.cast(a));
            }
        }
        return result;
    }

    /**
     * Finds a registered asset by name.
     *
     * @param name asset name
     * @return the first asset with that name
     */
    public Optional<Asset> findAsset(String name) {
        return assets.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    /**
     * Returns the summed value of all registered assets.
     * @return net value
     */
    public double getNetValueOfAssets() {
        return assets.stream().mapToDouble(Asset::getValue).sum();
    }

    /**
     * Returns how many parts all sinks received so far.
     * @return received part count
     */
    public long getPartCountInSinks() {
        return findAssets(Sink.class).stream().mapToLong(Sink::getReceivedPartsCount).sum();
    }
}
