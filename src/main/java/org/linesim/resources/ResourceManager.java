package org.linesim.resources;

import org.linesim.runtime.Clock;
import org.linesim.runtime.EventType;
import org.linesim.runtime.spi.IDataRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Named pools of limited resources that callers reserve and release.
 * <p>
 * A reservation is all-or-nothing: either every requested amount fits into the unreserved part
 * of its pool and all of them are taken together, or nothing is taken. Callers that cannot get
 * their resources right away may register a waiter; waiters are re-tested in registration order
 * by a housekeeping event whenever resources come back. A waiter is only told that its request
 * fits now. It has to call {@link #reserve(Map)} itself, nothing is held on its behalf.
 * </p>
 */
public class ResourceManager {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceManager.class);

    private final Clock clock;
    private final IDataRecorder recorder;
    private final Map<String, ResourcePool> pools = new LinkedHashMap<>();
    private final List<Waiter> waiters = new ArrayList<>();
    private final AtomicInteger leakCount = new AtomicInteger();
    private boolean recheckScheduled = false;

    private record Waiter(Map<String, Double> request, BiConsumer<ResourceManager, Map<String, Double>> callback) {
    }

    /**
     * Creates an empty resource manager.
     *
     * @param clock    clock used to schedule waiter re-checks
     * @param recorder receiver of {@code resource_update} datapoints
     */
    public ResourceManager(Clock clock, IDataRecorder recorder) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.recorder = Objects.requireNonNull(recorder, "Recorder cannot be null");
    }

    /**
     * Grows or shrinks the capacity of a pool, creating the pool on first reference. Shrinking
     * below the current usage is allowed; no reservation is revoked.
     *
     * @param resourceName pool name
     * @param delta        capacity change, negative to shrink
     * @throws CapacityViolationException if the capacity would drop below zero
     */
    public void addResources(String resourceName, double delta) {
        Objects.requireNonNull(resourceName, "Resource name cannot be null");
        if (Double.isNaN(delta)) {
            throw new IllegalArgumentException("Resource delta cannot be NaN for '" + resourceName + "'");
        }
        ResourcePool pool = pools.get(resourceName);
        double current = pool == null ? 0.0 : pool.getCapacity();
        if (current + delta < 0) {
            throw new CapacityViolationException(resourceName, String.format(
                    "Cannot reduce capacity of resource '%s' below zero: capacity=%s, change=%s", resourceName, current, delta));
        }
        if (pool == null) {
            pool = new ResourcePool(resourceName);
            pools.put(resourceName, pool);
        }
        if (delta == 0) {
            return;
        }
        pool.changeCapacity(delta);
        LOG.debug("Capacity of '{}' changed by {} to {}", resourceName, delta, pool.getCapacity());
        recordUpdate(pool);
        scheduleWaiterCheck();
    }

    /**
     * Tries to reserve every amount of the request at once.
     *
     * @param request resource name to amount; zero amounts are ignored
     * @return the reservation, or empty if any amount does not fit (nothing is reserved then)
     */
    public Optional<ReservedResources> reserve(Map<String, Double> request) {
        Map<String, Double> normalized = normalize(request);
        if (!canFulfill(normalized)) {
            return Optional.empty();
        }
        for (Map.Entry<String, Double> entry : normalized.entrySet()) {
            ResourcePool pool = pools.get(entry.getKey());
            pool.changeUsage(entry.getValue());
            recordUpdate(pool);
        }
        return Optional.of(new ReservedResources(this, normalized));
    }

    /**
     * Registers a waiter that is called once the request could be fulfilled. The callback
     * receives this manager and a copy of the request.
     *
     * @param request  resource name to amount
     * @param callback called at most once, from a housekeeping event
     */
    public void reserveWithCallback(Map<String, Double> request, BiConsumer<ResourceManager, Map<String, Double>> callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        waiters.add(new Waiter(normalize(request), callback));
        scheduleWaiterCheck();
    }

    /**
     * Checks whether a request would currently fit, without reserving anything.
     *
     * @param request resource name to amount
     * @return true if {@link #reserve(Map)} would succeed now
     */
    public boolean canReserve(Map<String, Double> request) {
        return canFulfill(normalize(request));
    }

    /**
     * Returns a pool by name.
     *
     * @param resourceName pool name
     * @return the pool, or empty if it was never created
     */
    public Optional<ResourcePool> getPool(String resourceName) {
        return Optional.ofNullable(pools.get(resourceName));
    }

    /**
     * Returns the unreserved amount of a pool; 0 for unknown pools.
     *
     * @param resourceName pool name
     * @return available amount
     */
    public double getAvailable(String resourceName) {
        ResourcePool pool = pools.get(resourceName);
        return pool == null ? 0.0 : pool.getAvailable();
    }

    public List<ResourcePool> getPools() {
        return Collections.unmodifiableList(new ArrayList<>(pools.values()));
    }

    public int getWaitingRequestCount() {
        return waiters.size();
    }

    /**
     * Returns how many reservations were dropped while still holding resources.
     * @return leak count
     */
    public int getLeakCount() {
        return leakCount.get();
    }

    void returnToPools(Map<String, Double> amounts) {
        for (Map.Entry<String, Double> entry : amounts.entrySet()) {
            ResourcePool pool = pools.get(entry.getKey());
            pool.changeUsage(-entry.getValue());
            recordUpdate(pool);
        }
        scheduleWaiterCheck();
    }

    void reportLeak(String handle, Map<String, Double> holdings) {
        leakCount.incrementAndGet();
        LOG.error("Reservation leak: {} was dropped while still holding {}", handle, holdings);
    }

    private void scheduleWaiterCheck() {
        if (waiters.isEmpty() || recheckScheduled) {
            return;
        }
        recheckScheduled = true;
        clock.schedule(clock.getNow(), Clock.ENGINE_ACTOR_ID, this::checkWaiters,
                EventType.OTHER_HIGH_PRIORITY, "ResourceManager waiter check");
    }

    private void checkWaiters() {
        recheckScheduled = false;
        int i = 0;
        while (i < waiters.size()) {
            Waiter waiter = waiters.get(i);
            if (canFulfill(waiter.request())) {
                waiters.remove(i);
                waiter.callback().accept(this, new LinkedHashMap<>(waiter.request()));
            } else {
                i++;
            }
        }
    }

    private boolean canFulfill(Map<String, Double> request) {
        for (Map.Entry<String, Double> entry : request.entrySet()) {
            ResourcePool pool = pools.get(entry.getKey());
            if (pool == null || pool.getAvailable() < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Double> normalize(Map<String, Double> request) {
        Objects.requireNonNull(request, "Resource request cannot be null");
        Map<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : request.entrySet()) {
            double amount = Objects.requireNonNull(entry.getValue(), "Requested amount cannot be null");
            if (Double.isNaN(amount) || amount < 0) {
                throw new IllegalArgumentException("Requested amount of '" + entry.getKey() + "' must be >= 0, got " + amount);
            }
            if (amount > 0) {
                result.put(entry.getKey(), amount);
            }
        }
        return result;
    }

    private void recordUpdate(ResourcePool pool) {
        recorder.addDatapoint("resource_update", pool.getName(),
                List.of(clock.getNow(), pool.getInUse(), pool.getCapacity()));
    }
}
