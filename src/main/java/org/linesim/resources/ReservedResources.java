package org.linesim.resources;

import java.lang.ref.Cleaner;
import java.lang.ref.WeakReference;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Receipt for resources taken from a {@link ResourceManager}. The holder owns the amounts until
 * it releases them; a handle must not be shared.
 * <p>
 * A handle that still holds resources when it is closed or garbage collected is reported as a
 * reservation leak (ERROR log and {@link ResourceManager#getLeakCount()}). The resources are
 * not returned to the pools in that case. A handle collected together with its manager is not
 * reported.
 * </p>
 */
public final class ReservedResources implements AutoCloseable {

    private static final Cleaner CLEANER = Cleaner.create();

    private final ResourceManager manager;
    private final Holdings holdings;
    private final Cleaner.Cleanable cleanable;

    /**
     * Amounts held by a handle. Kept apart from the handle so the cleaner can inspect them
     * after the handle became unreachable.
     */
    private static final class Holdings implements Runnable {
        private final WeakReference<ResourceManager> manager;
        private final String description;
        private final Map<String, Double> amounts;

        Holdings(ResourceManager manager, String description, Map<String, Double> amounts) {
            this.manager = new WeakReference<>(manager);
            this.description = description;
            this.amounts = amounts;
        }

        @Override
        public void run() {
            Map<String, Double> remaining;
            synchronized (this) {
                remaining = new LinkedHashMap<>(amounts);
            }
            ResourceManager owner = manager.get();
            if (owner != null && !remaining.isEmpty()) {
                owner.reportLeak(description, remaining);
            }
        }
    }

    ReservedResources(ResourceManager manager, Map<String, Double> reserved) {
        this.manager = manager;
        this.holdings = new Holdings(manager, "Reservation" + reserved.keySet(), new LinkedHashMap<>(reserved));
        this.cleanable = CLEANER.register(this, holdings);
    }

    /**
     * Returns the amounts still held.
     * @return a copy, resource name to amount
     */
    public Map<String, Double> getReserved() {
        synchronized (holdings) {
            return new LinkedHashMap<>(holdings.amounts);
        }
    }

    /**
     * Returns true if nothing is held anymore.
     * @return whether the reservation is empty
     */
    public boolean isEmpty() {
        synchronized (holdings) {
            return holdings.amounts.isEmpty();
        }
    }

    /**
     * Releases everything this reservation holds.
     */
    public void release() {
        release(getReserved());
    }

    /**
     * Releases part of the reservation. Amounts that drop to zero are removed from it.
     *
     * @param amounts resource name to amount to release
     * @throws UnknownResourceException if a name is not held by this reservation
     * @throws OverReleaseException     if an amount exceeds what is held
     */
    public void release(Map<String, Double> amounts) {
        Objects.requireNonNull(amounts, "Amounts cannot be null");
        Map<String, Double> toRelease = new LinkedHashMap<>();
        synchronized (holdings) {
            for (Map.Entry<String, Double> entry : amounts.entrySet()) {
                String name = entry.getKey();
                double amount = Objects.requireNonNull(entry.getValue(), "Released amount cannot be null");
                if (Double.isNaN(amount) || amount < 0) {
                    throw new IllegalArgumentException("Released amount of '" + name + "' must be >= 0, got " + amount);
                }
                Double held = holdings.amounts.get(name);
                if (held == null) {
                    throw new UnknownResourceException(name);
                }
                if (amount > held) {
                    throw new OverReleaseException(name, amount, held);
                }
                if (amount > 0) {
                    toRelease.put(name, amount);
                }
            }
            for (Map.Entry<String, Double> entry : toRelease.entrySet()) {
                double left = holdings.amounts.get(entry.getKey()) - entry.getValue();
                if (left <= 0) {
                    holdings.amounts.remove(entry.getKey());
                } else {
                    holdings.amounts.put(entry.getKey(), left);
                }
            }
        }
        if (!toRelease.isEmpty()) {
            manager.returnToPools(toRelease);
        }
    }

    /**
     * Moves everything another reservation holds into this one. The other reservation is empty
     * afterwards.
     *
     * @param other reservation from the same manager
     */
    public void merge(ReservedResources other) {
        Objects.requireNonNull(other, "Other reservation cannot be null");
        if (other == this) {
            throw new IllegalArgumentException("A reservation cannot be merged into itself.");
        }
        if (other.manager != manager) {
            throw new IllegalArgumentException("Cannot merge reservations of different resource managers.");
        }
        Map<String, Double> taken;
        synchronized (other.holdings) {
            taken = new LinkedHashMap<>(other.holdings.amounts);
            other.holdings.amounts.clear();
        }
        synchronized (holdings) {
            taken.forEach((name, amount) -> holdings.amounts.merge(name, amount, Double::sum));
        }
    }

    /**
     * Discards the handle. If it still holds resources a reservation leak is reported.
     */
    @Override
    public void close() {
        cleanable.clean();
    }

    @Override
    public String toString() {
        return "ReservedResources" + getReserved();
    }
}
