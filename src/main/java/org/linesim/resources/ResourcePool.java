package org.linesim.resources;

/**
 * A named pool of fungible capacity. Usage may temporarily exceed capacity after the capacity
 * was reduced; it comes back down only as reservations are released.
 */
public final class ResourcePool {

    private final String name;
    private double capacity;
    private double inUse;

    ResourcePool(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getInUse() {
        return inUse;
    }

    /**
     * Returns the unreserved capacity. Negative while usage exceeds a reduced capacity.
     * @return capacity minus usage
     */
    public double getAvailable() {
        return capacity - inUse;
    }

    void changeCapacity(double delta) {
        capacity += delta;
    }

    void changeUsage(double delta) {
        inUse += delta;
    }

    @Override
    public String toString() {
        return String.format("%s[inUse=%s, capacity=%s]", name, inUse, capacity);
    }
}
