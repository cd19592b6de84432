package org.linesim.maintenance;

/**
 * Something a {@link Maintainer} can work on. The maintainer only talks to its targets through
 * this interface; the tag identifies which kind of work is requested and is chosen by whoever
 * creates the work order.
 */
public interface Maintainable {

    /**
     * Returns the name of the target, used in datapoints and log messages.
     * @return target name
     */
    String getName();

    /**
     * Returns how long the work order takes, in simulation time.
     *
     * @param tag work order tag, may be null
     * @return duration, at least 0
     */
    double getWorkOrderDuration(Object tag);

    /**
     * Returns how much of the maintainer's capacity the work order occupies while it is active.
     *
     * @param tag work order tag, may be null
     * @return needed capacity
     */
    double getWorkOrderCapacity(Object tag);

    /**
     * Returns the one-time cost charged to the maintainer when work starts.
     *
     * @param tag work order tag, may be null
     * @return cost, 0 if costs are tracked elsewhere
     */
    double getWorkOrderCost(Object tag);

    /**
     * Called when the maintainer starts the work order. Usually shuts the target down.
     *
     * @param tag work order tag, may be null
     */
    void startWork(Object tag);

    /**
     * Called when the maintainer finishes the work order. Usually restores the target.
     *
     * @param tag work order tag, may be null
     */
    void endWork(Object tag);
}
