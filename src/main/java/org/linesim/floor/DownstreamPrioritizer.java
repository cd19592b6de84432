package org.linesim.floor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides in which order a device offers a part to its downstream devices. The first device
 * in the returned list that accepts the part gets it.
 */
@FunctionalInterface
public interface DownstreamPrioritizer {

    /**
     * Orders the downstream candidates.
     *
     * @param downstream candidates in wiring order; must not be modified
     * @return a new list, highest priority first
     */
    List<PartFlowController> prioritize(List<PartFlowController> downstream);

    /**
     * Creates a prioritizer that sorts with a comparator. The sort is stable, so devices that
     * compare equal keep their wiring order.
     *
     * @param comparator ordering of downstream devices
     * @return the prioritizer
     */
    static DownstreamPrioritizer sortedBy(Comparator<? super PartFlowController> comparator) {
        return downstream -> {
            List<PartFlowController> sorted = new ArrayList<>(downstream);
            sorted.sort(comparator);
            return sorted;
        };
    }

    /**
     * Devices that have been waiting for a part the longest come first; devices that are not
     * waiting at all come last.
     *
     * @return the default prioritizer
     */
    static DownstreamPrioritizer longestWaitingFirst() {
        return sortedBy(Comparator.comparing(PartFlowController::getWaitingSince,
                Comparator.nullsLast(Comparator.naturalOrder())));
    }

    /**
     * Keeps the wiring order.
     *
     * @return a prioritizer that does not reorder
     */
    static DownstreamPrioritizer wiringOrder() {
        return ArrayList::new;
    }
}
