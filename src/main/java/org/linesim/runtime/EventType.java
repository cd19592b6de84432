package org.linesim.runtime;

/**
 * Kind of a scheduled event. When several events are due at the same simulation time the kind
 * decides which one runs first.
 * <p>
 * Constants are declared from the highest to the lowest execution priority, so the natural
 * enum order is the execution order.
 * </p>
 */
public enum EventType {
    /** Engine housekeeping such as resource re-checks and schedule transitions. */
    OTHER_HIGH_PRIORITY,
    /** Sensor sampling. */
    SENSOR,
    /** A scheduled device failure. */
    FAIL,
    /** Completion of a processing cycle; runs before part handoffs of the same instant. */
    FINISH_PROCESSING,
    /** Handing a finished part to a downstream device. */
    PASS_PART,
    /** Returning processing resources to the resource pools. */
    RELEASE_RESERVED_RESOURCES,
    /** A maintainer starting an admitted work order. */
    START_WORK,
    /** A maintainer finishing a work order. */
    FINISH_WORK,
    /** Default for everything else. */
    OTHER_LOW_PRIORITY,
    /** End of a run; always the last event at its time. */
    TERMINATE
}
