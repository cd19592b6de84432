package org.linesim.floor;

/**
 * Lifecycle state of a {@link PartHandler}.
 */
public enum DeviceState {
    /** Accepts, processes and passes parts. */
    OPERATIONAL,
    /** Paused; scheduled events are parked and resume where they left off on restore. */
    SHUTDOWN,
    /** Broken down; scheduled events were cancelled and the input part is lost. */
    FAILED
}
