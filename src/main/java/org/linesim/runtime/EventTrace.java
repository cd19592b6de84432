package org.linesim.runtime;

/**
 * One executed event as recorded by the clock's execution trace.
 *
 * @param time    simulation time of execution
 * @param actorId id of the asset that owned the event
 * @param label   label given when the event was scheduled
 * @param type    kind of the event
 */
public record EventTrace(double time, long actorId, String label, EventType type) {
}
