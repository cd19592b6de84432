package org.linesim.floor;

/**
 * Thrown when a device graph is wired in a way the flow protocol does not support: a device
 * feeding itself, a downstream attached to a sink, or an edge that crosses a group boundary.
 * The graph is left unchanged.
 */
public class TopologyException extends RuntimeException {

    public TopologyException(String message) {
        super(message);
    }
}
