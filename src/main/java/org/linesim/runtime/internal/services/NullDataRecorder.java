package org.linesim.runtime.internal.services;

import org.linesim.runtime.spi.IDataRecorder;

/**
 * Recorder that drops every datapoint.
 */
public final class NullDataRecorder implements IDataRecorder {

    @Override
    public void addDatapoint(String category, String subject, Object payload) {
        // nothing is stored
    }
}
