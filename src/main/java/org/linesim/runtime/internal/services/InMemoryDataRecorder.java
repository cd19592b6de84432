package org.linesim.runtime.internal.services;

import org.linesim.runtime.spi.IDataRecorder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps datapoints in a two-level table: category, then subject, then the datapoints in the
 * order they were recorded.
 */
public final class InMemoryDataRecorder implements IDataRecorder {

    private final Map<String, Map<String, List<Object>>> table = new LinkedHashMap<>();

    @Override
    public void addDatapoint(String category, String subject, Object payload) {
        table.computeIfAbsent(category, k -> new LinkedHashMap<>())
                .computeIfAbsent(subject, k -> new ArrayList<>())
                .add(payload);
    }

    /**
     * Returns the datapoints recorded for a category and subject.
     *
     * @param category datapoint category
     * @param subject  datapoint subject
     * @return an unmodifiable view, empty if nothing was recorded
     */
    public List<Object> get(String category, String subject) {
        Map<String, List<Object>> bySubject = table.get(category);
        if (bySubject == null) {
            return List.of();
        }
        List<Object> points = bySubject.get(subject);
        return points == null ? List.of() : Collections.unmodifiableList(points);
    }

    /**
     * Returns all subjects that recorded datapoints under a category.
     *
     * @param category datapoint category
     * @return subjects in first-recorded order
     */
    public List<String> subjects(String category) {
        Map<String, List<Object>> bySubject = table.get(category);
        return bySubject == null ? List.of() : List.copyOf(bySubject.keySet());
    }

    /**
     * Removes all recorded datapoints.
     */
    public void clear() {
        table.clear();
    }
}
