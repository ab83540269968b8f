package com.qa.trust.service;

import com.qa.trust.model.ProjectMetrics;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide owner of per-project detection counters. One instance is injected wherever
 * counters are needed; tests create their own.
 */
@Component
public class ProjectMetricsStore {

    private final ConcurrentHashMap<String, ProjectMetrics> metrics = new ConcurrentHashMap<>();

    /**
     * Run {@code update} with exclusive access to the project's live metrics.
     */
    public <T> T update(String project, Function<ProjectMetrics, T> update) {
        ProjectMetrics live = metrics.computeIfAbsent(project, ProjectMetrics::forProject);
        synchronized (live) {
            return update.apply(live);
        }
    }

    public ProjectMetrics snapshot(String project) {
        ProjectMetrics live = metrics.get(project);
        if (live == null) {
            return ProjectMetrics.forProject(project);
        }
        synchronized (live) {
            return live.copy();
        }
    }

    public Map<String, ProjectMetrics> snapshotAll() {
        Map<String, ProjectMetrics> all = new TreeMap<>();
        for (String project : metrics.keySet()) {
            all.put(project, snapshot(project));
        }
        return all;
    }

    public void clear() {
        metrics.clear();
    }
}
