package com.qa.trust.service;

import com.qa.trust.config.MetricsConfig;
import com.qa.trust.config.TrustConfig;
import com.qa.trust.engine.DurationStatistics;
import com.qa.trust.engine.OutcomeWindow;
import com.qa.trust.exception.StorageException;
import com.qa.trust.model.FlakyTestEntry;
import com.qa.trust.model.FlakyTestSnapshot;
import com.qa.trust.model.HealthPoint;
import com.qa.trust.model.IngestionResult;
import com.qa.trust.model.RunRecord;
import com.qa.trust.model.TestCaseResult;
import com.qa.trust.model.TestOutcome;
import com.qa.trust.model.TestRunEntry;
import com.qa.trust.model.TestRunReport;
import com.qa.trust.model.TestTrend;
import com.qa.trust.model.TrendPoint;
import com.qa.trust.repository.JsonFileStore;
import com.qa.trust.repository.TestHistoryRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps per-project run history and derives flakiness and duration trends from it.
 * <p>
 * Ingestion for one project is serialized by a per-project lock; different projects never
 * block each other. History is pruned to the newest runs on every write.
 */
@Service
public class FlakinessTracker {

    private static final Logger log = LoggerFactory.getLogger(FlakinessTracker.class);
    private static final long DAY_MILLIS = 24L * 60 * 60 * 1000;

    private final TestHistoryRepository historyRepository;
    private final TrustConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> projectLocks = new ConcurrentHashMap<>();
    // project -> flaky test count, backing the gauge
    private final ConcurrentHashMap<String, Integer> flakyCounts = new ConcurrentHashMap<>();

    public FlakinessTracker(TestHistoryRepository historyRepository, TrustConfig config,
                            MetricsConfig metricsConfig, Clock clock) {
        this.historyRepository = historyRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Record a run and regenerate the project's flaky-test set.
     *
     * @param runId optional run identifier; generated when null
     * @throws StorageException when the history could not be read or written. If the write
     *                          failed, the exception carries the computed {@link IngestionResult}
     *                          for {@link #retryPersist(IngestionResult)}.
     */
    @Observed(name = "history.ingest", contextualName = "ingest-run")
    public IngestionResult ingest(String project, TestRunReport report, String runId) {
        ReentrantLock lock = lockFor(project);
        lock.lock();
        try {
            List<RunRecord> history = loadHistoryOrThrow(project);

            RunRecord run = toRunRecord(report, runId);
            history.add(run);
            List<RunRecord> pruned = prune(history);

            Map<String, FlakyTestEntry> flaky = computeFlakyTests(pruned, run.getTimestamp());

            IngestionResult result = IngestionResult.builder()
                    .project(project)
                    .run(run)
                    .history(pruned)
                    .flakyTests(flaky)
                    .persisted(false)
                    .build();

            log.info("Ingested run {} for project {}: total={}, failed={}, flaky tests={}",
                    run.getRunId(), project, run.getTotal(), run.getFailed(), flaky.size());
            return persist(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write a previously computed ingestion without recomputing it. Refuses when newer runs
     * were stored in the meantime, since writing would drop them.
     */
    public IngestionResult retryPersist(IngestionResult pending) {
        if (pending.isPersisted()) {
            return pending;
        }
        String project = pending.getProject();
        ReentrantLock lock = lockFor(project);
        lock.lock();
        try {
            List<RunRecord> current = loadHistoryOrThrow(project);
            boolean superseded = current.stream()
                    .anyMatch(r -> r.getTimestamp() > pending.getRun().getTimestamp()
                            && !r.getRunId().equals(pending.getRun().getRunId()));
            if (superseded) {
                throw new IllegalStateException("History of project " + project
                        + " has newer runs than pending run " + pending.getRun().getRunId());
            }
            return persist(pending);
        } finally {
            lock.unlock();
        }
    }

    public List<FlakyTestEntry> getFlakyTests(String project) {
        try {
            FlakyTestSnapshot snapshot = historyRepository.loadFlakyTests(project);
            List<FlakyTestEntry> entries = new ArrayList<>(snapshot.getTests().values());
            entries.sort(Comparator.comparingDouble(FlakyTestEntry::getFlakinessScore).reversed()
                    .thenComparing(FlakyTestEntry::getTestId));
            return entries;
        } catch (IOException e) {
            metricsConfig.recordStorageFailure("flaky");
            throw new StorageException("Failed to read flaky tests of project " + project, e);
        }
    }

    public Map<String, List<FlakyTestEntry>> getAllFlakyTests() {
        Map<String, List<FlakyTestEntry>> all = new LinkedHashMap<>();
        try {
            for (String project : historyRepository.listProjects()) {
                List<FlakyTestEntry> entries = getFlakyTests(project);
                if (!entries.isEmpty()) {
                    all.put(project, entries);
                }
            }
        } catch (IOException e) {
            metricsConfig.recordStorageFailure("history");
            throw new StorageException("Failed to list projects with history", e);
        }
        return all;
    }

    /**
     * Outcome and duration statistics of one test over the last {@code days} days.
     */
    public TestTrend getTestTrends(String project, String testId, int days) {
        TrustConfig.History settings = config.getHistory();
        long cutoff = clock.millis() - days * DAY_MILLIS;

        Map<TestOutcome, Integer> outcomes = new EnumMap<>(TestOutcome.class);
        List<Double> durations = new ArrayList<>();
        List<TrendPoint> points = new ArrayList<>();

        for (RunRecord run : loadHistoryOrThrow(project)) {
            if (run.getTimestamp() < cutoff) continue;
            TestRunEntry entry = run.getTests().get(testId);
            if (entry == null) continue;

            outcomes.merge(entry.getOutcome(), 1, Integer::sum);
            if (entry.getDuration() > 0) {
                durations.add(entry.getDuration());
            }
            points.add(TrendPoint.builder()
                    .runId(run.getRunId())
                    .timestamp(run.getTimestamp())
                    .outcome(entry.getOutcome())
                    .duration(entry.getDuration())
                    .build());
        }

        int totalRuns = points.size();
        int passed = outcomes.getOrDefault(TestOutcome.PASSED, 0);
        double successRate = totalRuns == 0 ? 0.0 : Math.round(passed * 10000.0 / totalRuns) / 100.0;

        TestTrend trend = TestTrend.builder()
                .project(project)
                .testId(testId)
                .periodDays(days)
                .totalRuns(totalRuns)
                .outcomes(outcomes)
                .successRate(successRate)
                .durationStats(DurationStatistics.summarize(durations))
                .recentRuns(new ArrayList<>(points.subList(
                        Math.max(0, totalRuns - settings.getTrendRecentRuns()), totalRuns)))
                .build();

        if (durations.size() >= settings.getRegressionMinSamples()) {
            double overallMean = DurationStatistics.mean(durations);
            double recentMean = DurationStatistics.mean(durations.subList(
                    Math.max(0, durations.size() - settings.getRegressionRecentSamples()), durations.size()));
            if (recentMean > overallMean * settings.getRegressionFactor()) {
                trend.setPerformanceRegression(true);
                trend.setRegressionFactor(Math.round(recentMean / overallMean * 100.0) / 100.0);
                log.warn("Performance regression for {} in project {}: recent mean {}s vs overall {}s",
                        testId, project, recentMean, overallMean);
            }
        }
        return trend;
    }

    public List<HealthPoint> getProjectHealthHistory(String project, int days) {
        long cutoff = clock.millis() - days * DAY_MILLIS;
        List<HealthPoint> points = new ArrayList<>();
        for (RunRecord run : loadHistoryOrThrow(project)) {
            if (run.getTimestamp() < cutoff) continue;
            points.add(HealthPoint.builder()
                    .runId(run.getRunId())
                    .timestamp(run.getTimestamp())
                    .total(run.getTotal())
                    .passed(run.getPassed())
                    .failed(run.getFailed())
                    .skipped(run.getSkipped())
                    .successRate(run.successRate())
                    .duration(run.getDuration())
                    .build());
        }
        return points;
    }

    /**
     * Flaky entries over the project's most recent {@code flakinessWindow} runs. A test that
     * did not run in that span has no window and is never reported.
     */
    Map<String, FlakyTestEntry> computeFlakyTests(List<RunRecord> history, long detectedAt) {
        TrustConfig.History settings = config.getHistory();
        List<RunRecord> recent = history.subList(
                Math.max(0, history.size() - settings.getFlakinessWindow()), history.size());

        Map<String, OutcomeWindow> windows = new LinkedHashMap<>();
        for (RunRecord run : recent) {
            for (Map.Entry<String, TestRunEntry> e : run.getTests().entrySet()) {
                windows.computeIfAbsent(e.getKey(), k -> new OutcomeWindow(settings.getFlakinessWindow()))
                        .add(e.getValue().getOutcome());
            }
        }

        Map<String, FlakyTestEntry> flaky = new LinkedHashMap<>();
        for (Map.Entry<String, OutcomeWindow> e : windows.entrySet()) {
            OutcomeWindow window = e.getValue();
            if (!window.isFlakinessEligible(settings.getMinRunsForFlakiness())) continue;

            flaky.put(e.getKey(), FlakyTestEntry.builder()
                    .testId(e.getKey())
                    .flakinessScore(round3(window.flakinessScore()))
                    .passRate(round3((double) window.passes() / window.size()))
                    .failRate(round3((double) window.failures() / window.size()))
                    .totalRuns(window.size())
                    .recentPattern(window.pattern(settings.getPatternLength()))
                    .lastOutcome(window.last())
                    .detectedAt(detectedAt)
                    .build());
        }
        return flaky;
    }

    private IngestionResult persist(IngestionResult result) {
        String project = result.getProject();
        try {
            historyRepository.saveHistory(project, result.getHistory());
            historyRepository.saveFlakyTests(project, FlakyTestSnapshot.builder()
                    .updatedAt(result.getRun().getTimestamp())
                    .tests(result.getFlakyTests())
                    .build());
        } catch (IOException e) {
            metricsConfig.recordStorageFailure("history");
            log.error("Failed to persist history of project {} (run {}): {}",
                    project, result.getRun().getRunId(), e.getMessage(), e);
            throw new StorageException("Failed to persist history of project " + project, e, result);
        }

        flakyCounts.put(project, result.getFlakyTests().size());
        metricsConfig.updateFlakyTestCount(flakyCounts.values().stream().mapToInt(Integer::intValue).sum());
        return result.toBuilder().persisted(true).build();
    }

    private List<RunRecord> loadHistoryOrThrow(String project) {
        try {
            return historyRepository.loadHistory(project);
        } catch (IOException e) {
            metricsConfig.recordStorageFailure("history");
            throw new StorageException("Failed to read history of project " + project, e);
        }
    }

    private List<RunRecord> prune(List<RunRecord> history) {
        int max = config.getHistory().getMaxRunsPerProject();
        if (history.size() <= max) {
            return history;
        }
        return new ArrayList<>(history.subList(history.size() - max, history.size()));
    }

    private RunRecord toRunRecord(TestRunReport report, String runId) {
        Map<String, TestRunEntry> tests = new LinkedHashMap<>();
        for (TestCaseResult testCase : report.getCases()) {
            tests.put(testCase.getId(), TestRunEntry.builder()
                    .outcome(testCase.getOutcome())
                    .duration(testCase.getDuration())
                    .error(testCase.getError() == null ? null : testCase.getError().getMessage())
                    .build());
        }

        return RunRecord.builder()
                .runId(runId != null ? runId : "run-" + UUID.randomUUID())
                .timestamp(clock.millis())
                .total(report.getCases().size())
                .passed(report.countOf(TestOutcome.PASSED))
                .failed(report.failureCount())
                .skipped(report.countOf(TestOutcome.SKIPPED))
                .duration(report.effectiveDuration())
                .tests(tests)
                .build();
    }

    private ReentrantLock lockFor(String project) {
        // keyed by file name so projects sharing a history file share the lock
        return projectLocks.computeIfAbsent(JsonFileStore.safeFileName(project), p -> new ReentrantLock());
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
