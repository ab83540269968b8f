package com.qa.trust.service;

import com.qa.trust.config.MetricsConfig;
import com.qa.trust.config.TrustConfig;
import com.qa.trust.exception.StorageException;
import com.qa.trust.model.FlakyTestEntry;
import com.qa.trust.model.HealthPoint;
import com.qa.trust.model.IngestionResult;
import com.qa.trust.model.RunRecord;
import com.qa.trust.model.TestOutcome;
import com.qa.trust.model.TestRunReport;
import com.qa.trust.model.TestTrend;
import com.qa.trust.repository.JsonFileStore;
import com.qa.trust.repository.TestHistoryRepository;
import com.qa.trust.testutil.MutableClock;
import com.qa.trust.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.qa.trust.testutil.TestDataFactory.testCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FlakinessTrackerTest {

    @TempDir
    Path dataDir;

    private TrustConfig config;
    private MutableClock clock;
    private MetricsConfig metricsConfig;
    private TestHistoryRepository repository;
    private FlakinessTracker tracker;

    @BeforeEach
    void setUp() {
        config = new TrustConfig();
        config.getStorage().setDataDir(dataDir.toString());
        clock = new MutableClock(TestDataFactory.NOW);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        repository = new TestHistoryRepository(new JsonFileStore(TestDataFactory.objectMapper()), config);
        tracker = new FlakinessTracker(repository, config, metricsConfig, clock);
    }

    @Test
    void ingest_alternatingOutcomes_maximallyFlaky() {
        for (int i = 0; i < 10; i++) {
            ingest("proj", i % 2 == 0 ? TestOutcome.PASSED : TestOutcome.FAILED);
        }

        List<FlakyTestEntry> flaky = tracker.getFlakyTests("proj");

        assertThat(flaky).hasSize(1);
        FlakyTestEntry entry = flaky.get(0);
        assertThat(entry.getTestId()).isEqualTo("test_target");
        assertThat(entry.getFlakinessScore()).isEqualTo(1.0);
        assertThat(entry.getPassRate()).isEqualTo(0.5);
        assertThat(entry.getFailRate()).isEqualTo(0.5);
        assertThat(entry.getTotalRuns()).isEqualTo(10);
        assertThat(entry.getRecentPattern()).isEqualTo("PFPFPFPFPF");
        assertThat(entry.getLastOutcome()).isEqualTo(TestOutcome.FAILED);
    }

    @Test
    void ingest_mostlyPassing_lowButNonZeroScore() {
        for (int i = 0; i < 5; i++) {
            ingest("proj", TestOutcome.PASSED);
        }
        ingest("proj", TestOutcome.FAILED);

        FlakyTestEntry entry = tracker.getFlakyTests("proj").get(0);

        assertThat(entry.getFlakinessScore()).isEqualTo(0.333);
        assertThat(entry.getRecentPattern()).isEqualTo("PPPPPF");
    }

    @Test
    void ingest_consistentOutcomes_notFlaky() {
        for (int i = 0; i < 5; i++) {
            ingest("proj", TestOutcome.FAILED);
        }

        assertThat(tracker.getFlakyTests("proj")).isEmpty();
    }

    @Test
    void ingest_tooFewRuns_notFlaky() {
        ingest("proj", TestOutcome.PASSED);
        IngestionResult result = ingest("proj", TestOutcome.FAILED);

        assertThat(result.getFlakyTests()).isEmpty();
    }

    @Test
    void ingest_errorCountsAsFailure() {
        ingest("proj", TestOutcome.PASSED);
        ingest("proj", TestOutcome.ERROR);
        ingest("proj", TestOutcome.PASSED);
        ingest("proj", TestOutcome.SKIPPED);

        FlakyTestEntry entry = tracker.getFlakyTests("proj").get(0);

        assertThat(entry.getRecentPattern()).isEqualTo("PFPS");
        assertThat(entry.getLastOutcome()).isEqualTo(TestOutcome.SKIPPED);
        // 2 passes, 1 failure over 4 runs
        assertThat(entry.getFlakinessScore()).isEqualTo(0.75);
    }

    @Test
    void ingest_windowKeepsMostRecentOutcomesPerTest() {
        config.getHistory().setFlakinessWindow(4);
        for (int i = 0; i < 6; i++) {
            ingest("proj", TestOutcome.FAILED);
        }
        for (int i = 0; i < 4; i++) {
            ingest("proj", TestOutcome.PASSED);
        }

        // the failures fell out of the window
        assertThat(tracker.getFlakyTests("proj")).isEmpty();
    }

    @Test
    void ingest_testAbsentFromRecentRuns_noLongerFlaky() {
        TestOutcome[] early = {TestOutcome.PASSED, TestOutcome.FAILED, TestOutcome.PASSED};
        IngestionResult result = null;
        for (TestOutcome outcome : early) {
            result = tracker.ingest("proj", TestDataFactory.report(
                    testCase("test_old", outcome, 0.1),
                    testCase("test_stable", TestOutcome.PASSED, 0.1)), null);
            clock.advance(Duration.ofMinutes(1));
        }
        assertThat(result.getFlakyTests()).containsOnlyKeys("test_old");

        for (int i = 0; i < 30; i++) {
            tracker.ingest("proj", TestDataFactory.report(testCase("test_stable", TestOutcome.PASSED, 0.1)), null);
            clock.advance(Duration.ofMinutes(1));
        }

        assertThat(tracker.getFlakyTests("proj")).isEmpty();
    }

    @Test
    void ingest_flakinessUsesProjectsLastRunsOnly() {
        config.getHistory().setFlakinessWindow(5);
        // test_target runs P,F in runs 1-2, then only passes; the failure leaves the window after run 6
        ingest("proj", TestOutcome.PASSED);
        ingest("proj", TestOutcome.FAILED);
        for (int i = 0; i < 3; i++) {
            ingest("proj", TestOutcome.PASSED);
        }
        assertThat(tracker.getFlakyTests("proj")).extracting(FlakyTestEntry::getRecentPattern)
                .containsExactly("PFPPP");

        ingest("proj", TestOutcome.PASSED);

        assertThat(tracker.getFlakyTests("proj")).isEmpty();
    }

    @Test
    void ingest_concurrentRunsForOneProject_allPersisted() throws Exception {
        int runs = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IngestionResult>> futures = new ArrayList<>();
        for (int i = 0; i < runs; i++) {
            String runId = "r" + i;
            futures.add(pool.submit(() -> {
                start.await();
                return tracker.ingest("proj", TestDataFactory.report(2, 1), runId);
            }));
        }
        start.countDown();
        for (Future<IngestionResult> future : futures) {
            assertThat(future.get(30, TimeUnit.SECONDS).isPersisted()).isTrue();
        }
        pool.shutdown();

        List<RunRecord> history = repository.loadHistory("proj");
        assertThat(history).hasSize(runs);
        assertThat(history).extracting(RunRecord::getRunId).doesNotHaveDuplicates();
    }

    @Test
    void ingest_otherProjectProceedsWhileOneIsBusy() throws Exception {
        CountDownLatch busyEntered = new CountDownLatch(1);
        CountDownLatch releaseBusy = new CountDownLatch(1);
        TestHistoryRepository slowRepository = new TestHistoryRepository(
                new JsonFileStore(TestDataFactory.objectMapper()), config) {
            @Override
            public List<RunRecord> loadHistory(String project) throws IOException {
                if ("busy".equals(project)) {
                    busyEntered.countDown();
                    try {
                        releaseBusy.await(30, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IOException("interrupted", e);
                    }
                }
                return super.loadHistory(project);
            }
        };
        FlakinessTracker shared = new FlakinessTracker(slowRepository, config, metricsConfig, clock);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<IngestionResult> busy = pool.submit(() -> shared.ingest("busy", TestDataFactory.report(1, 0), "b1"));
            assertThat(busyEntered.await(10, TimeUnit.SECONDS)).isTrue();

            Future<IngestionResult> other = pool.submit(() -> shared.ingest("other", TestDataFactory.report(1, 0), "o1"));

            assertThat(other.get(10, TimeUnit.SECONDS).isPersisted()).isTrue();
            assertThat(busy.isDone()).isFalse();

            releaseBusy.countDown();
            assertThat(busy.get(10, TimeUnit.SECONDS).isPersisted()).isTrue();
        } finally {
            releaseBusy.countDown();
            pool.shutdown();
        }
    }

    @Test
    void ingest_prunesToNewestRuns() throws IOException {
        config.getHistory().setMaxRunsPerProject(5);
        for (int i = 0; i < 7; i++) {
            tracker.ingest("proj", TestDataFactory.report(3, 0), "r" + i);
            clock.advance(Duration.ofMinutes(1));
        }

        List<RunRecord> history = repository.loadHistory("proj");

        assertThat(history).extracting(RunRecord::getRunId).containsExactly("r2", "r3", "r4", "r5", "r6");
    }

    @Test
    void ingest_recordsRunSummary() {
        TestRunReport report = TestDataFactory.report(
                testCase("a", TestOutcome.PASSED, 0.5),
                testCase("b", TestOutcome.FAILED, 1.0, "AssertionError"),
                testCase("c", TestOutcome.ERROR, 0.25, "TimeoutError"),
                testCase("d", TestOutcome.SKIPPED, 0.0));

        IngestionResult result = tracker.ingest("proj", report, null);

        RunRecord run = result.getRun();
        assertThat(result.isPersisted()).isTrue();
        assertThat(run.getRunId()).startsWith("run-");
        assertThat(run.getTimestamp()).isEqualTo(TestDataFactory.NOW.toEpochMilli());
        assertThat(run.getTotal()).isEqualTo(4);
        assertThat(run.getPassed()).isEqualTo(1);
        assertThat(run.getFailed()).isEqualTo(2);
        assertThat(run.getSkipped()).isEqualTo(1);
        assertThat(run.getDuration()).isEqualTo(1.75);
        assertThat(run.getTests().get("c").getError()).isEqualTo("TimeoutError");
    }

    @Test
    void ingest_historySurvivesNewTrackerInstance() {
        for (int i = 0; i < 4; i++) {
            ingest("proj", i % 2 == 0 ? TestOutcome.PASSED : TestOutcome.FAILED);
        }

        FlakinessTracker reopened = new FlakinessTracker(repository, config, metricsConfig, clock);
        ingest(reopened, "proj", TestOutcome.PASSED);

        FlakyTestEntry entry = reopened.getFlakyTests("proj").get(0);
        assertThat(entry.getTotalRuns()).isEqualTo(5);
        assertThat(entry.getRecentPattern()).isEqualTo("PFPFP");
    }

    @Test
    void getFlakyTests_unknownProject_empty() {
        assertThat(tracker.getFlakyTests("never-seen")).isEmpty();
    }

    @Test
    void getFlakyTests_sortedByScoreDescending() {
        String[] outcomesA = {"P", "P", "P", "F"};
        String[] outcomesB = {"P", "F", "P", "F"};
        for (int i = 0; i < 4; i++) {
            TestRunReport report = TestDataFactory.report(
                    testCase("test_a", letter(outcomesA[i]), 0.1),
                    testCase("test_b", letter(outcomesB[i]), 0.1));
            tracker.ingest("proj", report, null);
            clock.advance(Duration.ofMinutes(1));
        }

        assertThat(tracker.getFlakyTests("proj"))
                .extracting(FlakyTestEntry::getTestId)
                .containsExactly("test_b", "test_a");
    }

    @Test
    void getAllFlakyTests_onlyProjectsWithFlakyTests() {
        for (int i = 0; i < 4; i++) {
            ingest("team/api", i % 2 == 0 ? TestOutcome.PASSED : TestOutcome.FAILED);
            ingest("stable", TestOutcome.PASSED);
        }

        Map<String, List<FlakyTestEntry>> all = tracker.getAllFlakyTests();

        assertThat(all).containsOnlyKeys("team_api");
        assertThat(all.get("team_api")).hasSize(1);
    }

    @Test
    void getTestTrends_recentSlowdown_flagsRegression() {
        for (int i = 0; i < 10; i++) {
            TestRunReport report = TestDataFactory.report(
                    testCase("test_slow", TestOutcome.PASSED, i < 5 ? 1.0 : 4.0));
            tracker.ingest("proj", report, "r" + i);
            clock.advance(Duration.ofHours(1));
        }

        TestTrend trend = tracker.getTestTrends("proj", "test_slow", 7);

        assertThat(trend.getTotalRuns()).isEqualTo(10);
        assertThat(trend.getSuccessRate()).isEqualTo(100.0);
        assertThat(trend.getOutcomes()).containsEntry(TestOutcome.PASSED, 10);
        assertThat(trend.getDurationStats().getMean()).isEqualTo(2.5);
        assertThat(trend.getDurationStats().getMax()).isEqualTo(4.0);
        assertThat(trend.isPerformanceRegression()).isTrue();
        assertThat(trend.getRegressionFactor()).isEqualTo(1.6);
        assertThat(trend.getRecentRuns()).hasSize(10);
    }

    @Test
    void getTestTrends_steadyDurations_noRegression() {
        for (int i = 0; i < 6; i++) {
            tracker.ingest("proj", TestDataFactory.report(testCase("test_x", TestOutcome.PASSED, 0.8)), null);
            clock.advance(Duration.ofHours(1));
        }

        TestTrend trend = tracker.getTestTrends("proj", "test_x", 7);

        assertThat(trend.isPerformanceRegression()).isFalse();
        assertThat(trend.getRegressionFactor()).isNull();
        assertThat(trend.getDurationStats().getStdDev()).isEqualTo(0.0);
    }

    @Test
    void getTestTrends_runsOutsideWindowIgnored() {
        ingest("proj", TestOutcome.FAILED);
        clock.advance(Duration.ofDays(10));
        ingest("proj", TestOutcome.PASSED);

        TestTrend trend = tracker.getTestTrends("proj", "test_target", 7);

        assertThat(trend.getTotalRuns()).isEqualTo(1);
        assertThat(trend.getOutcomes()).containsOnlyKeys(TestOutcome.PASSED);
        assertThat(trend.isPerformanceRegression()).isFalse();
    }

    @Test
    void getTestTrends_unknownTest_emptyTrend() {
        ingest("proj", TestOutcome.PASSED);

        TestTrend trend = tracker.getTestTrends("proj", "missing", 7);

        assertThat(trend.getTotalRuns()).isZero();
        assertThat(trend.getSuccessRate()).isEqualTo(0.0);
        assertThat(trend.getDurationStats()).isNull();
    }

    @Test
    void getProjectHealthHistory_returnsRunsInWindow() {
        tracker.ingest("proj", TestDataFactory.report(1, 1), "old");
        clock.advance(Duration.ofDays(3));
        tracker.ingest("proj", TestDataFactory.report(3, 1), "new");

        List<HealthPoint> points = tracker.getProjectHealthHistory("proj", 2);

        assertThat(points).hasSize(1);
        HealthPoint point = points.get(0);
        assertThat(point.getRunId()).isEqualTo("new");
        assertThat(point.getTotal()).isEqualTo(4);
        assertThat(point.getFailed()).isEqualTo(1);
        assertThat(point.getSuccessRate()).isEqualTo(75.0);
    }

    @Test
    void ingest_saveFails_carriesPendingResultForRetry() throws IOException {
        TestHistoryRepository failingRepository = mock(TestHistoryRepository.class);
        when(failingRepository.loadHistory("proj")).thenAnswer(inv -> new ArrayList<>());
        doThrow(new IOException("disk full")).doNothing()
                .when(failingRepository).saveHistory(eq("proj"), anyList());
        FlakinessTracker failing = new FlakinessTracker(failingRepository, config, metricsConfig, clock);

        StorageException error = catchStorageFailure(failing);
        IngestionResult pending = error.getPendingResult(IngestionResult.class);

        assertThat(error).hasCauseInstanceOf(IOException.class);
        assertThat(pending).isNotNull();
        assertThat(pending.isPersisted()).isFalse();
        assertThat(pending.getRun().getRunId()).isEqualTo("r1");
        assertThat(pending.getHistory()).hasSize(1);

        IngestionResult retried = failing.retryPersist(pending);

        assertThat(retried.isPersisted()).isTrue();
        assertThat(retried.getRun()).isEqualTo(pending.getRun());
    }

    @Test
    void retryPersist_newerRunsStored_refuses() throws IOException {
        TestHistoryRepository failingRepository = mock(TestHistoryRepository.class);
        RunRecord newer = RunRecord.builder()
                .runId("r2")
                .timestamp(TestDataFactory.NOW.toEpochMilli() + 60_000)
                .build();
        when(failingRepository.loadHistory("proj"))
                .thenAnswer(inv -> new ArrayList<>())
                .thenAnswer(inv -> new ArrayList<>(List.of(newer)));
        doThrow(new IOException("disk full")).when(failingRepository).saveHistory(eq("proj"), anyList());
        FlakinessTracker failing = new FlakinessTracker(failingRepository, config, metricsConfig, clock);

        IngestionResult pending = catchStorageFailure(failing).getPendingResult(IngestionResult.class);

        assertThatThrownBy(() -> failing.retryPersist(pending))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("newer runs");
    }

    @Test
    void ingest_historyUnreadable_noPendingResult() throws IOException {
        TestHistoryRepository brokenRepository = mock(TestHistoryRepository.class);
        when(brokenRepository.loadHistory("proj")).thenThrow(new IOException("corrupt"));
        FlakinessTracker broken = new FlakinessTracker(brokenRepository, config, metricsConfig, clock);

        StorageException error = catchStorageFailure(broken);

        assertThat(error.getPendingResult()).isNull();
    }

    private StorageException catchStorageFailure(FlakinessTracker target) {
        try {
            target.ingest("proj", TestDataFactory.report(2, 1), "r1");
        } catch (StorageException e) {
            return e;
        }
        throw new AssertionError("Expected StorageException");
    }

    private IngestionResult ingest(String project, TestOutcome outcome) {
        return ingest(tracker, project, outcome);
    }

    private IngestionResult ingest(FlakinessTracker target, String project, TestOutcome outcome) {
        TestRunReport report = TestDataFactory.report(
                testCase("test_target", outcome, 0.2),
                testCase("test_stable", TestOutcome.PASSED, 0.2));
        IngestionResult result = target.ingest(project, report, null);
        clock.advance(Duration.ofMinutes(1));
        return result;
    }

    private static TestOutcome letter(String letter) {
        return "P".equals(letter) ? TestOutcome.PASSED : TestOutcome.FAILED;
    }
}
