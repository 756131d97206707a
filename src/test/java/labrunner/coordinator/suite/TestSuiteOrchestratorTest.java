package labrunner.coordinator.suite;

import labrunner.coordinator.config.RunnerConfig;
import labrunner.coordinator.model.ChildTestResult;
import labrunner.coordinator.model.RetryRecord;
import labrunner.coordinator.model.ReturnCode;
import labrunner.coordinator.model.SuiteMode;
import labrunner.coordinator.model.SuiteReport;
import labrunner.coordinator.model.SuiteRun;
import labrunner.coordinator.model.Task;
import labrunner.coordinator.model.TaskRequest;
import labrunner.coordinator.model.TaskState;
import labrunner.coordinator.model.TestSpec;
import labrunner.coordinator.repository.ErrorKind;
import labrunner.coordinator.repository.TaskQueueException;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestSuiteOrchestratorTest {

    private static final String SUITE_ID = "suite-4f2a10";

    private FakeTaskQueue queue;
    private FakeClock clock;
    private RunnerConfig config;

    @BeforeEach
    void setup() {
        queue = new FakeTaskQueue();
        clock = new FakeClock(Instant.parse("2024-03-01T10:00:00Z"));
        config = RunnerConfig.defaults().withMaxRetries(10);
    }

    private TestSuiteOrchestrator orchestrator() {
        return new TestSuiteOrchestrator(queue, config, clock, clock);
    }

    private static TestSpec spec(String name, int jobRetries) {
        return TestSpec.builder()
                .testName(name)
                .build("eve-release/R120-15600.0.0")
                .board("eve")
                .pool("suites")
                .jobRetries(jobRetries)
                .build();
    }

    private static TestSpec provisionSpec(int i) {
        return TestSpec.builder()
                .testName("provision")
                .build("eve-release/R120-15600.0.0")
                .board("eve")
                .pool("suites")
                .botId("bot-" + i)
                .dutName("chromeos4-row1-host" + i)
                .build();
    }

    @Test
    void submitsOneTaskPerSpecUnderTheSuite() {
        SuiteRun run = orchestrator().start(SUITE_ID, List.of(spec("A", 2), spec("B", 1)), SuiteMode.NORMAL, 0);

        assertEquals(2, queue.submittedCount());
        assertEquals(List.of("task-1", "task-2"), List.copyOf(run.activeTaskIds()));
        for (TaskRequest request : queue.submitted()) {
            assertEquals(SUITE_ID, request.parentId());
            assertTrue(request.tags().contains("parent_task_id:" + SUITE_ID));
        }
    }

    @Test
    void firstAttemptUsesOneJobRetry() {
        SuiteRun run = orchestrator().start(SUITE_ID, List.of(spec("A", 3)), SuiteMode.NORMAL, 0);

        RetryRecord record = run.record("task-1").orElseThrow();
        assertEquals(2, record.remainingRetries());
        assertTrue(record.previousRetriedIds().isEmpty());
    }

    @Test
    void usesConfiguredSuiteId() {
        config.withSuiteId("from-env");
        SuiteRun run = orchestrator().start(List.of(spec("A", 1)), SuiteMode.NORMAL, 0);
        assertEquals("from-env", run.suiteId());
    }

    @Test
    void rejectsMissingSuiteId() {
        assertThrows(IllegalStateException.class,
                () -> orchestrator().start(List.of(spec("A", 1)), SuiteMode.NORMAL, 0));
    }

    @Test
    void submissionFailurePropagates() {
        queue.failSubmissions(new TaskQueueException(ErrorKind.INFRA, "queue unreachable"));

        TaskQueueException e = assertThrows(TaskQueueException.class,
                () -> orchestrator().start(SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0));
        assertEquals(ErrorKind.INFRA, e.kind());
    }

    @Test
    @DisplayName("three tests, two retried once, one failure left")
    void endToEndScenario() {
        config.withMaxRetries(5);
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 2), spec("B", 2), spec("C", 2)),
                SuiteMode.NORMAL, 0);
        assertEquals(1, run.record("task-1").orElseThrow().remainingRetries());

        queue.finish("task-1", TaskState.COMPLETED, true);
        queue.finish("task-2", TaskState.COMPLETED, false);
        queue.setState("task-3", TaskState.EXPIRED);

        assertTrue(orchestrator.pollAndAdvance(run));
        assertEquals(3, run.remainingSuiteRetries());
        // Retries keep the test's position
        assertEquals(List.of("task-4", "task-2", "task-5"), List.copyOf(run.activeTaskIds()));
        assertEquals(0, run.record("task-4").orElseThrow().remainingRetries());
        assertEquals(List.of("task-1"), run.record("task-4").orElseThrow().previousRetriedIds());
        assertEquals(0, run.record("task-5").orElseThrow().remainingRetries());
        assertEquals(List.of("task-3"), run.record("task-5").orElseThrow().previousRetriedIds());
        assertFalse(orchestrator.isFinishedWaiting(run));

        queue.finish("task-4", TaskState.COMPLETED, true);
        queue.finish("task-5", TaskState.COMPLETED, false);

        assertFalse(orchestrator.pollAndAdvance(run));
        assertTrue(orchestrator.isFinishedWaiting(run));
        assertEquals(5, queue.submittedCount());
        assertEquals(3, run.remainingSuiteRetries());

        SuiteReport report = new SuiteReporter().report("bvt-inline", run);
        assertEquals(2, report.passedCount());
        assertEquals(1, report.failedCount());
        ChildTestResult a = report.results().get(0);
        assertEquals("A", a.testName());
        assertEquals(Task.COMPLETED_FAILURE, a.state());
        assertEquals(List.of("task-1", "task-4"), a.taskIds());
        assertEquals(ReturnCode.ERROR, report.returnCode());
    }

    @Test
    void stopsRetryingWhenTestBudgetIsExhausted() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 3)), SuiteMode.NORMAL, 0);

        String active = "task-1";
        int[] expectedRemaining = { 1, 0 };
        for (int remaining : expectedRemaining) {
            queue.finish(active, TaskState.COMPLETED, true);
            assertTrue(orchestrator.pollAndAdvance(run));
            active = run.activeTaskIds().iterator().next();
            assertEquals(remaining, run.record(active).orElseThrow().remainingRetries());
        }

        queue.finish(active, TaskState.COMPLETED, true);
        assertFalse(orchestrator.pollAndAdvance(run));
        assertTrue(orchestrator.isFinishedWaiting(run));
        assertEquals(3, queue.submittedCount());
        assertEquals(8, run.remainingSuiteRetries());
    }

    @Test
    void stopsRetryingWhenSuiteBudgetIsExhausted() {
        config.withMaxRetries(1);
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 5), spec("B", 5)), SuiteMode.NORMAL, 0);

        queue.finish("task-1", TaskState.COMPLETED, true);
        queue.finish("task-2", TaskState.COMPLETED, true);

        assertTrue(orchestrator.pollAndAdvance(run));
        assertEquals(3, queue.submittedCount());
        assertEquals(0, run.remainingSuiteRetries());
        assertTrue(run.isActive("task-2"));
        assertEquals(4, run.record("task-2").orElseThrow().remainingRetries());

        queue.finish("task-3", TaskState.KILLED, false);
        assertFalse(orchestrator.pollAndAdvance(run));
        assertEquals(3, queue.submittedCount());
        assertTrue(orchestrator.isFinishedWaiting(run));
    }

    @Test
    void neverRetriesSuccess() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 5)), SuiteMode.NORMAL, 0);

        queue.finish("task-1", TaskState.COMPLETED, false);

        assertFalse(orchestrator.pollAndAdvance(run));
        assertEquals(1, queue.submittedCount());
        assertTrue(orchestrator.isFinishedWaiting(run));
    }

    @Test
    void zeroJobRetriesRunsOnceAndFinishes() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 0)), SuiteMode.NORMAL, 0);
        assertEquals(-1, run.record("task-1").orElseThrow().remainingRetries());

        queue.finish("task-1", TaskState.COMPLETED, true);

        assertFalse(orchestrator.pollAndAdvance(run));
        assertTrue(orchestrator.isFinishedWaiting(run));
        assertEquals(1, queue.submittedCount());
        assertEquals(10, run.remainingSuiteRetries());
    }

    @Test
    void retriesNothingWhenTestRetryIsDisabled() {
        config.withTestRetry(false);
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 5)), SuiteMode.NORMAL, 0);

        queue.finish("task-1", TaskState.FAILED_INFRA, false);

        assertFalse(orchestrator.pollAndAdvance(run));
        assertTrue(orchestrator.isFinishedWaiting(run));
    }

    @Test
    void ignoresSupersededTasks() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 2)), SuiteMode.NORMAL, 0);

        queue.finish("task-1", TaskState.COMPLETED, true);
        assertTrue(orchestrator.pollAndAdvance(run));
        assertEquals(List.of("task-1"), List.copyOf(run.supersededTaskIds()));

        // task-1 still comes back from the queue as a terminal failure
        for (int i = 0; i < 3; i++) {
            assertFalse(orchestrator.pollAndAdvance(run));
        }
        assertEquals(2, queue.submittedCount());
        assertFalse(run.lastSnapshot().containsKey("task-1"));
        assertFalse(orchestrator.isFinishedWaiting(run));

        queue.finish("task-2", TaskState.COMPLETED, false);
        orchestrator.pollAndAdvance(run);
        assertTrue(orchestrator.isFinishedWaiting(run));
    }

    @Test
    void pendingTasksAreNotTouched() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 2), spec("B", 2)), SuiteMode.NORMAL, 0);

        queue.setState("task-2", TaskState.RUNNING);

        assertFalse(orchestrator.pollAndAdvance(run));
        assertEquals(2, run.outstandingCount());
        assertFalse(orchestrator.isFinishedWaiting(run));
    }

    @Test
    void retrySubmissionFailurePropagates() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 2)), SuiteMode.NORMAL, 0);

        queue.finish("task-1", TaskState.COMPLETED, true);
        queue.failSubmissions(new TaskQueueException(ErrorKind.TIMEOUT, "submit timed out"));

        TaskQueueException e = assertThrows(TaskQueueException.class, () -> orchestrator.pollAndAdvance(run));
        assertEquals(ErrorKind.TIMEOUT, e.kind());
        assertTrue(run.isActive("task-1"));
        assertEquals(10, run.remainingSuiteRetries());
    }

    @Test
    void falseBeforeFirstPoll() {
        SuiteRun run = orchestrator().start(SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0);
        queue.finish("task-1", TaskState.COMPLETED, false);

        assertFalse(orchestrator().isFinishedWaiting(run));
    }

    @Test
    void isIdempotentBetweenPolls() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 2), spec("B", 1)), SuiteMode.NORMAL, 0);

        queue.finish("task-1", TaskState.COMPLETED, true);
        queue.finish("task-2", TaskState.COMPLETED, false);
        orchestrator.pollAndAdvance(run);

        boolean first = orchestrator.isFinishedWaiting(run);
        // The queue moving on must not change the answer until the next poll
        queue.finish("task-3", TaskState.COMPLETED, false);
        assertEquals(first, orchestrator.isFinishedWaiting(run));
        assertFalse(first);

        orchestrator.pollAndAdvance(run);
        assertTrue(orchestrator.isFinishedWaiting(run));
        assertTrue(orchestrator.isFinishedWaiting(run));
    }

    @Test
    void provisionModeStopsOnceThresholdIsExceeded() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        List<TestSpec> specs = List.of(provisionSpec(1), provisionSpec(2), provisionSpec(3), provisionSpec(4),
                provisionSpec(5));
        SuiteRun run = orchestrator.start(SUITE_ID, specs, SuiteMode.PROVISION, 2);

        queue.finish("task-1", TaskState.COMPLETED, false, "bot-1");
        queue.finish("task-2", TaskState.COMPLETED, false, "bot-2");
        orchestrator.pollAndAdvance(run);
        assertFalse(orchestrator.isFinishedWaiting(run));

        queue.finish("task-3", TaskState.COMPLETED, false, "bot-3");
        orchestrator.pollAndAdvance(run);
        assertTrue(orchestrator.isFinishedWaiting(run));
        assertEquals(2, run.outstandingCount());
    }

    @Test
    void provisionModeCountsBotsNotTasks() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(provisionSpec(1), provisionSpec(2), provisionSpec(3)),
                SuiteMode.PROVISION, 1);

        queue.finish("task-1", TaskState.COMPLETED, false, "bot-1");
        queue.finish("task-2", TaskState.COMPLETED, false, "bot-1");
        queue.finish("task-3", TaskState.COMPLETED, true, "bot-3");
        orchestrator.pollAndAdvance(run);

        assertFalse(orchestrator.isFinishedWaiting(run));
    }

    @Test
    void returnsOnceFinished() throws InterruptedException {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0);
        queue.finish("task-1", TaskState.COMPLETED, false);

        orchestrator.runToCompletion(run, Duration.ofSeconds(30), Duration.ofMinutes(5));

        assertEquals(1, queue.queries());
        assertTrue(clock.sleeps().isEmpty());
    }

    @Test
    void timesOutWithOutstandingCount() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0);

        SuiteTimeoutException e = assertThrows(SuiteTimeoutException.class,
                () -> orchestrator.runToCompletion(run, Duration.ofSeconds(1), Duration.ofSeconds(3)));

        assertEquals(1, e.outstandingTasks());
        assertEquals(SUITE_ID, e.suiteId());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1)),
                clock.sleeps());
        assertEquals(4, queue.queries());
    }

    @Test
    void lastSleepIsCutAtTheDeadline() {
        TestSuiteOrchestrator orchestrator = orchestrator();
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0);

        assertThrows(SuiteTimeoutException.class,
                () -> orchestrator.runToCompletion(run, Duration.ofSeconds(30), Duration.ofSeconds(45)));

        assertEquals(List.of(Duration.ofSeconds(30), Duration.ofSeconds(15)), clock.sleeps());
    }

    @Test
    @DisplayName("times out on the wall clock without hanging")
    void timesOutInRealTime() {
        TestSuiteOrchestrator orchestrator = new TestSuiteOrchestrator(queue, config);
        SuiteRun run = orchestrator.start(SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0);

        long started = System.nanoTime();
        assertTimeoutPreemptively(Duration.ofSeconds(6), () -> assertThrows(SuiteTimeoutException.class,
                () -> orchestrator.runToCompletion(run, Duration.ofSeconds(1), Duration.ofSeconds(3))));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertTrue(elapsedMs >= 2900, "returned too early: " + elapsedMs + "ms");
    }

    @Test
    void runReportsTimeoutInsteadOfThrowing() throws InterruptedException {
        config.withSuitePollInterval(Duration.ofSeconds(30)).withSuiteTimeout(Duration.ofMinutes(2));

        SuiteReport report = orchestrator().run("bvt-cq", SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0,
                false);

        assertEquals(SuiteReport.TIMED_OUT, report.state());
        assertEquals(ReturnCode.SUITE_TIMEOUT, report.returnCode());
        assertEquals(4, report.returnCode().exitCode());
        assertEquals(1, report.outstandingCount());
        assertEquals(0, report.passedCount());
        assertEquals(0, report.failedCount());
    }

    private Task seeded(String id, String name, TaskState state, String... tags) {
        return Task.builder().id(id).name(name).parentId(SUITE_ID).state(state).tags(List.of(tags)).build();
    }

    @Test
    void rebuildsRecordsFromQueueHistory() {
        queue.seed(seeded("old-a1", "A", TaskState.COMPLETED));
        queue.seed(seeded("old-a2", "A", TaskState.RUNNING));
        queue.seed(seeded("old-c1", "C", TaskState.KILLED));

        SuiteRun run = orchestrator().resume(SUITE_ID, List.of(spec("A", 3), spec("B", 2), spec("C", 1)),
                SuiteMode.NORMAL, 0);

        RetryRecord a = run.record("old-a2").orElseThrow();
        assertEquals(1, a.remainingRetries());
        assertEquals(List.of("old-a1"), a.previousRetriedIds());

        // No unfinished task: the first one stays active
        RetryRecord c = run.record("old-c1").orElseThrow();
        assertEquals(0, c.remainingRetries());

        // B was never scheduled
        assertEquals(1, queue.submittedCount());
        assertEquals("B", queue.submitted().get(0).name());
        assertEquals(1, run.record("task-1").orElseThrow().remainingRetries());
    }

    @Test
    void matchesProvisionTasksByBotTag() {
        queue.seed(seeded("old-1", "provision", TaskState.PENDING, "id:bot-1"));

        SuiteRun run = orchestrator().resume(SUITE_ID, List.of(provisionSpec(1), provisionSpec(2)),
                SuiteMode.PROVISION, 1);

        assertTrue(run.isActive("old-1"));
        assertTrue(run.isActive("task-1"));
        assertTrue(queue.submitted().get(0).tags().contains("id:bot-2"));
    }

    @Test
    void rejectsTwoUnfinishedTasksForOneTest() {
        queue.seed(seeded("old-a1", "A", TaskState.RUNNING));
        queue.seed(seeded("old-a2", "A", TaskState.PENDING));

        assertThrows(IllegalStateException.class,
                () -> orchestrator().resume(SUITE_ID, List.of(spec("A", 3)), SuiteMode.NORMAL, 0));
    }

    @Test
    void dryRunEchoesCommandsAndRenamesTasks() {
        config.withDryRun(true);
        orchestrator().start(SUITE_ID, List.of(spec("A", 1)), SuiteMode.NORMAL, 0);

        TaskRequest request = queue.submitted().get(0);
        assertEquals("Echo A", request.name());
        assertEquals("/bin/echo", request.slices().get(0).command().get(0));
        assertEquals("/bin/echo", request.slices().get(1).command().get(0));
    }
}
