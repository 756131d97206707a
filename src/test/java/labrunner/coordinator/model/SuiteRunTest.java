package labrunner.coordinator.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SuiteRunTest {

    private static TestSpec spec(String name) {
        return TestSpec.builder().testName(name).build("eve-release/R120").board("eve").pool("cq")
                .jobRetries(3).build();
    }

    private static Task done(String id, String botId, boolean failure) {
        return Task.builder().id(id).state(TaskState.COMPLETED).failure(failure).botId(botId).build();
    }

    @Test
    void replaceKeepsSchedulingOrder() {
        SuiteRun run = new SuiteRun("suite-1", SuiteMode.NORMAL, 0, true, 5);
        run.track(RetryRecord.first(spec("a"), "t1"));
        run.track(RetryRecord.first(spec("b"), "t2"));
        run.track(RetryRecord.first(spec("c"), "t3"));

        run.replace("t2", run.record("t2").orElseThrow().retriedAs("t4"));

        assertEquals(List.of("t1", "t4", "t3"), List.copyOf(run.activeTaskIds()));
        assertFalse(run.isActive("t2"));
        assertEquals(List.of("t2"), List.copyOf(run.supersededTaskIds()));

        RetryRecord retried = run.record("t4").orElseThrow();
        assertEquals(1, retried.retryCount());
        assertEquals(1, retried.remainingRetries());
        assertEquals(List.of("t2", "t4"), retried.allTaskIds());
    }

    @Test
    void replacingAnInactiveIdFails() {
        SuiteRun run = new SuiteRun("suite-1", SuiteMode.NORMAL, 0, true, 5);
        RetryRecord record = RetryRecord.first(spec("a"), "t1");
        run.track(record);

        assertThrows(IllegalStateException.class, () -> run.replace("t9", record.retriedAs("t2")));
        assertThrows(IllegalStateException.class, () -> run.track(record));
    }

    @Test
    void suiteBudgetCannotGoNegative() {
        SuiteRun run = new SuiteRun("suite-1", SuiteMode.NORMAL, 0, true, 1);
        run.consumeSuiteRetry();
        assertEquals(0, run.remainingSuiteRetries());
        assertThrows(IllegalStateException.class, run::consumeSuiteRetry);

        assertEquals(0, new SuiteRun("suite-2", SuiteMode.NORMAL, 0, true, -3).remainingSuiteRetries());
    }

    @Test
    void outstandingCountsUnseenAndUnfinishedTasks() {
        SuiteRun run = new SuiteRun("suite-1", SuiteMode.NORMAL, 0, true, 5);
        run.track(RetryRecord.first(spec("a"), "t1"));
        run.track(RetryRecord.first(spec("b"), "t2"));
        run.track(RetryRecord.first(spec("c"), "t3"));

        run.recordPoll(Map.of(
                "t1", done("t1", "bot-1", false),
                "t2", Task.builder().id("t2").state(TaskState.RUNNING).build()), false);

        assertEquals(2, run.outstandingCount());
        assertEquals(1, run.pollCount());
        assertTrue(run.lastSeen("t3").isEmpty());
    }

    @Test
    void successfulBotsAreDistinctAndOnlyFromActiveTasks() {
        SuiteRun run = new SuiteRun("suite-1", SuiteMode.PROVISION, 1, false, 0);
        run.track(RetryRecord.first(spec("a"), "t1"));
        run.track(RetryRecord.first(spec("b"), "t2"));
        run.track(RetryRecord.first(spec("c"), "t3"));

        run.recordPoll(Map.of(
                "t1", done("t1", "bot-1", false),
                "t2", done("t2", "bot-1", false),
                "t3", done("t3", "bot-3", true),
                "old", done("old", "bot-9", false)), false);

        assertEquals(List.of("bot-1"), List.copyOf(run.successfulBots()));
    }

    @Test
    void rejectsInvalidRuns() {
        assertThrows(IllegalArgumentException.class, () -> new SuiteRun(" ", SuiteMode.NORMAL, 0, true, 0));
        assertThrows(IllegalArgumentException.class, () -> new SuiteRun("s", SuiteMode.PROVISION, -1, true, 0));
    }

    @Test
    void firstAttemptUsesOneJobRetry() {
        assertEquals(2, RetryRecord.first(spec("a"), "t1").remainingRetries());
    }

    @Test
    void zeroJobRetriesLeavesNothingToRetry() {
        TestSpec once = TestSpec.builder().testName("a").build("b").board("eve").pool("cq").jobRetries(0).build();
        assertEquals(-1, RetryRecord.first(once, "t1").remainingRetries());

        assertThrows(IllegalArgumentException.class,
                () -> TestSpec.builder().testName("a").build("b").board("eve").pool("cq").jobRetries(-1).build());
    }
}
