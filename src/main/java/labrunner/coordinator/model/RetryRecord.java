package labrunner.coordinator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Retry lineage of one logical child test: the task id currently being
 * polled, how many retries it has left and the ids it superseded.
 * Superseded ids are kept for reporting only and are never polled again.
 */
public final class RetryRecord {
    private final TestSpec testSpec;
    private final String taskId;
    private final int remainingRetries;
    private final List<String> previousRetriedIds;

    public RetryRecord(TestSpec testSpec, String taskId, int remainingRetries, List<String> previousRetriedIds) {
        this.testSpec = Objects.requireNonNull(testSpec, "testSpec is required");
        this.taskId = Objects.requireNonNull(taskId, "taskId is required");
        this.remainingRetries = remainingRetries;
        this.previousRetriedIds = List.copyOf(previousRetriedIds);
    }

    /** Record for a freshly scheduled test; the first attempt uses up one of its job retries. */
    public static RetryRecord first(TestSpec testSpec, String taskId) {
        return new RetryRecord(testSpec, taskId, testSpec.jobRetries() - 1, List.of());
    }

    public TestSpec testSpec() {
        return testSpec;
    }

    public String taskId() {
        return taskId;
    }

    public int remainingRetries() {
        return remainingRetries;
    }

    public List<String> previousRetriedIds() {
        return previousRetriedIds;
    }

    public int retryCount() {
        return previousRetriedIds.size();
    }

    /** All task ids of this test, oldest first; the active id is last. */
    public List<String> allTaskIds() {
        List<String> ids = new ArrayList<>(previousRetriedIds);
        ids.add(taskId);
        return ids;
    }

    /**
     * Record that replaces this one after the active task was retried as
     * {@code newTaskId}.
     */
    public RetryRecord retriedAs(String newTaskId) {
        List<String> previous = new ArrayList<>(previousRetriedIds);
        previous.add(taskId);
        return new RetryRecord(testSpec, newTaskId, remainingRetries - 1, previous);
    }

    @Override
    public String toString() {
        return "RetryRecord{test='" + testSpec.testName() + "', taskId='" + taskId
                + "', remainingRetries=" + remainingRetries + ", previous=" + previousRetriedIds + "}";
    }
}
