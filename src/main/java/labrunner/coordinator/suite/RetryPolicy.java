package labrunner.coordinator.suite;

import labrunner.coordinator.model.RetryRecord;
import labrunner.coordinator.model.SuiteRun;
import labrunner.coordinator.model.Task;
import labrunner.coordinator.model.TaskState;

import java.util.Optional;

/**
 * Decides whether a finished child task gets resubmitted.
 *
 * Pure: budgets are only read here. The orchestrator applies the side
 * effects after a positive decision.
 */
public final class RetryPolicy {

    private RetryPolicy() {
    }

    /**
     * @param retryEnabled whether test retries are turned on for the run
     * @param state        task state from the latest poll
     * @param failure      failure flag reported with the state
     * @param record       record whose active id is the task, or null if the
     *                     task is not (or no longer) active
     * @param suiteBudget  retries left in the shared suite budget
     */
    public static boolean shouldRetry(boolean retryEnabled, TaskState state, boolean failure,
            RetryRecord record, int suiteBudget) {
        if (!retryEnabled || record == null) {
            return false;
        }
        boolean unsuccessful = (state == TaskState.COMPLETED && failure) || state.isInfraFailure();
        return unsuccessful && record.remainingRetries() > 0 && suiteBudget > 0;
    }

    /**
     * Decision for one task of the given run, against the run's live budget.
     */
    public static boolean shouldRetry(SuiteRun run, Task task) {
        Optional<RetryRecord> record = run.record(task.id());
        return shouldRetry(run.retryEnabled(), task.state(), task.failure(), record.orElse(null),
                run.remainingSuiteRetries());
    }
}
