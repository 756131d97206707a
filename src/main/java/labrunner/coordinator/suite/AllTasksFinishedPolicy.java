package labrunner.coordinator.suite;

import labrunner.coordinator.model.SuiteRun;
import labrunner.coordinator.model.Task;

import java.util.Optional;

/**
 * Finished when the last poll retried nothing and saw every active task
 * terminal. A retry made in that poll adds an active id the poll never saw,
 * so the run keeps waiting for it.
 */
public class AllTasksFinishedPolicy implements CompletionPolicy {

    @Override
    public boolean isFinished(SuiteRun run) {
        if (run.pollCount() == 0 || run.retriedInLastPoll()) {
            return false;
        }
        for (String taskId : run.activeTaskIds()) {
            Optional<Task> seen = run.lastSeen(taskId);
            if (seen.isEmpty() || !seen.get().isTerminal()) {
                return false;
            }
        }
        return true;
    }
}
