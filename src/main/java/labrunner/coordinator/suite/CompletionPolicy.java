package labrunner.coordinator.suite;

import labrunner.coordinator.model.SuiteMode;
import labrunner.coordinator.model.SuiteRun;

/**
 * Decides when a suite run may stop waiting. Evaluated against the state the
 * last poll left in the run, so repeated calls without a poll agree.
 */
public interface CompletionPolicy {

    boolean isFinished(SuiteRun run);

    static CompletionPolicy forMode(SuiteMode mode) {
        return switch (mode) {
            case NORMAL -> new AllTasksFinishedPolicy();
            case PROVISION -> new ProvisionPolicy();
        };
    }
}
