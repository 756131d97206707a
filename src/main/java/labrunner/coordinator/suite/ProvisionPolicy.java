package labrunner.coordinator.suite;

import labrunner.coordinator.model.SuiteRun;

/**
 * Finished once more distinct bots than the threshold have completed their
 * provisioning task successfully. Failures and pending tasks are ignored.
 */
public class ProvisionPolicy implements CompletionPolicy {

    @Override
    public boolean isFinished(SuiteRun run) {
        return run.successfulBots().size() > run.provisionThreshold();
    }
}
