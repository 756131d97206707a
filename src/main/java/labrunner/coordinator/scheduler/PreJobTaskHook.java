package labrunner.coordinator.scheduler;

import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.Job;

/**
 * Runs right after a job was activated on a host.
 */
@FunctionalInterface
public interface PreJobTaskHook {

    void beforeJob(Job job, Host host);
}
