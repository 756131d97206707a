package labrunner.coordinator.repository;

import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.Job;

import java.util.Optional;

/**
 * Finds hosts that satisfy a job's requirements.
 */
public interface HostMatcher {

    /**
     * Whether the host satisfies the job's requirements.
     */
    boolean matches(Job job, Host host);

    /**
     * Find a free matching host and lease it.
     *
     * @return the leased host, or empty if none could be acquired
     */
    Optional<Host> acquire(Job job);
}
