package labrunner.coordinator.repository;

import labrunner.coordinator.model.Host;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Store of lab hosts and their lease flags.
 */
public interface HostRepository {

    /**
     * Insert or update a host.
     *
     * @param host the host to save
     */
    void save(Host host);

    /**
     * Find a host by ID.
     *
     * @param hostId the host ID
     * @return the host if found
     */
    Optional<Host> findById(String hostId);

    /**
     * Get all hosts.
     *
     * @return hosts ordered by id
     */
    List<Host> findAll();

    /**
     * Leased hosts that are healthy and referenced by neither an active job
     * nor an incomplete special task. Computed from a single query.
     *
     * @return hosts that can be released
     */
    List<Host> findUnusedHealthy();

    /**
     * Unleased, unlocked, healthy hosts; candidates for new assignments.
     *
     * @return hosts ordered by id
     */
    List<Host> findAvailable();

    /**
     * Set or clear the lease flag of the given hosts in one statement.
     *
     * @param leased     the new flag value
     * @param hostIds    hosts to update
     * @return number of hosts updated
     */
    int setLeased(boolean leased, Collection<String> hostIds);

    /**
     * Atomically lease a host if it is not leased yet.
     *
     * @param hostId the host ID
     * @return true if this call took the lease
     */
    boolean tryLease(String hostId);
}
