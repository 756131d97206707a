package labrunner.coordinator.store;

import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.Job;
import labrunner.coordinator.repository.HostMatcher;
import labrunner.coordinator.repository.HostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Matches jobs to hosts by labels: a host qualifies when it carries every
 * label the job depends on. Acquisition leases the first qualifying host
 * that is still free, losing races to other schedulers gracefully.
 */
public class LabelHostMatcher implements HostMatcher {

    private static final Logger log = LoggerFactory.getLogger(LabelHostMatcher.class);

    private final HostRepository hostRepository;

    public LabelHostMatcher(HostRepository hostRepository) {
        this.hostRepository = hostRepository;
    }

    @Override
    public boolean matches(Job job, Host host) {
        return host.isUsable() && host.labels().containsAll(job.dependencies());
    }

    @Override
    public Optional<Host> acquire(Job job) {
        for (Host host : hostRepository.findAvailable()) {
            if (!matches(job, host)) {
                continue;
            }
            if (hostRepository.tryLease(host.id())) {
                log.debug("Acquired host {} for job {}", host.id(), job.id());
                return Optional.of(host.toBuilder().leased(true).build());
            }
            log.debug("Host {} was leased by someone else, trying next", host.id());
        }
        return Optional.empty();
    }
}
