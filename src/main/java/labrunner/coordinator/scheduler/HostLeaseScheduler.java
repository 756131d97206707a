package labrunner.coordinator.scheduler;

import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.Job;
import labrunner.coordinator.model.SpecialTask;
import labrunner.coordinator.repository.HostMatcher;
import labrunner.coordinator.repository.HostRepository;
import labrunner.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Leases hosts to queued work and releases them once nothing references them.
 *
 * Each tick:
 * 1. release leased hosts that no active job or pending special task uses
 * 2. lease the hosts of frontend special tasks (unless disabled)
 * 3. assign hosts to pending jobs
 * 4. start queued special tasks on leased hosts
 * 5. report hosts held by more than one active job
 *
 * Frontend leasing runs before job scheduling so that maintenance work
 * requested from the frontend is not starved by new jobs.
 */
public class HostLeaseScheduler implements HostScheduler {

    private static final Logger log = LoggerFactory.getLogger(HostLeaseScheduler.class);

    static final String OVERLAPPING_JOBS_SUBJECT = "Hosts assigned to more than one active job";

    private final HostRepository hostRepository;
    private final JobRepository jobRepository;
    private final HostMatcher hostMatcher;
    private final PreJobTaskHook preJobTaskHook;
    private final Notifier notifier;
    private final boolean leaseFrontendTaskHosts;

    public HostLeaseScheduler(HostRepository hostRepository, JobRepository jobRepository, HostMatcher hostMatcher,
            PreJobTaskHook preJobTaskHook, Notifier notifier) {
        this(hostRepository, jobRepository, hostMatcher, preJobTaskHook, notifier, true);
    }

    /**
     * @param leaseFrontendTaskHosts false for the base variant that leaves
     *                               frontend tasks to another process
     */
    public HostLeaseScheduler(HostRepository hostRepository, JobRepository jobRepository, HostMatcher hostMatcher,
            PreJobTaskHook preJobTaskHook, Notifier notifier, boolean leaseFrontendTaskHosts) {
        this.hostRepository = hostRepository;
        this.jobRepository = jobRepository;
        this.hostMatcher = hostMatcher;
        this.preJobTaskHook = preJobTaskHook;
        this.notifier = notifier;
        this.leaseFrontendTaskHosts = leaseFrontendTaskHosts;
    }

    @Override
    public void tick() {
        releaseHosts();
        if (leaseFrontendTaskHosts) {
            leaseHostsOfFrontendTasks();
        }
        scheduleJobs();
        startSpecialTasks();
        checkHostAssignments();
    }

    /**
     * Clear the lease of every healthy host nothing references, computed from
     * a fresh snapshot.
     *
     * @return number of hosts released
     */
    public int releaseHosts() {
        List<String> unused = new ArrayList<>();
        for (Host host : hostRepository.findUnusedHealthy()) {
            unused.add(host.id());
        }
        if (unused.isEmpty()) {
            return 0;
        }
        int released = hostRepository.setLeased(false, unused);
        log.info("Released {} host(s): {}", released, unused);
        return released;
    }

    /**
     * Lease the hosts of frontend special tasks. Leasing a host that got
     * leased meanwhile is harmless: release only looks at references.
     *
     * @return number of hosts leased
     */
    public int leaseHostsOfFrontendTasks() {
        List<String> hostIds = jobRepository.findUnleasedHostsOfFrontendTasks();
        if (hostIds.isEmpty()) {
            return 0;
        }
        int leased = hostRepository.setLeased(true, hostIds);
        log.info("Leased {} host(s) for frontend tasks: {}", leased, hostIds);
        return leased;
    }

    /**
     * Give every pending job a host, either the one it already names or one
     * found by the matcher.
     *
     * @return number of jobs activated
     */
    public int scheduleJobs() {
        List<Job> pending = jobRepository.findPendingJobs();
        if (pending.isEmpty()) {
            log.debug("No pending jobs");
            return 0;
        }

        int activated = 0;
        for (Job job : pending) {
            Optional<Host> host = job.hasHost() ? leasePreassignedHost(job) : hostMatcher.acquire(job);
            if (host.isEmpty()) {
                log.debug("No host for job {} this tick", job.id());
                continue;
            }
            if (!jobRepository.activate(job.id(), host.get().id())) {
                // Lease is dropped by the next release pass
                log.warn("Job {} changed state before it could be activated on {}", job.id(), host.get().id());
                continue;
            }
            log.info("Job {} activated on host {}", job.id(), host.get().id());
            preJobTaskHook.beforeJob(job, host.get());
            activated++;
        }
        return activated;
    }

    /**
     * Start queued special tasks whose host is leased, job-bound tasks first.
     * At most one special task runs on a host at a time.
     *
     * @return number of tasks started
     */
    public int startSpecialTasks() {
        int started = 0;
        for (SpecialTask task : jobRepository.findPrioritizedSpecialTasks(true)) {
            if (jobRepository.startSpecialTask(task.id())) {
                log.info("Started {} task {} on host {}", task.type(), task.id(), task.hostId());
                started++;
            } else {
                log.debug("Host {} is busy, {} task {} waits", task.hostId(), task.type(), task.id());
            }
        }
        return started;
    }

    /**
     * Report hosts held by several active jobs. Never corrects them.
     *
     * @return number of offending hosts
     */
    public int checkHostAssignments() {
        List<Job> overlapping = jobRepository.findOverlappingJobs();
        if (overlapping.isEmpty()) {
            return 0;
        }

        Map<String, List<String>> jobsByHost = new LinkedHashMap<>();
        for (Job job : overlapping) {
            jobsByHost.computeIfAbsent(job.hostId(), h -> new ArrayList<>()).add(job.id());
        }

        StringBuilder message = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : jobsByHost.entrySet()) {
            message.append("host ").append(entry.getKey()).append(" -> jobs ").append(entry.getValue()).append('\n');
        }
        notifier.notify(OVERLAPPING_JOBS_SUBJECT, message.toString().trim());
        return jobsByHost.size();
    }

    private Optional<Host> leasePreassignedHost(Job job) {
        Optional<Host> host = hostRepository.findById(job.hostId());
        if (host.isEmpty()) {
            log.warn("Job {} names unknown host {}", job.id(), job.hostId());
            return Optional.empty();
        }
        if (host.get().leased()) {
            log.debug("Host {} of job {} is leased, waiting", job.hostId(), job.id());
            return Optional.empty();
        }
        if (!hostMatcher.matches(job, host.get())) {
            log.warn("Host {} does not satisfy the dependencies of job {}: {}",
                    job.hostId(), job.id(), job.dependencies());
            return Optional.empty();
        }
        if (!hostRepository.tryLease(job.hostId())) {
            return Optional.empty();
        }
        return Optional.of(host.get().toBuilder().leased(true).build());
    }
}
