package labrunner.coordinator.scheduler;

import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.Job;
import labrunner.coordinator.model.SpecialTask;
import labrunner.coordinator.model.SpecialTaskType;
import labrunner.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Queues a VERIFY task bound to the job, so the host is checked before the
 * job runs and stays referenced until the check completes.
 */
public class VerifyTaskHook implements PreJobTaskHook {

    private static final Logger log = LoggerFactory.getLogger(VerifyTaskHook.class);

    private final JobRepository jobRepository;

    public VerifyTaskHook(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    @Override
    public void beforeJob(Job job, Host host) {
        SpecialTask verify = SpecialTask.builder()
                .id(UUID.randomUUID().toString())
                .hostId(host.id())
                .jobId(job.id())
                .type(SpecialTaskType.VERIFY)
                .active(false)
                .complete(false)
                .createdAt(Instant.now())
                .build();
        jobRepository.saveSpecialTask(verify);
        log.debug("Queued {} before job {} on host {}", verify.type(), job.id(), host.id());
    }
}
