package labrunner.coordinator.repository;

import labrunner.coordinator.model.Job;
import labrunner.coordinator.model.SpecialTask;

import java.util.List;
import java.util.Optional;

/**
 * Queries over queued jobs and host maintenance tasks.
 */
public interface JobRepository {

    void save(Job job);

    Optional<Job> findById(String jobId);

    /**
     * Jobs that are neither active nor complete, highest priority first.
     */
    List<Job> findPendingJobs();

    /**
     * Mark a pending job active on the given host.
     *
     * @return false if the job was already active or complete
     */
    boolean activate(String jobId, String hostId);

    /**
     * Mark a job complete and inactive.
     *
     * @return true if updated
     */
    boolean complete(String jobId);

    /**
     * Active, incomplete jobs that share their host with another such job.
     * Ordered by host, then job id.
     */
    List<Job> findOverlappingJobs();

    void saveSpecialTask(SpecialTask task);

    Optional<SpecialTask> findSpecialTask(String taskId);

    List<SpecialTask> findSpecialTasksForJob(String jobId);

    /**
     * Mark a special task complete and inactive.
     *
     * @return true if updated
     */
    boolean completeSpecialTask(String taskId);

    /**
     * Hosts of incomplete frontend special tasks (tasks without a job) that
     * are not leased yet.
     */
    List<String> findUnleasedHostsOfFrontendTasks();

    /**
     * Incomplete, inactive special tasks ready to run, job-bound tasks first.
     * A task is skipped while its host is held by an active job other than
     * its own.
     *
     * @param onlyLeasedHosts only return tasks whose host is leased
     */
    List<SpecialTask> findPrioritizedSpecialTasks(boolean onlyLeasedHosts);

    /**
     * Mark a queued special task active, unless another special task is
     * already active on its host.
     *
     * @return false if the task was not queued or its host is busy
     */
    boolean startSpecialTask(String taskId);
}
