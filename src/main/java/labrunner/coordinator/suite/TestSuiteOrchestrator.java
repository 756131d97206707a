package labrunner.coordinator.suite;

import labrunner.coordinator.config.RunnerConfig;
import labrunner.coordinator.model.RetryRecord;
import labrunner.coordinator.model.SuiteMode;
import labrunner.coordinator.model.SuiteReport;
import labrunner.coordinator.model.SuiteRun;
import labrunner.coordinator.model.Task;
import labrunner.coordinator.model.TestSpec;
import labrunner.coordinator.repository.TaskQueueClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches the child tests of a suite to the task queue, polls them and
 * resubmits failed ones within the per-test and suite-wide retry budgets.
 *
 * One orchestrator may drive several runs, but each run must be advanced
 * from a single thread.
 */
public class TestSuiteOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TestSuiteOrchestrator.class);

    private final TaskQueueClient taskQueue;
    private final RunnerConfig config;
    private final TaskRequestFactory requestFactory;
    private final SuiteReporter reporter;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<SuiteMode, CompletionPolicy> completionPolicies = new EnumMap<>(SuiteMode.class);

    public TestSuiteOrchestrator(TaskQueueClient taskQueue, RunnerConfig config) {
        this(taskQueue, config, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public TestSuiteOrchestrator(TaskQueueClient taskQueue, RunnerConfig config, Clock clock, Sleeper sleeper) {
        this.taskQueue = taskQueue;
        this.config = config;
        this.requestFactory = new TaskRequestFactory(config);
        this.reporter = new SuiteReporter();
        this.clock = clock;
        this.sleeper = sleeper;
        for (SuiteMode mode : SuiteMode.values()) {
            completionPolicies.put(mode, CompletionPolicy.forMode(mode));
        }
    }

    /**
     * Start a suite under the parent id from the configuration.
     *
     * @throws IllegalStateException if no suite id is configured
     */
    public SuiteRun start(List<TestSpec> specs, SuiteMode mode, int provisionThreshold) {
        if (config.suiteId() == null) {
            throw new IllegalStateException("No suite id configured; set SWARMING_TASK_ID or [suite] suite_id");
        }
        return start(config.suiteId(), specs, mode, provisionThreshold);
    }

    /**
     * Submit one task per spec under the given parent id.
     *
     * @throws labrunner.coordinator.repository.TaskQueueException if a
     *         submission fails; nothing is retried here
     */
    public SuiteRun start(String suiteId, List<TestSpec> specs, SuiteMode mode, int provisionThreshold) {
        SuiteRun run = newRun(suiteId, mode, provisionThreshold);
        log.info("Starting suite {} ({} mode) with {} test(s)", suiteId, mode, specs.size());
        schedule(run, specs);
        return run;
    }

    /**
     * Rebuild the state of a suite that was started earlier, for example by a
     * process that died, from the queue's history. Specs without any task are
     * scheduled now.
     *
     * @throws IllegalStateException if one test has two unfinished tasks
     */
    public SuiteRun resume(String suiteId, List<TestSpec> specs, SuiteMode mode, int provisionThreshold) {
        SuiteRun run = newRun(suiteId, mode, provisionThreshold);
        List<Task> allTasks = taskQueue.queryByParent(suiteId);
        List<TestSpec> notYetScheduled = new ArrayList<>();

        for (TestSpec spec : specs) {
            List<Task> tasks = tasksOf(spec, run, allTasks);
            if (tasks.isEmpty()) {
                notYetScheduled.add(spec);
                continue;
            }

            Task current = currentTask(tasks);
            String activeId = current != null ? current.id() : tasks.get(0).id();
            List<String> previous = new ArrayList<>();
            for (Task task : tasks) {
                if (!task.id().equals(activeId)) {
                    previous.add(task.id());
                }
            }
            run.track(new RetryRecord(spec, activeId, spec.jobRetries() - tasks.size(), previous));
        }

        log.info("Resuming suite {}: {} test(s) found, {} not yet scheduled",
                suiteId, specs.size() - notYetScheduled.size(), notYetScheduled.size());
        schedule(run, notYetScheduled);
        return run;
    }

    /**
     * One iteration of the control loop: read every child task once, then
     * retry the active ones that failed.
     *
     * @return true if any task was retried
     */
    public boolean pollAndAdvance(SuiteRun run) {
        List<Task> children = taskQueue.queryByParent(run.suiteId());

        // The queue keeps superseded attempts; only active ids are live
        Map<String, Task> active = new LinkedHashMap<>();
        for (Task task : children) {
            if (run.isActive(task.id())) {
                active.put(task.id(), task);
            }
        }
        log.debug("Suite {}: {} child task(s), {} active", run.suiteId(), children.size(), active.size());

        boolean retried = false;
        for (Task task : active.values()) {
            if (!task.isTerminal()) {
                continue;
            }
            if (RetryPolicy.shouldRetry(run, task)) {
                retry(run, task);
                retried = true;
            }
        }

        run.recordPoll(active, retried);
        return retried;
    }

    public boolean isFinishedWaiting(SuiteRun run) {
        return completionPolicies.get(run.mode()).isFinished(run);
    }

    /**
     * Poll until the run is finished, sleeping {@code pollInterval} between
     * polls.
     *
     * @throws SuiteTimeoutException if {@code timeout} elapses first
     */
    public void runToCompletion(SuiteRun run, Duration pollInterval, Duration timeout) throws InterruptedException {
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(timeout);
        Instant nextProgressLog = startedAt;

        while (true) {
            pollAndAdvance(run);
            if (isFinishedWaiting(run)) {
                log.info("Finished waiting for child tasks of suite {}", run.suiteId());
                return;
            }

            Instant now = clock.instant();
            if (!now.isBefore(nextProgressLog)) {
                log.info("Suite {}: waiting for {} of {} test(s), {} suite retries left",
                        run.suiteId(), run.outstandingCount(), run.activeTaskIds().size(),
                        run.remainingSuiteRetries());
                nextProgressLog = now.plus(config.progressLogInterval());
            } else {
                log.debug("Suite {}: waiting for {} test(s)", run.suiteId(), run.outstandingCount());
            }

            if (!now.isBefore(deadline)) {
                log.error("Timeout in waiting for child tasks of suite {}", run.suiteId());
                throw new SuiteTimeoutException(run.suiteId(), run.outstandingCount(), timeout);
            }

            Duration untilDeadline = Duration.between(now, deadline);
            sleeper.sleep(pollInterval.compareTo(untilDeadline) < 0 ? pollInterval : untilDeadline);
        }
    }

    /**
     * Start (or resume) a suite, wait for it with the configured interval and
     * timeout, and report its results. A timeout is reported, not thrown.
     */
    public SuiteReport run(String suiteName, String suiteId, List<TestSpec> specs, SuiteMode mode,
            int provisionThreshold, boolean resume) throws InterruptedException {
        SuiteRun run = resume
                ? resume(suiteId, specs, mode, provisionThreshold)
                : start(suiteId, specs, mode, provisionThreshold);

        SuiteReport report;
        try {
            runToCompletion(run, config.suitePollInterval(), config.suiteTimeout());
            report = reporter.report(suiteName, run);
        } catch (SuiteTimeoutException e) {
            report = reporter.reportTimeout(suiteName, run, e.outstandingTasks());
        }
        reporter.log(report);
        return report;
    }

    // Helper methods

    private SuiteRun newRun(String suiteId, SuiteMode mode, int provisionThreshold) {
        return new SuiteRun(suiteId, mode, provisionThreshold, config.testRetry(), config.suiteMaxRetries());
    }

    private void schedule(SuiteRun run, List<TestSpec> specs) {
        for (TestSpec spec : specs) {
            String taskId = submit(run, spec);
            run.track(RetryRecord.first(spec, taskId));
        }
    }

    private String submit(SuiteRun run, TestSpec spec) {
        log.info("Scheduling test {}", spec.testName());
        String taskId = taskQueue.submit(requestFactory.build(spec, run.suiteId(), run.isProvision()));
        log.debug("Test {} scheduled as task {}", spec.testName(), taskId);
        return taskId;
    }

    private void retry(SuiteRun run, Task task) {
        RetryRecord record = run.record(task.id()).orElseThrow();
        log.info("Retrying test {} (task {} ended {}), remaining {} retries",
                record.testSpec().testName(), task.id(), task.finalState(), record.remainingRetries() - 1);

        String newTaskId = submit(run, record.testSpec());
        run.replace(task.id(), record.retriedAs(newTaskId));
        run.consumeSuiteRetry();
    }

    private List<Task> tasksOf(TestSpec spec, SuiteRun run, List<Task> allTasks) {
        List<Task> tasks = new ArrayList<>();
        if (run.isProvision()) {
            // Pending tasks have no bot yet, so match on the pinning tag
            String botTag = TaskRequestFactory.botTag(spec.botId());
            for (Task task : allTasks) {
                if (task.hasTag(botTag)) {
                    tasks.add(task);
                }
            }
        } else {
            String name = requestFactory.taskName(spec);
            for (Task task : allTasks) {
                if (name.equals(task.name())) {
                    tasks.add(task);
                }
            }
        }
        return tasks;
    }

    private static Task currentTask(List<Task> tasks) {
        Task current = null;
        for (Task task : tasks) {
            if (task.isTerminal()) {
                continue;
            }
            if (current != null) {
                throw new IllegalStateException("Parent task has 2 unfinished child tasks for one test: "
                        + current.id() + ", " + task.id());
            }
            current = task;
        }
        return current;
    }
}
