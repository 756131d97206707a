package labrunner.coordinator.suite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import labrunner.coordinator.model.ChildTestResult;
import labrunner.coordinator.model.RetryRecord;
import labrunner.coordinator.model.ReturnCode;
import labrunner.coordinator.model.SuiteReport;
import labrunner.coordinator.model.SuiteRun;
import labrunner.coordinator.model.Task;
import labrunner.coordinator.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds a finished suite run into per-test results and a suite verdict.
 */
public class SuiteReporter {

    private static final Logger log = LoggerFactory.getLogger(SuiteReporter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public SuiteReport report(String suiteName, SuiteRun run) {
        List<ChildTestResult> results = results(run);
        List<String> provisioned = run.isProvision() ? List.copyOf(run.successfulBots()) : List.of();
        int outstanding = run.outstandingCount();

        if (run.isProvision() && run.successfulBots().size() > run.provisionThreshold()) {
            return new SuiteReport(suiteName, run.suiteId(), Task.COMPLETED_SUCCESS, ReturnCode.OK,
                    results, provisioned, outstanding);
        }

        for (ChildTestResult result : results) {
            String state = result.state();
            if (Task.COMPLETED_FAILURE.equals(state)) {
                return new SuiteReport(suiteName, run.suiteId(), state, ReturnCode.ERROR, results, provisioned,
                        outstanding);
            }
            if (isInfraState(state)) {
                return new SuiteReport(suiteName, run.suiteId(), state, ReturnCode.INFRA_FAILURE, results,
                        provisioned, outstanding);
            }
            if (TaskState.PENDING.name().equals(state) || TaskState.RUNNING.name().equals(state)) {
                return new SuiteReport(suiteName, run.suiteId(), SuiteReport.TIMED_OUT, ReturnCode.SUITE_TIMEOUT,
                        results, provisioned, outstanding);
            }
        }
        return new SuiteReport(suiteName, run.suiteId(), Task.COMPLETED_SUCCESS, ReturnCode.OK, results,
                provisioned, outstanding);
    }

    /**
     * Report for a run whose wait deadline passed. Children may still be
     * running, so their states are kept as last seen.
     */
    public SuiteReport reportTimeout(String suiteName, SuiteRun run) {
        return reportTimeout(suiteName, run, run.outstandingCount());
    }

    /**
     * @param outstanding tasks the wait loop gave up on
     */
    public SuiteReport reportTimeout(String suiteName, SuiteRun run, int outstanding) {
        return new SuiteReport(suiteName, run.suiteId(), SuiteReport.TIMED_OUT, ReturnCode.SUITE_TIMEOUT,
                results(run), run.isProvision() ? List.copyOf(run.successfulBots()) : List.of(), outstanding);
    }

    public void log(SuiteReport report) {
        log.info("################# SUITE REPORTING #################");
        log.info("Suite {} {} (return code {})", report.suiteName(), report.state(), report.returnCode());

        int width = 0;
        for (ChildTestResult result : report.results()) {
            width = Math.max(width, result.displayName().length());
        }
        for (ChildTestResult result : report.results()) {
            String padded = String.format("%-" + (width + 3) + "s", result.displayName());
            log.info("{}{}", padded, result.state());
            if (result.retryCount() > 0) {
                log.info("{}  retry_count: {}", padded, result.retryCount());
            }
        }
        if (!report.provisionedDuts().isEmpty()) {
            log.info("Provisioned duts: {}", report.provisionedDuts());
        }
        log.info("{} passed, {} failed", report.passedCount(), report.failedCount());
        if (report.outstandingCount() > 0) {
            log.info("{} test(s) still outstanding", report.outstandingCount());
        }
    }

    public String toJson(SuiteReport report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize report of suite " + report.suiteId(), e);
        }
    }

    private List<ChildTestResult> results(SuiteRun run) {
        List<ChildTestResult> results = new ArrayList<>();
        for (RetryRecord record : run.records()) {
            Optional<Task> task = run.lastSeen(record.taskId());
            // A retry scheduled in the last poll was never seen
            String state = task.map(Task::finalState).orElse(TaskState.PENDING.name());
            results.add(new ChildTestResult(record.testSpec().testName(), record.testSpec().dutName(),
                    state, record.retryCount(), record.allTaskIds()));
        }
        return results;
    }

    private static boolean isInfraState(String state) {
        return TaskState.EXPIRED.name().equals(state)
                || TaskState.KILLED.name().equals(state)
                || TaskState.FAILED_INFRA.name().equals(state);
    }
}
