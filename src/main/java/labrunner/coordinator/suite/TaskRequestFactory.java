package labrunner.coordinator.suite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import labrunner.coordinator.config.RunnerConfig;
import labrunner.coordinator.model.TaskRequest;
import labrunner.coordinator.model.TaskSlice;
import labrunner.coordinator.model.TestSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the task request for one child test.
 *
 * Every request has two slices. The first only matches bots whose DUT is
 * already provisioned with the build; the second provisions the DUT before
 * running the test. Both share one expiration budget.
 */
public class TaskRequestFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskRequestFactory.class);

    static final String EXPERIMENTAL_KEY = "experimental";
    static final String PARENT_JOB_ID_KEY = "parent_job_id";
    static final String DUT_READY_STATE = "ready";
    static final String DRY_RUN_COMMAND = "/bin/echo";

    private static final Set<String> UNSUPPORTED_DEPENDENCIES =
            Set.of("skip_provision", "cleanup-reboot", "rpm", "modem_repair");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RunnerConfig config;

    public TaskRequestFactory(RunnerConfig config) {
        this.config = config;
    }

    /**
     * @param spec          test to run
     * @param suiteId       parent task id, or null for a detached test
     * @param provisionMode whether the request belongs to a provision suite
     */
    public TaskRequest build(TestSpec spec, String suiteId, boolean provisionMode) {
        List<String> command = baseCommand(spec, suiteId);
        List<String> provisionCommand = new ArrayList<>(command);
        provisionCommand.add("-provision-labels");
        provisionCommand.add("cros-version:" + spec.build());

        String logdogUrl = config.logdogAnnotationUrl();
        if (logdogUrl != null) {
            for (List<String> cmd : List.of(command, provisionCommand)) {
                cmd.add("-logdog-annotation-url");
                cmd.add(logdogUrl);
            }
        }

        if (config.dryRun()) {
            command.add(0, DRY_RUN_COMMAND);
            provisionCommand.add(0, DRY_RUN_COMMAND);
        }

        Map<String, String> fallbackDimensions = dimensions(spec);
        Map<String, String> normalDimensions = new LinkedHashMap<>(fallbackDimensions);
        normalDimensions.put("provisionable-cros-version", spec.build());

        long provisionExpiration = provisionExpirationSecs(spec, provisionMode);

        TaskRequest.Builder request = TaskRequest.builder()
                .name(taskName(spec))
                .slice(new TaskSlice(command, normalDimensions, provisionExpiration))
                .slice(new TaskSlice(provisionCommand, fallbackDimensions,
                        spec.expirationSecs() - provisionExpiration))
                .user(config.taskUser())
                .parentId(suiteId)
                .priority(spec.priority())
                .executionTimeoutSecs(spec.executionTimeoutSecs())
                .ioTimeoutSecs(spec.ioTimeoutSecs())
                .gracePeriodSecs(spec.gracePeriodSecs())
                .tag(config.luciTag())
                .tag("build:" + spec.build());

        if (suiteId != null) {
            request.tag("parent_task_id:" + suiteId);
        }
        if (spec.botId() != null) {
            request.tag(botTag(spec.botId()));
        }
        String quotaAccount = spec.quotaAccount() != null ? spec.quotaAccount() : config.quotaAccount();
        if (quotaAccount != null) {
            request.tag("qs_account:" + quotaAccount);
        }
        if (logdogUrl != null) {
            request.tag("log_location:" + logdogUrl);
        }
        return request.build();
    }

    /** Name the queue shows for the test's tasks. */
    public String taskName(TestSpec spec) {
        return config.dryRun() ? "Echo " + spec.testName() : spec.testName();
    }

    /** Tag that pins a task to one bot; pending tasks carry it before any bot is assigned. */
    public static String botTag(String botId) {
        return "id:" + botId;
    }

    /**
     * Share of the expiration given to the already-provisioned slice. CQ runs
     * provision in an earlier stage, so its tests wait longer for such a bot.
     */
    static long provisionExpirationSecs(TestSpec spec, boolean provisionMode) {
        if ("cq".equals(spec.pool()) && !provisionMode) {
            return (long) (0.95 * spec.expirationSecs());
        }
        return (long) (0.05 * spec.expirationSecs());
    }

    /** Pool label as bots report it, e.g. {@code DUT_POOL_CQ}. */
    static String toPoolLabel(String pool) {
        return "DUT_POOL_" + pool.toUpperCase(Locale.ROOT);
    }

    private List<String> baseCommand(TestSpec spec, String suiteId) {
        Map<String, String> keyvals = new LinkedHashMap<>(spec.keyvals());
        keyvals.put(EXPERIMENTAL_KEY, String.valueOf(spec.experimental()));
        if (suiteId != null) {
            keyvals.put(PARENT_JOB_ID_KEY, suiteId);
        }

        List<String> command = new ArrayList<>();
        command.add(config.workerPath());
        if (spec.clientTest()) {
            command.add("-client-test");
        }
        command.add("-keyvals");
        command.add(toJson(keyvals));
        command.add("-task-name");
        command.add(spec.testName());
        return command;
    }

    private Map<String, String> dimensions(TestSpec spec) {
        Map<String, String> dimensions = new LinkedHashMap<>();
        dimensions.put("pool", config.dronePool());
        dimensions.put("label-pool", toPoolLabel(spec.pool()));
        dimensions.put("label-board", spec.board());
        dimensions.put("dut_state", DUT_READY_STATE);
        if (spec.model() != null) {
            dimensions.put("label-model", spec.model());
        }
        if (spec.botId() != null) {
            dimensions.put("id", spec.botId());
        }

        for (String dependency : spec.dependencies()) {
            if (UNSUPPORTED_DEPENDENCIES.contains(dependency)) {
                log.warn("Dependency {} of {} is not supported", dependency, spec.testName());
            }
        }
        return dimensions;
    }

    private static String toJson(Map<String, String> keyvals) {
        try {
            return MAPPER.writeValueAsString(keyvals);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode keyvals: " + keyvals, e);
        }
    }
}
