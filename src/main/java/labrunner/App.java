package labrunner;

import labrunner.coordinator.config.Dependencies;
import labrunner.coordinator.config.RunnerConfig;
import labrunner.coordinator.model.SuiteReport;
import labrunner.coordinator.suite.SuiteRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <pre>
 * labrunner scheduler [config.ini]
 * labrunner suite &lt;suite.json&gt; [config.ini] [--resume]
 * </pre>
 *
 * The suite command exits with the suite's return code.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int USAGE_ERROR = 64;

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            usage();
            System.exit(USAGE_ERROR);
        }

        switch (args[0]) {
            case "scheduler" -> runScheduler(loadConfig(args.length > 1 ? args[1] : null));
            case "suite" -> {
                if (args.length < 2) {
                    usage();
                    System.exit(USAGE_ERROR);
                }
                boolean resume = false;
                String ini = null;
                for (int i = 2; i < args.length; i++) {
                    if ("--resume".equals(args[i])) {
                        resume = true;
                    } else {
                        ini = args[i];
                    }
                }
                System.exit(runSuite(Path.of(args[1]), loadConfig(ini), resume));
            }
            default -> {
                usage();
                System.exit(USAGE_ERROR);
            }
        }
    }

    static RunnerConfig loadConfig(String iniPath) throws IOException {
        if (iniPath == null) {
            return RunnerConfig.fromEnv();
        }
        log.info("Loading config from {}", iniPath);
        return RunnerConfig.fromIni(new File(iniPath));
    }

    private static void runScheduler(RunnerConfig config) throws InterruptedException {
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping host scheduler...");
            deps.close();
            stopped.countDown();
        }, "labrunner-shutdown"));

        deps.startScheduler();
        stopped.await();
    }

    static int runSuite(Path requestFile, RunnerConfig config, boolean resume)
            throws IOException, InterruptedException {
        SuiteRequest request = SuiteRequest.fromJson(Files.readString(requestFile, StandardCharsets.UTF_8));
        if (config.suiteId() == null) {
            throw new IllegalStateException("No suite id configured; set SWARMING_TASK_ID or [suite] suite_id");
        }

        try (Dependencies deps = Dependencies.create(config)) {
            SuiteReport report = deps.orchestrator().run(request.suiteName(), config.suiteId(),
                    request.specs(), request.mode(), request.provisionThreshold(), resume);
            return report.returnCode().exitCode();
        }
    }

    private static void usage() {
        System.err.println("usage: labrunner scheduler [config.ini]");
        System.err.println("       labrunner suite <suite.json> [config.ini] [--resume]");
    }
}
