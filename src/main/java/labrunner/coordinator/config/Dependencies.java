package labrunner.coordinator.config;

import labrunner.coordinator.repository.HostMatcher;
import labrunner.coordinator.repository.HostRepository;
import labrunner.coordinator.repository.JobRepository;
import labrunner.coordinator.scheduler.DummyHostScheduler;
import labrunner.coordinator.scheduler.HostLeaseScheduler;
import labrunner.coordinator.scheduler.HostScheduler;
import labrunner.coordinator.scheduler.LoggingNotifier;
import labrunner.coordinator.scheduler.Scheduler;
import labrunner.coordinator.scheduler.VerifyTaskHook;
import labrunner.coordinator.store.Database;
import labrunner.coordinator.store.JdbcHostRepository;
import labrunner.coordinator.store.JdbcJobRepository;
import labrunner.coordinator.store.JdbcTaskQueue;
import labrunner.coordinator.store.LabelHostMatcher;
import labrunner.coordinator.suite.TestSuiteOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(RunnerConfig.fromEnv());
 * deps.startScheduler(); // tick the host scheduler in the background
 * SuiteReport report = deps.orchestrator().run(...);
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final RunnerConfig config;
    private final Database database;
    private final JdbcTaskQueue taskQueue;
    private final HostRepository hostRepository;
    private final JobRepository jobRepository;
    private final HostMatcher hostMatcher;
    private final HostScheduler hostScheduler;
    private final TestSuiteOrchestrator orchestrator;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(RunnerConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Stores
        this.taskQueue = new JdbcTaskQueue(database);
        this.hostRepository = new JdbcHostRepository(database);
        this.jobRepository = new JdbcJobRepository(database);
        this.hostMatcher = new LabelHostMatcher(hostRepository);

        // Control loops
        this.hostScheduler = config.inlineHostAcquisition()
                ? new DummyHostScheduler()
                : new HostLeaseScheduler(hostRepository, jobRepository, hostMatcher,
                        new VerifyTaskHook(jobRepository), new LoggingNotifier());
        this.orchestrator = new TestSuiteOrchestrator(taskQueue, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(RunnerConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(RunnerConfig.fromEnv());
    }

    // Getters
    public RunnerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JdbcTaskQueue taskQueue() {
        return taskQueue;
    }

    public HostRepository hostRepository() {
        return hostRepository;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public HostMatcher hostMatcher() {
        return hostMatcher;
    }

    public HostScheduler hostScheduler() {
        return hostScheduler;
    }

    public TestSuiteOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(hostScheduler, config);
        }
        return scheduler;
    }

    /**
     * Start ticking the host scheduler in the background.
     */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Stop the background scheduler.
     */
    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
