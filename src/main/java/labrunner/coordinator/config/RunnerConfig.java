package labrunner.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Configuration holder for the suite runner and the host scheduler.
 * All settings have sensible defaults.
 */
public final class RunnerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/labrunner;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Host scheduler settings
    private Duration hostSchedulerTickInterval = Duration.ofSeconds(5);
    private boolean inlineHostAcquisition = false;

    // Suite settings
    private String suiteId = null; // task id of the suite itself, parent of all children
    private Duration suitePollInterval = Duration.ofSeconds(30);
    private Duration suiteTimeout = Duration.ofHours(24);
    private Duration progressLogInterval = Duration.ofSeconds(300);
    private int suiteMaxRetries = 10;
    private boolean testRetry = true;
    private boolean dryRun = false;

    // Task request settings
    private String dronePool = "ChromeOSSkylab";
    private String taskUser = "skylab_suite_runner";
    private String luciTag = "luci_project:chromeos";
    private String workerPath = "/opt/infra-tools/skylab_swarming_worker";
    private String quotaAccount = null;
    private String logdogAnnotationUrl = null; // log stream of the suite, passed on to children

    private RunnerConfig() {
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig();
    }

    public static RunnerConfig fromEnv() {
        RunnerConfig config = new RunnerConfig();

        String dbUrl = System.getenv("LABRUNNER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String suiteId = System.getenv("SWARMING_TASK_ID");
        if (suiteId != null && !suiteId.isBlank()) {
            config.suiteId = suiteId;
        }

        String maxRetries = System.getenv("LABRUNNER_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.suiteMaxRetries = Integer.parseInt(maxRetries);
        }

        String dryRun = System.getenv("LABRUNNER_DRY_RUN");
        if (dryRun != null && !dryRun.isBlank()) {
            config.dryRun = Boolean.parseBoolean(dryRun);
        }

        String quotaAccount = System.getenv("LABRUNNER_QUOTA_ACCOUNT");
        if (quotaAccount != null && !quotaAccount.isBlank()) {
            config.quotaAccount = quotaAccount;
        }

        String logdogUrl = System.getenv("LABRUNNER_LOGDOG_URL");
        if (logdogUrl != null && !logdogUrl.isBlank()) {
            config.logdogAnnotationUrl = logdogUrl;
        }

        return config;
    }

    /**
     * Environment config overlaid with an INI file. Recognized sections are
     * [database], [scheduler] and [suite]; missing keys keep their value.
     *
     * @throws IOException if the file cannot be read
     */
    public static RunnerConfig fromIni(File file) throws IOException {
        RunnerConfig config = fromEnv();
        Ini ini = new Ini(file);

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = opt(database, "url", config.databaseUrl);
            config.databasePoolSize = optInt(database, "pool_size", config.databasePoolSize);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            config.hostSchedulerTickInterval = optSeconds(scheduler, "tick_interval_secs",
                    config.hostSchedulerTickInterval);
            config.inlineHostAcquisition = Boolean.parseBoolean(
                    opt(scheduler, "inline_host_acquisition", String.valueOf(config.inlineHostAcquisition)));
        }

        Profile.Section suite = ini.get("suite");
        if (suite != null) {
            config.suiteId = opt(suite, "suite_id", config.suiteId);
            config.suitePollInterval = optSeconds(suite, "poll_interval_secs", config.suitePollInterval);
            String timeoutMins = opt(suite, "timeout_mins", null);
            if (timeoutMins != null) {
                config.suiteTimeout = Duration.ofMinutes(Long.parseLong(timeoutMins));
            }
            config.progressLogInterval = optSeconds(suite, "progress_log_interval_secs", config.progressLogInterval);
            config.suiteMaxRetries = optInt(suite, "max_retries", config.suiteMaxRetries);
            config.testRetry = Boolean.parseBoolean(opt(suite, "test_retry", String.valueOf(config.testRetry)));
            config.dryRun = Boolean.parseBoolean(opt(suite, "dry_run", String.valueOf(config.dryRun)));
            config.dronePool = opt(suite, "drone_pool", config.dronePool);
            config.quotaAccount = opt(suite, "quota_account", config.quotaAccount);
            config.logdogAnnotationUrl = opt(suite, "logdog_annotation_url", config.logdogAnnotationUrl);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration hostSchedulerTickInterval() {
        return hostSchedulerTickInterval;
    }

    public boolean inlineHostAcquisition() {
        return inlineHostAcquisition;
    }

    public String suiteId() {
        return suiteId;
    }

    public Duration suitePollInterval() {
        return suitePollInterval;
    }

    public Duration suiteTimeout() {
        return suiteTimeout;
    }

    public Duration progressLogInterval() {
        return progressLogInterval;
    }

    public int suiteMaxRetries() {
        return suiteMaxRetries;
    }

    public boolean testRetry() {
        return testRetry;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public String dronePool() {
        return dronePool;
    }

    public String taskUser() {
        return taskUser;
    }

    public String luciTag() {
        return luciTag;
    }

    public String workerPath() {
        return workerPath;
    }

    public String quotaAccount() {
        return quotaAccount;
    }

    public String logdogAnnotationUrl() {
        return logdogAnnotationUrl;
    }

    // Fluent setters for testing/customization
    public RunnerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public RunnerConfig withHostSchedulerTickInterval(Duration interval) {
        this.hostSchedulerTickInterval = interval;
        return this;
    }

    public RunnerConfig withInlineHostAcquisition(boolean inline) {
        this.inlineHostAcquisition = inline;
        return this;
    }

    public RunnerConfig withSuiteId(String suiteId) {
        this.suiteId = suiteId;
        return this;
    }

    public RunnerConfig withSuitePollInterval(Duration interval) {
        this.suitePollInterval = interval;
        return this;
    }

    public RunnerConfig withSuiteTimeout(Duration timeout) {
        this.suiteTimeout = timeout;
        return this;
    }

    public RunnerConfig withProgressLogInterval(Duration interval) {
        this.progressLogInterval = interval;
        return this;
    }

    public RunnerConfig withMaxRetries(int maxRetries) {
        this.suiteMaxRetries = maxRetries;
        return this;
    }

    public RunnerConfig withTestRetry(boolean testRetry) {
        this.testRetry = testRetry;
        return this;
    }

    public RunnerConfig withDryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    public RunnerConfig withQuotaAccount(String quotaAccount) {
        this.quotaAccount = quotaAccount;
        return this;
    }

    public RunnerConfig withLogdogAnnotationUrl(String url) {
        this.logdogAnnotationUrl = url;
        return this;
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int optInt(Profile.Section s, String key, int def) {
        String v = opt(s, key, null);
        return v == null ? def : Integer.parseInt(v);
    }

    private static Duration optSeconds(Profile.Section s, String key, Duration def) {
        String v = opt(s, key, null);
        return v == null ? def : Duration.ofSeconds(Long.parseLong(v));
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", suiteId='" + suiteId + '\'' +
                ", maxRetries=" + suiteMaxRetries +
                ", testRetry=" + testRetry +
                ", dryRun=" + dryRun +
                ", inlineHostAcquisition=" + inlineHostAcquisition +
                '}';
    }
}
