package labrunner.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RunnerConfigTest {

    @TempDir
    Path tempDir;

    private File write(String content) throws IOException {
        Path file = tempDir.resolve("labrunner.ini");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    void defaults() {
        RunnerConfig config = RunnerConfig.defaults();

        assertEquals(Duration.ofSeconds(30), config.suitePollInterval());
        assertEquals(Duration.ofHours(24), config.suiteTimeout());
        assertEquals(10, config.suiteMaxRetries());
        assertTrue(config.testRetry());
        assertFalse(config.dryRun());
        assertFalse(config.inlineHostAcquisition());
        assertNull(config.suiteId());
        assertNull(config.quotaAccount());
        assertNull(config.logdogAnnotationUrl());
    }

    @Test
    void iniOverridesEverySection() throws IOException {
        File ini = write("""
                [database]
                url = jdbc:h2:mem:from-ini
                pool_size = 3

                [scheduler]
                tick_interval_secs = 2
                inline_host_acquisition = true

                [suite]
                suite_id = 4a1b2c3d4e5f6070
                poll_interval_secs = 15
                timeout_mins = 90
                progress_log_interval_secs = 60
                max_retries = 4
                test_retry = false
                dry_run = true
                drone_pool = ChromeOSSkylab-test
                quota_account = bvt-sync
                logdog_annotation_url = logdog://logs.example.org/chromeos/suite/+/annotations
                """);

        RunnerConfig config = RunnerConfig.fromIni(ini);

        assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals(Duration.ofSeconds(2), config.hostSchedulerTickInterval());
        assertTrue(config.inlineHostAcquisition());
        assertEquals("4a1b2c3d4e5f6070", config.suiteId());
        assertEquals(Duration.ofSeconds(15), config.suitePollInterval());
        assertEquals(Duration.ofMinutes(90), config.suiteTimeout());
        assertEquals(Duration.ofSeconds(60), config.progressLogInterval());
        assertEquals(4, config.suiteMaxRetries());
        assertFalse(config.testRetry());
        assertTrue(config.dryRun());
        assertEquals("ChromeOSSkylab-test", config.dronePool());
        assertEquals("bvt-sync", config.quotaAccount());
        assertEquals("logdog://logs.example.org/chromeos/suite/+/annotations", config.logdogAnnotationUrl());
    }

    @Test
    void missingKeysKeepDefaults() throws IOException {
        File ini = write("""
                [suite]
                max_retries = 2
                """);

        RunnerConfig config = RunnerConfig.fromIni(ini);

        assertEquals(2, config.suiteMaxRetries());
        assertEquals(Duration.ofSeconds(30), config.suitePollInterval());
        assertEquals(Duration.ofSeconds(5), config.hostSchedulerTickInterval());
        assertEquals(10, config.databasePoolSize());
    }

    @Test
    void missingFileFails() {
        assertThrows(IOException.class, () -> RunnerConfig.fromIni(tempDir.resolve("absent.ini").toFile()));
    }
}
