package labrunner.coordinator.store;

import labrunner.coordinator.config.RunnerConfig;
import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.Job;
import labrunner.coordinator.model.SpecialTask;
import labrunner.coordinator.model.SpecialTaskType;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Database db;
    private static JdbcHostRepository hosts;
    private static JdbcJobRepository jobs;

    @BeforeAll
    static void setup() {
        RunnerConfig config = RunnerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        hosts = new JdbcHostRepository(db);
        jobs = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM special_tasks");
            st.execute("DELETE FROM jobs");
            st.execute("DELETE FROM hosts");
            conn.commit();
        }
    }

    private static Job job(String id, int priority, int minute) {
        return Job.builder().id(id).priority(priority).createdAt(T0.plusSeconds(60L * minute)).build();
    }

    @Test
    void pendingJobsByPriorityThenAge() {
        jobs.save(job("old-low", 10, 0));
        jobs.save(job("new-high", 50, 5));
        jobs.save(job("old-high", 50, 1));
        jobs.save(Job.builder().id("running").priority(99).hostId("h1").active(true).build());
        jobs.save(Job.builder().id("done").priority(99).complete(true).build());

        List<String> pending = jobs.findPendingJobs().stream().map(Job::id).toList();
        assertEquals(List.of("old-high", "new-high", "old-low"), pending);
    }

    @Test
    void jobRoundTrip() {
        jobs.save(Job.builder().id("job-1").name("dummy_Pass").dependencies(Set.of("board:eve", "pool:cq"))
                .priority(20).createdAt(T0).build());

        Job found = jobs.findById("job-1").orElseThrow();
        assertEquals("dummy_Pass", found.name());
        assertEquals(Set.of("board:eve", "pool:cq"), found.dependencies());
        assertEquals(20, found.priority());
        assertEquals(T0, found.createdAt());
        assertFalse(found.hasHost());
        assertTrue(jobs.findById("missing").isEmpty());
    }

    @Test
    void activateOnlyOnce() {
        jobs.save(job("job-1", 0, 0));

        assertTrue(jobs.activate("job-1", "h1"));
        assertFalse(jobs.activate("job-1", "h2"));

        Job active = jobs.findById("job-1").orElseThrow();
        assertTrue(active.active());
        assertEquals("h1", active.hostId());

        assertTrue(jobs.complete("job-1"));
        assertFalse(jobs.activate("job-1", "h2"));
        assertTrue(jobs.findPendingJobs().isEmpty());
    }

    @Test
    void overlappingJobsAreActiveJobsSharingAHost() {
        jobs.save(Job.builder().id("a").hostId("h1").active(true).build());
        jobs.save(Job.builder().id("b").hostId("h1").active(true).build());
        jobs.save(Job.builder().id("c").hostId("h2").active(true).build());
        jobs.save(Job.builder().id("d").hostId("h2").complete(true).build());
        jobs.save(Job.builder().id("e").hostId("h3").build());

        List<String> overlapping = jobs.findOverlappingJobs().stream().map(Job::id).toList();
        assertEquals(List.of("a", "b"), overlapping);
    }

    @Test
    void specialTaskLifecycle() {
        jobs.saveSpecialTask(SpecialTask.builder().id("st-1").hostId("h1").jobId("job-1")
                .type(SpecialTaskType.REPAIR).build());

        SpecialTask saved = jobs.findSpecialTask("st-1").orElseThrow();
        assertEquals(SpecialTaskType.REPAIR, saved.type());
        assertFalse(saved.isFrontendTask());
        assertEquals(List.of(saved), jobs.findSpecialTasksForJob("job-1"));

        assertTrue(jobs.completeSpecialTask("st-1"));
        assertTrue(jobs.findSpecialTask("st-1").orElseThrow().complete());
        assertFalse(jobs.completeSpecialTask("missing"));
    }

    @Test
    void startSpecialTaskOnlyWhenHostIsFree() {
        jobs.saveSpecialTask(SpecialTask.builder().id("st-1").hostId("h1").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("st-2").hostId("h1").type(SpecialTaskType.CLEANUP).build());
        jobs.saveSpecialTask(SpecialTask.builder().id("st-3").hostId("h2").build());

        assertTrue(jobs.startSpecialTask("st-1"));
        assertTrue(jobs.findSpecialTask("st-1").orElseThrow().active());
        assertFalse(jobs.startSpecialTask("st-1"));
        assertFalse(jobs.startSpecialTask("st-2"));
        assertTrue(jobs.startSpecialTask("st-3"));

        jobs.completeSpecialTask("st-1");
        assertTrue(jobs.startSpecialTask("st-2"));
        assertFalse(jobs.startSpecialTask("missing"));
    }

    @Test
    void unleasedHostsOfFrontendTasks() {
        hosts.save(Host.builder().id("h1").build());
        hosts.save(Host.builder().id("h2").leased(true).build());
        hosts.save(Host.builder().id("h3").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("st-1").hostId("h1").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("st-2").hostId("h1").type(SpecialTaskType.CLEANUP).build());
        jobs.saveSpecialTask(SpecialTask.builder().id("st-3").hostId("h2").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("st-4").hostId("h3").jobId("job-1").build());

        assertEquals(List.of("h1"), jobs.findUnleasedHostsOfFrontendTasks());
    }

    @Test
    void prioritizedSpecialTasksPutJobTasksFirst() {
        hosts.save(Host.builder().id("h1").leased(true).build());
        hosts.save(Host.builder().id("h2").leased(true).build());
        hosts.save(Host.builder().id("h3").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("frontend").hostId("h1").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("for-job").hostId("h2").jobId("job-2").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("unleased").hostId("h3").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("running").hostId("h1").active(true).build());

        List<String> all = jobs.findPrioritizedSpecialTasks(false).stream().map(SpecialTask::id).toList();
        assertEquals(List.of("for-job", "frontend", "unleased"), all);

        List<String> leasedOnly = jobs.findPrioritizedSpecialTasks(true).stream().map(SpecialTask::id).toList();
        assertEquals(List.of("for-job", "frontend"), leasedOnly);
    }

    @Test
    void specialTasksWaitWhileAnotherJobHoldsTheHost() {
        hosts.save(Host.builder().id("h1").leased(true).build());
        jobs.save(Job.builder().id("job-1").hostId("h1").active(true).build());
        jobs.saveSpecialTask(SpecialTask.builder().id("own").hostId("h1").jobId("job-1").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("frontend").hostId("h1").build());
        jobs.saveSpecialTask(SpecialTask.builder().id("other-job").hostId("h1").jobId("job-2").build());

        List<String> runnable = jobs.findPrioritizedSpecialTasks(true).stream().map(SpecialTask::id).toList();
        assertEquals(List.of("own"), runnable);
    }
}
