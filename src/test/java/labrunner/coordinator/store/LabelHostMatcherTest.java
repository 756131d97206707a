package labrunner.coordinator.store;

import labrunner.coordinator.config.RunnerConfig;
import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.HostStatus;
import labrunner.coordinator.model.Job;
import org.junit.jupiter.api.*;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LabelHostMatcherTest {

    private static Database db;
    private static JdbcHostRepository hosts;
    private static LabelHostMatcher matcher;

    @BeforeAll
    static void setup() {
        RunnerConfig config = RunnerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-matcher;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        hosts = new JdbcHostRepository(db);
        matcher = new LabelHostMatcher(hosts);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanHosts() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM hosts");
            conn.commit();
        }
    }

    @Test
    void hostMustCarryEveryDependency() {
        Job job = Job.builder().id("job-1").dependencies(Set.of("board:eve", "pool:cq")).build();

        assertTrue(matcher.matches(job, Host.builder().id("h1").labels(Set.of("board:eve", "pool:cq", "x")).build()));
        assertFalse(matcher.matches(job, Host.builder().id("h2").labels(Set.of("board:eve")).build()));
        assertFalse(matcher.matches(job, Host.builder().id("h3").labels(Set.of("board:eve", "pool:cq"))
                .status(HostStatus.REPAIR_FAILED).build()));
        assertTrue(matcher.matches(Job.builder().id("job-2").build(), Host.builder().id("h4").build()));
    }

    @Test
    void acquireLeasesFirstMatchingFreeHost() {
        hosts.save(Host.builder().id("a").labels(Set.of("board:nami")).build());
        hosts.save(Host.builder().id("b").labels(Set.of("board:eve")).leased(true).build());
        hosts.save(Host.builder().id("c").labels(Set.of("board:eve")).build());
        hosts.save(Host.builder().id("d").labels(Set.of("board:eve")).build());

        Job job = Job.builder().id("job-1").dependencies(Set.of("board:eve")).build();
        Optional<Host> acquired = matcher.acquire(job);

        assertEquals("c", acquired.orElseThrow().id());
        assertTrue(acquired.get().leased());
        assertTrue(hosts.findById("c").orElseThrow().leased());
        assertFalse(hosts.findById("d").orElseThrow().leased());
    }

    @Test
    void acquireReturnsEmptyWhenNothingMatches() {
        hosts.save(Host.builder().id("a").labels(Set.of("board:nami")).build());

        Job job = Job.builder().id("job-1").dependencies(Set.of("board:eve")).build();
        assertTrue(matcher.acquire(job).isEmpty());
        assertFalse(hosts.findById("a").orElseThrow().leased());
    }
}
