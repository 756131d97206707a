package labrunner.coordinator.store;

import labrunner.coordinator.model.Job;
import labrunner.coordinator.model.SpecialTask;
import labrunner.coordinator.model.SpecialTaskType;
import labrunner.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    MERGE INTO jobs (id, name, dependencies, host_id, active, complete, priority, created_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, JsonColumns.write(job.dependencies()));
            ps.setString(4, job.hostId());
            ps.setBoolean(5, job.active());
            ps.setBoolean(6, job.complete());
            ps.setInt(7, job.priority());
            ps.setTimestamp(8, Timestamp.from(job.createdAt() != null ? job.createdAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        List<Job> jobs = queryJobs("SELECT * FROM jobs WHERE id = ?", "job " + jobId, jobId);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public List<Job> findPendingJobs() {
        String sql = """
                    SELECT * FROM jobs
                    WHERE active = FALSE AND complete = FALSE
                    ORDER BY priority DESC, created_at, id
                """;
        return queryJobs(sql, "pending jobs");
    }

    @Override
    public boolean activate(String jobId, String hostId) {
        String sql = """
                    UPDATE jobs SET host_id = ?, active = TRUE
                    WHERE id = ? AND active = FALSE AND complete = FALSE
                """;
        return update(sql, "activate job " + jobId, hostId, jobId);
    }

    @Override
    public boolean complete(String jobId) {
        return update("UPDATE jobs SET active = FALSE, complete = TRUE WHERE id = ?", "complete job " + jobId, jobId);
    }

    @Override
    public List<Job> findOverlappingJobs() {
        String sql = """
                    SELECT j.* FROM jobs j
                    WHERE j.active = TRUE AND j.complete = FALSE
                      AND j.host_id IN (
                          SELECT host_id FROM jobs
                          WHERE active = TRUE AND complete = FALSE AND host_id IS NOT NULL
                          GROUP BY host_id
                          HAVING COUNT(*) > 1)
                    ORDER BY j.host_id, j.id
                """;
        return queryJobs(sql, "overlapping jobs");
    }

    @Override
    public void saveSpecialTask(SpecialTask task) {
        String sql = """
                    INSERT INTO special_tasks (id, host_id, job_id, task_type, active, complete, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.hostId());
            ps.setString(3, task.jobId());
            ps.setString(4, task.type().name());
            ps.setBoolean(5, task.active());
            ps.setBoolean(6, task.complete());
            ps.setTimestamp(7, Timestamp.from(task.createdAt() != null ? task.createdAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save special task: " + task.id(), e);
        }
    }

    @Override
    public Optional<SpecialTask> findSpecialTask(String taskId) {
        List<SpecialTask> tasks = querySpecialTasks("SELECT * FROM special_tasks WHERE id = ?",
                "special task " + taskId, taskId);
        return tasks.isEmpty() ? Optional.empty() : Optional.of(tasks.get(0));
    }

    @Override
    public List<SpecialTask> findSpecialTasksForJob(String jobId) {
        return querySpecialTasks("SELECT * FROM special_tasks WHERE job_id = ? ORDER BY seq",
                "special tasks of job " + jobId, jobId);
    }

    @Override
    public boolean completeSpecialTask(String taskId) {
        return update("UPDATE special_tasks SET active = FALSE, complete = TRUE WHERE id = ?",
                "complete special task " + taskId, taskId);
    }

    @Override
    public boolean startSpecialTask(String taskId) {
        String sql = """
                    UPDATE special_tasks SET active = TRUE
                    WHERE id = ? AND active = FALSE AND complete = FALSE
                      AND NOT EXISTS (
                          SELECT 1 FROM special_tasks o
                          WHERE o.host_id = special_tasks.host_id AND o.active = TRUE AND o.complete = FALSE)
                """;
        return update(sql, "start special task " + taskId, taskId);
    }

    @Override
    public List<String> findUnleasedHostsOfFrontendTasks() {
        String sql = """
                    SELECT DISTINCT s.host_id FROM special_tasks s
                    JOIN hosts h ON h.id = s.host_id
                    WHERE s.complete = FALSE AND s.job_id IS NULL AND h.leased = FALSE
                    ORDER BY s.host_id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<String> hostIds = new ArrayList<>();
            while (rs.next()) {
                hostIds.add(rs.getString(1));
            }
            return hostIds;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find hosts of frontend tasks", e);
        }
    }

    @Override
    public List<SpecialTask> findPrioritizedSpecialTasks(boolean onlyLeasedHosts) {
        String sql = """
                    SELECT s.* FROM special_tasks s
                    JOIN hosts h ON h.id = s.host_id
                    WHERE s.complete = FALSE AND s.active = FALSE
                      AND (CAST(? AS BOOLEAN) = FALSE OR h.leased = TRUE)
                      AND NOT EXISTS (
                          SELECT 1 FROM jobs j
                          WHERE j.host_id = s.host_id AND j.active = TRUE AND j.complete = FALSE
                            AND (s.job_id IS NULL OR j.id <> s.job_id))
                    ORDER BY CASE WHEN s.job_id IS NULL THEN 1 ELSE 0 END, s.seq
                """;
        return querySpecialTasks(sql, "prioritized special tasks", onlyLeasedHosts);
    }

    // Helper methods

    private boolean update(String sql, String what, Object... params) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, params);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + what, e);
        }
    }

    private List<Job> queryJobs(String sql, String what, Object... params) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, params);
            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapJob(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + what, e);
        }
    }

    private List<SpecialTask> querySpecialTasks(String sql, String what, Object... params) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, params);
            List<SpecialTask> tasks = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tasks.add(mapSpecialTask(rs));
                }
            }
            return tasks;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + what, e);
        }
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            if (params[i] instanceof Boolean b) {
                ps.setBoolean(i + 1, b);
            } else {
                ps.setString(i + 1, (String) params[i]);
            }
        }
    }

    private Job mapJob(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .dependencies(JsonColumns.readStringSet(rs.getString("dependencies")))
                .hostId(rs.getString("host_id"))
                .active(rs.getBoolean("active"))
                .complete(rs.getBoolean("complete"))
                .priority(rs.getInt("priority"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private SpecialTask mapSpecialTask(ResultSet rs) throws SQLException {
        return SpecialTask.builder()
                .id(rs.getString("id"))
                .hostId(rs.getString("host_id"))
                .jobId(rs.getString("job_id"))
                .type(SpecialTaskType.valueOf(rs.getString("task_type")))
                .active(rs.getBoolean("active"))
                .complete(rs.getBoolean("complete"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
