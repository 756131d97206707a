package labrunner.coordinator.store;

import labrunner.coordinator.model.Task;
import labrunner.coordinator.model.TaskRequest;
import labrunner.coordinator.model.TaskSlice;
import labrunner.coordinator.model.TaskState;
import labrunner.coordinator.repository.ErrorKind;
import labrunner.coordinator.repository.TaskQueueClient;
import labrunner.coordinator.repository.TaskQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed task queue. Keeps every submitted task, superseded retries
 * included, so a suite can be resumed from the queue's history.
 *
 * Bots (or tests) report progress through {@link #updateState}.
 */
public class JdbcTaskQueue implements TaskQueueClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskQueue.class);

    private final Database db;

    public JdbcTaskQueue(Database db) {
        this.db = db;
    }

    @Override
    public String submit(TaskRequest request) {
        String sql = """
                    INSERT INTO child_tasks (id, name, parent_id, state, failure, tags, slices, task_user, priority,
                                             execution_timeout_secs, io_timeout_secs, grace_period_secs, created_at)
                    VALUES (?, ?, ?, 'PENDING', FALSE, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        String taskId = generateTaskId();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            ps.setString(2, request.name());
            ps.setString(3, request.parentId());
            ps.setString(4, JsonColumns.write(request.tags()));
            ps.setString(5, JsonColumns.write(request.slices()));
            ps.setString(6, request.user());
            ps.setInt(7, request.priority());
            ps.setLong(8, request.executionTimeoutSecs());
            ps.setLong(9, request.ioTimeoutSecs());
            ps.setLong(10, request.gracePeriodSecs());
            ps.setTimestamp(11, Timestamp.from(Instant.now()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Submitted task {} ({}) under parent {}", taskId, request.name(), request.parentId());
            return taskId;
        } catch (SQLException e) {
            throw new TaskQueueException(ErrorKind.INFRA, "Failed to submit task: " + request.name(), e);
        }
    }

    @Override
    public List<Task> queryByParent(String parentId) {
        String sql = "SELECT * FROM child_tasks WHERE parent_id = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, parentId);
            List<Task> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new TaskQueueException(ErrorKind.INFRA, "Failed to query children of " + parentId, e);
        }
    }

    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM child_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TaskQueueException(ErrorKind.INFRA, "Failed to find task: " + taskId, e);
        }
    }

    /**
     * Slices the task was submitted with.
     *
     * @throws TaskQueueException NOT_FOUND if the task does not exist
     */
    public List<TaskSlice> findSlices(String taskId) {
        String sql = "SELECT slices FROM child_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return JsonColumns.readSlices(rs.getString("slices"));
                }
            }
        } catch (SQLException e) {
            throw new TaskQueueException(ErrorKind.INFRA, "Failed to read slices of task: " + taskId, e);
        }
        throw new TaskQueueException(ErrorKind.NOT_FOUND, "No such task: " + taskId);
    }

    /**
     * Record a state transition reported by the bot running the task.
     *
     * @throws TaskQueueException NOT_FOUND if the task does not exist
     */
    public void updateState(String taskId, TaskState state, boolean failure, String botId) {
        String sql = """
                    UPDATE child_tasks
                    SET state = ?, failure = ?, bot_id = COALESCE(CAST(? AS VARCHAR(128)), bot_id),
                        finished_at = COALESCE(CAST(? AS TIMESTAMP), finished_at)
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, state.name());
            ps.setBoolean(2, failure);
            ps.setString(3, botId);
            ps.setTimestamp(4, state.isTerminal() ? Timestamp.from(Instant.now()) : null);
            ps.setString(5, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                throw new TaskQueueException(ErrorKind.NOT_FOUND, "No such task: " + taskId);
            }
            log.debug("Task {} -> {} (failure={}, bot={})", taskId, state, failure, botId);
        } catch (SQLException e) {
            throw new TaskQueueException(ErrorKind.INFRA, "Failed to update task: " + taskId, e);
        }
    }

    /**
     * Task ids are 16 hex digits ending in 0, like run summaries of the
     * remote execution service.
     */
    static String generateTaskId() {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return hex.substring(0, 15) + "0";
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .parentId(rs.getString("parent_id"))
                .state(TaskState.valueOf(rs.getString("state")))
                .failure(rs.getBoolean("failure"))
                .botId(rs.getString("bot_id"))
                .tags(JsonColumns.readStringList(rs.getString("tags")))
                .priority(rs.getInt("priority"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
