package labrunner.coordinator.store;

import labrunner.coordinator.model.Host;
import labrunner.coordinator.model.HostStatus;
import labrunner.coordinator.repository.HostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of HostRepository.
 * Lease changes are single conditional UPDATEs so concurrent schedulers
 * cannot both take the same host.
 */
public class JdbcHostRepository implements HostRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcHostRepository.class);

    private final Database db;

    public JdbcHostRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Host host) {
        String sql = """
                    MERGE INTO hosts (id, hostname, labels, status, leased, locked)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, host.id());
            ps.setString(2, host.hostname());
            ps.setString(3, JsonColumns.write(host.labels()));
            ps.setString(4, host.status().name());
            ps.setBoolean(5, host.leased());
            ps.setBoolean(6, host.locked());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save host: " + host.id(), e);
        }
    }

    @Override
    public Optional<Host> findById(String hostId) {
        String sql = "SELECT * FROM hosts WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, hostId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find host: " + hostId, e);
        }
    }

    @Override
    public List<Host> findAll() {
        return query("SELECT * FROM hosts ORDER BY id", "all hosts");
    }

    @Override
    public List<Host> findUnusedHealthy() {
        String sql = """
                    SELECT h.* FROM hosts h
                    WHERE h.leased = TRUE
                      AND h.locked = FALSE
                      AND h.status = 'READY'
                      AND NOT EXISTS (
                          SELECT 1 FROM jobs j
                          WHERE j.host_id = h.id AND j.active = TRUE AND j.complete = FALSE)
                      AND NOT EXISTS (
                          SELECT 1 FROM special_tasks s
                          WHERE s.host_id = h.id AND s.complete = FALSE)
                    ORDER BY h.id
                """;
        return query(sql, "unused healthy hosts");
    }

    @Override
    public List<Host> findAvailable() {
        String sql = """
                    SELECT * FROM hosts
                    WHERE leased = FALSE AND locked = FALSE AND status = 'READY'
                    ORDER BY id
                """;
        return query(sql, "available hosts");
    }

    @Override
    public int setLeased(boolean leased, Collection<String> hostIds) {
        if (hostIds.isEmpty())
            return 0;

        String placeholders = String.join(", ", Collections.nCopies(hostIds.size(), "?"));
        String sql = "UPDATE hosts SET leased = ? WHERE id IN (" + placeholders + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, leased);
            int index = 2;
            for (String hostId : hostIds) {
                ps.setString(index++, hostId);
            }

            int updated = ps.executeUpdate();
            conn.commit();

            log.debug("Set leased={} on {} hosts", leased, updated);
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set leased=" + leased + " on hosts " + hostIds, e);
        }
    }

    @Override
    public boolean tryLease(String hostId) {
        String sql = "UPDATE hosts SET leased = TRUE WHERE id = ? AND leased = FALSE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, hostId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to lease host: " + hostId, e);
        }
    }

    private List<Host> query(String sql, String what) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<Host> hosts = new ArrayList<>();
            while (rs.next()) {
                hosts.add(mapRow(rs));
            }
            return hosts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + what, e);
        }
    }

    private Host mapRow(ResultSet rs) throws SQLException {
        return Host.builder()
                .id(rs.getString("id"))
                .hostname(rs.getString("hostname"))
                .labels(JsonColumns.readStringSet(rs.getString("labels")))
                .status(HostStatus.valueOf(rs.getString("status")))
                .leased(rs.getBoolean("leased"))
                .locked(rs.getBoolean("locked"))
                .build();
    }
}
