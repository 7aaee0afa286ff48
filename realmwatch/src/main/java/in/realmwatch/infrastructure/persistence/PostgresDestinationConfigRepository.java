package in.realmwatch.infrastructure.persistence;

import in.realmwatch.application.port.output.DestinationConfigRepository;
import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.destination.FailureClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL implementation of DestinationConfigRepository.
 *
 * Failure counters live in destination_failure_counters, one row per
 * (destination, failure class); increments are atomic upserts.
 */
public final class PostgresDestinationConfigRepository implements DestinationConfigRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDestinationConfigRepository.class);

    private static final String COLUMNS = """
        destination_id, realm_id, channel_id, live_updates, warning_notifications,
        offline_role_id, fetch_devices, entitled
        """;

    private final DataSource dataSource;

    public PostgresDestinationConfigRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<DestinationConfig> findById(String destinationId) {
        String sql = "SELECT " + COLUMNS + " FROM destination_configs WHERE destination_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, destinationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find destination {}: {}", destinationId, e.getMessage());
            throw new RuntimeException("Failed to find destination", e);
        }
        return Optional.empty();
    }

    @Override
    public List<DestinationConfig> findByRealm(String realmId) {
        String sql = "SELECT " + COLUMNS + " FROM destination_configs WHERE realm_id = ? ORDER BY destination_id";

        List<DestinationConfig> configs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, realmId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    configs.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find destinations of realm {}: {}", realmId, e.getMessage());
            throw new RuntimeException("Failed to find destinations", e);
        }
        return configs;
    }

    @Override
    public Set<String> findPolledRealmIds() {
        String sql = """
            SELECT DISTINCT realm_id
            FROM destination_configs
            WHERE realm_id IS NOT NULL AND channel_id IS NOT NULL
            """;

        Set<String> realms = new HashSet<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                realms.add(rs.getString("realm_id"));
            }
        } catch (SQLException e) {
            log.error("Failed to load polled realms: {}", e.getMessage());
            throw new RuntimeException("Failed to load polled realms", e);
        }
        return realms;
    }

    @Override
    public void save(DestinationConfig config) {
        String sql = """
            INSERT INTO destination_configs (
                destination_id, realm_id, channel_id, live_updates, warning_notifications,
                offline_role_id, fetch_devices, entitled, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, NOW())
            ON CONFLICT (destination_id) DO UPDATE SET
                realm_id = EXCLUDED.realm_id,
                channel_id = EXCLUDED.channel_id,
                live_updates = EXCLUDED.live_updates,
                warning_notifications = EXCLUDED.warning_notifications,
                offline_role_id = EXCLUDED.offline_role_id,
                fetch_devices = EXCLUDED.fetch_devices,
                entitled = EXCLUDED.entitled,
                updated_at = NOW()
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, config.destinationId());
            ps.setString(2, config.realmId());
            ps.setString(3, config.channelId());
            ps.setBoolean(4, config.liveUpdates());
            ps.setBoolean(5, config.warningNotifications());
            ps.setString(6, config.offlineRoleId());
            ps.setBoolean(7, config.fetchDevices());
            ps.setBoolean(8, config.entitled());
            ps.executeUpdate();

            log.debug("Saved destination {}", config.destinationId());

        } catch (SQLException e) {
            log.error("Failed to save destination {}: {}", config.destinationId(), e.getMessage());
            throw new RuntimeException("Failed to save destination", e);
        }
    }

    @Override
    public void delete(String destinationId) {
        String deleteCounters = "DELETE FROM destination_failure_counters WHERE destination_id = ?";
        String deleteConfig = "DELETE FROM destination_configs WHERE destination_id = ?";

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement counters = conn.prepareStatement(deleteCounters);
                 PreparedStatement config = conn.prepareStatement(deleteConfig)) {

                counters.setString(1, destinationId);
                counters.executeUpdate();
                config.setString(1, destinationId);
                config.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to delete destination {}: {}", destinationId, e.getMessage());
            throw new RuntimeException("Failed to delete destination", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // FAILURE COUNTERS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public int incrementFailureCount(String destinationId, FailureClass failureClass) {
        String sql = """
            INSERT INTO destination_failure_counters (destination_id, failure_class, failure_count, updated_at)
            VALUES (?, ?, 1, NOW())
            ON CONFLICT (destination_id, failure_class) DO UPDATE SET
                failure_count = destination_failure_counters.failure_count + 1,
                updated_at = NOW()
            RETURNING failure_count
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, destinationId);
            ps.setString(2, failureClass.name());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt("failure_count");
            }
        } catch (SQLException e) {
            log.error("Failed to increment {} counter of {}: {}", failureClass, destinationId, e.getMessage());
            throw new RuntimeException("Failed to increment failure counter", e);
        }
    }

    @Override
    public void resetFailureCount(String destinationId, FailureClass failureClass) {
        String sql = """
            UPDATE destination_failure_counters
            SET failure_count = 0, updated_at = NOW()
            WHERE destination_id = ? AND failure_class = ? AND failure_count <> 0
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, destinationId);
            ps.setString(2, failureClass.name());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to reset {} counter of {}: {}", failureClass, destinationId, e.getMessage());
            throw new RuntimeException("Failed to reset failure counter", e);
        }
    }

    @Override
    public int getFailureCount(String destinationId, FailureClass failureClass) {
        String sql = """
            SELECT failure_count FROM destination_failure_counters
            WHERE destination_id = ? AND failure_class = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, destinationId);
            ps.setString(2, failureClass.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt("failure_count") : 0;
            }
        } catch (SQLException e) {
            log.error("Failed to read {} counter of {}: {}", failureClass, destinationId, e.getMessage());
            throw new RuntimeException("Failed to read failure counter", e);
        }
    }

    @Override
    public void resetFailureCountsForRealm(String realmId, FailureClass failureClass) {
        String sql = """
            UPDATE destination_failure_counters c
            SET failure_count = 0, updated_at = NOW()
            FROM destination_configs d
            WHERE c.destination_id = d.destination_id
              AND d.realm_id = ?
              AND c.failure_class = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, realmId);
            ps.setString(2, failureClass.name());
            int reset = ps.executeUpdate();
            log.debug("Reset {} {} counters of realm {}", reset, failureClass, realmId);

        } catch (SQLException e) {
            log.error("Failed to reset {} counters of realm {}: {}", failureClass, realmId, e.getMessage());
            throw new RuntimeException("Failed to reset realm failure counters", e);
        }
    }

    private DestinationConfig mapRow(ResultSet rs) throws SQLException {
        return new DestinationConfig(
            rs.getString("destination_id"),
            rs.getString("realm_id"),
            rs.getString("channel_id"),
            rs.getBoolean("live_updates"),
            rs.getBoolean("warning_notifications"),
            rs.getString("offline_role_id"),
            rs.getBoolean("fetch_devices"),
            rs.getBoolean("entitled")
        );
    }
}
