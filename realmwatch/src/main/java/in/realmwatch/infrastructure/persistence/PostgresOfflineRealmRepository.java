package in.realmwatch.infrastructure.persistence;

import in.realmwatch.application.port.output.OfflineRealmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class PostgresOfflineRealmRepository implements OfflineRealmRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresOfflineRealmRepository.class);

    private final DataSource dataSource;

    public PostgresOfflineRealmRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Map<String, Instant> findAll() {
        String sql = "SELECT realm_id, offline_since FROM offline_realms";

        Map<String, Instant> realms = new HashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                realms.put(rs.getString("realm_id"), rs.getTimestamp("offline_since").toInstant());
            }

        } catch (SQLException e) {
            log.error("Failed to load offline realms: {}", e.getMessage());
            throw new RuntimeException("Failed to load offline realms", e);
        }
        return realms;
    }

    @Override
    public void insert(String realmId, Instant offlineSince) {
        String sql = """
            INSERT INTO offline_realms (realm_id, offline_since)
            VALUES (?, ?)
            ON CONFLICT (realm_id) DO NOTHING
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, realmId);
            ps.setTimestamp(2, Timestamp.from(offlineSince));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to mark realm {} offline: {}", realmId, e.getMessage());
            throw new RuntimeException("Failed to mark realm offline", e);
        }
    }

    @Override
    public void delete(String realmId) {
        String sql = "DELETE FROM offline_realms WHERE realm_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, realmId);
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to clear offline marker of realm {}: {}", realmId, e.getMessage());
            throw new RuntimeException("Failed to clear offline marker", e);
        }
    }
}
