package in.realmwatch.infrastructure.persistence;

import in.realmwatch.application.port.output.ParticipantSessionRepository;
import in.realmwatch.domain.presence.ParticipantSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * PostgreSQL implementation of ParticipantSessionRepository.
 *
 * Upserts are keyed by (realm_id, participant_id) and never rewrite the
 * stored correlation_id; replaying the same delta rewrites the same rows.
 */
public final class PostgresParticipantSessionRepository implements ParticipantSessionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresParticipantSessionRepository.class);

    private final DataSource dataSource;

    public PostgresParticipantSessionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsertAll(Collection<ParticipantSession> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO participant_sessions (correlation_id, realm_id, participant_id, online, last_seen)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (realm_id, participant_id)
            DO UPDATE SET
                online = EXCLUDED.online,
                last_seen = EXCLUDED.last_seen
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            conn.setAutoCommit(false);
            try {
                for (ParticipantSession session : sessions) {
                    ps.setString(1, session.correlationId());
                    ps.setString(2, session.realmId());
                    ps.setString(3, session.participantId());
                    ps.setBoolean(4, session.online());
                    ps.setTimestamp(5, Timestamp.from(session.lastSeen()));
                    ps.addBatch();
                }

                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            log.debug("Upserted {} participant sessions", sessions.size());

        } catch (SQLException e) {
            log.error("Failed to upsert participant sessions: {}", e.getMessage());
            throw new RuntimeException("Failed to upsert participant sessions", e);
        }
    }

    @Override
    public void touchLastSeen(String realmId, Collection<String> participantIds, Instant lastSeen) {
        if (participantIds == null || participantIds.isEmpty()) {
            return;
        }

        String sql = """
            UPDATE participant_sessions
            SET last_seen = ?
            WHERE realm_id = ? AND participant_id = ANY (?) AND online = TRUE
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(lastSeen));
            ps.setString(2, realmId);
            ps.setArray(3, conn.createArrayOf("varchar", participantIds.toArray()));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to refresh last_seen for realm {}: {}", realmId, e.getMessage());
            throw new RuntimeException("Failed to refresh last_seen", e);
        }
    }

    @Override
    public int markOfflineSeenBefore(Instant cutoff) {
        String sql = """
            UPDATE participant_sessions
            SET online = FALSE
            WHERE online = TRUE AND last_seen < ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to expire sessions seen before {}: {}", cutoff, e.getMessage());
            throw new RuntimeException("Failed to expire sessions", e);
        }
    }

    @Override
    public List<ParticipantSession> findAll() {
        String sql = """
            SELECT correlation_id, realm_id, participant_id, online, last_seen
            FROM participant_sessions
            ORDER BY realm_id, participant_id
            """;

        List<ParticipantSession> sessions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                sessions.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to load sessions: {}", e.getMessage());
            throw new RuntimeException("Failed to load sessions", e);
        }
        return sessions;
    }

    @Override
    public int deleteByRealm(String realmId) {
        String sql = "DELETE FROM participant_sessions WHERE realm_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, realmId);
            return ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to delete sessions of realm {}: {}", realmId, e.getMessage());
            throw new RuntimeException("Failed to delete sessions", e);
        }
    }

    private ParticipantSession mapRow(ResultSet rs) throws SQLException {
        return new ParticipantSession(
            rs.getString("correlation_id"),
            rs.getString("realm_id"),
            rs.getString("participant_id"),
            rs.getBoolean("online"),
            rs.getTimestamp("last_seen").toInstant()
        );
    }
}
