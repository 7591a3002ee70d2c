package in.matchbot.infrastructure.persistence;

import in.matchbot.application.port.output.LikeRepository;
import in.matchbot.application.port.output.StorageException;
import in.matchbot.domain.like.Like;
import in.matchbot.domain.like.LikeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of LikeRepository.
 *
 * recordLike serializes the two directions of one pair with a
 * transaction-scoped advisory lock keyed on the unordered pair. The insert and
 * the reverse check then run under that lock, so when A->B and B->A race the
 * second transaction always sees the first one's row.
 */
public final class PostgresLikeRepository implements LikeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLikeRepository.class);

    private final DataSource dataSource;

    public PostgresLikeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public LikeOutcome recordLike(long likerId, long likeeId) {
        String lockSql = "SELECT pg_advisory_xact_lock(?, ?)";
        String insertSql = """
            INSERT INTO likes (liker_id, likee_id, created_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (liker_id, likee_id) DO NOTHING
            """;
        String reverseSql = "SELECT 1 FROM likes WHERE liker_id = ? AND likee_id = ?";

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    // two-int form; the lock key is the unordered pair
                    ps.setInt(1, pairKey(Math.min(likerId, likeeId)));
                    ps.setInt(2, pairKey(Math.max(likerId, likeeId)));
                    ps.execute();
                }

                boolean inserted;
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setLong(1, likerId);
                    ps.setLong(2, likeeId);
                    inserted = ps.executeUpdate() == 1;
                }

                boolean mutual;
                try (PreparedStatement ps = conn.prepareStatement(reverseSql)) {
                    ps.setLong(1, likeeId);
                    ps.setLong(2, likerId);
                    try (ResultSet rs = ps.executeQuery()) {
                        mutual = rs.next();
                    }
                }

                conn.commit();
                log.debug("[STORE] Like {} -> {} inserted={} mutual={}", likerId, likeeId, inserted, mutual);
                return inserted ? LikeOutcome.recorded(mutual) : LikeOutcome.alreadyLiked(mutual);

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to record like {} -> {}: {}", likerId, likeeId, e.getMessage());
            throw new StorageException("recordLike", "Failed to record like " + likerId + " -> " + likeeId, e);
        }
    }

    @Override
    public void removeLike(long likerId, long likeeId) {
        String sql = "DELETE FROM likes WHERE liker_id = ? AND likee_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, likerId);
            ps.setLong(2, likeeId);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("[STORE] Failed to remove like {} -> {}: {}", likerId, likeeId, e.getMessage());
            throw new StorageException("removeLike", "Failed to remove like " + likerId + " -> " + likeeId, e);
        }
    }

    @Override
    public Optional<Like> findLike(long likerId, long likeeId) {
        String sql = "SELECT * FROM likes WHERE liker_id = ? AND likee_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, likerId);
            ps.setLong(2, likeeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to get like {} -> {}: {}", likerId, likeeId, e.getMessage());
            throw new StorageException("findLike", "Failed to get like " + likerId + " -> " + likeeId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<Like> findByLiker(long likerId) {
        String sql = "SELECT * FROM likes WHERE liker_id = ? ORDER BY likee_id ASC";

        List<Like> likes = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, likerId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    likes.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to list likes of {}: {}", likerId, e.getMessage());
            throw new StorageException("findByLiker", "Failed to list likes of " + likerId, e);
        }
        return likes;
    }

    /**
     * Fold a user id into the 32-bit advisory lock key space. Collisions only
     * cost extra serialization, never correctness.
     */
    static int pairKey(long userId) {
        return Long.hashCode(userId);
    }

    private Like mapRow(ResultSet rs) throws SQLException {
        return new Like(
            rs.getLong("liker_id"),
            rs.getLong("likee_id"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
