package in.matchbot.infrastructure.persistence;

import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.application.port.output.StorageException;
import in.matchbot.domain.profile.CandidateQuery;
import in.matchbot.domain.profile.Gender;
import in.matchbot.domain.profile.Profile;
import in.matchbot.domain.profile.ProfileStatus;
import in.matchbot.domain.profile.ProfileUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of ProfileRepository.
 */
public final class PostgresProfileRepository implements ProfileRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresProfileRepository.class);

    private final DataSource dataSource;

    public PostgresProfileRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Profile upsertProfile(long userId, ProfileUpdate update) {
        // Single statement: creates the draft row or merges non-null fields.
        String sql = """
            INSERT INTO profiles (user_id, username, name, age, gender, looking_for, bio, photo_ref, status)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, COALESCE(CAST(? AS VARCHAR), 'DRAFT'))
            ON CONFLICT (user_id) DO UPDATE SET
                username = COALESCE(EXCLUDED.username, profiles.username),
                name = COALESCE(EXCLUDED.name, profiles.name),
                age = COALESCE(EXCLUDED.age, profiles.age),
                gender = COALESCE(EXCLUDED.gender, profiles.gender),
                looking_for = COALESCE(EXCLUDED.looking_for, profiles.looking_for),
                bio = COALESCE(EXCLUDED.bio, profiles.bio),
                photo_ref = COALESCE(EXCLUDED.photo_ref, profiles.photo_ref),
                status = COALESCE(CAST(? AS VARCHAR), profiles.status),
                updated_at = NOW()
            RETURNING *
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            String status = update.status() != null ? update.status().name() : null;
            int idx = 1;
            ps.setLong(idx++, userId);
            setNullableString(ps, idx++, update.username());
            setNullableString(ps, idx++, update.name());
            if (update.age() != null) {
                ps.setInt(idx++, update.age());
            } else {
                ps.setNull(idx++, Types.INTEGER);
            }
            setNullableString(ps, idx++, update.gender() != null ? update.gender().name() : null);
            setNullableString(ps, idx++, update.lookingFor() != null ? update.lookingFor().name() : null);
            setNullableString(ps, idx++, update.bio());
            setNullableString(ps, idx++, update.photoRef());
            setNullableString(ps, idx++, status);
            setNullableString(ps, idx++, status);

            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                Profile profile = mapRow(rs);
                log.debug("[STORE] Upserted profile {} status={}", userId, profile.status());
                return profile;
            }

        } catch (SQLException e) {
            log.error("[STORE] Failed to upsert profile {}: {}", userId, e.getMessage());
            throw new StorageException("upsertProfile", "Failed to upsert profile " + userId, e);
        }
    }

    @Override
    public Optional<Profile> findById(long userId) {
        String sql = "SELECT * FROM profiles WHERE user_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to get profile {}: {}", userId, e.getMessage());
            throw new StorageException("findById", "Failed to get profile " + userId, e);
        }
        return Optional.empty();
    }

    @Override
    public Optional<Profile> nextCandidate(CandidateQuery query) {
        StringBuilder sql = new StringBuilder("""
            SELECT p.*
              FROM profiles p
             WHERE p.status = 'ACTIVE'
               AND p.user_id <> ?
               AND NOT EXISTS (
                    SELECT 1 FROM likes l WHERE l.liker_id = ? AND l.likee_id = p.user_id
               )
               AND NOT (p.user_id = ANY (?))
            """);
        if (query.afterUserId() != null) {
            sql.append("   AND p.user_id > ?\n");
        }
        if (query.lookingFor() != null) {
            sql.append("   AND (p.gender IS NULL OR p.gender = ?)\n");
        }
        if (query.viewerGender() != null) {
            sql.append("   AND (p.looking_for IS NULL OR p.looking_for = ?)\n");
        }
        sql.append(" ORDER BY p.user_id ASC LIMIT 1");

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            Array excluded = conn.createArrayOf("bigint", query.excludedIds().toArray(new Long[0]));
            int idx = 1;
            ps.setLong(idx++, query.viewerId());
            ps.setLong(idx++, query.viewerId());
            ps.setArray(idx++, excluded);
            if (query.afterUserId() != null) {
                ps.setLong(idx++, query.afterUserId());
            }
            if (query.lookingFor() != null) {
                ps.setString(idx++, query.lookingFor().name());
            }
            if (query.viewerGender() != null) {
                ps.setString(idx++, query.viewerGender().name());
            }

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to get next candidate for {}: {}", query.viewerId(), e.getMessage());
            throw new StorageException("nextCandidate", "Failed to get next candidate for " + query.viewerId(), e);
        }
        return Optional.empty();
    }

    @Override
    public void resetUser(long userId) {
        String deleteLikesSql = "DELETE FROM likes WHERE liker_id = ?";
        String clearProfileSql = """
            UPDATE profiles
               SET name = NULL,
                   age = NULL,
                   gender = NULL,
                   looking_for = NULL,
                   bio = NULL,
                   photo_ref = NULL,
                   status = 'DRAFT',
                   updated_at = NOW()
             WHERE user_id = ?
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int removed;
                try (PreparedStatement ps = conn.prepareStatement(deleteLikesSql)) {
                    ps.setLong(1, userId);
                    removed = ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(clearProfileSql)) {
                    ps.setLong(1, userId);
                    ps.executeUpdate();
                }
                conn.commit();
                log.info("[STORE] Reset user {} ({} likes removed)", userId, removed);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to reset user {}: {}", userId, e.getMessage());
            throw new StorageException("resetUser", "Failed to reset user " + userId, e);
        }
    }

    @Override
    public void deleteUser(long userId) {
        String deleteLikesSql = "DELETE FROM likes WHERE liker_id = ? OR likee_id = ?";
        String deleteProfileSql = "DELETE FROM profiles WHERE user_id = ?";

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(deleteLikesSql)) {
                    ps.setLong(1, userId);
                    ps.setLong(2, userId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(deleteProfileSql)) {
                    ps.setLong(1, userId);
                    ps.executeUpdate();
                }
                conn.commit();
                log.info("[STORE] Deleted user {}", userId);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to delete user {}: {}", userId, e.getMessage());
            throw new StorageException("deleteUser", "Failed to delete user " + userId, e);
        }
    }

    @Override
    public Profile updateFilters(long userId, Gender gender, Gender lookingFor) {
        String sql = """
            INSERT INTO profiles (user_id, gender, looking_for)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id) DO UPDATE SET
                gender = EXCLUDED.gender,
                looking_for = EXCLUDED.looking_for,
                updated_at = NOW()
            RETURNING *
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, userId);
            setNullableString(ps, 2, gender != null ? gender.name() : null);
            setNullableString(ps, 3, lookingFor != null ? lookingFor.name() : null);

            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return mapRow(rs);
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to update filters for {}: {}", userId, e.getMessage());
            throw new StorageException("updateFilters", "Failed to update filters for " + userId, e);
        }
    }

    @Override
    public Profile setStatus(long userId, ProfileStatus status) {
        return upsertProfile(userId, ProfileUpdate.status(status));
    }

    @Override
    public List<Long> listActiveUserIds() {
        String sql = "SELECT user_id FROM profiles WHERE status = 'ACTIVE' ORDER BY user_id ASC";

        List<Long> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                ids.add(rs.getLong("user_id"));
            }
        } catch (SQLException e) {
            log.error("[STORE] Failed to list active users: {}", e.getMessage());
            throw new StorageException("listActiveUserIds", "Failed to list active users", e);
        }
        return ids;
    }

    private static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value != null) {
            ps.setString(idx, value);
        } else {
            ps.setNull(idx, Types.VARCHAR);
        }
    }

    private Profile mapRow(ResultSet rs) throws SQLException {
        int age = rs.getInt("age");
        Integer nullableAge = rs.wasNull() ? null : age;
        Timestamp createdAt = rs.getTimestamp("created_at");
        Timestamp updatedAt = rs.getTimestamp("updated_at");

        return new Profile(
            rs.getLong("user_id"),
            rs.getString("username"),
            rs.getString("name"),
            nullableAge,
            Gender.fromCode(rs.getString("gender")),
            Gender.fromCode(rs.getString("looking_for")),
            rs.getString("bio"),
            rs.getString("photo_ref"),
            ProfileStatus.fromCode(rs.getString("status")),
            createdAt != null ? createdAt.toInstant() : null,
            updatedAt != null ? updatedAt.toInstant() : null
        );
    }
}
