package in.matchbot.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema Migration - creates the profile and like tables on startup.
 *
 * Creates two tables:
 * - profiles: one row per user (draft until onboarding completes)
 * - likes: one row per (liker, likee) pair
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates tables if they don't exist.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting schema migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "profiles")) {
                log.info("[MIGRATION] Creating profiles table...");
                createProfilesTable(conn);
                log.info("[MIGRATION] ✓ profiles table created");
            } else {
                log.info("[MIGRATION] profiles table already exists");
            }

            if (!tableExists(conn, "likes")) {
                log.info("[MIGRATION] Creating likes table...");
                createLikesTable(conn);
                log.info("[MIGRATION] ✓ likes table created");
            } else {
                log.info("[MIGRATION] likes table already exists");
            }

            log.info("[MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createProfilesTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE profiles (
                user_id BIGINT PRIMARY KEY,
                username VARCHAR(64),
                name VARCHAR(128),
                age INT,
                gender VARCHAR(16),
                looking_for VARCHAR(16),
                bio TEXT,
                photo_ref TEXT,
                status VARCHAR(16) NOT NULL DEFAULT 'DRAFT',
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                CONSTRAINT profiles_status_check CHECK (status IN ('DRAFT', 'ACTIVE', 'HIDDEN'))
            )
            """;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_profiles_status ON profiles (status, user_id)");
        }
    }

    private void createLikesTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE likes (
                liker_id BIGINT NOT NULL,
                likee_id BIGINT NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (liker_id, likee_id),
                CONSTRAINT likes_no_self CHECK (liker_id <> likee_id)
            )
            """;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_likes_likee ON likes (likee_id)");
        }
    }
}
