package in.matchbot.infrastructure.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.matchbot.domain.like.LikeOutcome;
import in.matchbot.domain.profile.CandidateQuery;
import in.matchbot.domain.profile.Gender;
import in.matchbot.domain.profile.Profile;
import in.matchbot.domain.profile.ProfileStatus;
import in.matchbot.domain.profile.ProfileUpdate;
import in.matchbot.migration.SchemaMigration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.sql.Connection;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PostgreSQL repositories against a real database.
 *
 * Runs only when MATCHBOT_TEST_DB_URL points at a scratch database; the
 * profiles and likes tables there are wiped before every test.
 */
@EnabledIfEnvironmentVariable(named = "MATCHBOT_TEST_DB_URL", matches = ".+")
class PostgresRepositoryTest {

    private static HikariDataSource dataSource;

    private PostgresProfileRepository profiles;
    private PostgresLikeRepository likes;

    @BeforeAll
    static void connect() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(System.getenv("MATCHBOT_TEST_DB_URL"));
        config.setUsername(System.getenv().getOrDefault("MATCHBOT_TEST_DB_USER", "postgres"));
        config.setPassword(System.getenv().getOrDefault("MATCHBOT_TEST_DB_PASS", "postgres"));
        config.setMaximumPoolSize(8);
        config.setPoolName("matchbot-test");
        dataSource = new HikariDataSource(config);
        new SchemaMigration(dataSource).migrate();
    }

    @AfterAll
    static void disconnect() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DELETE FROM likes");
            stmt.execute("DELETE FROM profiles");
        }
        profiles = new PostgresProfileRepository(dataSource);
        likes = new PostgresLikeRepository(dataSource);
    }

    private void activate(long userId, String name) {
        profiles.upsertProfile(userId, ProfileUpdate.activate(name, 30, "bio", "ref" + userId));
    }

    @Test
    void testUpsertMergesFields() {
        Profile draft = profiles.upsertProfile(1L, ProfileUpdate.username("ann"));
        assertEquals(ProfileStatus.DRAFT, draft.status());
        assertNull(draft.name());

        Profile active = profiles.upsertProfile(1L, ProfileUpdate.activate("Ann", 27, "hi", "ref1"));
        assertEquals("ann", active.username(), "username kept by the partial update");
        assertEquals(ProfileStatus.ACTIVE, active.status());
        assertEquals(27, active.age());

        assertEquals(active.name(), profiles.findById(1L).orElseThrow().name());
        assertTrue(profiles.findById(99L).isEmpty());
    }

    @Test
    void testRecordLikeDetectsMutual() {
        activate(1L, "Ann");
        activate(2L, "Bob");

        assertEquals(new LikeOutcome(true, false), likes.recordLike(1L, 2L));
        assertTrue(likes.recordLike(2L, 1L).formsMatch());
        LikeOutcome repeat = likes.recordLike(1L, 2L);
        assertTrue(repeat.alreadyLiked());
        assertFalse(repeat.formsMatch());
        assertTrue(likes.findLike(1L, 2L).isPresent());
    }

    @Test
    void testConcurrentMutualLikesFormOneMatch() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                long a = 1000L + round * 2;
                long b = a + 1;
                activate(a, "A");
                activate(b, "B");

                CountDownLatch start = new CountDownLatch(1);
                Future<LikeOutcome> first = pool.submit(() -> {
                    start.await();
                    return likes.recordLike(a, b);
                });
                Future<LikeOutcome> second = pool.submit(() -> {
                    start.await();
                    return likes.recordLike(b, a);
                });
                start.countDown();

                int matches = 0;
                if (first.get(10, TimeUnit.SECONDS).formsMatch()) matches++;
                if (second.get(10, TimeUnit.SECONDS).formsMatch()) matches++;
                assertEquals(1, matches, "round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testNextCandidateOrderAndExclusions() {
        activate(1L, "Viewer");
        activate(2L, "Liked");
        activate(3L, "Passed");
        activate(4L, "Hidden");
        activate(5L, "Shown");
        profiles.setStatus(4L, ProfileStatus.HIDDEN);
        profiles.upsertProfile(6L, ProfileUpdate.username("draft"));
        likes.recordLike(1L, 2L);

        Optional<Profile> next = profiles.nextCandidate(CandidateQuery.of(1L, null, Set.of(3L)));
        assertEquals(5L, next.orElseThrow().userId());
        assertTrue(profiles.nextCandidate(CandidateQuery.of(1L, 5L, Set.of(3L))).isEmpty());
    }

    @Test
    void testNextCandidateFilters() {
        activate(1L, "Viewer");
        activate(2L, "Man");
        activate(3L, "Woman");
        activate(4L, "Unknown");
        profiles.updateFilters(2L, Gender.MALE, Gender.MALE);
        profiles.updateFilters(3L, Gender.FEMALE, null);

        CandidateQuery womanSeekingMen = new CandidateQuery(1L, null, Set.of(), Gender.FEMALE, Gender.MALE);
        // 2 is a man but only wants men, 3 is the wrong gender, 4 has no gender set
        assertEquals(4L, profiles.nextCandidate(womanSeekingMen).orElseThrow().userId());
    }

    @Test
    void testResetAndDelete() {
        activate(1L, "Ann");
        activate(2L, "Bob");
        likes.recordLike(1L, 2L);
        likes.recordLike(2L, 1L);

        profiles.resetUser(1L);
        Profile reset = profiles.findById(1L).orElseThrow();
        assertEquals(ProfileStatus.DRAFT, reset.status());
        assertNull(reset.name());
        assertTrue(likes.findByLiker(1L).isEmpty());
        assertTrue(likes.findLike(2L, 1L).isPresent(), "received likes survive a reset");

        profiles.deleteUser(2L);
        assertTrue(profiles.findById(2L).isEmpty());
        assertTrue(likes.findByLiker(2L).isEmpty());
        assertEquals(List.of(), profiles.listActiveUserIds());
    }
}
