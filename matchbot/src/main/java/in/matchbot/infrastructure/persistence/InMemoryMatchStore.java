package in.matchbot.infrastructure.persistence;

import in.matchbot.application.port.output.LikeRepository;
import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.domain.like.Like;
import in.matchbot.domain.like.LikeOutcome;
import in.matchbot.domain.profile.CandidateQuery;
import in.matchbot.domain.profile.Gender;
import in.matchbot.domain.profile.Profile;
import in.matchbot.domain.profile.ProfileStatus;
import in.matchbot.domain.profile.ProfileUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of both store ports (offline mode and tests).
 *
 * A single lock guards profiles and likes together, so reset/delete that touch
 * both tables are as atomic as the PostgreSQL transactions.
 */
public final class InMemoryMatchStore implements ProfileRepository, LikeRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMatchStore.class);

    private final ReentrantLock lock = new ReentrantLock();

    // ordered by user id for the browse scan
    private final NavigableMap<Long, Profile> profiles = new TreeMap<>();
    // likerId -> (likeeId -> like)
    private final Map<Long, Map<Long, Like>> likesByLiker = new HashMap<>();

    // ═══════════════════════════════════════════════════════════════
    // Profiles
    // ═══════════════════════════════════════════════════════════════

    @Override
    public Profile upsertProfile(long userId, ProfileUpdate update) {
        lock.lock();
        try {
            Instant now = Instant.now();
            Profile current = profiles.getOrDefault(userId, Profile.draft(userId, null, now));
            Profile merged = current.merge(update, now);
            profiles.put(userId, merged);
            return merged;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Profile> findById(long userId) {
        lock.lock();
        try {
            return Optional.ofNullable(profiles.get(userId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Profile> nextCandidate(CandidateQuery query) {
        lock.lock();
        try {
            Map<Long, Like> liked = likesByLiker.getOrDefault(query.viewerId(), Map.of());
            NavigableMap<Long, Profile> tail = query.afterUserId() == null
                ? profiles
                : profiles.tailMap(query.afterUserId(), false);

            for (Profile candidate : tail.values()) {
                long id = candidate.userId();
                if (id == query.viewerId()
                        || !candidate.isActive()
                        || liked.containsKey(id)
                        || query.excludedIds().contains(id)
                        || !query.accepts(candidate)) {
                    continue;
                }
                return Optional.of(candidate);
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resetUser(long userId) {
        lock.lock();
        try {
            Map<Long, Like> authored = likesByLiker.remove(userId);
            Profile current = profiles.get(userId);
            if (current != null) {
                profiles.put(userId, current.cleared(Instant.now()));
            }
            log.info("[STORE] Reset user {} ({} likes removed)", userId, authored == null ? 0 : authored.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteUser(long userId) {
        lock.lock();
        try {
            likesByLiker.remove(userId);
            for (Map<Long, Like> likes : likesByLiker.values()) {
                likes.remove(userId);
            }
            profiles.remove(userId);
            log.info("[STORE] Deleted user {}", userId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Profile updateFilters(long userId, Gender gender, Gender lookingFor) {
        lock.lock();
        try {
            Instant now = Instant.now();
            Profile current = profiles.getOrDefault(userId, Profile.draft(userId, null, now));
            Profile updated = current.withFilters(gender, lookingFor, now);
            profiles.put(userId, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Profile setStatus(long userId, ProfileStatus status) {
        return upsertProfile(userId, ProfileUpdate.status(status));
    }

    @Override
    public List<Long> listActiveUserIds() {
        lock.lock();
        try {
            List<Long> ids = new ArrayList<>();
            for (Profile profile : profiles.values()) {
                if (profile.isActive()) {
                    ids.add(profile.userId());
                }
            }
            return ids;
        } finally {
            lock.unlock();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Likes
    // ═══════════════════════════════════════════════════════════════

    @Override
    public LikeOutcome recordLike(long likerId, long likeeId) {
        lock.lock();
        try {
            Map<Long, Like> authored = likesByLiker.computeIfAbsent(likerId, k -> new HashMap<>());
            boolean inserted = authored.putIfAbsent(likeeId, new Like(likerId, likeeId, Instant.now())) == null;
            boolean mutual = likesByLiker.getOrDefault(likeeId, Map.of()).containsKey(likerId);
            return inserted ? LikeOutcome.recorded(mutual) : LikeOutcome.alreadyLiked(mutual);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeLike(long likerId, long likeeId) {
        lock.lock();
        try {
            Map<Long, Like> authored = likesByLiker.get(likerId);
            if (authored != null) {
                authored.remove(likeeId);
                if (authored.isEmpty()) {
                    likesByLiker.remove(likerId);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Like> findLike(long likerId, long likeeId) {
        lock.lock();
        try {
            return Optional.ofNullable(likesByLiker.getOrDefault(likerId, Map.of()).get(likeeId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Like> findByLiker(long likerId) {
        lock.lock();
        try {
            List<Like> likes = new ArrayList<>(likesByLiker.getOrDefault(likerId, Map.of()).values());
            likes.sort((a, b) -> Long.compare(a.likeeId(), b.likeeId()));
            return likes;
        } finally {
            lock.unlock();
        }
    }
}
