package in.matchbot.infrastructure.persistence;

import in.matchbot.domain.like.LikeOutcome;
import in.matchbot.domain.profile.CandidateQuery;
import in.matchbot.domain.profile.Gender;
import in.matchbot.domain.profile.Profile;
import in.matchbot.domain.profile.ProfileStatus;
import in.matchbot.domain.profile.ProfileUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-memory match store")
class InMemoryMatchStoreTest {

    private InMemoryMatchStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMatchStore();
    }

    private Profile activate(long userId) {
        return store.upsertProfile(userId, ProfileUpdate.activate("User" + userId, 25, "bio", "ref" + userId));
    }

    @Test
    @DisplayName("Upsert creates a draft row and merges partial fields")
    void upsertMergesPartialFields() {
        Profile created = store.upsertProfile(1L, ProfileUpdate.username("ann"));
        assertEquals(ProfileStatus.DRAFT, created.status());
        assertEquals("ann", created.username());
        assertNull(created.name());

        Profile activated = store.upsertProfile(1L, ProfileUpdate.activate("Ann", 27, "hi", "ref1"));
        assertEquals(ProfileStatus.ACTIVE, activated.status());
        assertEquals("ann", activated.username(), "username kept when update leaves it null");
        assertEquals("Ann", activated.name());
        assertEquals(27, activated.age());
        assertEquals(created.createdAt(), activated.createdAt());
    }

    @Test
    @DisplayName("Unknown profile is empty, not an error")
    void findByIdMissing() {
        assertTrue(store.findById(42L).isEmpty());
    }

    @Test
    @DisplayName("Second direction of a like reports mutual, repeats report already liked")
    void recordLikeDetectsMutual() {
        LikeOutcome first = store.recordLike(1L, 2L);
        assertTrue(first.recorded());
        assertFalse(first.mutual());

        LikeOutcome second = store.recordLike(2L, 1L);
        assertTrue(second.formsMatch());

        LikeOutcome repeat = store.recordLike(1L, 2L);
        assertTrue(repeat.alreadyLiked());
        assertFalse(repeat.formsMatch());
    }

    @Test
    @DisplayName("Candidates come in ascending id order without repeats until exhausted")
    void nextCandidateIsOrderedAndExhausts() {
        for (long id = 1; id <= 5; id++) {
            activate(id);
        }

        List<Long> seen = new ArrayList<>();
        Long cursor = null;
        while (true) {
            Optional<Profile> next = store.nextCandidate(CandidateQuery.of(3L, cursor, Set.of()));
            if (next.isEmpty()) {
                break;
            }
            seen.add(next.get().userId());
            cursor = next.get().userId();
        }

        assertEquals(List.of(1L, 2L, 4L, 5L), seen);
    }

    @Test
    @DisplayName("Non-active, liked and excluded profiles are skipped")
    void nextCandidateSkipsIneligible() {
        activate(1L);
        activate(2L);
        activate(3L);
        activate(4L);
        store.upsertProfile(5L, ProfileUpdate.username("draft"));
        store.setStatus(4L, ProfileStatus.HIDDEN);
        store.recordLike(1L, 2L);

        Set<Long> seen = new HashSet<>();
        Long cursor = null;
        Optional<Profile> next;
        while ((next = store.nextCandidate(CandidateQuery.of(1L, cursor, Set.of(3L)))).isPresent()) {
            seen.add(next.get().userId());
            cursor = next.get().userId();
        }

        assertTrue(seen.isEmpty(), "only liked, excluded, hidden and draft users exist: " + seen);
    }

    @Test
    @DisplayName("Gender filters apply in both directions and unset values never filter")
    void nextCandidateHonoursFilters() {
        activate(1L);
        activate(2L);
        activate(3L);
        activate(4L);
        store.updateFilters(2L, Gender.FEMALE, null);
        store.updateFilters(3L, Gender.MALE, null);
        store.updateFilters(4L, Gender.FEMALE, Gender.FEMALE);

        // viewer 1 is a man looking for women
        CandidateQuery query = new CandidateQuery(1L, null, Set.of(), Gender.MALE, Gender.FEMALE);
        Optional<Profile> first = store.nextCandidate(query);
        assertEquals(2L, first.orElseThrow().userId());

        Optional<Profile> second = store.nextCandidate(
            new CandidateQuery(1L, 2L, Set.of(), Gender.MALE, Gender.FEMALE));
        assertTrue(second.isEmpty(), "3 is a man, 4 looks for women only");
    }

    @Test
    @DisplayName("Reset removes authored likes only and reverts the profile to draft")
    void resetUserKeepsReceivedLikes() {
        activate(1L);
        activate(2L);
        activate(3L);
        store.recordLike(1L, 2L);
        store.recordLike(1L, 3L);
        store.recordLike(2L, 1L);

        store.resetUser(1L);

        assertTrue(store.findByLiker(1L).isEmpty());
        assertTrue(store.findLike(2L, 1L).isPresent());
        Profile reset = store.findById(1L).orElseThrow();
        assertEquals(ProfileStatus.DRAFT, reset.status());
        assertNull(reset.name());
        assertTrue(store.nextCandidate(CandidateQuery.of(3L, null, Set.of(2L))).isEmpty());
    }

    @Test
    @DisplayName("Delete removes the profile and likes in both directions")
    void deleteUserRemovesEverything() {
        activate(1L);
        activate(2L);
        store.recordLike(1L, 2L);
        store.recordLike(2L, 1L);

        store.deleteUser(1L);

        assertTrue(store.findById(1L).isEmpty());
        assertTrue(store.findLike(2L, 1L).isEmpty());
        assertTrue(store.findByLiker(1L).isEmpty());
        assertEquals(List.of(2L), store.listActiveUserIds());
    }

    @Test
    @DisplayName("Remove like is idempotent")
    void removeLikeIdempotent() {
        store.recordLike(1L, 2L);
        store.removeLike(1L, 2L);
        store.removeLike(1L, 2L);
        assertTrue(store.findLike(1L, 2L).isEmpty());
    }
}
