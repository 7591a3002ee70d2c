package in.matchbot.domain.conversation;

import in.matchbot.domain.profile.Gender;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Transient per-user conversation progress. Lives in process memory only.
 *
 * Not thread-safe: the dispatcher guarantees a single writer per user.
 */
public final class ConversationSession {
    private final long userId;
    private ConversationState state = ConversationState.NEW;
    private ProfileDraft draft;

    // filters dialogue: gender picked, not yet saved
    private Gender chosenGender;

    // browse cycle
    private Long currentCandidateId;
    private Long browseCursor;
    private final Set<Long> passedIds = new HashSet<>();

    public ConversationSession(long userId) {
        this.userId = userId;
    }

    public long userId() {
        return userId;
    }

    public ConversationState state() {
        return state;
    }

    public void transitionTo(ConversationState next) {
        this.state = next;
    }

    public ProfileDraft draft() {
        return draft;
    }

    public void startDraft(ProfileDraft draft) {
        this.draft = draft;
    }

    public void clearDraft() {
        this.draft = null;
    }

    /**
     * Hold the gender picked in the filters dialogue until "looking for" is
     * answered; both are stored together. Null means "not set".
     */
    public void chooseGender(Gender gender) {
        this.chosenGender = gender;
    }

    public Gender chosenGender() {
        return chosenGender;
    }

    public void clearChosenGender() {
        this.chosenGender = null;
    }

    public Long currentCandidateId() {
        return currentCandidateId;
    }

    public Long browseCursor() {
        return browseCursor;
    }

    public Set<Long> passedIds() {
        return Collections.unmodifiableSet(passedIds);
    }

    /**
     * Remember the candidate on screen and move the cursor past it.
     */
    public void presentCandidate(long candidateId) {
        this.currentCandidateId = candidateId;
        this.browseCursor = candidateId;
    }

    public void clearCurrentCandidate() {
        this.currentCandidateId = null;
    }

    public void markPassed(long candidateId) {
        passedIds.add(candidateId);
        if (currentCandidateId != null && currentCandidateId == candidateId) {
            currentCandidateId = null;
        }
    }

    /**
     * Start a new browsing cycle: cursor back to the beginning, passes forgotten.
     */
    public void resetBrowseCycle() {
        currentCandidateId = null;
        browseCursor = null;
        passedIds.clear();
    }

    /**
     * Back to a fresh session (reset / delete).
     */
    public void clear() {
        state = ConversationState.NEW;
        draft = null;
        chosenGender = null;
        resetBrowseCycle();
    }

    /**
     * Deep copy used to roll the session back when a request fails in storage.
     */
    public ConversationSession snapshot() {
        ConversationSession copy = new ConversationSession(userId);
        copy.restoreFrom(this);
        return copy;
    }

    public void restoreFrom(ConversationSession other) {
        this.state = other.state;
        this.draft = other.draft != null ? other.draft.copy() : null;
        this.chosenGender = other.chosenGender;
        this.currentCandidateId = other.currentCandidateId;
        this.browseCursor = other.browseCursor;
        this.passedIds.clear();
        this.passedIds.addAll(other.passedIds);
    }
}
