package in.matchbot.application.service;

import in.matchbot.config.BotSettings;
import in.matchbot.domain.conversation.CommandType;
import in.matchbot.domain.conversation.ConversationSession;
import in.matchbot.domain.conversation.ConversationState;
import in.matchbot.domain.conversation.InboundEvent;
import in.matchbot.domain.conversation.MenuOption;
import in.matchbot.domain.conversation.OutboundMessage;
import in.matchbot.domain.conversation.UserInput;
import in.matchbot.domain.like.LikeResultType;
import in.matchbot.domain.profile.Gender;
import in.matchbot.domain.profile.Profile;
import in.matchbot.domain.profile.ProfileStatus;
import in.matchbot.infrastructure.persistence.InMemoryMatchStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Conversation state machine")
class ConversationEngineTest {

    private static final long ADMIN_ID = 900L;

    private InMemoryMatchStore store;
    private MatchingService matching;
    private ConversationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryMatchStore();
        matching = new MatchingService(store, store);
        BotSettings settings = new BotSettings(16, 100, 2, 64, 1, 1000, Set.of(ADMIN_ID), "https://t.me/help");
        engine = new ConversationEngine(store, matching, new ProfileValidator(settings), settings);
    }

    private EngineResult send(ConversationSession session, UserInput input) {
        return engine.handle(session, InboundEvent.of(session.userId(), "user" + session.userId(), input));
    }

    private EngineResult text(ConversationSession session, String text) {
        return send(session, UserInput.text(text));
    }

    private EngineResult choose(ConversationSession session, MenuOption option) {
        return send(session, UserInput.choice(option));
    }

    private ConversationSession onboard(long userId, String name) {
        ConversationSession session = new ConversationSession(userId);
        send(session, UserInput.command(CommandType.START));
        text(session, name);
        text(session, "27");
        text(session, "hi");
        send(session, UserInput.photo("ref" + userId));
        choose(session, MenuOption.ACCEPT);
        return session;
    }

    private static String lastText(EngineResult result) {
        return result.replies().get(result.replies().size() - 1).text();
    }

    @Test
    @DisplayName("Onboarding walks name, age, bio, photo, confirm and activates the profile")
    void onboardingActivatesProfile() {
        ConversationSession session = new ConversationSession(1L);

        send(session, UserInput.command(CommandType.START));
        assertEquals(ConversationState.COLLECTING_NAME, session.state());
        assertEquals(ProfileStatus.DRAFT, store.findById(1L).orElseThrow().status());

        text(session, "Ann");
        assertEquals(ConversationState.COLLECTING_AGE, session.state());
        text(session, "27");
        assertEquals(ConversationState.COLLECTING_BIO, session.state());
        text(session, "hi");
        assertEquals(ConversationState.COLLECTING_PHOTO, session.state());

        EngineResult preview = send(session, UserInput.photo("ref1"));
        assertEquals(ConversationState.CONFIRMING, session.state());
        assertEquals("ref1", preview.replies().get(0).photoRef());
        assertTrue(preview.replies().get(0).keyboard().contains(MenuOption.ACCEPT));
        assertEquals(ProfileStatus.DRAFT, store.findById(1L).orElseThrow().status(), "nothing committed before accept");

        choose(session, MenuOption.ACCEPT);
        assertEquals(ConversationState.BROWSING, session.state());
        Profile saved = store.findById(1L).orElseThrow();
        assertEquals(ProfileStatus.ACTIVE, saved.status());
        assertEquals("Ann", saved.name());
        assertEquals(27, saved.age());
        assertEquals("hi", saved.bio());
        assertEquals("ref1", saved.photoRef());
        assertEquals("user1", saved.username());
        assertNull(session.draft());
    }

    @Test
    @DisplayName("Out-of-range ages re-prompt without advancing or touching the store")
    void invalidAgeStaysInState() {
        ConversationSession session = new ConversationSession(1L);
        send(session, UserInput.command(CommandType.START));
        text(session, "Ann");
        Profile before = store.findById(1L).orElseThrow();

        EngineResult young = text(session, "3");
        assertEquals(ConversationState.COLLECTING_AGE, session.state());
        assertTrue(lastText(young).contains(Messages.ASK_AGE));

        text(session, "250");
        assertEquals(ConversationState.COLLECTING_AGE, session.state());
        assertEquals(before, store.findById(1L).orElseThrow());
        assertNull(session.draft().age());

        text(session, "27");
        assertEquals(ConversationState.COLLECTING_BIO, session.state());
        assertEquals(27, session.draft().age());
    }

    @Test
    @DisplayName("Text at the photo step is rejected")
    void textIsNotAPhoto() {
        ConversationSession session = new ConversationSession(1L);
        send(session, UserInput.command(CommandType.START));
        text(session, "Ann");
        text(session, "27");
        text(session, "hi");

        text(session, "here is my photo");
        assertEquals(ConversationState.COLLECTING_PHOTO, session.state());
    }

    @Test
    @DisplayName("Two users like each other: second like forms the match, repeat is a no-op")
    void mutualLikeScenario() {
        ConversationSession ann = onboard(1L, "Ann");
        ConversationSession bob = onboard(2L, "Bob");

        EngineResult card = choose(ann, MenuOption.BROWSE);
        assertEquals(2L, ann.currentCandidateId());
        assertEquals("ref2", card.replies().get(0).photoRef());

        EngineResult annLikes = choose(ann, MenuOption.LIKE);
        assertEquals(LikeResultType.LIKED, annLikes.likeResult().type());
        assertFalse(annLikes.matchFormed());

        choose(bob, MenuOption.BROWSE);
        assertEquals(1L, bob.currentCandidateId());
        EngineResult bobLikes = choose(bob, MenuOption.LIKE);
        assertTrue(bobLikes.matchFormed());
        assertEquals(2L, bobLikes.likeResult().likerId());
        assertEquals(1L, bobLikes.likeResult().likeeId());

        assertEquals(LikeResultType.NO_OP, matching.like(1L, 2L).type());
    }

    @Test
    @DisplayName("Exhausted pool offers browse again, plus clear filters when filters are set")
    void poolExhausted() {
        ConversationSession ann = onboard(1L, "Ann");

        EngineResult empty = choose(ann, MenuOption.BROWSE);
        OutboundMessage reply = empty.replies().get(0);
        assertEquals(Messages.POOL_EXHAUSTED, reply.text());
        assertTrue(reply.keyboard().contains(MenuOption.BROWSE_AGAIN));
        assertFalse(reply.keyboard().contains(MenuOption.CLEAR_FILTERS));

        store.updateFilters(1L, Gender.FEMALE, Gender.MALE);
        EngineResult filtered = choose(ann, MenuOption.BROWSE_AGAIN);
        assertTrue(filtered.replies().get(0).keyboard().contains(MenuOption.CLEAR_FILTERS));
    }

    @Test
    @DisplayName("Pass hides the candidate until browse again")
    void passThenBrowseAgain() {
        ConversationSession ann = onboard(1L, "Ann");
        onboard(2L, "Bob");

        choose(ann, MenuOption.BROWSE);
        EngineResult afterPass = choose(ann, MenuOption.PASS);
        assertEquals(Messages.POOL_EXHAUSTED, afterPass.replies().get(0).text());

        choose(ann, MenuOption.BROWSE_AGAIN);
        assertEquals(2L, ann.currentCandidateId());
    }

    @Test
    @DisplayName("Reset is accepted from any state and restarts onboarding")
    void resetFromAnyState() {
        ConversationSession ann = onboard(1L, "Ann");
        onboard(2L, "Bob");
        choose(ann, MenuOption.BROWSE);
        choose(ann, MenuOption.LIKE);

        choose(ann, MenuOption.EDIT_PROFILE);
        text(ann, "Annie");
        assertEquals(ConversationState.COLLECTING_AGE, ann.state());

        send(ann, UserInput.command(CommandType.RESET));
        assertEquals(ConversationState.COLLECTING_NAME, ann.state());
        assertTrue(store.findByLiker(1L).isEmpty());
        assertEquals(ProfileStatus.DRAFT, store.findById(1L).orElseThrow().status());
        assertNull(ann.browseCursor());
        assertNotNull(ann.draft());
        assertNull(ann.draft().previous());
    }

    @Test
    @DisplayName("Input without a handler gets the neutral menu reply")
    void unknownInputIsNeutral() {
        ConversationSession fresh = new ConversationSession(5L);
        EngineResult result = text(fresh, "hello?");
        assertEquals(Messages.SEND_START, lastText(result));
        assertEquals(ConversationState.NEW, fresh.state());

        ConversationSession ann = onboard(1L, "Ann");
        EngineResult browsing = text(ann, "what now");
        assertEquals(Messages.USE_MENU, lastText(browsing));
        assertEquals(ConversationState.BROWSING, ann.state());

        EngineResult like = choose(ann, MenuOption.LIKE);
        assertEquals(Messages.NO_CANDIDATE, lastText(like));
        assertNull(like.likeResult());
    }

    @Test
    @DisplayName("Editing offers keep current and only changes what was retyped")
    void editKeepsCurrentValues() {
        ConversationSession ann = onboard(1L, "Ann");

        EngineResult prompt = choose(ann, MenuOption.EDIT_PROFILE);
        assertEquals(ConversationState.COLLECTING_NAME, ann.state());
        assertTrue(prompt.replies().get(0).keyboard().contains(MenuOption.KEEP_CURRENT));

        choose(ann, MenuOption.KEEP_CURRENT);
        text(ann, "31");
        choose(ann, MenuOption.KEEP_CURRENT);
        choose(ann, MenuOption.KEEP_CURRENT);
        assertEquals(ConversationState.CONFIRMING, ann.state());
        choose(ann, MenuOption.ACCEPT);

        Profile saved = store.findById(1L).orElseThrow();
        assertEquals("Ann", saved.name());
        assertEquals(31, saved.age());
        assertEquals("hi", saved.bio());
        assertEquals("ref1", saved.photoRef());
    }

    @Test
    @DisplayName("Keep current is not offered during first onboarding")
    void keepCurrentIgnoredWithoutPrevious() {
        ConversationSession session = new ConversationSession(1L);
        send(session, UserInput.command(CommandType.START));

        choose(session, MenuOption.KEEP_CURRENT);
        assertEquals(ConversationState.COLLECTING_NAME, session.state());
        assertNull(session.draft().name());
    }

    @Test
    @DisplayName("Cancel returns to browsing with a profile, to NEW without one")
    void cancelDiscardsDraft() {
        ConversationSession ann = onboard(1L, "Ann");
        choose(ann, MenuOption.EDIT_PROFILE);
        text(ann, "Annie");
        send(ann, UserInput.command(CommandType.CANCEL));
        assertEquals(ConversationState.BROWSING, ann.state());
        assertNull(ann.draft());
        assertEquals("Ann", store.findById(1L).orElseThrow().name());

        ConversationSession bob = new ConversationSession(2L);
        send(bob, UserInput.command(CommandType.START));
        text(bob, "Bob");
        choose(bob, MenuOption.CANCEL);
        assertEquals(ConversationState.NEW, bob.state());
    }

    @Test
    @DisplayName("/start with an active profile opens the menu")
    void startWithActiveProfile() {
        ConversationSession ann = onboard(1L, "Ann");
        ConversationSession restarted = new ConversationSession(1L);

        EngineResult result = send(restarted, UserInput.command(CommandType.START));
        assertEquals(ConversationState.BROWSING, restarted.state());
        assertTrue(result.replies().get(0).keyboard().contains(MenuOption.BROWSE));
        assertEquals(ConversationState.BROWSING, ann.state());
    }

    @Test
    @DisplayName("Filters dialogue stores own gender and preference")
    void filtersDialogue() {
        ConversationSession ann = onboard(1L, "Ann");

        choose(ann, MenuOption.FILTERS);
        assertEquals(ConversationState.CHOOSING_GENDER, ann.state());
        text(ann, "woman");
        assertEquals(ConversationState.CHOOSING_GENDER, ann.state());
        choose(ann, MenuOption.I_AM_WOMAN);
        assertEquals(ConversationState.CHOOSING_LOOKING_FOR, ann.state());
        choose(ann, MenuOption.LOOKING_FOR_MEN);
        assertEquals(ConversationState.BROWSING, ann.state());

        Profile saved = store.findById(1L).orElseThrow();
        assertEquals(Gender.FEMALE, saved.gender());
        assertEquals(Gender.MALE, saved.lookingFor());

        choose(ann, MenuOption.CLEAR_FILTERS);
        assertFalse(store.findById(1L).orElseThrow().hasFilters());
    }

    @Test
    @DisplayName("Cancelling halfway through the filters dialogue keeps the stored filters")
    void filtersCancelKeepsStoredFilters() {
        ConversationSession ann = onboard(1L, "Ann");

        choose(ann, MenuOption.FILTERS);
        choose(ann, MenuOption.I_AM_MAN);
        assertNull(store.findById(1L).orElseThrow().gender(), "nothing stored before the dialogue ends");
        EngineResult cancelled = choose(ann, MenuOption.CANCEL);

        assertEquals(ConversationState.BROWSING, ann.state());
        assertEquals(Messages.CANCELLED, cancelled.replies().get(0).text());
        assertNull(store.findById(1L).orElseThrow().gender());
        assertNull(ann.chosenGender());

        choose(ann, MenuOption.FILTERS);
        choose(ann, MenuOption.I_AM_WOMAN);
        choose(ann, MenuOption.LOOKING_FOR_ANYONE);
        choose(ann, MenuOption.FILTERS);
        choose(ann, MenuOption.I_AM_MAN);
        send(ann, UserInput.command(CommandType.CANCEL));

        Profile saved = store.findById(1L).orElseThrow();
        assertEquals(Gender.FEMALE, saved.gender());
        assertNull(saved.lookingFor());
    }

    @Test
    @DisplayName("Typed text that reads like a button label is ordinary input while collecting")
    void labelLikeTextIsCollected() {
        ConversationSession session = new ConversationSession(1L);
        send(session, UserInput.command(CommandType.START));

        send(session, UserInput.fromMessageText("Next"));
        assertEquals(ConversationState.COLLECTING_AGE, session.state());
        assertEquals("Next", session.draft().name());
        text(session, "27");

        send(session, UserInput.fromMessageText("Anyone"));
        assertEquals(ConversationState.COLLECTING_PHOTO, session.state());
        assertEquals("Anyone", session.draft().bio());

        send(session, UserInput.command(CommandType.START));
        text(session, "Ann");
        text(session, "27");
        send(session, UserInput.fromMessageText("Cancel"));
        assertEquals(ConversationState.COLLECTING_PHOTO, session.state(), "typed Cancel is a bio, not a cancel");
        assertEquals("Cancel", session.draft().bio());
    }

    @Test
    @DisplayName("Hide and show toggle visibility")
    void hideAndShow() {
        ConversationSession ann = onboard(1L, "Ann");

        EngineResult hidden = choose(ann, MenuOption.HIDE_PROFILE);
        assertEquals(ProfileStatus.HIDDEN, store.findById(1L).orElseThrow().status());
        assertTrue(hidden.replies().get(0).keyboard().contains(MenuOption.SHOW_PROFILE));

        choose(ann, MenuOption.SHOW_PROFILE);
        assertEquals(ProfileStatus.ACTIVE, store.findById(1L).orElseThrow().status());
    }

    @Test
    @DisplayName("Delete removes the profile and resets the session")
    void deleteProfile() {
        ConversationSession ann = onboard(1L, "Ann");

        EngineResult result = choose(ann, MenuOption.DELETE_PROFILE);
        assertEquals(Messages.DELETED, lastText(result));
        assertTrue(result.sessionEnded());
        assertEquals(ConversationState.NEW, ann.state());
        assertTrue(store.findById(1L).isEmpty());
    }

    @Test
    @DisplayName("Broadcast is admin-only and needs text")
    void broadcastCommand() {
        ConversationSession user = new ConversationSession(1L);
        EngineResult denied = send(user, UserInput.command(CommandType.BROADCAST, "hello"));
        assertEquals(Messages.COMMAND_UNAVAILABLE, lastText(denied));
        assertFalse(denied.hasBroadcast());

        ConversationSession admin = new ConversationSession(ADMIN_ID);
        EngineResult usage = send(admin, UserInput.command(CommandType.BROADCAST, ""));
        assertEquals(Messages.BROADCAST_USAGE, lastText(usage));

        EngineResult queued = send(admin, UserInput.command(CommandType.BROADCAST, " hello all "));
        assertEquals("hello all", queued.broadcastText());
    }

    @Test
    @DisplayName("Support and help replies")
    void supportAndHelp() {
        ConversationSession ann = onboard(1L, "Ann");
        assertTrue(lastText(choose(ann, MenuOption.SUPPORT)).contains("https://t.me/help"));
        assertEquals(Messages.HELP, lastText(send(ann, UserInput.command(CommandType.HELP))));
        assertEquals(Messages.NO_PROFILE, lastText(send(new ConversationSession(7L),
            UserInput.command(CommandType.MY_PROFILE))));
    }
}
