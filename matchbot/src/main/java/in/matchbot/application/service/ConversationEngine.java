package in.matchbot.application.service;

import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.application.port.output.StorageException;
import in.matchbot.config.BotSettings;
import in.matchbot.domain.conversation.CommandType;
import in.matchbot.domain.conversation.ConversationSession;
import in.matchbot.domain.conversation.ConversationState;
import in.matchbot.domain.conversation.InboundEvent;
import in.matchbot.domain.conversation.InputKind;
import in.matchbot.domain.conversation.MenuOption;
import in.matchbot.domain.conversation.OutboundMessage;
import in.matchbot.domain.conversation.ProfileDraft;
import in.matchbot.domain.conversation.UserInput;
import in.matchbot.domain.like.LikeResult;
import in.matchbot.domain.profile.Gender;
import in.matchbot.domain.profile.Profile;
import in.matchbot.domain.profile.ProfileStatus;
import in.matchbot.domain.profile.ProfileUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Per-user conversation state machine.
 *
 * Onboarding: NEW -> COLLECTING_NAME -> COLLECTING_AGE -> COLLECTING_BIO
 * -> COLLECTING_PHOTO -> CONFIRMING -> BROWSING.
 *
 * Each collecting step validates one input; on failure it re-prompts and the
 * state does not move. Nothing is written to the store until CONFIRMING is
 * accepted. Commands (/reset, /start, /cancel, ...) are accepted in every state.
 *
 * Not thread-safe per session: callers must serialize events of one user.
 * Storage failures propagate as StorageException; the dispatcher restores the
 * session snapshot. The one exception is a failure after a like was committed,
 * which is reported on the result so the like outcome is not lost.
 */
public final class ConversationEngine {
    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    private final ProfileRepository profiles;
    private final MatchingService matching;
    private final ProfileValidator validator;
    private final BotSettings settings;

    public ConversationEngine(ProfileRepository profiles, MatchingService matching,
                              ProfileValidator validator, BotSettings settings) {
        this.profiles = profiles;
        this.matching = matching;
        this.validator = validator;
        this.settings = settings;
    }

    public EngineResult handle(ConversationSession session, InboundEvent event) {
        UserInput input = event.input();
        EngineResult.Builder out = new EngineResult.Builder(session.userId());
        ConversationState before = session.state();

        if (input.kind() == InputKind.COMMAND) {
            handleCommand(session, event, out);
        } else {
            switch (session.state()) {
                case NEW, RESETTING -> out.text(Messages.SEND_START);
                case COLLECTING_NAME -> onName(session, input, out);
                case COLLECTING_AGE -> onAge(session, input, out);
                case COLLECTING_BIO -> onBio(session, input, out);
                case COLLECTING_PHOTO -> onPhoto(session, input, out);
                case CONFIRMING -> onConfirm(session, input, out);
                case BROWSING -> onBrowsing(session, input, out);
                case CHOOSING_GENDER -> onGender(session, input, out);
                case CHOOSING_LOOKING_FOR -> onLookingFor(session, input, out);
            }
        }

        if (before != session.state()) {
            log.debug("[DISPATCH] User {} {} -> {}", session.userId(), before, session.state());
        }
        return out.build();
    }

    // ═══════════════════════════════════════════════════════════════
    // Commands
    // ═══════════════════════════════════════════════════════════════

    private void handleCommand(ConversationSession session, InboundEvent event, EngineResult.Builder out) {
        UserInput input = event.input();
        switch (input.command()) {
            case START -> start(session, event.username(), out);
            case RESET -> reset(session, event.username(), out);
            case CANCEL -> cancel(session, out);
            case MY_PROFILE -> showOwnProfile(session, out);
            case HELP -> out.text(Messages.HELP);
            case BROADCAST -> broadcast(session, input.text(), out);
        }
    }

    private void start(ConversationSession session, String username, EngineResult.Builder out) {
        Optional<Profile> stored = profiles.findById(session.userId());
        if (stored.isPresent() && stored.get().isComplete()) {
            if (username != null && !username.equals(stored.get().username())) {
                profiles.upsertProfile(session.userId(), ProfileUpdate.username(username));
            }
            session.clearDraft();
            session.transitionTo(ConversationState.BROWSING);
            out.text("Welcome back, " + stored.get().name() + "!", Messages.mainMenu(stored.get()));
            return;
        }
        beginOnboarding(session, username, out);
    }

    private void beginOnboarding(ConversationSession session, String username, EngineResult.Builder out) {
        profiles.upsertProfile(session.userId(), ProfileUpdate.username(username));
        session.startDraft(ProfileDraft.empty());
        session.transitionTo(ConversationState.COLLECTING_NAME);
        out.text(Messages.ASK_NAME, Messages.collecting(false));
    }

    private void reset(ConversationSession session, String username, EngineResult.Builder out) {
        session.transitionTo(ConversationState.RESETTING);
        matching.reset(session);
        session.clear();
        out.text(Messages.RESET_DONE);
        beginOnboarding(session, username, out);
    }

    private void cancel(ConversationSession session, EngineResult.Builder out) {
        ConversationState state = session.state();
        if (!state.isEditingProfile() && !state.isChoosingFilters()) {
            out.text(Messages.NOTHING_TO_CANCEL);
            return;
        }
        session.clearDraft();
        session.clearChosenGender();
        Optional<Profile> stored = profiles.findById(session.userId()).filter(Profile::isComplete);
        if (stored.isPresent()) {
            session.transitionTo(ConversationState.BROWSING);
            out.text(Messages.CANCELLED, Messages.mainMenu(stored.get()));
        } else {
            session.transitionTo(ConversationState.NEW);
            out.text(Messages.CANCELLED + " Send /start when you're ready.");
        }
    }

    private void showOwnProfile(ConversationSession session, EngineResult.Builder out) {
        Optional<Profile> stored = profiles.findById(session.userId()).filter(Profile::isComplete);
        if (stored.isEmpty()) {
            out.text(Messages.NO_PROFILE);
            return;
        }
        Profile profile = stored.get();
        String text = Messages.profileCard(profile);
        if (profile.isHidden()) {
            text += "\n(hidden)";
        }
        out.reply(OutboundMessage.card(session.userId(), text, profile.photoRef(),
            session.state() == ConversationState.BROWSING ? Messages.mainMenu(profile) : null));
    }

    private void broadcast(ConversationSession session, String text, EngineResult.Builder out) {
        if (!settings.isAdmin(session.userId())) {
            out.text(Messages.COMMAND_UNAVAILABLE);
            return;
        }
        if (text == null || text.isBlank()) {
            out.text(Messages.BROADCAST_USAGE);
            return;
        }
        out.broadcast(text.trim()).text(Messages.BROADCAST_QUEUED);
    }

    // ═══════════════════════════════════════════════════════════════
    // Onboarding / edit
    // ═══════════════════════════════════════════════════════════════

    private void onName(ConversationSession session, UserInput input, EngineResult.Builder out) {
        ProfileDraft draft = session.draft();
        if (input.is(MenuOption.CANCEL)) {
            cancel(session, out);
            return;
        }
        if (input.is(MenuOption.KEEP_CURRENT) && draft.previousName() != null) {
            draft.setName(draft.previousName());
        } else if (input.kind() == InputKind.TEXT) {
            try {
                draft.setName(validator.validateName(input.text()));
            } catch (ValidationException e) {
                out.text(Messages.validationError(e.getMessage(), Messages.ASK_NAME),
                    Messages.collecting(draft.previousName() != null));
                return;
            }
        } else {
            out.text(Messages.USE_MENU + "\n" + Messages.ASK_NAME, Messages.collecting(draft.previousName() != null));
            return;
        }
        session.transitionTo(ConversationState.COLLECTING_AGE);
        out.text(Messages.withCurrent(Messages.ASK_AGE, draft.previousAge()),
            Messages.collecting(draft.previousAge() != null));
    }

    private void onAge(ConversationSession session, UserInput input, EngineResult.Builder out) {
        ProfileDraft draft = session.draft();
        if (input.is(MenuOption.CANCEL)) {
            cancel(session, out);
            return;
        }
        if (input.is(MenuOption.KEEP_CURRENT) && draft.previousAge() != null) {
            draft.setAge(draft.previousAge());
        } else if (input.kind() == InputKind.TEXT) {
            try {
                draft.setAge(validator.validateAge(input.text()));
            } catch (ValidationException e) {
                out.text(Messages.validationError(e.getMessage(), Messages.ASK_AGE),
                    Messages.collecting(draft.previousAge() != null));
                return;
            }
        } else {
            out.text(Messages.USE_MENU + "\n" + Messages.ASK_AGE, Messages.collecting(draft.previousAge() != null));
            return;
        }
        session.transitionTo(ConversationState.COLLECTING_BIO);
        out.text(Messages.withCurrent(Messages.ASK_BIO, draft.previousBio()),
            Messages.collecting(draft.previousBio() != null));
    }

    private void onBio(ConversationSession session, UserInput input, EngineResult.Builder out) {
        ProfileDraft draft = session.draft();
        if (input.is(MenuOption.CANCEL)) {
            cancel(session, out);
            return;
        }
        if (input.is(MenuOption.KEEP_CURRENT) && draft.previousBio() != null) {
            draft.setBio(draft.previousBio());
        } else if (input.kind() == InputKind.TEXT) {
            try {
                draft.setBio(validator.validateBio(input.text()));
            } catch (ValidationException e) {
                out.text(Messages.validationError(e.getMessage(), Messages.ASK_BIO),
                    Messages.collecting(draft.previousBio() != null));
                return;
            }
        } else {
            out.text(Messages.USE_MENU + "\n" + Messages.ASK_BIO, Messages.collecting(draft.previousBio() != null));
            return;
        }
        session.transitionTo(ConversationState.COLLECTING_PHOTO);
        out.text(Messages.ASK_PHOTO, Messages.collecting(draft.previousPhotoRef() != null));
    }

    private void onPhoto(ConversationSession session, UserInput input, EngineResult.Builder out) {
        ProfileDraft draft = session.draft();
        if (input.is(MenuOption.CANCEL)) {
            cancel(session, out);
            return;
        }
        if (input.is(MenuOption.KEEP_CURRENT) && draft.previousPhotoRef() != null) {
            draft.setPhotoRef(draft.previousPhotoRef());
        } else if (input.kind() == InputKind.PHOTO) {
            try {
                draft.setPhotoRef(validator.validatePhotoRef(input.text()));
            } catch (ValidationException e) {
                out.text(e.getMessage(), Messages.collecting(draft.previousPhotoRef() != null));
                return;
            }
        } else {
            // text is not a photo
            out.text(Messages.validationError("That's not a photo.", Messages.ASK_PHOTO),
                Messages.collecting(draft.previousPhotoRef() != null));
            return;
        }
        session.transitionTo(ConversationState.CONFIRMING);
        out.reply(OutboundMessage.card(session.userId(), Messages.draftPreview(draft),
            draft.photoRef(), Messages.confirm()));
    }

    private void onConfirm(ConversationSession session, UserInput input, EngineResult.Builder out) {
        ProfileDraft draft = session.draft();
        if (input.is(MenuOption.ACCEPT) && draft != null && draft.isComplete()) {
            Profile saved = profiles.upsertProfile(session.userId(),
                ProfileUpdate.activate(draft.name(), draft.age(), draft.bio(), draft.photoRef()));
            session.clearDraft();
            matching.restartCycle(session);
            session.transitionTo(ConversationState.BROWSING);
            log.info("[DISPATCH] User {} profile activated", session.userId());
            out.text(Messages.SAVED, Messages.mainMenu(saved));
        } else if (input.is(MenuOption.EDIT)) {
            Optional<Profile> stored = profiles.findById(session.userId()).filter(Profile::isComplete);
            session.startDraft(stored.map(ProfileDraft::editing).orElseGet(ProfileDraft::empty));
            session.transitionTo(ConversationState.COLLECTING_NAME);
            out.text(Messages.withCurrent(Messages.ASK_NAME, session.draft().previousName()),
                Messages.collecting(session.draft().previousName() != null));
        } else if (input.is(MenuOption.CANCEL)) {
            cancel(session, out);
        } else {
            out.text(Messages.USE_MENU, Messages.confirm());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Browsing / main menu
    // ═══════════════════════════════════════════════════════════════

    private void onBrowsing(ConversationSession session, UserInput input, EngineResult.Builder out) {
        Optional<Profile> stored = profiles.findById(session.userId()).filter(Profile::isComplete);
        if (stored.isEmpty()) {
            // profile vanished underneath the session (deleted or reset elsewhere)
            session.clear();
            out.text(Messages.NO_PROFILE).endSession();
            return;
        }
        Profile viewer = stored.get();

        if (input.kind() != InputKind.CHOICE) {
            out.text(Messages.USE_MENU, Messages.mainMenu(viewer));
            return;
        }

        switch (input.option()) {
            case BROWSE, NEXT -> showNextCandidate(session, viewer, out);
            case BROWSE_AGAIN -> {
                matching.restartCycle(session);
                showNextCandidate(session, viewer, out);
            }
            case LIKE -> like(session, viewer, out);
            case PASS -> pass(session, viewer, out);
            case MENU -> out.text("Menu", Messages.mainMenu(viewer));
            case MY_PROFILE -> showOwnProfile(session, out);
            case EDIT_PROFILE -> {
                session.startDraft(ProfileDraft.editing(viewer));
                session.transitionTo(ConversationState.COLLECTING_NAME);
                out.text(Messages.withCurrent(Messages.ASK_NAME, viewer.name()), Messages.collecting(true));
            }
            case FILTERS -> {
                session.clearChosenGender();
                session.transitionTo(ConversationState.CHOOSING_GENDER);
                out.text(Messages.ASK_GENDER, Messages.genderChoice());
            }
            case CLEAR_FILTERS -> {
                Profile updated = profiles.updateFilters(session.userId(), null, null);
                matching.restartCycle(session);
                out.text(Messages.FILTERS_CLEARED);
                showNextCandidate(session, updated, out);
            }
            case HIDE_PROFILE -> {
                Profile updated = profiles.setStatus(session.userId(), ProfileStatus.HIDDEN);
                out.text(Messages.HIDDEN, Messages.mainMenu(updated));
            }
            case SHOW_PROFILE -> {
                Profile updated = profiles.setStatus(session.userId(), ProfileStatus.ACTIVE);
                out.text(Messages.SHOWN, Messages.mainMenu(updated));
            }
            case DELETE_PROFILE -> {
                profiles.deleteUser(session.userId());
                session.clear();
                log.info("[DISPATCH] User {} deleted their profile", session.userId());
                out.text(Messages.DELETED).endSession();
            }
            case RESET_PROFILE -> reset(session, viewer.username(), out);
            case SUPPORT -> out.text(Messages.support(settings.supportContact()), Messages.mainMenu(viewer));
            default -> out.text(Messages.USE_MENU, Messages.mainMenu(viewer));
        }
    }

    private void showNextCandidate(ConversationSession session, Profile viewer, EngineResult.Builder out) {
        Optional<Profile> candidate = matching.nextCandidate(session, viewer);
        if (candidate.isEmpty()) {
            out.text(viewer.hasFilters() ? Messages.POOL_EXHAUSTED_FILTERED : Messages.POOL_EXHAUSTED,
                Messages.poolExhausted(viewer.hasFilters()));
            return;
        }
        Profile shown = candidate.get();
        out.reply(OutboundMessage.card(session.userId(), Messages.profileCard(shown),
            shown.photoRef(), Messages.candidateActions()));
    }

    private void like(ConversationSession session, Profile viewer, EngineResult.Builder out) {
        Long candidateId = session.currentCandidateId();
        if (candidateId == null) {
            out.text(Messages.NO_CANDIDATE, Messages.mainMenu(viewer));
            return;
        }

        LikeResult result = matching.like(session.userId(), candidateId);
        out.likeResult(result);
        session.clearCurrentCandidate();
        switch (result.type()) {
            case LIKED -> out.text(Messages.LIKED);
            case NO_OP -> out.text(Messages.ALREADY_LIKED);
            case INVALID_TARGET -> out.text(Messages.TARGET_GONE);
            case MATCH_FORMED -> {
                // both sides are told by the match notifier
            }
        }
        try {
            showNextCandidate(session, viewer, out);
        } catch (StorageException e) {
            // the like is committed: keep its result so a match is still announced
            log.error("[DISPATCH] Like by {} stored, next candidate failed: {}", session.userId(), e.getMessage());
            out.storageFailure(e.getOperation()).text(Messages.TRY_AGAIN, Messages.mainMenu(viewer));
        }
    }

    private void pass(ConversationSession session, Profile viewer, EngineResult.Builder out) {
        Long candidateId = session.currentCandidateId();
        if (candidateId == null) {
            out.text(Messages.NO_CANDIDATE, Messages.mainMenu(viewer));
            return;
        }
        matching.pass(session, candidateId);
        showNextCandidate(session, viewer, out);
    }

    // ═══════════════════════════════════════════════════════════════
    // Filters
    // ═══════════════════════════════════════════════════════════════

    private void onGender(ConversationSession session, UserInput input, EngineResult.Builder out) {
        if (input.kind() != InputKind.CHOICE) {
            out.text(Messages.USE_MENU + "\n" + Messages.ASK_GENDER, Messages.genderChoice());
            return;
        }
        Gender gender;
        switch (input.option()) {
            case I_AM_MAN -> gender = Gender.MALE;
            case I_AM_WOMAN -> gender = Gender.FEMALE;
            case SKIP -> gender = null;
            case CANCEL -> {
                cancel(session, out);
                return;
            }
            default -> {
                out.text(Messages.USE_MENU + "\n" + Messages.ASK_GENDER, Messages.genderChoice());
                return;
            }
        }
        session.chooseGender(gender);
        session.transitionTo(ConversationState.CHOOSING_LOOKING_FOR);
        out.text(Messages.ASK_LOOKING_FOR, Messages.lookingForChoice());
    }

    private void onLookingFor(ConversationSession session, UserInput input, EngineResult.Builder out) {
        if (input.kind() != InputKind.CHOICE) {
            out.text(Messages.USE_MENU + "\n" + Messages.ASK_LOOKING_FOR, Messages.lookingForChoice());
            return;
        }
        Gender lookingFor;
        switch (input.option()) {
            case LOOKING_FOR_MEN -> lookingFor = Gender.MALE;
            case LOOKING_FOR_WOMEN -> lookingFor = Gender.FEMALE;
            case LOOKING_FOR_ANYONE -> lookingFor = null;
            case CANCEL -> {
                cancel(session, out);
                return;
            }
            default -> {
                out.text(Messages.USE_MENU + "\n" + Messages.ASK_LOOKING_FOR, Messages.lookingForChoice());
                return;
            }
        }
        Profile updated = profiles.updateFilters(session.userId(), session.chosenGender(), lookingFor);
        session.clearChosenGender();
        matching.restartCycle(session);
        session.transitionTo(ConversationState.BROWSING);
        out.text(Messages.filters(updated), Messages.mainMenu(updated));
    }
}
