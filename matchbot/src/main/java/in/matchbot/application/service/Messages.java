package in.matchbot.application.service;

import in.matchbot.domain.conversation.Keyboard;
import in.matchbot.domain.conversation.MenuOption;
import in.matchbot.domain.conversation.ProfileDraft;
import in.matchbot.domain.profile.Profile;

import java.util.ArrayList;
import java.util.List;

/**
 * User-facing texts and keyboards.
 */
public final class Messages {

    public static final String ASK_NAME = "What's your name?";
    public static final String ASK_AGE = "How old are you?";
    public static final String ASK_BIO = "Tell us a little about yourself.";
    public static final String ASK_PHOTO = "Send a photo for your profile.";
    public static final String CONFIRM = "This is how your profile looks. Save it?";
    public static final String SAVED = "Your profile is saved. Happy browsing!";
    public static final String USE_MENU = "Please use the menu.";
    public static final String SEND_START = "Please use the menu. Send /start to create your profile.";
    public static final String NO_PROFILE = "You don't have a profile yet. Send /start to create one.";
    public static final String POOL_EXHAUSTED = "No more profiles right now. Check back later!";
    public static final String POOL_EXHAUSTED_FILTERED =
        "No more profiles match your filters right now. Check back later or clear your filters.";
    public static final String NO_CANDIDATE = "There's no profile on screen. Tap Browse to see one.";
    public static final String LIKED = "Liked! We'll let you know if it's mutual.";
    public static final String ALREADY_LIKED = "You already liked this profile.";
    public static final String TARGET_GONE = "This profile is no longer available.";
    public static final String RESET_DONE = "Your profile and likes were cleared. Let's start over.";
    public static final String DELETED = "Your profile has been deleted. Send /start to create a new one.";
    public static final String HIDDEN = "Your profile is hidden. Others won't see it until you show it again.";
    public static final String SHOWN = "Your profile is visible again.";
    public static final String CANCELLED = "Cancelled.";
    public static final String NOTHING_TO_CANCEL = "Nothing to cancel.";
    public static final String ASK_GENDER = "Who are you? (used to match preferences)";
    public static final String ASK_LOOKING_FOR = "Who would you like to see?";
    public static final String FILTERS_SAVED = "Filters saved.";
    public static final String FILTERS_CLEARED = "Filters cleared.";
    public static final String COMMAND_UNAVAILABLE = "This command is unavailable.";
    public static final String BROADCAST_USAGE = "Usage: /broadcast <text>";
    public static final String BROADCAST_QUEUED = "Broadcast started.";
    public static final String BROADCAST_FAILED = "Broadcast failed before anything was sent. Please try again later.";
    public static final String TRY_AGAIN = "Something went wrong. Please try again.";
    public static final String HELP = """
        /start - create your profile or open the menu
        /myprofile - show your profile
        /cancel - stop editing
        /reset - clear your profile and likes and start over
        /help - this message""";

    public static Keyboard mainMenu(Profile profile) {
        MenuOption visibility = profile != null && profile.isHidden()
            ? MenuOption.SHOW_PROFILE
            : MenuOption.HIDE_PROFILE;
        return Keyboard.rows(
            List.of(MenuOption.BROWSE),
            List.of(MenuOption.MY_PROFILE, MenuOption.EDIT_PROFILE),
            List.of(MenuOption.FILTERS, visibility),
            List.of(MenuOption.DELETE_PROFILE, MenuOption.RESET_PROFILE),
            List.of(MenuOption.SUPPORT)
        );
    }

    public static Keyboard candidateActions() {
        return Keyboard.rows(
            List.of(MenuOption.LIKE, MenuOption.PASS),
            List.of(MenuOption.MENU)
        );
    }

    public static Keyboard poolExhausted(boolean hasFilters) {
        List<List<MenuOption>> rows = new ArrayList<>();
        rows.add(List.of(MenuOption.BROWSE_AGAIN));
        if (hasFilters) {
            rows.add(List.of(MenuOption.CLEAR_FILTERS));
        }
        rows.add(List.of(MenuOption.MENU));
        return new Keyboard(rows);
    }

    /**
     * Prompt keyboard for a collecting step: "Keep current" when editing, Cancel always.
     */
    public static Keyboard collecting(boolean hasPrevious) {
        return hasPrevious
            ? Keyboard.column(MenuOption.KEEP_CURRENT, MenuOption.CANCEL)
            : Keyboard.column(MenuOption.CANCEL);
    }

    public static Keyboard confirm() {
        return Keyboard.rows(
            List.of(MenuOption.ACCEPT, MenuOption.EDIT),
            List.of(MenuOption.CANCEL)
        );
    }

    public static Keyboard genderChoice() {
        return Keyboard.rows(
            List.of(MenuOption.I_AM_MAN, MenuOption.I_AM_WOMAN),
            List.of(MenuOption.SKIP, MenuOption.CANCEL)
        );
    }

    public static Keyboard lookingForChoice() {
        return Keyboard.rows(
            List.of(MenuOption.LOOKING_FOR_MEN, MenuOption.LOOKING_FOR_WOMEN),
            List.of(MenuOption.LOOKING_FOR_ANYONE, MenuOption.CANCEL)
        );
    }

    public static String profileCard(Profile profile) {
        StringBuilder sb = new StringBuilder();
        sb.append(profile.name() != null ? profile.name() : "?");
        if (profile.age() != null) {
            sb.append(", ").append(profile.age());
        }
        if (profile.bio() != null && !profile.bio().isBlank()) {
            sb.append('\n').append(profile.bio());
        }
        return sb.toString();
    }

    public static String draftPreview(ProfileDraft draft) {
        return CONFIRM + "\n\n" + draft.name() + ", " + draft.age() + "\n" + draft.bio();
    }

    public static String withCurrent(String prompt, Object current) {
        return current == null ? prompt : prompt + "\nCurrent: " + current;
    }

    public static String support(String contact) {
        return "Questions or problems? Contact us: " + contact;
    }

    public static String filters(Profile profile) {
        String own = profile.gender() != null ? profile.gender().label() : "not set";
        String wanted = profile.lookingFor() != null ? profile.lookingFor().label() : "anyone";
        return FILTERS_SAVED + " You: " + own + ". Showing: " + wanted + ".";
    }

    public static String matchNotice(Profile counterpart, String contactLink) {
        return "It's a match! 🎉\n\n" + profileCard(counterpart) + "\n\nSay hi: " + contactLink;
    }

    public static String broadcastReport(int delivered, int total) {
        return "Broadcast delivered to " + delivered + " of " + total + " users.";
    }

    public static String validationError(String reason, String prompt) {
        return reason + "\n" + prompt;
    }

    private Messages() {}
}
