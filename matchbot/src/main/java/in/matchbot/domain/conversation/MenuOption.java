package in.matchbot.domain.conversation;

import java.util.Optional;

/**
 * Selectable options. The token travels through the transport (callback data);
 * the label is what the user sees.
 */
public enum MenuOption {
    // main menu
    BROWSE("browse", "Browse profiles"),
    MY_PROFILE("my_profile", "My profile"),
    EDIT_PROFILE("edit_profile", "Edit profile"),
    FILTERS("filters", "Filters"),
    HIDE_PROFILE("hide_profile", "Hide my profile"),
    SHOW_PROFILE("show_profile", "Show my profile"),
    DELETE_PROFILE("delete_profile", "Delete profile"),
    RESET_PROFILE("reset_profile", "Start over"),
    SUPPORT("support", "Support"),

    // browsing
    LIKE("like", "❤️"),
    PASS("pass", "👎"),
    NEXT("next", "Next"),
    MENU("menu", "⬅️ Menu"),
    BROWSE_AGAIN("browse_again", "Browse again"),
    CLEAR_FILTERS("clear_filters", "Clear filters"),

    // onboarding
    KEEP_CURRENT("keep", "Keep current"),
    ACCEPT("accept", "✅ Save"),
    EDIT("edit", "✏️ Edit"),
    CANCEL("cancel", "Cancel"),

    // filters
    I_AM_MAN("gender_male", "I'm a man"),
    I_AM_WOMAN("gender_female", "I'm a woman"),
    SKIP("skip", "Skip"),
    LOOKING_FOR_MEN("looking_male", "Looking for men"),
    LOOKING_FOR_WOMEN("looking_female", "Looking for women"),
    LOOKING_FOR_ANYONE("looking_any", "Anyone");

    private final String token;
    private final String label;

    MenuOption(String token, String label) {
        this.token = token;
        this.label = label;
    }

    public String token() {
        return token;
    }

    public String label() {
        return label;
    }

    public static Optional<MenuOption> fromToken(String token) {
        if (token == null) return Optional.empty();
        for (MenuOption option : values()) {
            if (option.token.equals(token)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
