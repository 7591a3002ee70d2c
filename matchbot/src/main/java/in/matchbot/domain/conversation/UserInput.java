package in.matchbot.domain.conversation;

/**
 * One inbound user input, tagged by kind.
 *
 * TEXT and PHOTO carry {@code text} (message text / media reference),
 * CHOICE carries {@code option}, COMMAND carries {@code command} and its
 * argument in {@code text}.
 */
public record UserInput(
    InputKind kind,
    String text,
    MenuOption option,
    CommandType command
) {
    public static UserInput text(String text) {
        return new UserInput(InputKind.TEXT, text == null ? "" : text, null, null);
    }

    public static UserInput photo(String reference) {
        return new UserInput(InputKind.PHOTO, reference, null, null);
    }

    public static UserInput choice(MenuOption option) {
        return new UserInput(InputKind.CHOICE, null, option, null);
    }

    public static UserInput command(CommandType command) {
        return new UserInput(InputKind.COMMAND, "", null, command);
    }

    public static UserInput command(CommandType command, String argument) {
        return new UserInput(InputKind.COMMAND, argument == null ? "" : argument, null, command);
    }

    /**
     * Classify raw message text: slash command or free text. Menu choices only
     * arrive as callback tokens, so text that happens to read like a button
     * label stays text.
     */
    public static UserInput fromMessageText(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("/")) {
            return CommandType.parse(text)
                .map(type -> command(type, CommandType.argument(text)))
                .orElseGet(() -> text(text));
        }
        return text(text);
    }

    public boolean is(MenuOption expected) {
        return kind == InputKind.CHOICE && option == expected;
    }

    public boolean is(CommandType expected) {
        return kind == InputKind.COMMAND && command == expected;
    }
}
