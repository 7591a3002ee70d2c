package in.matchbot.domain.conversation;

import java.util.Optional;

/**
 * Slash commands understood in every state.
 */
public enum CommandType {
    START("/start"),
    RESET("/reset"),
    CANCEL("/cancel"),
    MY_PROFILE("/myprofile"),
    HELP("/help"),
    BROADCAST("/broadcast");

    private final String command;

    CommandType(String command) {
        this.command = command;
    }

    public String command() {
        return command;
    }

    /**
     * Parse the command word of a message like "/broadcast hello" or "/start@MyBot".
     */
    public static Optional<CommandType> parse(String text) {
        if (text == null || !text.startsWith("/")) {
            return Optional.empty();
        }
        String word = text.trim().split("\\s+", 2)[0];
        int at = word.indexOf('@');
        if (at > 0) {
            word = word.substring(0, at);
        }
        for (CommandType type : values()) {
            if (type.command.equalsIgnoreCase(word)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Text after the command word, trimmed; empty when there is none.
     */
    public static String argument(String text) {
        String[] parts = text.trim().split("\\s+", 2);
        return parts.length > 1 ? parts[1].trim() : "";
    }
}
