package in.matchbot.domain.conversation;

/**
 * One reply to one user: text, optional choice set, optional photo.
 */
public record OutboundMessage(
    long userId,
    String text,
    Keyboard keyboard,
    String photoRef
) {
    public OutboundMessage {
        keyboard = keyboard == null ? Keyboard.none() : keyboard;
    }

    public static OutboundMessage text(long userId, String text) {
        return new OutboundMessage(userId, text, Keyboard.none(), null);
    }

    public static OutboundMessage withKeyboard(long userId, String text, Keyboard keyboard) {
        return new OutboundMessage(userId, text, keyboard, null);
    }

    public static OutboundMessage card(long userId, String text, String photoRef, Keyboard keyboard) {
        return new OutboundMessage(userId, text, keyboard, photoRef);
    }

    public boolean hasPhoto() {
        return photoRef != null && !photoRef.isBlank();
    }
}
