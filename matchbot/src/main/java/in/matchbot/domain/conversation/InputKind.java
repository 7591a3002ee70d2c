package in.matchbot.domain.conversation;

public enum InputKind {
    TEXT,       // free text, validated per collecting step
    PHOTO,      // opaque media reference
    CHOICE,     // menu option token
    COMMAND     // slash command
}
