package in.matchbot.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import in.matchbot.domain.conversation.InboundEvent;
import in.matchbot.domain.conversation.MenuOption;
import in.matchbot.domain.conversation.UserInput;

import java.time.Instant;
import java.util.Optional;

/**
 * Bot API update JSON -> transport-agnostic InboundEvent.
 *
 * - message.photo  -> PHOTO (largest size's file_id)
 * - message.text   -> COMMAND / CHOICE (typed label) / TEXT
 * - other messages -> empty TEXT, which every state answers neutrally
 * - callback_query -> CHOICE by token
 * Updates without a sender (channel posts, edits) are skipped.
 */
public class TelegramUpdateMapper {

    public record MappedUpdate(long updateId, InboundEvent event, String callbackQueryId) {
        public boolean isCallback() {
            return callbackQueryId != null;
        }
    }

    public Optional<MappedUpdate> map(JsonNode update) {
        long updateId = update.path("update_id").asLong();

        JsonNode callback = update.get("callback_query");
        if (callback != null) {
            JsonNode from = callback.path("from");
            if (!from.has("id")) {
                return Optional.empty();
            }
            String data = callback.path("data").asText("");
            UserInput input = MenuOption.fromToken(data)
                .map(UserInput::choice)
                .orElseGet(() -> UserInput.text(""));
            return Optional.of(new MappedUpdate(updateId,
                event(from, input), callback.path("id").asText(null)));
        }

        JsonNode message = update.get("message");
        if (message == null) {
            return Optional.empty();
        }
        JsonNode from = message.path("from");
        if (!from.has("id")) {
            return Optional.empty();
        }

        UserInput input;
        JsonNode photos = message.get("photo");
        if (photos != null && photos.isArray() && photos.size() > 0) {
            // sizes are ordered small to large
            input = UserInput.photo(photos.get(photos.size() - 1).path("file_id").asText());
        } else if (message.has("text")) {
            input = UserInput.fromMessageText(message.get("text").asText());
        } else {
            input = UserInput.text("");
        }
        return Optional.of(new MappedUpdate(updateId, event(from, input), null));
    }

    private InboundEvent event(JsonNode from, UserInput input) {
        String username = from.hasNonNull("username") ? from.get("username").asText() : null;
        return new InboundEvent(from.get("id").asLong(), username, input, Instant.now());
    }
}
