package in.matchbot.application.service;

import in.matchbot.domain.conversation.Keyboard;
import in.matchbot.domain.conversation.OutboundMessage;
import in.matchbot.domain.like.LikeResult;

import java.util.ArrayList;
import java.util.List;

/**
 * What handling one event produced: replies for the sender, plus the side
 * effects the dispatcher carries out after the session is updated.
 *
 * @param replies       messages to the sender, in order
 * @param likeResult    outcome of a like action, null when none happened
 * @param broadcastText admin broadcast to fan out, null when none was requested
 * @param failedStorageOperation store call that failed after earlier effects of
 *                      this event were committed, null when none did
 * @param sessionEnded  the user's profile is gone and the session can be dropped
 */
public record EngineResult(
    List<OutboundMessage> replies,
    LikeResult likeResult,
    String broadcastText,
    String failedStorageOperation,
    boolean sessionEnded
) {
    public EngineResult {
        replies = replies == null ? List.of() : List.copyOf(replies);
    }

    public boolean matchFormed() {
        return likeResult != null && likeResult.isMatch();
    }

    public boolean hasBroadcast() {
        return broadcastText != null;
    }

    public boolean partiallyFailed() {
        return failedStorageOperation != null;
    }

    /**
     * Accumulates replies while a handler runs.
     */
    static final class Builder {
        private final long userId;
        private final List<OutboundMessage> replies = new ArrayList<>();
        private LikeResult likeResult;
        private String broadcastText;
        private String failedStorageOperation;
        private boolean sessionEnded;

        Builder(long userId) {
            this.userId = userId;
        }

        Builder reply(OutboundMessage message) {
            replies.add(message);
            return this;
        }

        Builder text(String text) {
            return reply(OutboundMessage.text(userId, text));
        }

        Builder text(String text, Keyboard keyboard) {
            return reply(OutboundMessage.withKeyboard(userId, text, keyboard));
        }

        Builder likeResult(LikeResult result) {
            this.likeResult = result;
            return this;
        }

        Builder broadcast(String text) {
            this.broadcastText = text;
            return this;
        }

        Builder storageFailure(String operation) {
            this.failedStorageOperation = operation;
            return this;
        }

        Builder endSession() {
            this.sessionEnded = true;
            return this;
        }

        EngineResult build() {
            return new EngineResult(replies, likeResult, broadcastText, failedStorageOperation, sessionEnded);
        }
    }
}
