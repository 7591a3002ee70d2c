package in.matchbot.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import in.matchbot.application.service.UpdateDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Hands raw updates from either the poller or the webhook to the dispatcher.
 */
public class TelegramUpdateRouter {
    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateRouter.class);

    private final TelegramUpdateMapper mapper;
    private final UpdateDispatcher dispatcher;
    private final TelegramBotClient client;

    public TelegramUpdateRouter(TelegramUpdateMapper mapper, UpdateDispatcher dispatcher, TelegramBotClient client) {
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.client = client;
    }

    /**
     * Queue one update; returns its update id, or -1 when the payload had none.
     */
    public long route(JsonNode update) {
        Optional<TelegramUpdateMapper.MappedUpdate> mapped = mapper.map(update);
        if (mapped.isEmpty()) {
            log.debug("[TELEGRAM] Skipped update {}", update.path("update_id").asLong(-1));
            return update.path("update_id").asLong(-1);
        }

        TelegramUpdateMapper.MappedUpdate m = mapped.get();
        if (m.isCallback()) {
            client.answerCallbackQuery(m.callbackQueryId());
        }
        dispatcher.dispatch(m.event());
        return m.updateId();
    }
}
