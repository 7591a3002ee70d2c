package in.matchbot.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.matchbot.infrastructure.telegram.TelegramUpdateRouter;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * POST /telegram/webhook
 *
 * Verifies the secret header, then queues the update and answers 200 at once;
 * the reply travels through the Bot API, not this response.
 */
public class TelegramWebhookHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final HttpString SECRET_HEADER = new HttpString("X-Telegram-Bot-Api-Secret-Token");

    private final TelegramUpdateRouter router;
    private final byte[] secret;

    public TelegramWebhookHandler(TelegramUpdateRouter router, String secret) {
        this.router = router;
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String provided = exchange.getRequestHeaders().getFirst(SECRET_HEADER);
        if (provided == null || !MessageDigest.isEqual(secret, provided.getBytes(StandardCharsets.UTF_8))) {
            log.warn("[TELEGRAM] Rejected webhook call from {}: bad secret", exchange.getSourceAddress());
            sendText(exchange, StatusCodes.UNAUTHORIZED, "unauthorized");
            return;
        }

        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode update = MAPPER.readTree(body);
                router.route(update);
                sendText(ex, StatusCodes.OK, "ok");
            } catch (IOException e) {
                log.warn("[TELEGRAM] Malformed webhook body: {}", e.getMessage());
                sendText(ex, StatusCodes.BAD_REQUEST, "malformed update");
            }
        }, StandardCharsets.UTF_8);
    }

    private void sendText(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
