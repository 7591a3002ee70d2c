package in.matchbot.infrastructure.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.matchbot.application.port.output.DeliveryException;
import in.matchbot.application.port.output.MessageSender;
import in.matchbot.domain.conversation.Keyboard;
import in.matchbot.domain.conversation.MenuOption;
import in.matchbot.domain.conversation.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin Telegram Bot API client.
 *
 * Implements the outbound MessageSender port (sendMessage / sendPhoto with an
 * inline keyboard whose callback data is the option token) and exposes the
 * inbound calls the poller and bootstrap need.
 *
 * The bot token is part of the request path and is never logged.
 */
public class TelegramBotClient implements MessageSender {
    private static final Logger log = LoggerFactory.getLogger(TelegramBotClient.class);

    private static final String DEFAULT_BASE_URL = "https://api.telegram.org";
    private static final int CAPTION_LIMIT = 1024;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final String baseUrl;
    private final String token;

    public TelegramBotClient(String token) {
        this(DEFAULT_BASE_URL, token);
    }

    public TelegramBotClient(String baseUrl, String token) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
    }

    // ═══════════════════════════════════════════════════════════════
    // Outbound
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void send(OutboundMessage message) {
        try {
            if (message.hasPhoto() && message.text().length() <= CAPTION_LIMIT) {
                call("sendPhoto", photoPayload(message), Duration.ofSeconds(30));
            } else if (message.hasPhoto()) {
                // caption too long: photo first, text with the keyboard after
                call("sendPhoto", photoPayload(new OutboundMessage(message.userId(), "", null, message.photoRef())),
                    Duration.ofSeconds(30));
                call("sendMessage", messagePayload(message), Duration.ofSeconds(30));
            } else {
                call("sendMessage", messagePayload(message), Duration.ofSeconds(30));
            }
        } catch (TelegramApiException e) {
            throw new DeliveryException(message.userId(), e.getMessage(), e);
        }
    }

    /**
     * Acknowledge a button press so the client stops its spinner. Fire-and-forget.
     */
    public void answerCallbackQuery(String callbackQueryId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("callback_query_id", callbackQueryId);

        httpClient.sendAsync(request("answerCallbackQuery", payload, Duration.ofSeconds(10)),
                HttpResponse.BodyHandlers.ofString())
            .whenComplete((response, error) -> {
                if (error != null) {
                    log.warn("[TELEGRAM] answerCallbackQuery failed: {}", error.getMessage());
                } else if (response.statusCode() != 200) {
                    log.warn("[TELEGRAM] answerCallbackQuery HTTP {}", response.statusCode());
                }
            });
    }

    // ═══════════════════════════════════════════════════════════════
    // Inbound / setup
    // ═══════════════════════════════════════════════════════════════

    /**
     * Long-poll for updates.
     *
     * @param offset         first update id to return (last seen + 1)
     * @param timeoutSeconds server-side long-poll timeout
     */
    public List<JsonNode> getUpdates(long offset, int timeoutSeconds) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("offset", offset);
        payload.put("timeout", timeoutSeconds);
        ArrayNode allowed = payload.putArray("allowed_updates");
        allowed.add("message");
        allowed.add("callback_query");

        JsonNode result = call("getUpdates", payload, Duration.ofSeconds(timeoutSeconds + 10L));
        List<JsonNode> updates = new ArrayList<>();
        if (result.isArray()) {
            result.forEach(updates::add);
        }
        return updates;
    }

    public void setWebhook(String url, String secretToken) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("url", url);
        payload.put("secret_token", secretToken);
        call("setWebhook", payload, Duration.ofSeconds(30));
        log.info("[TELEGRAM] Webhook registered at {}", url);
    }

    /**
     * Required before long polling when a webhook was registered earlier.
     */
    public void deleteWebhook() {
        call("deleteWebhook", objectMapper.createObjectNode(), Duration.ofSeconds(30));
    }

    // ═══════════════════════════════════════════════════════════════
    // Payloads
    // ═══════════════════════════════════════════════════════════════

    ObjectNode messagePayload(OutboundMessage message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("chat_id", message.userId());
        payload.put("text", message.text());
        addKeyboard(payload, message.keyboard());
        return payload;
    }

    ObjectNode photoPayload(OutboundMessage message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("chat_id", message.userId());
        payload.put("photo", message.photoRef());
        if (message.text() != null && !message.text().isEmpty()) {
            payload.put("caption", message.text());
        }
        addKeyboard(payload, message.keyboard());
        return payload;
    }

    private void addKeyboard(ObjectNode payload, Keyboard keyboard) {
        if (keyboard == null || keyboard.isEmpty()) {
            return;
        }
        ObjectNode markup = payload.putObject("reply_markup");
        ArrayNode rows = markup.putArray("inline_keyboard");
        for (List<MenuOption> row : keyboard.rows()) {
            ArrayNode buttons = rows.addArray();
            for (MenuOption option : row) {
                ObjectNode button = buttons.addObject();
                button.put("text", option.label());
                button.put("callback_data", option.token());
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // HTTP
    // ═══════════════════════════════════════════════════════════════

    private HttpRequest request(String method, ObjectNode payload, Duration timeout) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new TelegramApiException(method, "cannot serialize payload", e);
        }
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/bot" + token + "/" + method))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
    }

    /**
     * POST a method call and return its {@code result} node.
     */
    private JsonNode call(String method, ObjectNode payload, Duration timeout) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request(method, payload, timeout), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TelegramApiException(method, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelegramApiException(method, "interrupted", e);
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (IOException e) {
            log.error("[TELEGRAM] {} HTTP {}: unparseable body", method, response.statusCode());
            throw new TelegramApiException(method, response.statusCode(), "unparseable response");
        }

        if (response.statusCode() != 200 || !json.path("ok").asBoolean(false)) {
            String description = json.path("description").asText("unknown error");
            int code = json.path("error_code").asInt(response.statusCode());
            int retryAfter = json.path("parameters").path("retry_after").asInt(0);
            log.debug("[TELEGRAM] {} rejected ({}): {}", method, code, description);
            throw new TelegramApiException(method, code, description, retryAfter);
        }
        return json.path("result");
    }
}
