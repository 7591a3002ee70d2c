package in.matchbot.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.function.IntSupplier;

/**
 * GET /api/health
 */
public class HealthHandler implements HttpHandler {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String storeKind;
    private final String transportKind;
    private final IntSupplier sessionCount;
    private final IntSupplier pendingEvents;

    public HealthHandler(String storeKind, String transportKind,
                         IntSupplier sessionCount, IntSupplier pendingEvents) {
        this.storeKind = storeKind;
        this.transportKind = transportKind;
        this.sessionCount = sessionCount;
        this.pendingEvents = pendingEvents;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("store", storeKind);
        health.put("transport", transportKind);
        health.put("sessions", sessionCount.getAsInt());
        health.put("pending", pendingEvents.getAsInt());
        health.put("ts", Instant.now().toString());

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(MAPPER.writeValueAsString(health), StandardCharsets.UTF_8);
    }
}
