package in.matchbot.transport.http;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics
 *
 * Text format 0.0.4 by default, OpenMetrics when the scraper asks for it in
 * Accept. Repeated {@code name[]} query parameters restrict the output to
 * those series, e.g. {@code /metrics?name[]=matchbot_matches_total}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("metrics export failed");
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body.toString());
        log.debug("[METRICS] Scrape served ({} chars, filter={})", body.getBuffer().length(),
            names.isEmpty() ? "none" : names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
