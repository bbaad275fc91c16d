package io.toolwatch.alert.sender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolwatch.alert.AlertSender;
import io.toolwatch.alert.DeliveryResult;
import io.toolwatch.config.ToolwatchProperties;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.ChangeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Posts the alert as JSON to every configured URL. A failing URL does not stop delivery to the others; the
 * delivery succeeds only if every URL answered with a 2xx status.
 *
 * <p>Payload:
 * <pre>
 * {"id": "...", "tool_id": "...", "tool_name": "...", "alert_type": "...", "severity": "high",
 *  "title": "...", "message": "...", "changes": [...], "metadata": {...},
 *  "created_at": "2026-01-01T00:00:00Z", "channels": ["webhook"]}
 * </pre>
 */
public class WebhookAlertSender implements AlertSender {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertSender.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolwatchProperties.Webhook config;
    private final HttpClient httpClient;

    public WebhookAlertSender(ToolwatchProperties.Webhook config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getTimeout()).build());
    }

    public WebhookAlertSender(ToolwatchProperties.Webhook config, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.WEBHOOK;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        if (!config.isConfigured()) {
            log.warn("Webhook URLs not configured, skipping alertId={}", alert.id());
            return DeliveryResult.fail(AlertChannel.WEBHOOK, "webhook channel not configured");
        }

        String body;
        try {
            body = MAPPER.writeValueAsString(buildPayload(alert));
        } catch (Exception e) {
            log.error("Webhook payload serialization failed alertId={}", alert.id(), e);
            return DeliveryResult.fail(AlertChannel.WEBHOOK, "serialization error: " + e.getMessage());
        }

        int delivered = 0;
        int attempted = 0;
        List<String> errors = new ArrayList<>();
        for (String url : config.getUrls()) {
            if (url == null || url.isBlank()) {
                continue;
            }
            attempted++;
            try {
                HttpRequest.Builder builder = HttpRequest.newBuilder()
                        .uri(URI.create(url))
                        .header("Content-Type", "application/json; charset=utf-8")
                        .timeout(config.getTimeout())
                        .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
                config.getHeaders().forEach(builder::header);

                HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
                int statusCode = response.statusCode();
                if (statusCode >= 200 && statusCode < 300) {
                    delivered++;
                    log.info("Webhook alert sent alertId={} url={} statusCode={}", alert.id(), url, statusCode);
                } else {
                    errors.add(url + " -> HTTP " + statusCode);
                    log.warn("Webhook alert failed alertId={} url={} statusCode={}", alert.id(), url, statusCode);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add(url + " -> interrupted");
                break;
            } catch (Exception e) {
                errors.add(url + " -> " + e.getMessage());
                log.error("Webhook alert error alertId={} url={} msg={}", alert.id(), url, e.getMessage(), e);
            }
        }

        String summary = "delivered to " + delivered + "/" + attempted + " webhooks";
        if (attempted > 0 && errors.isEmpty()) {
            return DeliveryResult.ok(AlertChannel.WEBHOOK, summary);
        }
        return DeliveryResult.fail(AlertChannel.WEBHOOK, errors.isEmpty() ? summary : summary + ": " + String.join("; ", errors));
    }

    static ObjectNode buildPayload(Alert alert) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("id", alert.id());
        payload.put("tool_id", alert.toolId());
        payload.put("tool_name", alert.toolName());
        payload.put("alert_type", alert.alertType());
        payload.put("severity", alert.severity().code());
        payload.put("title", alert.title());
        payload.put("message", alert.message());

        ArrayNode changes = payload.putArray("changes");
        for (ChangeSummary c : alert.changes()) {
            ObjectNode node = changes.addObject();
            node.put("change_type", c.changeType().code());
            node.put("field_name", c.fieldName());
            node.put("old_value", c.oldValue());
            node.put("new_value", c.newValue());
            node.put("summary", c.summary());
            node.put("impact_score", c.impactScore());
            node.put("confidence", c.confidence());
            node.put("severity", c.severity().code());
        }
        payload.set("metadata", MAPPER.valueToTree(alert.metadata()));
        payload.put("created_at", alert.createdAt().toString());
        ArrayNode channels = payload.putArray("channels");
        alert.channels().forEach(ch -> channels.add(ch.code()));
        return payload;
    }
}
