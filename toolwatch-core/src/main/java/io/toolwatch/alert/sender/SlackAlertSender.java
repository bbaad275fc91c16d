package io.toolwatch.alert.sender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolwatch.alert.AlertSender;
import io.toolwatch.alert.DeliveryResult;
import io.toolwatch.config.ToolwatchProperties;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Posts alerts to a Slack incoming webhook as a coloured attachment.
 */
public class SlackAlertSender implements AlertSender {

    private static final Logger log = LoggerFactory.getLogger(SlackAlertSender.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolwatchProperties.Slack config;
    private final HttpClient httpClient;

    public SlackAlertSender(ToolwatchProperties.Slack config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getTimeout()).build());
    }

    public SlackAlertSender(ToolwatchProperties.Slack config, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.SLACK;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        if (!config.isConfigured()) {
            log.warn("Slack webhook URL not configured, skipping alertId={}", alert.id());
            return DeliveryResult.fail(AlertChannel.SLACK, "slack channel not configured");
        }
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getWebhookUrl()))
                    .header("Content-Type", "application/json; charset=utf-8")
                    .timeout(config.getTimeout())
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(buildPayload(alert)), StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            int statusCode = response.statusCode();
            if (statusCode >= 200 && statusCode < 300) {
                log.info("Slack alert sent alertId={} statusCode={}", alert.id(), statusCode);
                return DeliveryResult.ok(AlertChannel.SLACK);
            }
            log.warn("Slack alert failed alertId={} statusCode={} body={}", alert.id(), statusCode, response.body());
            return DeliveryResult.fail(AlertChannel.SLACK, "HTTP status " + statusCode);
        } catch (IOException e) {
            log.error("Slack alert IO error alertId={}", alert.id(), e);
            return DeliveryResult.fail(AlertChannel.SLACK, "network error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.fail(AlertChannel.SLACK, "interrupted");
        } catch (Exception e) {
            log.error("Slack alert failed alertId={}", alert.id(), e);
            return DeliveryResult.fail(AlertChannel.SLACK, "send error: " + e.getMessage());
        }
    }

    ObjectNode buildPayload(Alert alert) {
        ObjectNode payload = MAPPER.createObjectNode();
        if (config.getChannel() != null) {
            payload.put("channel", config.getChannel());
        }
        payload.put("username", config.getUsername());

        ObjectNode attachment = payload.putArray("attachments").addObject();
        attachment.put("color", colorFor(alert.severity()));
        attachment.put("title", alert.title());
        attachment.put("text", alert.message());
        ArrayNode fields = attachment.putArray("fields");
        field(fields, "Tool", alert.toolName() == null ? "-" : alert.toolName());
        field(fields, "Severity", alert.severity().code().toUpperCase(Locale.ROOT));
        field(fields, "Changes", String.valueOf(alert.changes().size()));
        field(fields, "Time", ConsoleAlertSender.TIME_FORMAT.format(alert.createdAt()));
        attachment.put("footer", "toolwatch");
        attachment.put("ts", alert.createdAt().getEpochSecond());
        return payload;
    }

    private static void field(ArrayNode fields, String title, String value) {
        ObjectNode f = fields.addObject();
        f.put("title", title);
        f.put("value", value);
        f.put("short", true);
    }

    static String colorFor(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> "danger";
            case HIGH -> "warning";
            case MEDIUM -> "good";
            case LOW -> "#439FE0";
            case INFO -> "#36a64f";
        };
    }
}
