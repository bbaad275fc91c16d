package io.toolwatch.alert;

import io.toolwatch.AlertStore;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes alerts to channel senders.
 *
 * <p>Each external channel listed on the alert is attempted independently. The alert is always written to the
 * {@link AlertStore} afterwards, whatever happened on the other channels; that write is reported as the
 * {@link AlertChannel#DATABASE} delivery.
 */
public class AlertDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final Map<AlertChannel, AlertSender> senderMap = new EnumMap<>(AlertChannel.class);
    private final AlertStore alertStore;

    public AlertDispatcher(List<AlertSender> senders, AlertStore alertStore) {
        Objects.requireNonNull(senders, "senders must not be null");
        this.alertStore = Objects.requireNonNull(alertStore, "alertStore must not be null");
        for (AlertSender sender : senders) {
            if (sender.channel() == AlertChannel.DATABASE) {
                throw new IllegalArgumentException("DATABASE delivery goes through the AlertStore, not a sender");
            }
            if (senderMap.putIfAbsent(sender.channel(), sender) != null) {
                throw new IllegalArgumentException("Duplicate sender for channel: " + sender.channel());
            }
        }
        log.info("Alert dispatcher initialized channels={}", senderMap.keySet());
    }

    public Set<AlertChannel> configuredChannels() {
        Set<AlertChannel> channels = EnumSet.of(AlertChannel.DATABASE);
        channels.addAll(senderMap.keySet());
        return channels;
    }

    public DispatchReport dispatch(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        List<DeliveryResult> results = new ArrayList<>();

        Set<AlertChannel> targets = alert.channels().isEmpty()
                ? EnumSet.noneOf(AlertChannel.class)
                : EnumSet.copyOf(alert.channels());
        for (AlertChannel channel : targets) {
            if (channel.isExternal()) {
                results.add(deliver(channel, alert));
            }
        }
        results.add(persist(alert));

        DispatchReport report = new DispatchReport(alert.id(), results);
        if (!report.allDelivered()) {
            log.warn("Alert dispatched with failures alertId={} failed={}", alert.id(),
                    report.failures().stream().map(DeliveryResult::channel).toList());
        } else {
            log.debug("Alert dispatched alertId={} channels={}", alert.id(), targets);
        }
        return report;
    }

    private DeliveryResult deliver(AlertChannel channel, Alert alert) {
        AlertSender sender = senderMap.get(channel);
        if (sender == null) {
            log.warn("Alert channel not configured channel={} alertId={}", channel, alert.id());
            return DeliveryResult.fail(channel, channel.code() + " channel not configured");
        }
        try {
            DeliveryResult result = sender.send(alert);
            if (result == null) {
                return DeliveryResult.fail(channel, "sender returned no result");
            }
            if (!result.success()) {
                log.warn("Alert delivery failed channel={} alertId={} msg={}", channel, alert.id(), result.message());
            }
            return result;
        } catch (Exception e) {
            log.error("Alert delivery failed channel={} alertId={} msg={}", channel, alert.id(), e.getMessage(), e);
            return DeliveryResult.fail(channel, "send error: " + e.getMessage());
        }
    }

    private DeliveryResult persist(Alert alert) {
        try {
            alertStore.save(alert);
            return DeliveryResult.ok(AlertChannel.DATABASE);
        } catch (Exception e) {
            log.error("Alert persist failed alertId={} msg={}", alert.id(), e.getMessage(), e);
            return DeliveryResult.fail(AlertChannel.DATABASE, "store error: " + e.getMessage());
        }
    }
}
