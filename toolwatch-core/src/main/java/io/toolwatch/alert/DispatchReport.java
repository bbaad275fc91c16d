package io.toolwatch.alert;

import io.toolwatch.core.AlertChannel;

import java.util.List;
import java.util.Optional;

public record DispatchReport(String alertId, List<DeliveryResult> deliveries) {

    public DispatchReport {
        deliveries = List.copyOf(deliveries);
    }

    public Optional<DeliveryResult> resultFor(AlertChannel channel) {
        return deliveries.stream().filter(d -> d.channel() == channel).findFirst();
    }

    public boolean delivered(AlertChannel channel) {
        return resultFor(channel).map(DeliveryResult::success).orElse(false);
    }

    public List<DeliveryResult> failures() {
        return deliveries.stream().filter(d -> !d.success()).toList();
    }

    public boolean allDelivered() {
        return deliveries.stream().allMatch(DeliveryResult::success);
    }
}
