package io.toolwatch.alert;

import io.toolwatch.core.AlertChannel;

/**
 * Outcome of delivering one alert through one channel.
 */
public record DeliveryResult(AlertChannel channel, boolean success, String message) {

    public static DeliveryResult ok(AlertChannel channel) {
        return new DeliveryResult(channel, true, "delivered");
    }

    public static DeliveryResult ok(AlertChannel channel, String message) {
        return new DeliveryResult(channel, true, message);
    }

    public static DeliveryResult fail(AlertChannel channel, String message) {
        return new DeliveryResult(channel, false, message);
    }
}
