package io.toolwatch.alert;

import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;

/**
 * Delivers alerts through one channel. Implementations report failures through the returned
 * {@link DeliveryResult} rather than by throwing.
 */
public interface AlertSender {

    AlertChannel channel();

    DeliveryResult send(Alert alert);
}
