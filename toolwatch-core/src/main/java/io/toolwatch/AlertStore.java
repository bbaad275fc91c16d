package io.toolwatch;

import io.toolwatch.core.Alert;

import java.time.Instant;
import java.util.List;

/**
 * Persisted alert history. Backs the {@code DATABASE} channel.
 */
public interface AlertStore {

    void save(Alert alert);

    /**
     * Mark an alert as acknowledged.
     *
     * @return {@code false} if no alert with that id exists
     */
    boolean acknowledge(String alertId, String acknowledgedBy, Instant acknowledgedAt);

    /**
     * Alerts created at or after {@code since}, newest first.
     */
    List<Alert> findSince(Instant since);
}
