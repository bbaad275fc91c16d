package io.toolwatch.internal;

import io.toolwatch.AlertStore;
import io.toolwatch.core.Alert;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class InMemoryAlertStore implements AlertStore {

    private final Map<String, Stored> alerts = new LinkedHashMap<>();

    private static final class Stored {
        private final Alert alert;
        private String acknowledgedBy;
        private Instant acknowledgedAt;

        private Stored(Alert alert) {
            this.alert = alert;
        }
    }

    @Override
    public synchronized void save(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        alerts.putIfAbsent(alert.id(), new Stored(alert));
    }

    @Override
    public synchronized boolean acknowledge(String alertId, String acknowledgedBy, Instant acknowledgedAt) {
        Stored s = alerts.get(alertId);
        if (s == null) {
            return false;
        }
        s.acknowledgedBy = acknowledgedBy;
        s.acknowledgedAt = acknowledgedAt;
        return true;
    }

    @Override
    public synchronized List<Alert> findSince(Instant since) {
        return alerts.values().stream()
                .map(s -> s.alert)
                .filter(a -> !a.createdAt().isBefore(since))
                .sorted(Comparator.comparing(Alert::createdAt).reversed())
                .toList();
    }

    public synchronized Optional<String> acknowledgedBy(String alertId) {
        Stored s = alerts.get(alertId);
        return s == null ? Optional.empty() : Optional.ofNullable(s.acknowledgedBy);
    }

    public synchronized Optional<Instant> acknowledgedAt(String alertId) {
        Stored s = alerts.get(alertId);
        return s == null ? Optional.empty() : Optional.ofNullable(s.acknowledgedAt);
    }

    public synchronized int size() {
        return alerts.size();
    }
}
