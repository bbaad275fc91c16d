package io.toolwatch.alert;

import io.toolwatch.AlertStore;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.AlertSeverity;
import io.toolwatch.internal.InMemoryAlertStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlertDispatcherTest {

    private final InMemoryAlertStore store = new InMemoryAlertStore();

    @Test
    void failingChannelShouldNotBlockOthersAndAlertIsPersisted() {
        AlertSender email = sender(AlertChannel.EMAIL);
        when(email.send(any())).thenThrow(new IllegalStateException("smtp down"));
        AlertSender slack = sender(AlertChannel.SLACK);
        when(slack.send(any())).thenReturn(DeliveryResult.ok(AlertChannel.SLACK));

        AlertDispatcher dispatcher = new AlertDispatcher(List.of(email, slack), store);
        DispatchReport report = dispatcher.dispatch(alert(AlertChannel.EMAIL, AlertChannel.SLACK, AlertChannel.DATABASE));

        assertFalse(report.delivered(AlertChannel.EMAIL));
        assertEquals("send error: smtp down", report.resultFor(AlertChannel.EMAIL).orElseThrow().message());
        assertTrue(report.delivered(AlertChannel.SLACK));
        assertTrue(report.delivered(AlertChannel.DATABASE));
        assertFalse(report.allDelivered());
        assertEquals(1, store.size());
    }

    @Test
    void alertShouldBePersistedEvenWithoutDatabaseChannel() {
        AlertSender slack = sender(AlertChannel.SLACK);
        when(slack.send(any())).thenReturn(DeliveryResult.fail(AlertChannel.SLACK, "HTTP 500"));

        AlertDispatcher dispatcher = new AlertDispatcher(List.of(slack), store);
        DispatchReport report = dispatcher.dispatch(alert(AlertChannel.SLACK));

        assertEquals(1, report.failures().size());
        assertTrue(report.delivered(AlertChannel.DATABASE));
        assertEquals(1, store.size());
    }

    @Test
    void unconfiguredChannelShouldReportFailure() {
        AlertSender slack = sender(AlertChannel.SLACK);
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(slack), store);

        DispatchReport report = dispatcher.dispatch(alert(AlertChannel.WEBHOOK));

        DeliveryResult webhook = report.resultFor(AlertChannel.WEBHOOK).orElseThrow();
        assertFalse(webhook.success());
        assertEquals("webhook channel not configured", webhook.message());
        verify(slack, never()).send(any());
    }

    @Test
    void storeFailureShouldBeReportedNotThrown() {
        AlertStore broken = mock(AlertStore.class);
        doThrow(new IllegalStateException("db down")).when(broken).save(any());

        DispatchReport report = new AlertDispatcher(List.of(), broken).dispatch(alert(AlertChannel.DATABASE));

        assertFalse(report.delivered(AlertChannel.DATABASE));
        assertEquals("store error: db down", report.resultFor(AlertChannel.DATABASE).orElseThrow().message());
    }

    @Test
    void duplicateOrDatabaseSendersShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new AlertDispatcher(List.of(sender(AlertChannel.SLACK), sender(AlertChannel.SLACK)), store));
        assertThrows(IllegalArgumentException.class,
                () -> new AlertDispatcher(List.of(sender(AlertChannel.DATABASE)), store));
        assertEquals(Set.of(AlertChannel.SLACK, AlertChannel.DATABASE),
                new AlertDispatcher(List.of(sender(AlertChannel.SLACK)), store).configuredChannels());
    }

    private static AlertSender sender(AlertChannel channel) {
        AlertSender sender = mock(AlertSender.class);
        when(sender.channel()).thenReturn(channel);
        return sender;
    }

    private static Alert alert(AlertChannel... channels) {
        return new Alert("alert_1", "t1", "Acme", "versions", AlertSeverity.HIGH, "Acme: Version Bump", "2.0 out",
                List.of(), Map.of(), Instant.parse("2026-05-01T09:00:00Z"), Set.of(channels));
    }
}
