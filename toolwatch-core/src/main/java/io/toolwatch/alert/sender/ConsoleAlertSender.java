package io.toolwatch.alert.sender;

import io.toolwatch.alert.AlertSender;
import io.toolwatch.alert.DeliveryResult;
import io.toolwatch.core.Alert;
import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.ChangeSummary;

import java.io.PrintStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints a formatted alert block. At most three change details are listed.
 */
public class ConsoleAlertSender implements AlertSender {

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final int MAX_DETAILS = 3;

    private final PrintStream out;

    public ConsoleAlertSender() {
        this(System.out);
    }

    public ConsoleAlertSender(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.CONSOLE;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append("ALERT [").append(alert.severity().code().toUpperCase(Locale.ROOT)).append("]\n");
        sb.append("Tool: ").append(alert.toolName()).append('\n');
        sb.append("Title: ").append(alert.title()).append('\n');
        sb.append("Message: ").append(alert.message()).append('\n');
        sb.append("Changes: ").append(alert.changes().size()).append('\n');
        sb.append("Time: ").append(TIME_FORMAT.format(alert.createdAt())).append('\n');
        if (!alert.changes().isEmpty()) {
            sb.append("Change Details:\n");
            for (ChangeSummary c : alert.changes().subList(0, Math.min(MAX_DETAILS, alert.changes().size()))) {
                sb.append("  - ").append(c.changeType().code()).append(": ").append(c.summary()).append('\n');
            }
        }
        sb.append("-".repeat(50));

        synchronized (out) {
            out.println(sb);
            out.flush();
        }
        return DeliveryResult.ok(AlertChannel.CONSOLE);
    }
}
