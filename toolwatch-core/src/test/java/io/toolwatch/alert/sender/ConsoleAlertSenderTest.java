package io.toolwatch.alert.sender;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleAlertSenderTest {

    @Test
    void shouldPrintFormattedBlock() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ConsoleAlertSender sender = new ConsoleAlertSender(new PrintStream(out, true, StandardCharsets.UTF_8));

        assertTrue(sender.send(WebhookAlertSenderTest.alert()).success());

        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("ALERT [HIGH]"));
        assertTrue(printed.contains("Tool: Acme IDE"));
        assertTrue(printed.contains("Time: 2026-05-01 09:00:00"));
        assertTrue(printed.contains("  - version_bump: Version 2.0 <beta> released"));
    }
}
