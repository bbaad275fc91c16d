package io.toolwatch.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalParserTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:01:00Z");

    @Test
    void parseHumanDurationShouldWork() {
        Duration duration = IntervalParser.parseDuration("5 minutes", "UTC", T0);
        assertEquals(Duration.ofMinutes(5), duration);
    }

    @Test
    void parseHumanDurationShouldSumMixedUnits() {
        assertEquals(Duration.ofDays(1).plusHours(3), IntervalParser.parseHumanDuration("1 day 3 hours"));
        assertEquals(Duration.ofSeconds(90), IntervalParser.parseHumanDuration("90"));
        assertEquals(Duration.ofDays(14), IntervalParser.parseHumanDuration("2w"));
        assertEquals(Duration.ZERO, IntervalParser.parseHumanDuration("0 minutes"));
    }

    @Test
    void parseHumanDurationShouldRejectMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("5 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("5 minutes 3 minutes"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("-5 minutes"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseHumanDuration("minutes"));
    }

    @Test
    void parseDurationShouldRejectZeroInterval() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseDuration("0 minutes", "UTC", T0));
    }

    @Test
    void parseCronDurationShouldSupportFiveFieldCron() {
        Duration duration = IntervalParser.parseDuration("*/5 * * * *", "UTC", T0);
        assertEquals(Duration.ofMinutes(4), duration);
    }

    @Test
    void nextRunAtShouldAddIntervalToBase() {
        assertEquals(T0.plusSeconds(300), IntervalParser.nextRunAt("5 minutes", "UTC", T0));
    }

    @Test
    void nextRunAtShouldFollowCron() {
        Instant from = Instant.parse("2026-01-01T00:06:00Z");
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), IntervalParser.nextRunAt("*/5 * * * *", "UTC", from));
    }

    @Test
    void nextRunAtShouldSupportAtSyntax() {
        Instant from = Instant.parse("2026-01-01T10:01:00Z");

        Instant next = IntervalParser.nextRunAt("AT 10:00", "UTC", from);

        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), next);
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(IntervalParser.looksLikeCron("0 */10 * * * *"));
        assertFalse(IntervalParser.looksLikeCron("1 day 3 hours"));
    }
}
