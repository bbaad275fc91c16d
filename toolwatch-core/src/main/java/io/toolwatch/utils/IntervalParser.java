package io.toolwatch.utils;

import org.quartz.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;

/**
 * Parses schedule and duration strings used in monitor and alert configuration.
 * <p>
 * Supported schedule formats:
 * <ul>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day 3 hours", compact "30s", "5m"</li>
 *   <li>Plain seconds: "300"</li>
 *   <li>Cron expressions, 5 or 6 fields: e.g. "0 0 2 * * *"</li>
 *   <li>Daily time of day: "AT 09:00"</li>
 * </ul>
 * Cron and time-of-day specs are calendar based, so the interval they produce depends on the base instant.
 */
public final class IntervalParser {

    private static final Map<String, Duration> UNITS = new LinkedHashMap<>();

    static {
        UNITS.put("month", Duration.ofDays(30));
        UNITS.put("week", Duration.ofDays(7));
        UNITS.put("day", Duration.ofDays(1));
        UNITS.put("hour", Duration.ofHours(1));
        UNITS.put("minute", Duration.ofMinutes(1));
        UNITS.put("min", Duration.ofMinutes(1));
        UNITS.put("second", Duration.ofSeconds(1));
        UNITS.put("sec", Duration.ofSeconds(1));
    }

    private IntervalParser() {
    }

    /**
     * Computes the first run time strictly after {@code from}.
     * <p>
     * Missed runs are not replayed: the result is always relative to {@code from}, so a caller that was
     * delayed by several intervals fires once and then resumes the regular cadence.
     *
     * @param spec     schedule spec (interval, cron or "AT hh:mm")
     * @param timezone IANA zone id for calendar specs; system default when null or unknown
     * @param from     base instant, usually the current time
     */
    public static Instant nextRunAt(String spec, String timezone, Instant from) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("schedule spec must not be blank");
        }
        Objects.requireNonNull(from, "from must not be null");

        ZoneId zone = resolveZone(timezone);
        String s = spec.trim();

        if (s.regionMatches(true, 0, "AT ", 0, 3)) {
            LocalTime timeOfDay;
            try {
                timeOfDay = LocalTime.parse(s.substring(3).trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid time of day in schedule: " + spec, e);
            }
            ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);
            ZonedDateTime candidate = base.with(timeOfDay);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1);
            }
            return candidate.toInstant();
        }

        Duration d = parseDuration(s, zone.getId(), from);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("schedule interval must be positive: " + spec);
        }
        return from.plus(d);
    }

    /**
     * Parse a schedule spec into a {@link Duration}.
     * <p>
     * A valid cron expression yields the time from {@code from} to its next occurrence; anything else is parsed
     * as a human-readable interval.
     */
    public static Duration parseDuration(String spec, String timezone, Instant from) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        Objects.requireNonNull(from, "from must not be null");
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        if (looksLikeCron(s)) {
            return parseCronDuration(normalizeCron(s), resolveZone(timezone), from);
        }
        Duration d = parseHumanDuration(s);
        if (d.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + spec);
        }
        return d;
    }

    public static Duration parseDuration(String spec) {
        return parseDuration(spec, null, Instant.now());
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * 6-field specs are taken as-is, 5-field specs get a "0" seconds field, and a "*" day-of-month together with
     * a "*" day-of-week becomes "?" for day-of-week.
     */
    public static String normalizeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("cron spec must not be blank");
        }
        String[] parts = spec.trim().split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return spec.trim();
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dow = ("*".equals(dayOfMonth) && "*".equals(dayOfWeek)) ? "?" : dayOfWeek;
        return String.join(" ", sec, min, hour, dayOfMonth, month, dow);
    }

    public static boolean looksLikeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            return false;
        }
        // "1 day 3 hours" splits into an even number of tokens too; cron needs at least 5.
        int fields = spec.trim().split("\\s+").length;
        if (fields < 5) {
            return false;
        }
        return CronExpression.isValidExpression(normalizeCron(spec));
    }

    /**
     * Duration from {@code from} to the next occurrence of a Quartz cron expression.
     */
    public static Duration parseCronDuration(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (java.text.ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, e);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return Duration.between(from, next.toInstant());
    }

    /**
     * Parse a human-readable duration. Zero is allowed ("0 minutes" disables a cooldown); negative values are not.
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            return Duration.ofSeconds(parseAmount(s, input));
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            long n = parseAmount(s.substring(0, s.length() - 1).trim(), input);
            return switch (s.charAt(s.length() - 1)) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                default -> Duration.ofDays(7L * n);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Set<Duration> seen = new HashSet<>();
        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseAmount(parts[i], input);
            String unitName = parts[i + 1];
            if (unitName.endsWith("s")) {
                unitName = unitName.substring(0, unitName.length() - 1);
            }
            Duration unit = UNITS.get(unitName);
            if (unit == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate unit in interval: " + parts[i + 1]);
            }
            total = total.plus(unit.multipliedBy(n));
        }
        return total;
    }

    private static long parseAmount(String digits, String input) {
        long n;
        try {
            n = Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number in interval: " + input);
        }
        if (n < 0) {
            throw new IllegalArgumentException("Interval values must be non-negative: " + input);
        }
        return n;
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            return ZoneId.systemDefault();
        }
    }
}
