package com.loglens.query;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves time range expressions against a fixed "now".
 *
 * Supported forms:
 * <ul>
 *   <li>{@code now}</li>
 *   <li>relative offsets {@code -30m}, {@code +1h}, units s, m, h, d, w, optionally snapped
 *       to the start of a unit with {@code @unit} ({@code -1d@d}, or {@code @h} alone)</li>
 *   <li>ISO-8601 instants and offset date-times</li>
 *   <li>local date-times and dates, read as UTC</li>
 *   <li>epoch seconds (epoch milliseconds when 12 digits or more)</li>
 * </ul>
 * Snapping to weeks goes back to Monday 00:00 UTC.
 */
public final class TimeRangeResolver {

    private static final Pattern RELATIVE = Pattern.compile("(?:([+-]\\d+)([smhdw]))?(?:@([smhdw]))?");
    private static final Pattern EPOCH = Pattern.compile("\\d+");

    private TimeRangeResolver() {
    }

    /**
     * @throws TimeRangeParseException on unreadable bounds or when earliest is after latest
     */
    public static TimeBounds resolve(TimeRange range, Instant now) {
        if (range == null || range.isUnbounded()) {
            return null;
        }
        Instant earliest = resolve(range.getEarliest(), now);
        Instant latest = resolve(range.getLatest(), now);
        if (earliest != null && latest != null && earliest.isAfter(latest)) {
            throw new TimeRangeParseException(range.getEarliest() + ".." + range.getLatest(),
                "earliest is after latest");
        }
        return new TimeBounds(earliest, latest);
    }

    /**
     * @return the instant, or null for a blank expression
     * @throws TimeRangeParseException on unreadable or out-of-range expressions
     */
    public static Instant resolve(String expression, Instant now) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        String text = expression.trim();
        if ("now".equalsIgnoreCase(text)) {
            return now;
        }

        Matcher relative = RELATIVE.matcher(text);
        if (relative.matches() && (relative.group(1) != null || relative.group(3) != null)) {
            try {
                Instant result = now;
                if (relative.group(1) != null) {
                    long amount = Long.parseLong(relative.group(1));
                    long seconds = Math.multiplyExact(amount, unitSeconds(relative.group(2).charAt(0)));
                    result = result.plusSeconds(seconds);
                }
                if (relative.group(3) != null) {
                    result = snap(result, relative.group(3).charAt(0));
                }
                return result;
            } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
                throw new TimeRangeParseException(expression, "relative offset is out of range", e);
            }
        }

        if (EPOCH.matcher(text).matches()) {
            try {
                long value = Long.parseLong(text);
                return text.length() >= 12 ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
            } catch (NumberFormatException | DateTimeException e) {
                throw new TimeRangeParseException(expression, "epoch value is out of range", e);
            }
        }

        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                try {
                    return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
                } catch (DateTimeParseException e) {
                    throw new TimeRangeParseException(expression, "not a relative time, ISO timestamp or epoch value", e);
                }
            }
        }
    }

    private static long unitSeconds(char unit) {
        return switch (unit) {
            case 's' -> 1L;
            case 'm' -> 60L;
            case 'h' -> 3_600L;
            case 'd' -> 86_400L;
            default -> 604_800L;
        };
    }

    private static Instant snap(Instant instant, char unit) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        ZonedDateTime snapped = switch (unit) {
            case 's' -> utc.truncatedTo(ChronoUnit.SECONDS);
            case 'm' -> utc.truncatedTo(ChronoUnit.MINUTES);
            case 'h' -> utc.truncatedTo(ChronoUnit.HOURS);
            case 'd' -> utc.truncatedTo(ChronoUnit.DAYS);
            default -> utc.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        };
        return snapped.toInstant();
    }
}
