package com.dispatchqueue.time;

import com.dispatchqueue.core.TimeParseException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns human-written schedule expressions into absolute instants.
 *
 * <p>Supported input:</p>
 * <ul>
 *   <li>{@code now}, {@code immediate}: the current instant</li>
 *   <li>{@code 5m}, {@code 2h}, {@code 1d}: short relative offsets</li>
 *   <li>{@code 5 minutes}, {@code 1 hour}, {@code 2 days}: long relative offsets, any case</li>
 *   <li>anything else is parsed as an absolute date: ISO instant ({@code 2026-12-25T10:00:00Z}),
 *       offset or zoned date-time, local date-time or plain date in the resolver's zone</li>
 * </ul>
 *
 * <p>Resolution is relative to the injected {@link Clock}; nothing else is consulted, so
 * the same clock always gives the same answer.</p>
 */
public class TimeResolver {
    private static final Pattern SHORT_RELATIVE = Pattern.compile("^(\\d+)([mhd])$");
    private static final Pattern LONG_RELATIVE =
            Pattern.compile("^(\\d+)\\s+(minute|minutes|hour|hours|day|days)$", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public TimeResolver(Clock clock) {
        this.clock = clock;
    }

    public TimeResolver() {
        this(Clock.systemUTC());
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Resolve a schedule expression to an absolute instant.
     *
     * @param input the expression; must not be blank
     * @return the resolved instant
     * @throws TimeParseException if the expression is not recognised
     */
    public Instant resolve(String input) {
        if (input == null || input.isBlank()) {
            throw new TimeParseException(String.valueOf(input));
        }
        String expression = input.trim();
        Instant now = clock.instant();

        String lowered = expression.toLowerCase(Locale.ROOT);
        if (lowered.equals("now") || lowered.equals("immediate")) {
            return now;
        }

        Matcher shortMatch = SHORT_RELATIVE.matcher(expression);
        if (shortMatch.matches()) {
            long value = parseAmount(expression, shortMatch.group(1));
            return offset(expression, now, shortMatch.group(2), value);
        }

        Matcher longMatch = LONG_RELATIVE.matcher(expression);
        if (longMatch.matches()) {
            long value = parseAmount(expression, longMatch.group(1));
            String unit = longMatch.group(2).toLowerCase(Locale.ROOT);
            return offset(expression, now, unit.substring(0, 1), value);
        }

        return parseAbsolute(expression);
    }

    /**
     * Resolve an optional absolute instant, defaulting to now.
     *
     * @param instant the instant, or null for immediate
     * @return {@code instant} or the current instant
     */
    public Instant resolve(Instant instant) {
        return instant != null ? instant : clock.instant();
    }

    /**
     * Render the distance from now to {@code target} as a short phrase
     * ("in 5 minutes", "in 2 hours", "overdue").
     *
     * @param target the instant to describe
     * @return relative phrase
     */
    public String formatRelative(Instant target) {
        Duration diff = Duration.between(clock.instant(), target);
        if (diff.isNegative()) {
            return "overdue";
        }
        long minutes = diff.toMinutes();
        long hours = diff.toHours();
        long days = diff.toDays();
        if (minutes < 1) {
            return "in less than a minute";
        } else if (minutes < 60) {
            return "in " + minutes + " minute" + (minutes == 1 ? "" : "s");
        } else if (hours < 24) {
            return "in " + hours + " hour" + (hours == 1 ? "" : "s");
        }
        return "in " + days + " day" + (days == 1 ? "" : "s");
    }

    private Instant parseAbsolute(String expression) {
        List<Function<String, Instant>> parsers = List.of(
                Instant::parse,
                text -> OffsetDateTime.parse(text).toInstant(),
                text -> ZonedDateTime.parse(text).toInstant(),
                text -> LocalDateTime.parse(text).atZone(clock.getZone()).toInstant(),
                text -> LocalDate.parse(text).atStartOfDay(clock.getZone()).toInstant());

        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : parsers) {
            try {
                return parser.apply(expression);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new TimeParseException(expression, lastFailure);
    }

    private static Instant offset(String expression, Instant now, String unit, long value) {
        try {
            return now.plus(unitDuration(unit).multipliedBy(value));
        } catch (ArithmeticException | DateTimeException e) {
            throw new TimeParseException(expression, e);
        }
    }

    private static long parseAmount(String expression, String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new TimeParseException(expression, e);
        }
    }

    private static Duration unitDuration(String unit) {
        return switch (unit) {
            case "m" -> Duration.ofMinutes(1);
            case "h" -> Duration.ofHours(1);
            case "d" -> Duration.ofDays(1);
            default -> throw new IllegalArgumentException("Unknown unit: " + unit);
        };
    }
}
