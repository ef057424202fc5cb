package net.vortexdevelopment.vbind.binding;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration literals.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>{@code [-][d.]hh:mm[:ss[.fffffff]]}, e.g. {@code "00:00:30"} or {@code "1.02:03:04.5"}</li>
 *   <li>a whole number of days, e.g. {@code "5"}</li>
 *   <li>ISO-8601 as understood by {@link Duration#parse(CharSequence)}, e.g. {@code "PT30S"}</li>
 * </ul>
 * Hours must be below 24, minutes and seconds below 60.
 */
public final class DurationParser {

    private static final Pattern DAYS = Pattern.compile("(-)?(\\d+)");
    private static final Pattern CLOCK = Pattern.compile(
            "(-)?(?:(\\d+)\\.)?(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2})(?:\\.(\\d{1,7}))?)?");

    private DurationParser() {
    }

    public static Duration parse(@NotNull String raw) {
        String text = raw.trim();
        if (isIso(text)) {
            return Duration.parse(text);
        }

        Matcher days = DAYS.matcher(text);
        if (days.matches()) {
            Duration duration = Duration.ofDays(Long.parseLong(days.group(2)));
            return days.group(1) != null ? duration.negated() : duration;
        }

        Matcher clock = CLOCK.matcher(text);
        if (!clock.matches()) {
            throw new DateTimeParseException("Text cannot be parsed to a Duration", raw, 0);
        }
        Duration duration = Duration.ofDays(clock.group(2) == null ? 0 : Long.parseLong(clock.group(2)))
                .plusHours(component(clock.group(3), 23, raw))
                .plusMinutes(component(clock.group(4), 59, raw))
                .plusSeconds(clock.group(5) == null ? 0 : component(clock.group(5), 59, raw));
        if (clock.group(6) != null) {
            // fraction of a second, at most 7 digits
            duration = duration.plusNanos(Long.parseLong((clock.group(6) + "000000000").substring(0, 9)));
        }
        return clock.group(1) != null ? duration.negated() : duration;
    }

    private static boolean isIso(String text) {
        int start = text.startsWith("-") || text.startsWith("+") ? 1 : 0;
        return text.length() > start && Character.toUpperCase(text.charAt(start)) == 'P';
    }

    private static long component(String digits, int max, String raw) {
        long value = Long.parseLong(digits);
        if (value > max) {
            throw new DateTimeParseException("Duration component out of range: " + digits, raw, 0);
        }
        return value;
    }
}
