package space.ketterling.forecastgraph.series;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes NWS {@code validTime} values such as
 * {@code 2024-01-01T00:00:00+00:00/PT6H}.
 *
 * <p>
 * Only whole-hour durations of the form {@code PT<n>H} are understood. Any
 * other duration (days, minutes, mixed forms, zero) decodes to a single hour;
 * this is not a parser for the full ISO-8601 duration grammar.
 * </p>
 */
public final class DurationDecoder {
    private static final Pattern WHOLE_HOURS = Pattern.compile("PT(\\d+)H");

    /**
     * Utility class; no instances.
     */
    private DurationDecoder() {
    }

    /**
     * Returns the hour count of a {@code PT<n>H} duration, or 1 for anything else.
     */
    public static int decodeHours(String duration) {
        if (duration == null || duration.isBlank())
            return 1;
        Matcher m = WHOLE_HOURS.matcher(duration.trim());
        if (!m.matches())
            return 1;
        try {
            int hours = Integer.parseInt(m.group(1));
            return hours >= 1 ? hours : 1;
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return 1;
        }
    }

    /**
     * Splits a {@code start/duration} string into a start instant and hour count.
     *
     * @throws IllegalArgumentException when the separator or start instant is
     *                                  missing or unparseable
     */
    public static ValidInterval decode(String validTime) {
        if (validTime == null)
            throw new IllegalArgumentException("validTime is required");
        int slash = validTime.indexOf('/');
        if (slash <= 0)
            throw new IllegalArgumentException("validTime has no interval separator: " + validTime);

        String startText = validTime.substring(0, slash).trim();
        String durationText = validTime.substring(slash + 1);
        try {
            OffsetDateTime start = OffsetDateTime.parse(startText);
            return new ValidInterval(start.toInstant(), decodeHours(durationText));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("validTime start is not an ISO date-time: " + validTime, e);
        }
    }
}
