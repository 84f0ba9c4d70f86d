package space.ketterling.forecastgraph.series;

import java.time.Instant;

/**
 * One upstream (interval, value) entry for a single forecast quantity.
 *
 * <p>
 * {@code value} is nullable; NWS publishes explicit nulls for gaps.
 * </p>
 */
public record RawSeriesRecord(Instant start, int durationHours, Double value) {

    public RawSeriesRecord {
        if (start == null)
            throw new IllegalArgumentException("start is required");
        if (durationHours < 1)
            throw new IllegalArgumentException("durationHours must be >= 1");
    }

    public static RawSeriesRecord of(ValidInterval interval, Double value) {
        return new RawSeriesRecord(interval.start(), interval.durationHours(), value);
    }

    /**
     * Exclusive end of the record's interval.
     */
    public Instant end() {
        return start.plusSeconds(durationHours * 3600L);
    }
}
