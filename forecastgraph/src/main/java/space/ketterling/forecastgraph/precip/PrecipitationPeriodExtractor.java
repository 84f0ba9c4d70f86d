package space.ketterling.forecastgraph.precip;

import space.ketterling.forecastgraph.series.RawSeriesRecord;
import space.ketterling.forecastgraph.units.UnitConverter;
import space.ketterling.forecastgraph.units.UnitSystem;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw accumulation series into periods indexed against the display
 * window, keeping each record's true multi-hour span.
 */
public final class PrecipitationPeriodExtractor {
    private static final long HOUR_MS = 3_600_000L;

    /**
     * Utility class; no instances.
     */
    private PrecipitationPeriodExtractor() {
    }

    /**
     * Extracts one period per record that carries a positive amount and
     * overlaps {@code [hour(now), hour(now) + windowHours)}. Periods are clipped
     * to the window; nothing is coalesced.
     */
    public static List<PrecipitationPeriod> extract(List<RawSeriesRecord> records,
            Instant now,
            int windowHours,
            UnitSystem units,
            PrecipitationKind kind) {
        if (records == null || records.isEmpty() || windowHours < 1)
            return List.of();

        Instant windowStart = now.truncatedTo(ChronoUnit.HOURS);
        Instant windowEnd = windowStart.plusSeconds(windowHours * 3600L);
        double threshold = kind.displayThreshold(units);

        List<PrecipitationPeriod> out = new ArrayList<>();
        for (RawSeriesRecord r : records) {
            Double amount = r.value();
            if (amount == null || amount <= 0.0)
                continue;

            Instant start = r.start();
            Instant end = r.end();
            if (!end.isAfter(windowStart) || !start.isBefore(windowEnd))
                continue;

            Instant clippedStart = start.isBefore(windowStart) ? windowStart : start;
            Instant clippedEnd = end.isAfter(windowEnd) ? windowEnd : end;

            int startIndex = hourOffset(windowStart, clippedStart);
            int endIndex = hourOffset(windowStart, clippedEnd);

            out.add(new PrecipitationPeriod(
                    startIndex,
                    endIndex,
                    amount,
                    UnitConverter.depth(amount, units),
                    threshold,
                    units,
                    kind));
        }
        return out;
    }

    private static int hourOffset(Instant windowStart, Instant t) {
        return (int) Math.floorDiv(t.toEpochMilli() - windowStart.toEpochMilli(), HOUR_MS);
    }
}
