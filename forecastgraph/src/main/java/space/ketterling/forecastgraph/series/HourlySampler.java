package space.ketterling.forecastgraph.series;

import java.time.Instant;
import java.util.List;

/**
 * Step-hold lookup over an expanded series.
 */
public final class HourlySampler {
    private static final long HOUR_MS = 3_600_000L;

    /**
     * Utility class; no instances.
     */
    private HourlySampler() {
    }

    /**
     * Returns the value in effect at {@code target}.
     *
     * <p>
     * The first sample whose hour {@code [instant, instant + 1h)} contains the
     * target wins. Otherwise the last sample at or before the target is held
     * forward. Returns {@code null} for an empty series or when every sample
     * lies after the target.
     * </p>
     */
    public static Double valueAt(List<ExpandedSample> samples, Instant target) {
        if (samples == null || samples.isEmpty() || target == null)
            return null;

        long t = target.toEpochMilli();
        for (ExpandedSample s : samples) {
            long start = s.instant().toEpochMilli();
            if (start <= t && t < start + HOUR_MS)
                return s.value();
        }

        Double closest = null;
        for (ExpandedSample s : samples) {
            if (s.instant().toEpochMilli() <= t)
                closest = s.value();
        }
        return closest;
    }
}
