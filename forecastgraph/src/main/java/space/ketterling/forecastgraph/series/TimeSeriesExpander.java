package space.ketterling.forecastgraph.series;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands run-length records into one sample per covered hour.
 */
public final class TimeSeriesExpander {

    /**
     * Utility class; no instances.
     */
    private TimeSeriesExpander() {
    }

    /**
     * Repeats each record's value across its duration, in record order.
     *
     * <p>
     * Records are not sorted or de-duplicated; overlapping input yields
     * overlapping samples, which {@link HourlySampler} resolves.
     * </p>
     */
    public static List<ExpandedSample> expand(List<RawSeriesRecord> records) {
        if (records == null || records.isEmpty())
            return List.of();

        int total = 0;
        for (RawSeriesRecord r : records) {
            total += r.durationHours();
        }

        List<ExpandedSample> out = new ArrayList<>(total);
        for (RawSeriesRecord r : records) {
            for (int h = 0; h < r.durationHours(); h++) {
                out.add(new ExpandedSample(r.start().plusSeconds(h * 3600L), r.value()));
            }
        }
        return out;
    }
}
