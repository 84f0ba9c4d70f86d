package space.ketterling.forecastgraph.nws;

import space.ketterling.forecastgraph.series.RawSeriesRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Raw gridpoint series per quantity, as published upstream.
 */
public final class GridSeries {
    private final Map<ForecastQuantity, List<RawSeriesRecord>> series;

    public GridSeries(Map<ForecastQuantity, List<RawSeriesRecord>> series) {
        EnumMap<ForecastQuantity, List<RawSeriesRecord>> copy = new EnumMap<>(ForecastQuantity.class);
        series.forEach((q, records) -> copy.put(q, List.copyOf(records)));
        this.series = Collections.unmodifiableMap(copy);
    }

    /**
     * Records for a quantity; empty when the upstream omitted it.
     */
    public List<RawSeriesRecord> get(ForecastQuantity quantity) {
        return series.getOrDefault(quantity, List.of());
    }

    public static GridSeries empty() {
        return new GridSeries(Map.of());
    }
}
