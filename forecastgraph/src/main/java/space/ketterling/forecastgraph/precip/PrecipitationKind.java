package space.ketterling.forecastgraph.precip;

import com.fasterxml.jackson.annotation.JsonValue;

import space.ketterling.forecastgraph.units.UnitSystem;

/**
 * Liquid (quantitative precipitation) or frozen (snowfall) accumulation.
 *
 * <p>
 * Thresholds are the minimum display amount (inches or mm) a client draws.
 * </p>
 */
public enum PrecipitationKind {
    LIQUID("rain", 0.01, 0.25),
    FROZEN("snow", 0.1, 2.5);

    private final String wireName;
    private final double imperialThreshold;
    private final double metricThreshold;

    PrecipitationKind(String wireName, double imperialThreshold, double metricThreshold) {
        this.wireName = wireName;
        this.imperialThreshold = imperialThreshold;
        this.metricThreshold = metricThreshold;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Minimum display amount (inches or mm) for this kind.
     */
    public double displayThreshold(UnitSystem units) {
        return units == UnitSystem.IMPERIAL ? imperialThreshold : metricThreshold;
    }
}
