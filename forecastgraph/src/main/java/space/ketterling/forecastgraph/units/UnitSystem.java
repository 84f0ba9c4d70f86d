package space.ketterling.forecastgraph.units;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Measurement system a display instance renders in.
 */
public enum UnitSystem {
    IMPERIAL("imperial", 32),
    METRIC("metric", 0);

    private final String wireName;
    private final int freezingPoint;

    UnitSystem(String wireName, int freezingPoint) {
        this.wireName = wireName;
        this.freezingPoint = freezingPoint;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Freezing point of water in this system's display temperature scale.
     */
    public int freezingPoint() {
        return freezingPoint;
    }

    /**
     * Parses a config value; anything other than "metric" falls back to imperial.
     */
    public static UnitSystem parse(String value) {
        if (value != null && "metric".equals(value.trim().toLowerCase(Locale.ROOT)))
            return METRIC;
        return IMPERIAL;
    }
}
