package space.ketterling.forecastgraph.model;

import space.ketterling.forecastgraph.precip.PrecipitationPeriod;
import space.ketterling.forecastgraph.units.UnitSystem;

import java.util.List;

/**
 * Normalized payload handed to the rendering layer.
 */
public record ForecastPayload(
        List<HourlySample> hourly,
        List<PrecipitationPeriod> precipitationPeriods,
        UnitSystem units) {

    public ForecastPayload {
        hourly = List.copyOf(hourly);
        precipitationPeriods = List.copyOf(precipitationPeriods);
    }

    /**
     * True when this payload was built for the given unit system and window.
     */
    public boolean matches(UnitSystem otherUnits, int hoursToShow) {
        return units == otherUnits && hourly.size() == hoursToShow;
    }
}
