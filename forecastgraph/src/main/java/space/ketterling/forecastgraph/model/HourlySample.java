package space.ketterling.forecastgraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One hour of display-ready forecast values.
 *
 * <p>
 * Temperatures and speeds are already in display units; any of them may be
 * {@code null} when the quantity had no sample for that hour. {@code pop} is a
 * probability in [0, 1].
 * </p>
 */
public record HourlySample(
        @JsonProperty("dt") long timestamp,
        @JsonProperty("temp") Integer temp,
        @JsonProperty("feels_like") Integer feelsLike,
        @JsonProperty("wind_speed") Integer windSpeed,
        @JsonProperty("wind_gust") Integer windGust,
        @JsonProperty("pop") double pop) {
}
