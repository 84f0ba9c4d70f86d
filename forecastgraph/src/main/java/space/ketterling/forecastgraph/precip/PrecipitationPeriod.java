package space.ketterling.forecastgraph.precip;

import com.fasterxml.jackson.annotation.JsonProperty;

import space.ketterling.forecastgraph.units.UnitSystem;

/**
 * A precipitation accumulation spanning hourly slots
 * {@code [startIndex, endIndex)} of the display window.
 */
public record PrecipitationPeriod(
        @JsonProperty("startIndex") int startIndex,
        @JsonProperty("endIndex") int endIndex,
        @JsonProperty("amount_mm") double amountNative,
        @JsonProperty("amount") Double amountDisplay,
        @JsonProperty("displayThreshold") double displayThreshold,
        @JsonProperty("units") UnitSystem units,
        @JsonProperty("type") PrecipitationKind kind) {

    public PrecipitationPeriod {
        if (startIndex < 0 || endIndex < startIndex)
            throw new IllegalArgumentException("invalid period indices " + startIndex + ".." + endIndex);
    }

    public boolean hasAmount() {
        return amountNative > 0.0;
    }
}
