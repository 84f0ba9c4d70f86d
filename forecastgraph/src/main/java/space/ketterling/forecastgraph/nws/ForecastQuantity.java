package space.ketterling.forecastgraph.nws;

/**
 * Gridpoint series consumed from the NWS {@code forecastGridData} resource,
 * keyed by their property names. Native units are noted per constant.
 */
public enum ForecastQuantity {
    /** degC */
    TEMPERATURE("temperature"),
    /** degC */
    APPARENT_TEMPERATURE("apparentTemperature"),
    /** km/h */
    WIND_SPEED("windSpeed"),
    /** km/h */
    WIND_GUST("windGust"),
    /** percent */
    PROBABILITY_OF_PRECIPITATION("probabilityOfPrecipitation"),
    /** mm, liquid */
    QUANTITATIVE_PRECIPITATION("quantitativePrecipitation"),
    /** mm, frozen */
    SNOWFALL_AMOUNT("snowfallAmount");

    private final String propertyName;

    ForecastQuantity(String propertyName) {
        this.propertyName = propertyName;
    }

    public String propertyName() {
        return propertyName;
    }
}
