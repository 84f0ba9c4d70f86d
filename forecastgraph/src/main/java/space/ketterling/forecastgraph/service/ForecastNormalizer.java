package space.ketterling.forecastgraph.service;

import space.ketterling.forecastgraph.config.AppConfig;
import space.ketterling.forecastgraph.model.ForecastPayload;
import space.ketterling.forecastgraph.model.HourlySample;
import space.ketterling.forecastgraph.nws.ForecastQuantity;
import space.ketterling.forecastgraph.nws.GridSeries;
import space.ketterling.forecastgraph.precip.PrecipitationKind;
import space.ketterling.forecastgraph.precip.PrecipitationPeriod;
import space.ketterling.forecastgraph.precip.PrecipitationPeriodExtractor;
import space.ketterling.forecastgraph.precip.PrecipitationPeriodMerger;
import space.ketterling.forecastgraph.series.ExpandedSample;
import space.ketterling.forecastgraph.series.HourlySampler;
import space.ketterling.forecastgraph.series.TimeSeriesExpander;
import space.ketterling.forecastgraph.units.UnitConverter;
import space.ketterling.forecastgraph.units.UnitSystem;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw gridpoint series into the hourly chart series plus merged
 * precipitation periods. Pure: the same input and {@code now} always give an
 * equal payload.
 */
public final class ForecastNormalizer {

    public ForecastPayload normalize(GridSeries series, UnitSystem units, int hoursToShow, Instant now) {
        int hours = AppConfig.clampHours(hoursToShow);
        Instant startHour = now.truncatedTo(ChronoUnit.HOURS);

        List<ExpandedSample> temps = TimeSeriesExpander.expand(series.get(ForecastQuantity.TEMPERATURE));
        List<ExpandedSample> feelsLike = TimeSeriesExpander.expand(series.get(ForecastQuantity.APPARENT_TEMPERATURE));
        List<ExpandedSample> windSpeed = TimeSeriesExpander.expand(series.get(ForecastQuantity.WIND_SPEED));
        List<ExpandedSample> windGust = TimeSeriesExpander.expand(series.get(ForecastQuantity.WIND_GUST));
        List<ExpandedSample> pop = TimeSeriesExpander.expand(
                series.get(ForecastQuantity.PROBABILITY_OF_PRECIPITATION));

        List<HourlySample> hourly = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            Instant target = startHour.plusSeconds(i * 3600L);
            hourly.add(new HourlySample(
                    target.getEpochSecond(),
                    UnitConverter.temperature(HourlySampler.valueAt(temps, target), units),
                    UnitConverter.temperature(HourlySampler.valueAt(feelsLike, target), units),
                    UnitConverter.speed(HourlySampler.valueAt(windSpeed, target), units),
                    UnitConverter.speed(HourlySampler.valueAt(windGust, target), units),
                    probability(HourlySampler.valueAt(pop, target))));
        }

        List<PrecipitationPeriod> liquid = PrecipitationPeriodExtractor.extract(
                series.get(ForecastQuantity.QUANTITATIVE_PRECIPITATION), now, hours, units,
                PrecipitationKind.LIQUID);
        List<PrecipitationPeriod> frozen = PrecipitationPeriodExtractor.extract(
                series.get(ForecastQuantity.SNOWFALL_AMOUNT), now, hours, units,
                PrecipitationKind.FROZEN);

        return new ForecastPayload(
                hourly,
                PrecipitationPeriodMerger.merge(liquid, frozen, hourly, units),
                units);
    }

    /**
     * Percent to [0, 1]; missing means no chance.
     */
    private static double probability(Double percent) {
        if (percent == null)
            return 0.0;
        return Math.max(0.0, Math.min(1.0, percent / 100.0));
    }
}
