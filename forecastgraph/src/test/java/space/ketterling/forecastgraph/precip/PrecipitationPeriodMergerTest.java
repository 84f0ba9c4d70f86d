package space.ketterling.forecastgraph.precip;

import org.junit.jupiter.api.Test;
import space.ketterling.forecastgraph.model.HourlySample;
import space.ketterling.forecastgraph.units.UnitSystem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class PrecipitationPeriodMergerTest {

    private static PrecipitationPeriod rain(int start, int end, double mm) {
        return new PrecipitationPeriod(start, end, mm, mm, 0.25, UnitSystem.METRIC, PrecipitationKind.LIQUID);
    }

    private static PrecipitationPeriod snow(int start, int end, double mm) {
        return new PrecipitationPeriod(start, end, mm, mm, 2.5, UnitSystem.METRIC, PrecipitationKind.FROZEN);
    }

    private static PrecipitationPeriod rainImperial(int start, int end, double mm) {
        return new PrecipitationPeriod(start, end, mm, mm * 0.0393701, 0.01, UnitSystem.IMPERIAL,
                PrecipitationKind.LIQUID);
    }

    /**
     * Hourly samples with the given temperatures; null entries are unknown.
     */
    private static List<HourlySample> temps(Integer... values) {
        List<HourlySample> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            out.add(new HourlySample(1_700_000_000L + i * 3600L, values[i], values[i], 5, 8, 0.5));
        }
        return out;
    }

    private static List<HourlySample> constant(int hours, Integer temp) {
        Integer[] values = new Integer[hours];
        Arrays.fill(values, temp);
        return temps(values);
    }

    @Test
    void testFrozenWinsOverLiquidAtSameStart() {
        PrecipitationPeriod snowAt5 = snow(5, 8, 10.0);

        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(rain(5, 8, 3.0)), List.of(snowAt5), constant(12, 5), UnitSystem.METRIC);

        assertThat(out).containsExactly(snowAt5);
    }

    @Test
    void testLiquidAtOrBelowFreezingIsSuppressed() {
        List<HourlySample> hourly = constant(12, 40);
        hourly.set(5, new HourlySample(0L, 30, 25, 5, 8, 0.5));

        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(rainImperial(5, 7, 2.0)), List.of(), hourly, UnitSystem.IMPERIAL);

        assertThat(out).isEmpty();
    }

    @Test
    void testExactlyFreezingIsSuppressedInBothSystems() {
        assertThat(PrecipitationPeriodMerger.merge(
                List.of(rainImperial(0, 1, 1.0)), List.of(), constant(2, 32), UnitSystem.IMPERIAL)).isEmpty();
        assertThat(PrecipitationPeriodMerger.merge(
                List.of(rain(0, 1, 1.0)), List.of(), constant(2, 0), UnitSystem.METRIC)).isEmpty();
        assertThat(PrecipitationPeriodMerger.merge(
                List.of(rain(0, 1, 1.0)), List.of(), constant(2, 1), UnitSystem.METRIC)).hasSize(1);
    }

    /**
     * 30 is below freezing in Fahrenheit but well above in Celsius.
     */
    @Test
    void testFreezingPointFollowsUnitSystem() {
        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(rain(3, 4, 1.0)), List.of(), constant(6, 30), UnitSystem.METRIC);

        assertThat(out).hasSize(1);
    }

    @Test
    void testUnknownTemperatureDoesNotSuppress() {
        List<PrecipitationPeriod> nullTemp = PrecipitationPeriodMerger.merge(
                List.of(rain(1, 2, 1.0)), List.of(), temps(-5, null, -5), UnitSystem.METRIC);
        assertThat(nullTemp).hasSize(1);

        List<PrecipitationPeriod> outOfRange = PrecipitationPeriodMerger.merge(
                List.of(rain(4, 5, 1.0)), List.of(), temps(-5, -5), UnitSystem.METRIC);
        assertThat(outOfRange).hasSize(1);

        List<PrecipitationPeriod> noHourly = PrecipitationPeriodMerger.merge(
                List.of(rain(0, 1, 1.0)), List.of(), List.of(), UnitSystem.METRIC);
        assertThat(noHourly).hasSize(1);
    }

    @Test
    void testZeroAmountFrozenDoesNotReplaceLiquid() {
        PrecipitationPeriod liquid = rain(2, 4, 1.5);

        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(liquid), List.of(snow(2, 4, 0.0)), constant(6, 10), UnitSystem.METRIC);

        assertThat(out).containsExactly(liquid);
    }

    @Test
    void testZeroAmountLiquidIsNotEmitted() {
        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(rain(2, 4, 0.0)), List.of(), constant(6, 10), UnitSystem.METRIC);

        assertThat(out).isEmpty();
    }

    @Test
    void testUnmatchedFrozenPeriodsAreAppended() {
        PrecipitationPeriod liquid = rain(0, 2, 1.0);
        PrecipitationPeriod snowLater = snow(6, 9, 20.0);

        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(liquid), List.of(snowLater, snow(10, 12, 0.0)), constant(12, 4), UnitSystem.METRIC);

        assertThat(out).containsExactly(liquid, snowLater);
    }

    /**
     * Frozen periods are emitted even at hours that are above freezing.
     */
    @Test
    void testFrozenIsNeverTemperatureFiltered() {
        PrecipitationPeriod warmSnow = snow(1, 2, 5.0);

        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(), List.of(warmSnow), constant(4, 15), UnitSystem.METRIC);

        assertThat(out).containsExactly(warmSnow);
    }

    /**
     * A frozen period matched to a suppressed-liquid hour still comes out once.
     */
    @Test
    void testFrozenAtFreezingHourReplacesLiquid() {
        PrecipitationPeriod snowAt3 = snow(3, 5, 8.0);

        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(
                List.of(rain(3, 5, 2.0)), List.of(snowAt3), constant(6, -2), UnitSystem.METRIC);

        assertThat(out).containsExactly(snowAt3);
    }

    @Test
    void testNeverTwoPeriodsWithSameStartIndex() {
        List<PrecipitationPeriod> liquid = List.of(rain(0, 2, 1.0), rain(0, 3, 2.0), rain(4, 5, 1.0));
        List<PrecipitationPeriod> frozen = List.of(snow(4, 6, 3.0), snow(4, 5, 9.0), snow(7, 8, 1.0),
                snow(7, 9, 2.0));

        List<PrecipitationPeriod> out = PrecipitationPeriodMerger.merge(liquid, frozen, constant(10, 10),
                UnitSystem.METRIC);

        assertThat(out).extracting(PrecipitationPeriod::startIndex).containsExactly(0, 4, 7);
        assertThat(out.get(0).amountNative()).isEqualTo(1.0);
        assertThat(out.get(1).amountNative()).isEqualTo(3.0);
        assertThat(out.get(2).amountNative()).isEqualTo(1.0);
    }

    @Test
    void testEmptyInputs() {
        assertThat(PrecipitationPeriodMerger.merge(List.of(), List.of(), List.of(), UnitSystem.IMPERIAL)).isEmpty();
        assertThat(PrecipitationPeriodMerger.merge(null, null, null, UnitSystem.IMPERIAL)).isEmpty();
    }
}
