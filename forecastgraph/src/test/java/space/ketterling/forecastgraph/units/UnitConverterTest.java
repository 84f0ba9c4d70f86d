package space.ketterling.forecastgraph.units;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class UnitConverterTest {

    @Test
    void testTemperature() {
        assertThat(UnitConverter.temperature(0.0, UnitSystem.IMPERIAL)).isEqualTo(32);
        assertThat(UnitConverter.temperature(-1.1, UnitSystem.IMPERIAL)).isEqualTo(30);
        assertThat(UnitConverter.temperature(37.0, UnitSystem.IMPERIAL)).isEqualTo(99);
        assertThat(UnitConverter.temperature(21.6, UnitSystem.METRIC)).isEqualTo(22);
        assertThat(UnitConverter.temperature(-3.4, UnitSystem.METRIC)).isEqualTo(-3);
    }

    @Test
    void testSpeed() {
        assertThat(UnitConverter.speed(16.668, UnitSystem.IMPERIAL)).isEqualTo(10);
        assertThat(UnitConverter.speed(100.0, UnitSystem.IMPERIAL)).isEqualTo(62);
        assertThat(UnitConverter.speed(16.668, UnitSystem.METRIC)).isEqualTo(17);
    }

    @Test
    void testDepth() {
        assertThat(UnitConverter.depth(25.4, UnitSystem.IMPERIAL)).isEqualTo(1.0);
        assertThat(UnitConverter.depth(1.0, UnitSystem.IMPERIAL)).isEqualTo(0.04);
        assertThat(UnitConverter.depth(3.7, UnitSystem.METRIC)).isEqualTo(3.7);
    }

    @Test
    void testNullPassesThrough() {
        assertThat(UnitConverter.temperature(null, UnitSystem.IMPERIAL)).isNull();
        assertThat(UnitConverter.speed(null, UnitSystem.METRIC)).isNull();
        assertThat(UnitConverter.depth(null, UnitSystem.IMPERIAL)).isNull();
        assertThat(UnitConverter.celsiusFrom(null, UnitSystem.IMPERIAL)).isNull();
        assertThat(UnitConverter.kphFrom(null, UnitSystem.IMPERIAL)).isNull();
        assertThat(UnitConverter.mmFrom(null, UnitSystem.IMPERIAL)).isNull();
    }

    /**
     * Native -> display -> native stays within the display rounding step.
     */
    @Test
    void testRoundTripWithinRoundingError() {
        for (UnitSystem units : UnitSystem.values()) {
            for (double c = -40.0; c <= 45.0; c += 0.7) {
                double back = UnitConverter.celsiusFrom(UnitConverter.temperature(c, units), units);
                assertThat(back).isCloseTo(c, within(1.0));
            }
            for (double kph = 0.0; kph <= 150.0; kph += 1.3) {
                double back = UnitConverter.kphFrom(UnitConverter.speed(kph, units), units);
                assertThat(back).isCloseTo(kph, within(1.0));
            }
            for (double mm = 0.0; mm <= 80.0; mm += 0.37) {
                double display = UnitConverter.depth(mm, units);
                double again = UnitConverter.depth(UnitConverter.mmFrom(display, units), units);
                assertThat(again).isCloseTo(display, within(0.01));
            }
        }
    }

    @Test
    void testUnitSystemParse() {
        assertThat(UnitSystem.parse("metric")).isEqualTo(UnitSystem.METRIC);
        assertThat(UnitSystem.parse(" Metric ")).isEqualTo(UnitSystem.METRIC);
        assertThat(UnitSystem.parse("imperial")).isEqualTo(UnitSystem.IMPERIAL);
        assertThat(UnitSystem.parse("kelvin")).isEqualTo(UnitSystem.IMPERIAL);
        assertThat(UnitSystem.parse(null)).isEqualTo(UnitSystem.IMPERIAL);
        assertThat(UnitSystem.IMPERIAL.freezingPoint()).isEqualTo(32);
        assertThat(UnitSystem.METRIC.freezingPoint()).isEqualTo(0);
    }
}
