package space.ketterling.forecastgraph.units;

/**
 * Converts NWS grid values (degC, km/h, mm) to display units.
 *
 * <p>
 * Every conversion passes {@code null} through as {@code null}.
 * </p>
 */
public final class UnitConverter {
    private static final double KPH_TO_MPH = 0.621371;
    private static final double MM_TO_INCHES = 0.0393701;

    /**
     * Utility class; no instances.
     */
    private UnitConverter() {
    }

    /**
     * Celsius to whole display degrees.
     */
    public static Integer temperature(Double celsius, UnitSystem units) {
        if (celsius == null)
            return null;
        if (units == UnitSystem.IMPERIAL)
            return (int) Math.round(celsius * 9.0 / 5.0 + 32.0);
        return (int) Math.round(celsius);
    }

    /**
     * km/h to whole display speed units (mph or km/h).
     */
    public static Integer speed(Double kph, UnitSystem units) {
        if (kph == null)
            return null;
        if (units == UnitSystem.IMPERIAL)
            return (int) Math.round(kph * KPH_TO_MPH);
        return (int) Math.round(kph);
    }

    /**
     * Millimetres to display depth: inches at two decimals, or millimetres as-is.
     */
    public static Double depth(Double mm, UnitSystem units) {
        if (mm == null)
            return null;
        if (units == UnitSystem.IMPERIAL)
            return Math.round(mm * MM_TO_INCHES * 100.0) / 100.0;
        return mm;
    }

    /**
     * Display temperature back to Celsius.
     */
    public static Double celsiusFrom(Number display, UnitSystem units) {
        if (display == null)
            return null;
        if (units == UnitSystem.IMPERIAL)
            return (display.doubleValue() - 32.0) * 5.0 / 9.0;
        return display.doubleValue();
    }

    /**
     * Display speed back to km/h.
     */
    public static Double kphFrom(Number display, UnitSystem units) {
        if (display == null)
            return null;
        if (units == UnitSystem.IMPERIAL)
            return display.doubleValue() / KPH_TO_MPH;
        return display.doubleValue();
    }

    /**
     * Display depth back to millimetres.
     */
    public static Double mmFrom(Double display, UnitSystem units) {
        if (display == null)
            return null;
        if (units == UnitSystem.IMPERIAL)
            return display / MM_TO_INCHES;
        return display;
    }
}
