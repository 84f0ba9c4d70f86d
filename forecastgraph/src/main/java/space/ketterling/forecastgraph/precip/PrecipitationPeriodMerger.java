package space.ketterling.forecastgraph.precip;

import space.ketterling.forecastgraph.model.HourlySample;
import space.ketterling.forecastgraph.units.UnitSystem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconciles liquid and frozen periods so each physical event is shown once.
 *
 * <p>
 * Rules, per distinct liquid {@code startIndex} in order of first appearance:
 * </p>
 * <ol>
 * <li>a positive frozen period at the same index replaces the liquid one;</li>
 * <li>otherwise a positive liquid period is dropped when the hour's display
 * temperature is known and at or below freezing, and kept when it is not.</li>
 * </ol>
 * <p>
 * Positive frozen periods at indices not taken in step 1 are appended after
 * that. A missing temperature never suppresses a period, and no two emitted
 * periods share a {@code startIndex}.
 * </p>
 */
public final class PrecipitationPeriodMerger {

    /**
     * Utility class; no instances.
     */
    private PrecipitationPeriodMerger() {
    }

    public static List<PrecipitationPeriod> merge(List<PrecipitationPeriod> liquid,
            List<PrecipitationPeriod> frozen,
            List<HourlySample> hourly,
            UnitSystem units) {
        List<PrecipitationPeriod> rain = liquid == null ? List.of() : liquid;
        List<PrecipitationPeriod> snow = frozen == null ? List.of() : frozen;

        List<PrecipitationPeriod> out = new ArrayList<>();
        Set<Integer> seenLiquid = new HashSet<>();
        Set<Integer> taken = new HashSet<>();

        for (PrecipitationPeriod r : rain) {
            int idx = r.startIndex();
            if (!seenLiquid.add(idx))
                continue;

            PrecipitationPeriod s = firstPositiveAt(snow, idx);
            if (s != null) {
                out.add(s);
                taken.add(idx);
                continue;
            }

            if (!r.hasAmount())
                continue;
            if (isAtOrBelowFreezing(hourly, idx, units))
                continue;

            out.add(r);
            taken.add(idx);
        }

        for (PrecipitationPeriod s : snow) {
            if (!s.hasAmount())
                continue;
            if (taken.add(s.startIndex()))
                out.add(s);
        }
        return out;
    }

    private static PrecipitationPeriod firstPositiveAt(List<PrecipitationPeriod> periods, int idx) {
        for (PrecipitationPeriod p : periods) {
            if (p.startIndex() == idx && p.hasAmount())
                return p;
        }
        return null;
    }

    private static boolean isAtOrBelowFreezing(List<HourlySample> hourly, int idx, UnitSystem units) {
        if (hourly == null || idx < 0 || idx >= hourly.size())
            return false;
        Integer temp = hourly.get(idx).temp();
        return temp != null && temp <= units.freezingPoint();
    }
}
