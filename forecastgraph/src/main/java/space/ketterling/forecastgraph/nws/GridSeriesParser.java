package space.ketterling.forecastgraph.nws;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.forecastgraph.series.DurationDecoder;
import space.ketterling.forecastgraph.series.RawSeriesRecord;
import space.ketterling.forecastgraph.series.ValidInterval;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the {@code properties} of an NWS gridpoint response into
 * {@link GridSeries}.
 */
public final class GridSeriesParser {
    private static final Logger log = LoggerFactory.getLogger(GridSeriesParser.class);

    /**
     * Utility class; no instances.
     */
    private GridSeriesParser() {
    }

    /**
     * Parses a full gridpoint response (the object holding {@code properties}).
     *
     * @throws IllegalStateException when {@code properties} is missing or not
     *                               an object
     */
    public static GridSeries parse(JsonNode root) {
        if (root == null)
            throw new IllegalStateException("Grid response is empty");
        JsonNode props = root.path("properties");
        if (!props.isObject())
            throw new IllegalStateException("Grid response has no properties object");

        Map<ForecastQuantity, List<RawSeriesRecord>> out = new EnumMap<>(ForecastQuantity.class);
        for (ForecastQuantity q : ForecastQuantity.values()) {
            out.put(q, parseValues(q, props.path(q.propertyName()).path("values")));
        }
        return new GridSeries(out);
    }

    private static List<RawSeriesRecord> parseValues(ForecastQuantity q, JsonNode values) {
        if (!values.isArray())
            return List.of();

        List<RawSeriesRecord> records = new ArrayList<>(values.size());
        for (JsonNode v : values) {
            String validTime = v.path("validTime").asText(null);
            if (validTime == null || validTime.isBlank()) {
                log.debug("Skipping {} record without validTime", q.propertyName());
                continue;
            }

            ValidInterval interval;
            try {
                interval = DurationDecoder.decode(validTime);
            } catch (IllegalArgumentException e) {
                log.debug("Skipping {} record: {}", q.propertyName(), e.getMessage());
                continue;
            }

            JsonNode valueNode = v.get("value");
            Double value = (valueNode == null || valueNode.isNull() || !valueNode.isNumber())
                    ? null
                    : valueNode.asDouble();
            records.add(RawSeriesRecord.of(interval, value));
        }
        return records;
    }
}
