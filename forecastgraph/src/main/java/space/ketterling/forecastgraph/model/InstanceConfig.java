package space.ketterling.forecastgraph.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import space.ketterling.forecastgraph.config.AppConfig;
import space.ketterling.forecastgraph.units.UnitSystem;

import java.time.Duration;
import java.util.Set;

/**
 * Configuration message sent by a display instance when it starts.
 *
 * <p>
 * Fields the service does not interpret (colours, chart sizes, toggles) are
 * kept verbatim in {@code displayOptions}.
 * </p>
 */
public record InstanceConfig(
        String instanceId,
        double latitude,
        double longitude,
        UnitSystem units,
        Duration updateInterval,
        int hoursToShow,
        ObjectNode displayOptions) {

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "instanceId", "latitude", "longitude", "units", "updateInterval", "hoursToShow");

    /**
     * Reads a config message, filling omitted fields from the app defaults.
     *
     * @throws IllegalArgumentException when the instance id or coordinates are
     *                                  missing or out of range
     */
    public static InstanceConfig fromJson(JsonNode node, AppConfig defaults) {
        if (node == null || !node.isObject())
            throw new IllegalArgumentException("config message must be a JSON object");

        String id = node.path("instanceId").asText(null);
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("instanceId is required");

        JsonNode latNode = node.get("latitude");
        JsonNode lonNode = node.get("longitude");
        if (latNode == null || lonNode == null || latNode.isNull() || lonNode.isNull())
            throw new IllegalArgumentException("latitude and longitude are required");

        double lat = parseCoordinate(latNode, "latitude");
        double lon = parseCoordinate(lonNode, "longitude");
        if (lat < -90.0 || lat > 90.0 || lon < -180.0 || lon > 180.0)
            throw new IllegalArgumentException("latitude or longitude out of range");

        UnitSystem units = node.hasNonNull("units")
                ? UnitSystem.parse(node.get("units").asText())
                : defaults.defaultUnits();

        Duration interval = defaults.defaultUpdateInterval();
        JsonNode intervalNode = node.get("updateInterval");
        if (intervalNode != null && intervalNode.canConvertToLong() && intervalNode.asLong() > 0)
            interval = Duration.ofMillis(intervalNode.asLong());

        int hours = defaults.defaultHoursToShow();
        JsonNode hoursNode = node.get("hoursToShow");
        if (hoursNode != null && hoursNode.canConvertToInt())
            hours = AppConfig.clampHours(hoursNode.asInt());

        ObjectNode options = JsonNodeFactory.instance.objectNode();
        node.fields().forEachRemaining(e -> {
            if (!KNOWN_FIELDS.contains(e.getKey()))
                options.set(e.getKey(), e.getValue());
        });

        return new InstanceConfig(id, lat, lon, units, interval, hours, options);
    }

    private static double parseCoordinate(JsonNode n, String name) {
        if (n.isNumber())
            return n.asDouble();
        try {
            return Double.parseDouble(n.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number", e);
        }
    }
}
