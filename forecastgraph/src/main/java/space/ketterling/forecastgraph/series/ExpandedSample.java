package space.ketterling.forecastgraph.series;

import java.time.Instant;

/**
 * A single hour of an expanded series.
 */
public record ExpandedSample(Instant instant, Double value) {
}
