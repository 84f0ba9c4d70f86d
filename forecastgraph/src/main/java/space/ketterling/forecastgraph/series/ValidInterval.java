package space.ketterling.forecastgraph.series;

import java.time.Instant;

/**
 * Start instant and whole-hour length decoded from an NWS {@code validTime}.
 */
public record ValidInterval(Instant start, int durationHours) {
}
