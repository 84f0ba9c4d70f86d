package space.ketterling.forecastgraph.nws;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Upstream grid forecast API. Futures complete exceptionally on non-success
 * status, network errors and malformed bodies.
 */
public interface GridForecastSource {

    /**
     * Point metadata for a coordinate pair (holds {@code forecastGridData}).
     */
    CompletableFuture<JsonNode> points(double lat, double lon);

    /**
     * Raw gridpoint forecast from a {@code forecastGridData} URL.
     */
    CompletableFuture<JsonNode> gridData(String gridDataUrl);
}
