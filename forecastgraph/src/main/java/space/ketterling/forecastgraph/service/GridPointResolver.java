package space.ketterling.forecastgraph.service;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.forecastgraph.nws.GridForecastSource;
import space.ketterling.forecastgraph.nws.NwsClient;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves coordinates to a {@code forecastGridData} URL, once per coordinate
 * pair.
 *
 * <p>
 * Grid topology does not move, so entries are written once and never evicted.
 * </p>
 */
public final class GridPointResolver {
    private static final Logger log = LoggerFactory.getLogger(GridPointResolver.class);

    private final GridForecastSource source;
    private final Map<String, String> gridUrlCache = new ConcurrentHashMap<>();

    public GridPointResolver(GridForecastSource source) {
        this.source = source;
    }

    /**
     * Returns the cached grid URL or asks the points endpoint for it.
     */
    public CompletableFuture<String> resolve(double lat, double lon) {
        String key = NwsClient.coordinateKey(lat, lon);
        String cached = gridUrlCache.get(key);
        if (cached != null)
            return CompletableFuture.completedFuture(cached);

        return source.points(lat, lon).thenApply(root -> {
            String url = extractGridUrl(root);
            String previous = gridUrlCache.putIfAbsent(key, url);
            if (previous != null)
                return previous;
            log.info("Cached grid URL for {} -> {}", key, url);
            return url;
        });
    }

    /**
     * Cached grid URL for a coordinate pair, if resolved already.
     */
    public String cached(double lat, double lon) {
        return gridUrlCache.get(NwsClient.coordinateKey(lat, lon));
    }

    public int size() {
        return gridUrlCache.size();
    }

    private static String extractGridUrl(JsonNode root) {
        String url = root == null ? null : root.path("properties").path("forecastGridData").asText(null);
        if (url == null || url.isBlank())
            throw new IllegalStateException("Points response has no forecastGridData");
        return url;
    }
}
