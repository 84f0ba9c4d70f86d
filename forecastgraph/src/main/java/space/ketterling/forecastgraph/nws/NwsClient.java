package space.ketterling.forecastgraph.nws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import space.ketterling.forecastgraph.config.AppConfig;
import space.ketterling.forecastgraph.metrics.ExternalApiMetrics;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous HTTP client for the National Weather Service (api.weather.gov)
 * points and gridpoint endpoints.
 *
 * <p>
 * Every request carries the configured User-Agent and an explicit timeout, so a
 * stalled upstream surfaces as a failure the retry policy can act on.
 * </p>
 */
public final class NwsClient implements GridForecastSource {
    public static final String POINTS_ENDPOINT = "NWS_POINTS";
    public static final String GRID_ENDPOINT = "NWS_GRID";

    private final HttpClient http;
    private final AppConfig cfg;
    private final ObjectMapper om;

    /**
     * Creates a new NWS client using app config and a shared {@link ObjectMapper}.
     */
    public NwsClient(AppConfig cfg, ObjectMapper om) {
        this.cfg = cfg;
        this.om = om;
        this.http = HttpClient.newBuilder()
                .connectTimeout(cfg.nwsConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Stable cache/URL key for a coordinate pair, four decimals.
     */
    public static String coordinateKey(double lat, double lon) {
        return String.format(Locale.ROOT, "%.4f,%.4f", lat, lon);
    }

    /**
     * Loads NWS point metadata for a latitude/longitude pair.
     */
    @Override
    public CompletableFuture<JsonNode> points(double lat, double lon) {
        return getJson(cfg.nwsBaseUrl() + "/points/" + coordinateKey(lat, lon), POINTS_ENDPOINT, "Points");
    }

    /**
     * Loads raw gridpoint forecast JSON from a {@code forecastGridData} URL.
     */
    @Override
    public CompletableFuture<JsonNode> gridData(String gridDataUrl) {
        return getJson(gridDataUrl, GRID_ENDPOINT, "Grid");
    }

    /**
     * Performs an async GET, records the outcome and parses the JSON body.
     */
    private CompletableFuture<JsonNode> getJson(String url, String endpoint, String label) {
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(cfg.nwsRequestTimeout())
                    .header("User-Agent", cfg.nwsUserAgent())
                    .header("Accept", "application/geo+json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        long t0 = System.currentTimeMillis();
        return http.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .whenComplete((resp, err) -> {
                    if (err != null)
                        ExternalApiMetrics.record(endpoint, false, System.currentTimeMillis() - t0);
                })
                .thenApply(resp -> {
                    long ms = System.currentTimeMillis() - t0;
                    if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                        ExternalApiMetrics.record(endpoint, false, ms);
                        throw new IllegalStateException(label + " API error: " + resp.statusCode());
                    }
                    try {
                        JsonNode json = om.readTree(resp.body());
                        ExternalApiMetrics.record(endpoint, true, ms);
                        return json;
                    } catch (JsonProcessingException e) {
                        ExternalApiMetrics.record(endpoint, false, ms);
                        throw new UncheckedIOException(label + " API returned malformed JSON", e);
                    }
                });
    }
}
