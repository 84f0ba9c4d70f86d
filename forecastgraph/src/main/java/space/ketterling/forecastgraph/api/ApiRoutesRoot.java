package space.ketterling.forecastgraph.api;

import io.javalin.Javalin;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "forecastgraph",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/metrics/external",
                        "GET /api/instances",
                        "POST /api/instances",
                        "DELETE /api/instances/{id}",
                        "POST /api/instances/{id}/refresh",
                        "GET /api/forecast?lat=34.05&lon=-118.4",
                        "WS /ws"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());
            out.put("instances", api.service().registeredInstances().size());
            out.put("sockets", api.notifier().sessionCount());
            ctx.json(out);
        });
    }
}
