package space.ketterling.forecastgraph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.javalin.Javalin;

import space.ketterling.forecastgraph.metrics.ExternalApiMetrics;

/**
 * Upstream call health for the rolling metrics window.
 */
final class ApiRoutesMetrics {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetrics() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode endpoints = out.putArray("endpoints");

            for (var e : ExternalApiMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("endpoint", e.getKey());
                row.put("calls_last_hour", snap.calls());
                row.put("failures_last_hour", snap.failures());
                row.put("failure_pct", snap.failurePct());
                row.put("avg_latency_ms", snap.avgLatencyMs());
                row.put("retries_last_hour", snap.retries());
                row.put("exhausted_last_hour", snap.exhausted());
                row.put("status", snap.status());
                endpoints.add(row);
            }

            ctx.json(out);
        });
    }
}
