package space.ketterling.forecastgraph.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import io.javalin.Javalin;

import space.ketterling.forecastgraph.model.ForecastPayload;
import space.ketterling.forecastgraph.model.InstanceConfig;
import space.ketterling.forecastgraph.service.ForecastService;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * REST counterpart of the socket protocol: register, list, refresh and remove
 * display instances, and read the cached forecast for a coordinate pair.
 */
final class ApiRoutesInstances {
    private static final long WORKER_WAIT_SECONDS = 5;

    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesInstances() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ForecastService service = api.service();

        app.get("/api/instances", ctx -> {
            ArrayNode arr = om.createArrayNode();
            for (String id : service.registeredInstances()) {
                arr.add(id);
            }
            ctx.json(arr);
        });

        app.post("/api/instances", ctx -> {
            JsonNode body;
            try {
                body = om.readTree(ctx.body());
            } catch (JsonProcessingException e) {
                ctx.status(400).json(om.createObjectNode().put("error", "body must be JSON"));
                return;
            }

            InstanceConfig config;
            try {
                config = InstanceConfig.fromJson(body, api.cfg());
            } catch (IllegalArgumentException e) {
                ctx.status(400).json(om.createObjectNode().put("error", e.getMessage()));
                return;
            }

            service.register(config);
            ctx.status(202).json(om.createObjectNode()
                    .put("status", "registered")
                    .put("instanceId", config.instanceId()));
        });

        app.delete("/api/instances/{id}", ctx -> {
            String id = ctx.pathParam("id");
            boolean removed = service.unregister(id).get(WORKER_WAIT_SECONDS, TimeUnit.SECONDS);
            if (!removed) {
                ctx.status(404).json(om.createObjectNode().put("error", "unknown instance " + id));
                return;
            }
            ctx.json(om.createObjectNode().put("removed", id));
        });

        app.post("/api/instances/{id}/refresh", ctx -> {
            String id = ctx.pathParam("id");
            boolean started = service.refreshNow(id).get(WORKER_WAIT_SECONDS, TimeUnit.SECONDS);
            if (!started) {
                ctx.status(404).json(om.createObjectNode().put("error", "unknown instance " + id));
                return;
            }
            ctx.status(202).json(om.createObjectNode().put("status", "started"));
        });

        app.get("/api/forecast", ctx -> {
            Double lat = ApiServer.parseDouble(ctx.queryParam("lat"), null);
            Double lon = ApiServer.parseDouble(ctx.queryParam("lon"), null);
            if (lat == null || lon == null) {
                ctx.status(400).json(om.createObjectNode().put("error", "lat and lon are required"));
                return;
            }
            if (!ApiServer.isLatLonValid(lat, lon)) {
                ctx.status(400).json(om.createObjectNode().put("error", "lat or lon out of range"));
                return;
            }

            Optional<ForecastPayload> payload = service.cachedPayload(lat, lon);
            if (payload.isEmpty()) {
                ctx.status(404).json(om.createObjectNode().put("error", "no forecast cached for this point"));
                return;
            }
            ctx.json(payload.get());
        });
    }
}
