package space.ketterling.forecastgraph.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.Javalin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.forecastgraph.model.InstanceConfig;
import space.ketterling.forecastgraph.service.ForecastService;

/**
 * WebSocket endpoint for display clients.
 *
 * <p>
 * Inbound messages are {@code {"notification": "CONFIG" | "REMOVE", "payload": {...}}};
 * outbound deliveries go through {@link SocketNotifier}.
 * </p>
 */
final class ApiRoutesSocket {
    private static final Logger log = LoggerFactory.getLogger(ApiRoutesSocket.class);

    static final String CONFIG_NOTIFICATION = "CONFIG";
    static final String REMOVE_NOTIFICATION = "REMOVE";

    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesSocket() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ForecastService service = api.service();
        SocketNotifier notifier = api.notifier();

        app.ws("/ws", ws -> {
            ws.onConnect(ctx -> {
                notifier.add(ctx);
                log.info("Socket connected {}", ctx.sessionId());
            });

            ws.onClose(ctx -> {
                notifier.remove(ctx);
                log.info("Socket closed {} ({})", ctx.sessionId(), ctx.status());
            });

            ws.onError(ctx -> {
                notifier.remove(ctx);
                log.warn("Socket error {}", ctx.sessionId(), ctx.error());
            });

            ws.onMessage(ctx -> {
                JsonNode msg;
                try {
                    msg = om.readTree(ctx.message());
                } catch (JsonProcessingException e) {
                    log.warn("Ignoring non-JSON socket message from {}", ctx.sessionId());
                    return;
                }

                String notification = msg.path("notification").asText("");
                JsonNode payload = msg.path("payload");
                switch (notification) {
                    case CONFIG_NOTIFICATION -> {
                        try {
                            service.register(InstanceConfig.fromJson(payload, api.cfg()));
                        } catch (IllegalArgumentException e) {
                            log.error("Rejected CONFIG from {}: {}", ctx.sessionId(), e.getMessage());
                        }
                    }
                    case REMOVE_NOTIFICATION -> {
                        String id = payload.path("instanceId").asText(null);
                        if (id == null || id.isBlank()) {
                            log.warn("REMOVE without instanceId from {}", ctx.sessionId());
                            return;
                        }
                        service.unregister(id);
                    }
                    default -> log.warn("Unknown socket notification '{}' from {}", notification, ctx.sessionId());
                }
            });
        });
    }
}
