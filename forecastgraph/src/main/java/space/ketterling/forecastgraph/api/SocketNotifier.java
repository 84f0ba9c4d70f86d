package space.ketterling.forecastgraph.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.javalin.websocket.WsContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.forecastgraph.model.ForecastPayload;
import space.ketterling.forecastgraph.service.ForecastListener;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes forecast deliveries to connected display clients as socket
 * notifications. Every session receives every notification; clients keep the
 * ones whose {@code instanceId} they own.
 */
public final class SocketNotifier implements ForecastListener {
    private static final Logger log = LoggerFactory.getLogger(SocketNotifier.class);

    public static final String DATA_NOTIFICATION = "WEATHER_GRAPH_DATA";
    public static final String ERROR_NOTIFICATION = "WEATHER_GRAPH_ERROR";

    private final ObjectMapper om;
    private final Set<WsContext> sessions = ConcurrentHashMap.newKeySet();

    public SocketNotifier(ObjectMapper om) {
        this.om = om;
    }

    void add(WsContext ctx) {
        sessions.add(ctx);
    }

    void remove(WsContext ctx) {
        sessions.remove(ctx);
    }

    int sessionCount() {
        return sessions.size();
    }

    @Override
    public void onForecast(String instanceId, ForecastPayload payload) {
        ObjectNode body = om.createObjectNode();
        body.put("instanceId", instanceId);
        body.set("data", om.valueToTree(payload));
        broadcast(DATA_NOTIFICATION, body);
    }

    @Override
    public void onError(String instanceId, String error) {
        ObjectNode body = om.createObjectNode();
        body.put("instanceId", instanceId);
        body.put("error", error);
        broadcast(ERROR_NOTIFICATION, body);
    }

    /**
     * Serializes {@code {notification, payload}} once and sends it to every
     * open session, dropping sessions that can no longer be written to.
     */
    private void broadcast(String notification, ObjectNode payload) {
        ObjectNode msg = om.createObjectNode();
        msg.put("notification", notification);
        msg.set("payload", payload);

        String text;
        try {
            text = om.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            log.error("Unable to serialize {} notification", notification, e);
            return;
        }

        for (WsContext ctx : sessions) {
            try {
                ctx.send(text);
            } catch (RuntimeException e) {
                log.warn("Dropping socket session {}: {}", ctx.sessionId(), e.getMessage());
                sessions.remove(ctx);
            }
        }
    }
}
