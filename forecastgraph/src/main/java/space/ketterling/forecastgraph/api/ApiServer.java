/*
* Copyright 2025 Taylor Ketterling
* API Server for ForecastGraph, the NWS grid forecast normalization service.
* utalizes Javalin for the HTTP and WebSocket endpoints display clients talk to.
* uses Jackson for JSON processing.
*/

package space.ketterling.forecastgraph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.forecastgraph.config.AppConfig;
import space.ketterling.forecastgraph.service.ForecastService;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final ForecastService service;
    private final SocketNotifier notifier;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, ForecastService service, SocketNotifier notifier) {
        this.cfg = cfg;
        this.om = om;
        this.service = service;
        this.notifier = notifier;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.jsonMapper(new JavalinJackson(om, false));
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        // JSON error instead of the default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesMetrics.register(this);
        ApiRoutesInstances.register(this);
        ApiRoutesSocket.register(this);

        app.start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /**
     * Port actually bound; differs from config when started on port 0.
     */
    public int port() {
        return app == null ? -1 : app.port();
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    AppConfig cfg() {
        return cfg;
    }

    ForecastService service() {
        return service;
    }

    SocketNotifier notifier() {
        return notifier;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    static boolean isLatLonValid(Double lat, Double lon) {
        if (lat == null || lon == null)
            return false;
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }

    static Double parseDouble(String s, Double def) {
        if (s == null || s.isBlank())
            return def;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
