/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for ForecastGraph, which normalizes NWS gridpoint
* forecasts into hourly chart series and precipitation periods for display clients.
*
* Startup flow loads configuration, builds the NWS client and the single forecast
* worker, then starts the API server that display clients register through;
* program also handles a graceful shutdown.
*/

package space.ketterling.forecastgraph;

import space.ketterling.forecastgraph.api.ApiServer;
import space.ketterling.forecastgraph.api.SocketNotifier;
import space.ketterling.forecastgraph.config.AppConfig;
import space.ketterling.forecastgraph.nws.NwsClient;
import space.ketterling.forecastgraph.service.ForecastService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();

        ObjectMapper om = new ObjectMapper();

        // HTTP client (NWS)
        NwsClient nwsClient = new NwsClient(cfg, om);

        // One worker for every display instance
        ScheduledExecutorService worker = Executors
                .newSingleThreadScheduledExecutor(r -> new Thread(r, "forecast-worker"));

        SocketNotifier notifier = new SocketNotifier(om);
        ForecastService service = new ForecastService(cfg, nwsClient, notifier, worker, Clock.systemUTC());

        ApiServer api = new ApiServer(cfg, om, service, notifier);
        api.start();
        log.info("API server started on port {}", api.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            api.stop();
            service.stop();
        }, "shutdown"));
    }
}
