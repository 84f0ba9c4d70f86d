package space.ketterling.forecastgraph.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import space.ketterling.forecastgraph.config.AppConfig;
import space.ketterling.forecastgraph.metrics.ExternalApiMetrics;
import space.ketterling.forecastgraph.model.ForecastPayload;
import space.ketterling.forecastgraph.model.InstanceConfig;
import space.ketterling.forecastgraph.nws.GridForecastSource;
import space.ketterling.forecastgraph.nws.GridSeriesParser;
import space.ketterling.forecastgraph.nws.NwsClient;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns display-instance registration, recurring fetches, retry/backoff, the
 * grid and data caches, and delivery to the rendering layer.
 *
 * <p>
 * All bookkeeping runs on one worker executor. HTTP calls are asynchronous, so
 * fetches for several instances can be in flight at the same time while their
 * completions are still handled one at a time on the worker.
 * </p>
 */
public final class ForecastService {
    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);
    private static final String FETCH_METRIC = "FETCH";
    private static final int MAX_BACKOFF_SHIFT = 20;

    private final AppConfig cfg;
    private final GridForecastSource source;
    private final ForecastListener listener;
    private final ScheduledExecutorService worker;
    private final Clock clock;
    private final GridPointResolver resolver;
    private final ForecastNormalizer normalizer = new ForecastNormalizer();

    // coordinate key -> last good payload
    private final Map<String, ForecastPayload> dataCache = new ConcurrentHashMap<>();
    private final Map<String, InstanceState> instances = new ConcurrentHashMap<>();

    public ForecastService(AppConfig cfg,
            GridForecastSource source,
            ForecastListener listener,
            ScheduledExecutorService worker,
            Clock clock) {
        this.cfg = cfg;
        this.source = source;
        this.listener = listener;
        this.worker = worker;
        this.clock = clock;
        this.resolver = new GridPointResolver(source);
    }

    /**
     * Handles a config message from a display instance.
     *
     * <p>
     * The first message for an instance gets any cached payload for the same
     * coordinates (built with the same units and window) right away, then an
     * immediate fetch and a recurring one. Later messages for an instance that
     * is still registered are ignored.
     * </p>
     */
    public CompletableFuture<Void> register(InstanceConfig config) {
        return CompletableFuture.runAsync(() -> withInstance(config.instanceId(), () -> doRegister(config)), worker)
                .whenComplete((v, err) -> {
                    if (err != null)
                        log.error("Registration failed for {}", config.instanceId(), unwrap(err));
                });
    }

    /**
     * Stops the recurring fetch for an instance and forgets it. Fetches already
     * in flight finish but deliver nothing and do not retry.
     */
    public CompletableFuture<Boolean> unregister(String instanceId) {
        return CompletableFuture.supplyAsync(() -> {
            InstanceState state = instances.remove(instanceId);
            if (state == null)
                return false;
            state.scheduledRefresh().cancel(false);
            log.info("Unregistered instance {}", instanceId);
            return true;
        }, worker);
    }

    /**
     * Starts an out-of-schedule fetch for a registered instance.
     */
    public CompletableFuture<Boolean> refreshNow(String instanceId) {
        return CompletableFuture.supplyAsync(() -> {
            if (!instances.containsKey(instanceId))
                return false;
            withInstance(instanceId, () -> fetch(instanceId, 0));
            return true;
        }, worker);
    }

    /**
     * Last successfully normalized payload for a coordinate pair.
     */
    public Optional<ForecastPayload> cachedPayload(double lat, double lon) {
        return Optional.ofNullable(dataCache.get(NwsClient.coordinateKey(lat, lon)));
    }

    public Set<String> registeredInstances() {
        return new TreeSet<>(instances.keySet());
    }

    /**
     * Cancels every recurring fetch and shuts the worker down.
     */
    public void stop() {
        for (InstanceState state : instances.values()) {
            state.scheduledRefresh().cancel(false);
        }
        instances.clear();
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("Forecast worker did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Forecast service stopped");
    }

    // -------------------------
    // Worker-side steps
    // -------------------------
    private void doRegister(InstanceConfig config) {
        String id = config.instanceId();
        if (instances.containsKey(id)) {
            log.debug("Instance {} already registered", id);
            return;
        }

        String key = NwsClient.coordinateKey(config.latitude(), config.longitude());
        ForecastPayload cached = dataCache.get(key);
        if (cached != null && cached.matches(config.units(), config.hoursToShow())) {
            log.info("Serving cached forecast for {} to instance {}", key, id);
            deliverForecast(id, cached);
        }

        long intervalMs = Math.max(1L, config.updateInterval().toMillis());
        ScheduledFuture<?> task = worker.scheduleWithFixedDelay(
                safe(id), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        InstanceState state = new InstanceState(config, task);
        instances.put(id, state);
        log.info("Registered instance {} at {} (every {} ms, {} hours, {})",
                id, key, intervalMs, config.hoursToShow(), config.units().wireName());

        fetch(state, 0);
    }

    /**
     * Starts a fetch for whatever registration {@code instanceId} currently has.
     */
    private void fetch(String instanceId, int attempt) {
        InstanceState state = instances.get(instanceId);
        if (state == null)
            return;
        fetch(state, attempt);
    }

    /**
     * Runs one fetch attempt for one registration. Network steps run on the HTTP
     * client; parsing, normalization and completion handling hop back to the
     * worker.
     */
    private void fetch(InstanceState state, int attempt) {
        InstanceConfig c = state.config();
        String instanceId = c.instanceId();
        String key = NwsClient.coordinateKey(c.latitude(), c.longitude());

        resolver.resolve(c.latitude(), c.longitude())
                .thenCompose(source::gridData)
                .thenApplyAsync(root -> normalizer.normalize(
                        GridSeriesParser.parse(root), c.units(), c.hoursToShow(), clock.instant()), worker)
                .whenCompleteAsync((payload, err) -> withInstance(instanceId,
                        () -> onFetchComplete(state, key, attempt, payload, err)), worker);
    }

    /**
     * A registration is current until its instance is removed or registered
     * again.
     */
    private boolean isCurrent(InstanceState state) {
        return instances.get(state.config().instanceId()) == state;
    }

    private void onFetchComplete(InstanceState state, String key, int attempt, ForecastPayload payload,
            Throwable err) {
        String instanceId = state.config().instanceId();
        if (err == null) {
            dataCache.put(key, payload);
            if (!isCurrent(state)) {
                log.info("Registration of {} ended; cached forecast for {} without delivery", instanceId, key);
                return;
            }
            log.info("Delivering forecast for {} ({} hours, {} precipitation periods)",
                    key, payload.hourly().size(), payload.precipitationPeriods().size());
            deliverForecast(instanceId, payload);
            return;
        }

        String message = describe(unwrap(err));
        if (!isCurrent(state)) {
            log.info("Registration of {} ended; dropping failed fetch: {}", instanceId, message);
            return;
        }

        log.warn("Error fetching forecast for {}: {}", key, message);
        if (attempt < cfg.fetchMaxRetries()) {
            long delay = cfg.fetchRetryBaseDelay().toMillis() * (1L << Math.min(attempt, MAX_BACKOFF_SHIFT));
            log.info("Retrying {} in {} ms (attempt {}/{})", instanceId, delay, attempt + 1, cfg.fetchMaxRetries());
            ExternalApiMetrics.recordRetry(FETCH_METRIC);
            worker.schedule(() -> withInstance(instanceId, () -> retry(state, attempt + 1)),
                    delay, TimeUnit.MILLISECONDS);
        } else {
            log.error("Giving up on {} after {} attempts: {}", instanceId, attempt + 1, message);
            ExternalApiMetrics.recordExhausted(FETCH_METRIC);
            deliverError(instanceId, message);
        }
    }

    private void retry(InstanceState state, int attempt) {
        if (!isCurrent(state)) {
            log.info("Registration of {} ended; skipping retry {}", state.config().instanceId(), attempt);
            return;
        }
        fetch(state, attempt);
    }

    private void deliverForecast(String instanceId, ForecastPayload payload) {
        try {
            listener.onForecast(instanceId, payload);
        } catch (RuntimeException e) {
            log.warn("Forecast delivery to {} failed", instanceId, e);
        }
    }

    private void deliverError(String instanceId, String message) {
        try {
            listener.onError(instanceId, message);
        } catch (RuntimeException e) {
            log.warn("Error delivery to {} failed", instanceId, e);
        }
    }

    // -------------------------
    // Helpers
    // -------------------------
    /**
     * Wraps a recurring fetch so an exception is logged instead of cancelling
     * the schedule.
     */
    private Runnable safe(String instanceId) {
        return () -> withInstance(instanceId, () -> {
            try {
                fetch(instanceId, 0);
            } catch (RuntimeException e) {
                log.error("Scheduled fetch failed for {}", instanceId, e);
            }
        });
    }

    private static void withInstance(String instanceId, Runnable r) {
        MDC.put("instance", instanceId);
        try {
            r.run();
        } finally {
            MDC.remove("instance");
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }
}
