package space.ketterling.forecastgraph.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks call outcomes and latency for upstream endpoints (NWS points, NWS
 * gridpoints) plus how many fetches were retried or ended in an error.
 *
 * <p>
 * Uses a rolling 60-minute window of per-minute buckets to compute a basic
 * health status per endpoint.
 * </p>
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, EndpointBuckets> ENDPOINTS = new ConcurrentHashMap<>();

    /**
     * Utility class; no instances.
     */
    private ExternalApiMetrics() {
    }

    /**
     * Records one upstream call outcome and its latency.
     */
    public static void record(String endpoint, boolean success, long latencyMs) {
        if (endpoint == null || endpoint.isBlank())
            return;
        bucketsFor(endpoint).record(Kind.CALL, success, latencyMs);
    }

    /**
     * Records that a failed fetch was scheduled for another attempt.
     */
    public static void recordRetry(String endpoint) {
        bucketsFor(endpoint).record(Kind.RETRY, true, 0L);
    }

    /**
     * Records that a fetch exhausted its retries and surfaced an error.
     */
    public static void recordExhausted(String endpoint) {
        bucketsFor(endpoint).record(Kind.EXHAUSTED, true, 0L);
    }

    /**
     * Returns per-endpoint snapshots, sorted by endpoint name.
     */
    public static Map<String, EndpointSnapshot> snapshot() {
        Map<String, EndpointSnapshot> out = new TreeMap<>();
        for (var e : ENDPOINTS.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot());
        }
        return out;
    }

    /**
     * Returns the rolling window size (minutes) used for metrics.
     */
    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Drops all recorded data.
     */
    public static void reset() {
        ENDPOINTS.clear();
    }

    private static EndpointBuckets bucketsFor(String endpoint) {
        return ENDPOINTS.computeIfAbsent(endpoint, k -> new EndpointBuckets());
    }

    private enum Kind {
        CALL, RETRY, EXHAUSTED
    }

    /**
     * Summary for a single endpoint over the last window.
     */
    public record EndpointSnapshot(
            long calls,
            long failures,
            double failurePct,
            double avgLatencyMs,
            long retries,
            long exhausted,
            String status) {
    }

    /**
     * Ring buffer of per-minute counters for an endpoint.
     */
    private static final class EndpointBuckets {
        private final long[] minute = new long[WINDOW_MINUTES];
        private final long[] calls = new long[WINDOW_MINUTES];
        private final long[] failures = new long[WINDOW_MINUTES];
        private final long[] latencyMs = new long[WINDOW_MINUTES];
        private final long[] retries = new long[WINDOW_MINUTES];
        private final long[] exhausted = new long[WINDOW_MINUTES];

        private synchronized void record(Kind kind, boolean success, long latency) {
            long nowMin = System.currentTimeMillis() / 60000L;
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                calls[idx] = 0L;
                failures[idx] = 0L;
                latencyMs[idx] = 0L;
                retries[idx] = 0L;
                exhausted[idx] = 0L;
            }
            switch (kind) {
                case CALL -> {
                    calls[idx] += 1L;
                    latencyMs[idx] += Math.max(0L, latency);
                    if (!success)
                        failures[idx] += 1L;
                }
                case RETRY -> retries[idx] += 1L;
                case EXHAUSTED -> exhausted[idx] += 1L;
            }
        }

        private synchronized EndpointSnapshot snapshot() {
            long nowMin = System.currentTimeMillis() / 60000L;
            long callSum = 0L;
            long failSum = 0L;
            long latencySum = 0L;
            long retrySum = 0L;
            long exhaustedSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || (nowMin - minute[i]) >= WINDOW_MINUTES)
                    continue;
                callSum += calls[i];
                failSum += failures[i];
                latencySum += latencyMs[i];
                retrySum += retries[i];
                exhaustedSum += exhausted[i];
            }
            double failurePct = callSum == 0 ? 0.0 : (failSum * 100.0) / callSum;
            double avgLatency = callSum == 0 ? 0.0 : (double) latencySum / callSum;
            String status;
            if (callSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new EndpointSnapshot(callSum, failSum, failurePct, avgLatency, retrySum, exhaustedSum, status);
        }
    }
}
