package space.ketterling.forecastgraph.service;

import space.ketterling.forecastgraph.model.ForecastPayload;

/**
 * Receives deliveries for display instances, keyed by instance id.
 */
public interface ForecastListener {

    void onForecast(String instanceId, ForecastPayload payload);

    /**
     * Called once per fetch invocation whose retries were exhausted.
     */
    void onError(String instanceId, String error);
}
