package space.ketterling.forecastgraph.testutil;

import space.ketterling.forecastgraph.model.ForecastPayload;
import space.ketterling.forecastgraph.service.ForecastListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingListener implements ForecastListener {

    public record Delivery(String instanceId, ForecastPayload payload) {
    }

    public record Failure(String instanceId, String error) {
    }

    private final List<Delivery> forecasts = new CopyOnWriteArrayList<>();
    private final List<Failure> errors = new CopyOnWriteArrayList<>();

    @Override
    public void onForecast(String instanceId, ForecastPayload payload) {
        forecasts.add(new Delivery(instanceId, payload));
    }

    @Override
    public void onError(String instanceId, String error) {
        errors.add(new Failure(instanceId, error));
    }

    public List<Delivery> forecasts() {
        return forecasts;
    }

    public List<Failure> errors() {
        return errors;
    }

    public long forecastsFor(String instanceId) {
        return forecasts.stream().filter(d -> d.instanceId().equals(instanceId)).count();
    }
}
