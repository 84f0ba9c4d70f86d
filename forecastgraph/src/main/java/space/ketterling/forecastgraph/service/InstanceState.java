package space.ketterling.forecastgraph.service;

import space.ketterling.forecastgraph.model.InstanceConfig;

import java.util.concurrent.ScheduledFuture;

/**
 * A registered display instance and its recurring refresh.
 */
record InstanceState(InstanceConfig config, ScheduledFuture<?> scheduledRefresh) {
}
