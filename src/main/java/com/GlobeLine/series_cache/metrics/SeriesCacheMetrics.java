package com.GlobeLine.series_cache.metrics;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Centralized metrics for series cache operations.
 */
@Component
public class SeriesCacheMetrics {

	private final Counter freshHitCounter;
	private final Counter refreshStartedCounter;
	private final Counter inFlightSharingCounter;
	private final Counter refreshSucceededCounter;
	private final Counter refreshFailedCounter;
	private final Counter observationsInsertedCounter;
	private final Counter observationsUpdatedCounter;
	private final Counter staleServedCounter;
	private final Counter noDataCounter;
	private final Counter seriesNotFoundCounter;
	private final Counter timeoutCounter;
	private final Timer queryTimer;

	public SeriesCacheMetrics(MeterRegistry meterRegistry) {
		this.freshHitCounter = Counter.builder("series.cache.fresh.hits")
				.description("Queries answered from the store without a refresh")
				.register(meterRegistry);

		this.refreshStartedCounter = Counter.builder("series.cache.refreshes.started")
				.description("Upstream refreshes started")
				.register(meterRegistry);

		this.inFlightSharingCounter = Counter.builder("series.cache.inflight.sharing")
				.description("Callers that joined a refresh already in flight")
				.register(meterRegistry);

		this.refreshSucceededCounter = Counter.builder("series.cache.refreshes.completed")
				.tag("outcome", "success")
				.register(meterRegistry);

		this.refreshFailedCounter = Counter.builder("series.cache.refreshes.completed")
				.tag("outcome", "failure")
				.register(meterRegistry);

		this.observationsInsertedCounter = Counter.builder("series.cache.observations.merged")
				.tag("change", "inserted")
				.register(meterRegistry);

		this.observationsUpdatedCounter = Counter.builder("series.cache.observations.merged")
				.tag("change", "updated")
				.register(meterRegistry);

		this.staleServedCounter = Counter.builder("series.cache.stale.served")
				.description("Queries answered with stored data after a failed refresh")
				.register(meterRegistry);

		this.noDataCounter = Counter.builder("series.cache.errors.no_data")
				.tag("error_type", "no_data")
				.register(meterRegistry);

		this.seriesNotFoundCounter = Counter.builder("series.cache.errors.series_not_found")
				.tag("error_type", "series_not_found")
				.register(meterRegistry);

		this.timeoutCounter = Counter.builder("series.cache.errors.timeout")
				.tag("error_type", "timeout")
				.register(meterRegistry);

		this.queryTimer = Timer.builder("series.cache.query.duration")
				.description("Time taken to answer a series query (end-to-end)")
				.register(meterRegistry);
	}

	public void recordFreshHit() {
		freshHitCounter.increment();
	}

	public void recordRefreshStarted() {
		refreshStartedCounter.increment();
	}

	public void recordInFlightSharing() {
		inFlightSharingCounter.increment();
	}

	public void recordRefreshSucceeded(int inserted, int updated) {
		refreshSucceededCounter.increment();
		observationsInsertedCounter.increment(inserted);
		observationsUpdatedCounter.increment(updated);
	}

	public void recordRefreshFailed() {
		refreshFailedCounter.increment();
	}

	public void recordStaleServed() {
		staleServedCounter.increment();
	}

	public void recordNoData() {
		noDataCounter.increment();
	}

	public void recordSeriesNotFound() {
		seriesNotFoundCounter.increment();
	}

	public void recordTimeout() {
		timeoutCounter.increment();
	}

	public Timer.Sample startTimer() {
		return Timer.start();
	}

	public void stopTimer(Timer.Sample sample) {
		sample.stop(queryTimer);
	}
}
