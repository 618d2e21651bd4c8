package com.GlobeLine.series_cache.service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

import jakarta.annotation.PostConstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.GlobeLine.series_cache.domain.FetchWindow;
import com.GlobeLine.series_cache.domain.SeriesState;
import com.GlobeLine.series_cache.dto.RefreshReport;
import com.GlobeLine.series_cache.dto.SeriesResult;
import com.GlobeLine.series_cache.dto.StoreStatistics;
import com.GlobeLine.series_cache.exception.InvalidSeriesRequestException;
import com.GlobeLine.series_cache.exception.NoDataException;
import com.GlobeLine.series_cache.exception.RequestTimeoutException;
import com.GlobeLine.series_cache.exception.SeriesNotFoundException;
import com.GlobeLine.series_cache.metrics.SeriesCacheMetrics;

import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Mono;

/**
 * Decorator service that wraps CoreSeriesCacheService and adds metrics instrumentation.
 *
 * Implements Decorator Pattern (wraps core service with metrics) and Observer Pattern
 * (receives cache events from core service for metrics recording).
 */
@Service
public class SeriesCacheService implements SeriesCacheEventObserver {

	private static final Logger logger = LoggerFactory.getLogger(SeriesCacheService.class);

	private final CoreSeriesCacheService coreService;
	private final SeriesCacheMetrics metrics;

	public SeriesCacheService(CoreSeriesCacheService coreService, SeriesCacheMetrics metrics) {
		this.coreService = coreService;
		this.metrics = metrics;
	}

	@PostConstruct
	public void wireObserver() {
		coreService.setObserver(this);
	}

	@Override
	public void onFreshHit() {
		metrics.recordFreshHit();
	}

	@Override
	public void onRefreshStarted() {
		metrics.recordRefreshStarted();
	}

	@Override
	public void onInFlightSharing() {
		metrics.recordInFlightSharing();
	}

	@Override
	public void onRefreshSucceeded(int inserted, int updated) {
		metrics.recordRefreshSucceeded(inserted, updated);
	}

	@Override
	public void onRefreshFailed() {
		metrics.recordRefreshFailed();
	}

	@Override
	public void onStaleServed() {
		metrics.recordStaleServed();
	}

	@Override
	public void onNoData() {
		metrics.recordNoData();
	}

	public Mono<SeriesResult> getSeries(String seriesKey, FetchWindow window, boolean forceRefresh) {
		return instrument(seriesKey, coreService.getSeries(seriesKey, window, forceRefresh));
	}

	public Mono<SeriesResult> getSeries(String seriesKey, FetchWindow window, boolean forceRefresh,
			Duration timeout) {
		return instrument(seriesKey, coreService.getSeries(seriesKey, window, forceRefresh, timeout));
	}

	public Mono<RefreshReport> refreshAll(Collection<String> seriesKeys) {
		return refreshAll(seriesKeys, false);
	}

	public Mono<RefreshReport> refreshAll(Collection<String> seriesKeys, boolean force) {
		return coreService.refreshAll(seriesKeys, force)
				.doOnSuccess(report -> report.outcomes().stream()
						.filter(RefreshOutcome::isFailed)
						.forEach(outcome -> logger.warn("Refresh of {} failed: {}",
								outcome.seriesKey(), outcome.errorMessage())));
	}

	public SeriesState stateOf(String seriesKey) {
		return coreService.stateOf(seriesKey);
	}

	public StoreStatistics statistics() {
		return coreService.statistics();
	}

	public List<String> staleSeries() {
		return coreService.staleSeries();
	}

	private Mono<SeriesResult> instrument(String seriesKey, Mono<SeriesResult> result) {
		Timer.Sample sample = metrics.startTimer();
		return result
				.doOnSuccess(series -> {
					logger.debug("Answered query for series: {} ({} observations, stale={})",
							seriesKey, series.observations().size(), series.stale());
				})
				.doOnError(NoDataException.class, ex -> {
					if (ex.getCause() instanceof SeriesNotFoundException) {
						metrics.recordSeriesNotFound();
					}
				})
				.doOnError(RequestTimeoutException.class, ex -> {
					metrics.recordTimeout();
				})
				.doOnError(Exception.class, ex -> {
					if (!(ex instanceof NoDataException) &&
					    !(ex instanceof RequestTimeoutException) &&
					    !(ex instanceof InvalidSeriesRequestException)) {
						logger.error("Unexpected error type for series: {}", seriesKey, ex);
					}
				})
				.doFinally(signalType -> {
					metrics.stopTimer(sample);
					logger.debug("Completed query for series: {} with signal: {}", seriesKey, signalType);
				});
	}
}
