package com.GlobeLine.series_cache.health;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.github.benmanes.caffeine.cache.Cache;

import com.GlobeLine.series_cache.dto.StoreStatistics;
import com.GlobeLine.series_cache.service.CoreSeriesCacheService;
import com.GlobeLine.series_cache.service.RefreshFailure;

/**
 * Reports what the series store holds and which series are stale.
 * Stale data is still served, so staleness alone never takes the service down.
 */
@Component
public class SeriesStoreHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(SeriesStoreHealthIndicator.class);

	private final CoreSeriesCacheService cacheService;
	private final Cache<String, RefreshFailure> refreshFailureCache;

	public SeriesStoreHealthIndicator(CoreSeriesCacheService cacheService,
			Cache<String, RefreshFailure> refreshFailureCache) {
		this.cacheService = cacheService;
		this.refreshFailureCache = refreshFailureCache;
	}

	@Override
	public Health health() {
		try {
			StoreStatistics statistics = cacheService.statistics();
			List<String> staleSeries = cacheService.staleSeries();

			if (statistics.seriesCount() > 0 && staleSeries.size() == statistics.seriesCount()) {
				logger.warn("Series store health check: all {} series are stale", staleSeries.size());
			}

			return Health.up()
					.withDetail("store", "in-memory")
					.withDetail("seriesCount", statistics.seriesCount())
					.withDetail("totalObservations", statistics.totalObservations())
					.withDetail("staleSeries", staleSeries)
					.withDetail("refreshesInFlight", cacheService.refreshesInFlight())
					.withDetail("recentFailures", refreshFailureCache.estimatedSize())
					.withDetail("lastSuccessfulRefresh",
							statistics.lastSuccessfulRefresh() != null ? statistics.lastSuccessfulRefresh().toString() : "never")
					.build();

		} catch (Exception ex) {
			logger.error("Series store health check failed: Unexpected error", ex);
			return Health.down()
					.withDetail("store", "in-memory")
					.withDetail("error", "Unable to read series store")
					.withDetail("errorMessage", ex.getMessage())
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
