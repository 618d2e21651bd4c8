package com.GlobeLine.series_cache.scheduler;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.GlobeLine.series_cache.config.SeriesCacheProperties;
import com.GlobeLine.series_cache.dto.RefreshReport;
import com.GlobeLine.series_cache.service.SeriesCacheService;
import com.GlobeLine.series_cache.service.SeriesCatalog;

/**
 * Periodically refreshes every configured series that has gone stale.
 * Only registered when {@code series-cache.scheduler.enabled=true}; the delay is wired in
 * {@link com.GlobeLine.series_cache.config.SchedulingConfig}.
 */
@Component
@ConditionalOnProperty(prefix = "series-cache.scheduler", name = "enabled", havingValue = "true")
public class SeriesRefreshScheduler {

	private static final Logger logger = LoggerFactory.getLogger(SeriesRefreshScheduler.class);

	private final SeriesCacheService cacheService;
	private final SeriesCatalog catalog;
	private final Duration refreshTimeout;

	public SeriesRefreshScheduler(SeriesCacheService cacheService, SeriesCatalog catalog,
			SeriesCacheProperties properties) {
		this.cacheService = cacheService;
		this.catalog = catalog;
		this.refreshTimeout = properties.refreshTimeout();
	}

	public void refreshConfiguredSeries() {
		logger.info("Starting scheduled refresh of {} configured series", catalog.configuredKeys().size());
		try {
			RefreshReport report = cacheService.refreshAll(catalog.configuredKeys(), false)
					.block(refreshTimeout.multipliedBy(2));
			if (report != null) {
				logger.info("Scheduled refresh finished: {} succeeded, {} failed", report.successful(), report.failed());
			}
		} catch (RuntimeException ex) {
			logger.error("Scheduled refresh failed", ex);
		}
	}
}
