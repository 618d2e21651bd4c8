package com.GlobeLine.series_cache.config;

import java.time.Duration;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Binds cache coordination settings (series-cache.*).
 * Series names keep their case when written with bracket notation, e.g.
 * {@code series-cache.series.[EUR_USD_DAILY].dataflow=EXR}.
 */
@ConfigurationProperties(prefix = "series-cache")
@Validated
public record SeriesCacheProperties(
		@DefaultValue("1h") Duration maxAge,
		@DefaultValue("30s") Duration requestTimeout,
		@DefaultValue("2m") Duration refreshTimeout,
		@Min(1) @DefaultValue("365") int defaultLookbackDays,
		@Min(1) @DefaultValue("4") int refreshConcurrency,
		@Min(1) @DefaultValue("500") int fetchHistorySize,
		@DefaultValue("EUR_USD_DAILY") String healthCheckSeries,
		@Valid @DefaultValue Scheduler scheduler,
		Map<String, SeriesEntry> series) {

	public SeriesCacheProperties {
		series = series == null ? Map.of() : Map.copyOf(series);
	}

	public record SeriesEntry(String dataflow, String dimensionKey, String label, String endpointGroup) {
	}

	public record Scheduler(
			@DefaultValue("false") boolean enabled,
			@DefaultValue("1h") Duration fixedDelay,
			@DefaultValue("10s") Duration initialDelay) {
	}
}
