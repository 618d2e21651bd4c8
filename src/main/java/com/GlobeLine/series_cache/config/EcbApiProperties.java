package com.GlobeLine.series_cache.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Binds ECB data API settings from application.properties (ecb.api.*).
 */
@ConfigurationProperties(prefix = "ecb.api")
@Validated
public record EcbApiProperties(
		@NotBlank @DefaultValue("https://data-api.ecb.europa.eu/service/data") String baseUrl,
		@NotBlank @DefaultValue("jsondata") String format,
		@DefaultValue("ECB-Series-Cache/1.0") String userAgent,
		@DefaultValue("5s") Duration connectTimeout,
		@DefaultValue("30s") Duration responseTimeout,
		@Valid @DefaultValue Retry retry,
		@Valid @DefaultValue RateLimit rateLimit) {

	/**
	 * @param maxAttempts total attempts including the first one
	 * @param baseDelay   delay before the first retry, doubled for each further retry
	 * @param maxDelay    upper bound for a single delay
	 * @param jitter      jitter factor in [0, 1]; 0 keeps delays strictly non-decreasing
	 */
	public record Retry(
			@Min(1) @Max(10) @DefaultValue("3") int maxAttempts,
			@DefaultValue("1s") Duration baseDelay,
			@DefaultValue("30s") Duration maxDelay,
			@DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0") double jitter) {
	}

	/**
	 * Budget applied to every endpoint group separately.
	 */
	public record RateLimit(
			@Min(1) @DefaultValue("10") int limitForPeriod,
			@DefaultValue("60s") Duration limitRefreshPeriod,
			@DefaultValue("250ms") Duration pollInterval) {
	}
}
