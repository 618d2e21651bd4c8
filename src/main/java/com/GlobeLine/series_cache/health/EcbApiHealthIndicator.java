package com.GlobeLine.series_cache.health;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.GlobeLine.series_cache.config.EcbApiProperties;
import com.GlobeLine.series_cache.config.SeriesCacheProperties;
import com.GlobeLine.series_cache.connectors.EcbClient;
import com.GlobeLine.series_cache.domain.SeriesDefinition;
import com.GlobeLine.series_cache.exception.RetryExhaustedException;
import com.GlobeLine.series_cache.exception.SeriesNotFoundException;
import com.GlobeLine.series_cache.exception.UpstreamException;
import com.GlobeLine.series_cache.service.SeriesCatalog;

/**
 * Health indicator that checks the ECB data API answers.
 *
 * Asks for the latest observation of one well-known series with a short timeout so the health
 * endpoint is never blocked for long. The probe goes through the same rate limiter as refreshes.
 */
@Component
public class EcbApiHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(EcbApiHealthIndicator.class);

	private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

	private final EcbClient ecbClient;
	private final SeriesCatalog catalog;
	private final EcbApiProperties apiProperties;
	private final String healthCheckSeries;

	public EcbApiHealthIndicator(EcbClient ecbClient, SeriesCatalog catalog, EcbApiProperties apiProperties,
			SeriesCacheProperties cacheProperties) {
		this.ecbClient = ecbClient;
		this.catalog = catalog;
		this.apiProperties = apiProperties;
		this.healthCheckSeries = cacheProperties.healthCheckSeries();
	}

	@Override
	public Health health() {
		try {
			SeriesDefinition definition = catalog.resolve(healthCheckSeries);
			ecbClient.probe(definition)
					.timeout(HEALTH_CHECK_TIMEOUT)
					.doOnSuccess(fetched -> logger.debug("ECB API health check passed for series: {}", healthCheckSeries))
					.doOnError(error -> logger.warn("ECB API health check failed: {}", error.getMessage()))
					.block();

			return Health.up()
					.withDetail("api", "ECB data API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("status", "reachable")
					.withDetail("healthCheckSeries", healthCheckSeries)
					.build();

		} catch (SeriesNotFoundException ex) {
			// the API answered, only the probe series is wrong
			logger.warn("ECB API health check series {} not found upstream", healthCheckSeries);
			return Health.up()
					.withDetail("api", "ECB data API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("status", "reachable")
					.withDetail("warning", ex.getMessage())
					.build();

		} catch (UpstreamException | RetryExhaustedException ex) {
			logger.warn("ECB API health check failed: {}", ex.getMessage());
			return Health.down()
					.withDetail("api", "ECB data API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("error", ex.getMessage())
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();

		} catch (Exception ex) {
			if (ex.getCause() instanceof TimeoutException) {
				logger.warn("ECB API health check failed: Request timeout after {} seconds", HEALTH_CHECK_TIMEOUT.getSeconds());
				return Health.down()
						.withDetail("api", "ECB data API")
						.withDetail("baseUrl", apiProperties.baseUrl())
						.withDetail("error", "Request timeout")
						.withDetail("timeoutSeconds", HEALTH_CHECK_TIMEOUT.getSeconds())
						.build();
			}

			logger.error("ECB API health check failed: Unexpected error", ex);
			return Health.down()
					.withDetail("api", "ECB data API")
					.withDetail("baseUrl", apiProperties.baseUrl())
					.withDetail("error", ex.getMessage() != null ? ex.getMessage() : "Unknown error")
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
