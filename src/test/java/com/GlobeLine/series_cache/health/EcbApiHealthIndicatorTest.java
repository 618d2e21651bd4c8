package com.GlobeLine.series_cache.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.GlobeLine.series_cache.config.EcbApiProperties;
import com.GlobeLine.series_cache.config.SeriesCacheProperties;
import com.GlobeLine.series_cache.connectors.EcbClient;
import com.GlobeLine.series_cache.domain.FetchedSeries;
import com.GlobeLine.series_cache.domain.SeriesFrequency;
import com.GlobeLine.series_cache.exception.RetryExhaustedException;
import com.GlobeLine.series_cache.exception.SeriesNotFoundException;
import com.GlobeLine.series_cache.exception.UpstreamTransportException;
import com.GlobeLine.series_cache.service.SeriesCatalog;
import com.GlobeLine.series_cache.support.TestSeriesCacheProperties;

import reactor.core.publisher.Mono;

class EcbApiHealthIndicatorTest {

	@Mock
	private EcbClient ecbClient;

	private EcbApiHealthIndicator healthIndicator;

	@BeforeEach
	void setUp() {
		MockitoAnnotations.openMocks(this);
		SeriesCacheProperties cacheProperties = TestSeriesCacheProperties.create();
		EcbApiProperties apiProperties = new EcbApiProperties(
				"https://data-api.ecb.europa.eu/service/data", "jsondata", "test-agent",
				Duration.ofSeconds(1), Duration.ofSeconds(5),
				new EcbApiProperties.Retry(1, Duration.ofMillis(10), Duration.ofMillis(10), 0),
				new EcbApiProperties.RateLimit(10, Duration.ofSeconds(1), Duration.ofMillis(10)));
		healthIndicator = new EcbApiHealthIndicator(ecbClient, new SeriesCatalog(cacheProperties), apiProperties,
				cacheProperties);
	}

	@Test
	void health_ProbeSucceeds_IsUp() {
		// Arrange
		when(ecbClient.probe(any())).thenReturn(Mono.just(
				new FetchedSeries("EUR_USD_DAILY", "US dollar/Euro", "US dollar", SeriesFrequency.DAILY, List.of())));

		// Act
		Health health = healthIndicator.health();

		// Assert
		assertThat(health.getStatus()).isEqualTo(Status.UP);
		assertThat(health.getDetails()).containsEntry("healthCheckSeries", "EUR_USD_DAILY");
	}

	@Test
	void health_UpstreamUnavailable_IsDown() {
		// Arrange
		when(ecbClient.probe(any())).thenReturn(Mono.error(new RetryExhaustedException(3,
				new UpstreamTransportException("EUR_USD_DAILY", "HTTP 503", 503, null))));

		// Act
		Health health = healthIndicator.health();

		// Assert
		assertThat(health.getStatus()).isEqualTo(Status.DOWN);
		assertThat(health.getDetails()).containsEntry("errorType", "RetryExhaustedException");
	}

	@Test
	void health_ProbeSeriesMissing_ApiStillUp() {
		// Arrange
		when(ecbClient.probe(any())).thenReturn(Mono.error(new SeriesNotFoundException("EUR_USD_DAILY", null)));

		// Act
		Health health = healthIndicator.health();

		// Assert
		assertThat(health.getStatus()).isEqualTo(Status.UP);
		assertThat(health.getDetails()).containsKey("warning");
	}

	@Test
	void health_ProbeHangs_IsDownWithTimeout() {
		// Arrange
		when(ecbClient.probe(any())).thenReturn(Mono.never());

		// Act
		Health health = healthIndicator.health();

		// Assert
		assertThat(health.getStatus()).isEqualTo(Status.DOWN);
		assertThat(health.getDetails()).containsEntry("error", "Request timeout");
	}
}
