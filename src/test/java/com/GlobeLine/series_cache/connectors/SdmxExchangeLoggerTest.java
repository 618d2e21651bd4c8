package com.GlobeLine.series_cache.connectors;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.GlobeLine.series_cache.config.EcbApiProperties;
import com.GlobeLine.series_cache.config.WebClientConfig;
import com.GlobeLine.series_cache.domain.FetchWindow;
import com.GlobeLine.series_cache.domain.SeriesDefinition;
import com.GlobeLine.series_cache.exception.SeriesNotFoundException;
import com.GlobeLine.series_cache.mapper.SdmxObservationMapper;
import com.GlobeLine.series_cache.ratelimit.EndpointRateLimiter;
import com.GlobeLine.series_cache.retry.RetryPolicy;
import com.GlobeLine.series_cache.support.SdmxPayloads;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import reactor.test.StepVerifier;

/**
 * Runs EcbClient over the WebClient built by WebClientConfig, so the SDMX exchange
 * logging and default headers are exercised end to end.
 */
@ExtendWith(OutputCaptureExtension.class)
class SdmxExchangeLoggerTest {

	private static final SeriesDefinition EUR_USD = new SeriesDefinition(
			"EUR_USD_DAILY", "EXR", "D.USD.EUR.SP00.A", "EUR/USD daily", "EXR");
	private static final FetchWindow JANUARY = FetchWindow.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

	private MockWebServer mockWebServer;
	private EcbClient ecbClient;

	@BeforeEach
	void setUp() throws Exception {
		mockWebServer = new MockWebServer();
		mockWebServer.start();

		EcbApiProperties properties = new EcbApiProperties(
				mockWebServer.url("/").toString().replaceAll("/$", ""),
				"jsondata",
				"series-cache-test",
				Duration.ofSeconds(1),
				Duration.ofSeconds(5),
				new EcbApiProperties.Retry(3, Duration.ofMillis(10), Duration.ofMillis(50), 0),
				new EcbApiProperties.RateLimit(100, Duration.ofSeconds(1), Duration.ofMillis(10)));

		RateLimiterRegistry registry = RateLimiterRegistry.of(RateLimiterConfig.custom()
				.limitForPeriod(100)
				.limitRefreshPeriod(Duration.ofSeconds(1))
				.timeoutDuration(Duration.ZERO)
				.build());

		ecbClient = new EcbClient(
				new WebClientConfig().ecbWebClient(properties),
				new EndpointRateLimiter(registry, Duration.ofMillis(10)),
				new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), 0),
				new SdmxObservationMapper(new ObjectMapper()),
				properties);
	}

	@AfterEach
	void tearDown() throws Exception {
		mockWebServer.shutdown();
	}

	@Test
	void rateLimitedAttempt_IsLoggedWithSeriesAndEndpointGroup(CapturedOutput output) throws Exception {
		// Arrange
		mockWebServer.enqueue(new MockResponse().setResponseCode(429)
				.addHeader("Retry-After", "2")
				.setBody("Too Many Requests"));
		mockWebServer.enqueue(new MockResponse().setResponseCode(200)
				.setBody(SdmxPayloads.eurUsdDaily())
				.addHeader("Content-Type", "application/json"));

		// Act
		StepVerifier.create(ecbClient.fetchSeries(EUR_USD, JANUARY))
				.expectNextCount(1)
				.verifyComplete();

		// Assert
		assertThat(output.getAll())
				.contains("SDMX rate limit hit for series EUR_USD_DAILY on endpoint group EXR, Retry-After: 2");

		RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
		assertThat(request).isNotNull();
		assertThat(request.getHeader("User-Agent")).isEqualTo("series-cache-test");
		assertThat(request.getHeader("Accept")).isEqualTo("application/json");
	}

	@Test
	void missingSeries_IsLoggedWithRequestedResource(CapturedOutput output) {
		// Arrange
		mockWebServer.enqueue(new MockResponse().setResponseCode(404).setBody("No results found"));

		// Act
		StepVerifier.create(ecbClient.fetchSeries(EUR_USD, JANUARY))
				.expectError(SeriesNotFoundException.class)
				.verify(Duration.ofSeconds(5));

		// Assert
		assertThat(output.getAll())
				.contains("SDMX resource /EXR/D.USD.EUR.SP00.A has no data for series EUR_USD_DAILY");
	}
}
