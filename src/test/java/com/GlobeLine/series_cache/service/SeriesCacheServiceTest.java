package com.GlobeLine.series_cache.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.github.benmanes.caffeine.cache.Caffeine;

import com.GlobeLine.series_cache.config.SeriesCacheProperties;
import com.GlobeLine.series_cache.connectors.EcbClient;
import com.GlobeLine.series_cache.domain.FetchWindow;
import com.GlobeLine.series_cache.domain.FetchedSeries;
import com.GlobeLine.series_cache.domain.Observation;
import com.GlobeLine.series_cache.domain.ObservationStatus;
import com.GlobeLine.series_cache.domain.SeriesFrequency;
import com.GlobeLine.series_cache.exception.NoDataException;
import com.GlobeLine.series_cache.exception.SeriesNotFoundException;
import com.GlobeLine.series_cache.metrics.SeriesCacheMetrics;
import com.GlobeLine.series_cache.store.InMemorySeriesStore;
import com.GlobeLine.series_cache.support.MutableClock;
import com.GlobeLine.series_cache.support.TestSeriesCacheProperties;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Unit tests for the metrics decorator around CoreSeriesCacheService.
 */
class SeriesCacheServiceTest {

	private static final String KEY = "EUR_USD_DAILY";
	private static final FetchWindow JUNE = FetchWindow.of(LocalDate.of(2024, 5, 27), LocalDate.of(2024, 6, 3));

	@Mock
	private EcbClient ecbClient;

	private SimpleMeterRegistry meterRegistry;
	private SeriesCacheService service;

	@BeforeEach
	void setUp() {
		MockitoAnnotations.openMocks(this);
		meterRegistry = new SimpleMeterRegistry();
		SeriesCacheProperties properties = TestSeriesCacheProperties.create();
		CoreSeriesCacheService coreService = new CoreSeriesCacheService(
				ecbClient,
				new InMemorySeriesStore(),
				new SeriesCatalog(properties),
				Caffeine.newBuilder().build(),
				new FetchHistory(properties),
				properties,
				new MutableClock(Instant.parse("2024-06-03T10:00:00Z")));
		service = new SeriesCacheService(coreService, new SeriesCacheMetrics(meterRegistry));
		service.wireObserver();
	}

	@Test
	void getSeries_RecordsRefreshThenFreshHit() {
		// Arrange
		when(ecbClient.fetchSeries(any(), any())).thenReturn(Mono.just(new FetchedSeries(KEY, "US dollar/Euro",
				"US dollar", SeriesFrequency.DAILY,
				List.of(new Observation(KEY, "2024-05-27", new BigDecimal("1.0858"), ObservationStatus.NORMAL)))));

		// Act
		service.getSeries(KEY, JUNE, false).block();
		service.getSeries(KEY, JUNE, false).block();

		// Assert
		assertThat(meterRegistry.get("series.cache.refreshes.started").counter().count()).isEqualTo(1.0);
		assertThat(meterRegistry.get("series.cache.refreshes.completed").tag("outcome", "success").counter().count())
				.isEqualTo(1.0);
		assertThat(meterRegistry.get("series.cache.observations.merged").tag("change", "inserted").counter().count())
				.isEqualTo(1.0);
		assertThat(meterRegistry.get("series.cache.fresh.hits").counter().count()).isEqualTo(1.0);
		assertThat(meterRegistry.get("series.cache.query.duration").timer().count()).isEqualTo(2);
	}

	@Test
	void getSeries_UnknownUpstreamSeries_RecordsNotFound() {
		// Arrange
		when(ecbClient.fetchSeries(any(), any())).thenReturn(Mono.error(new SeriesNotFoundException(KEY, null)));

		// Act & Assert
		StepVerifier.create(service.getSeries(KEY, JUNE, false))
				.expectError(NoDataException.class)
				.verify();

		assertThat(meterRegistry.get("series.cache.errors.no_data").counter().count()).isEqualTo(1.0);
		assertThat(meterRegistry.get("series.cache.errors.series_not_found").counter().count()).isEqualTo(1.0);
		assertThat(meterRegistry.get("series.cache.refreshes.completed").tag("outcome", "failure").counter().count())
				.isEqualTo(1.0);
	}
}
