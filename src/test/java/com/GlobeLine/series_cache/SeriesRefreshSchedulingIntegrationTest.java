package com.GlobeLine.series_cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskHolder;
import org.springframework.test.context.ActiveProfiles;

import com.GlobeLine.series_cache.dto.RefreshReport;
import com.GlobeLine.series_cache.scheduler.SeriesRefreshScheduler;
import com.GlobeLine.series_cache.service.SeriesCacheService;
import com.GlobeLine.series_cache.service.SeriesCatalog;

import reactor.core.publisher.Mono;

/**
 * Boots the context with background refresh switched on. The initial delay is long enough
 * that the registered task never fires while the test runs.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
		"series-cache.scheduler.enabled=true",
		"series-cache.scheduler.fixed-delay=30m",
		"series-cache.scheduler.initial-delay=1h"
})
@ActiveProfiles("test")
class SeriesRefreshSchedulingIntegrationTest {

	@MockBean
	private SeriesCacheService seriesCacheService;

	@Autowired
	private SeriesRefreshScheduler refreshScheduler;

	@Autowired
	private SeriesCatalog catalog;

	@Autowired
	private ScheduledTaskHolder scheduledTaskHolder;

	@Test
	void context_RegistersFixedDelayTaskFromBoundDurations() {
		assertThat(scheduledTaskHolder.getScheduledTasks())
				.map(scheduledTask -> scheduledTask.getTask())
				.filteredOn(FixedDelayTask.class::isInstance)
				.singleElement()
				.satisfies(task -> {
					FixedDelayTask fixedDelay = (FixedDelayTask) task;
					assertThat(fixedDelay.getIntervalDuration()).isEqualTo(Duration.ofMinutes(30));
					assertThat(fixedDelay.getInitialDelayDuration()).isEqualTo(Duration.ofHours(1));
				});
	}

	@Test
	void refreshConfiguredSeries_CallsRefreshAllWithCatalogKeys() {
		// Arrange
		Instant now = Instant.now();
		when(seriesCacheService.refreshAll(anyCollection(), anyBoolean()))
				.thenReturn(Mono.just(new RefreshReport(List.of(), now, now)));

		// Act
		refreshScheduler.refreshConfiguredSeries();

		// Assert
		assertThat(catalog.configuredKeys()).contains("EUR_USD_DAILY", "ECB_MAIN_RATE");
		verify(seriesCacheService).refreshAll(catalog.configuredKeys(), false);
	}
}
