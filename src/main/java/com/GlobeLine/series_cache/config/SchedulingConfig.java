package com.GlobeLine.series_cache.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import com.GlobeLine.series_cache.scheduler.SeriesRefreshScheduler;

/**
 * Registers the background catalog refresh, only when it is enabled.
 * Delays come from the bound {@link SeriesCacheProperties.Scheduler} durations.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "series-cache.scheduler", name = "enabled", havingValue = "true")
public class SchedulingConfig implements SchedulingConfigurer {

	private final SeriesRefreshScheduler refreshScheduler;
	private final SeriesCacheProperties.Scheduler schedule;

	public SchedulingConfig(SeriesRefreshScheduler refreshScheduler, SeriesCacheProperties properties) {
		this.refreshScheduler = refreshScheduler;
		this.schedule = properties.scheduler();
	}

	@Override
	public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
		taskRegistrar.addFixedDelayTask(new FixedDelayTask(
				refreshScheduler::refreshConfiguredSeries, schedule.fixedDelay(), schedule.initialDelay()));
	}
}
