package com.GlobeLine.series_cache.dto;

import java.time.Instant;
import java.util.List;

import com.GlobeLine.series_cache.domain.SeriesDescriptor;

public record StoreStatistics(
		int seriesCount,
		long totalObservations,
		List<SeriesDescriptor> latestUpdates,
		Instant lastSuccessfulRefresh) {
}
