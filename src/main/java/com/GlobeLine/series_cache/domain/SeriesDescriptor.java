package com.GlobeLine.series_cache.domain;

import java.time.Instant;

/**
 * Identity and sync state of one stored series.
 */
public record SeriesDescriptor(
		String seriesKey,
		String label,
		String unit,
		SeriesFrequency frequency,
		Instant lastSyncedAt) {
}
