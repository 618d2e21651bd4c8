package com.GlobeLine.series_cache.service;

import java.time.Instant;

public record FetchLogEntry(
		String seriesKey,
		Instant timestamp,
		boolean success,
		int observationCount,
		String errorMessage) {
}
