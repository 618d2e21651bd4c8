package com.GlobeLine.series_cache.domain;

import java.time.LocalDate;

import com.GlobeLine.series_cache.exception.InvalidSeriesRequestException;

/**
 * Date range requested by a caller. Both bounds are inclusive, like the upstream's
 * startPeriod/endPeriod parameters.
 */
public record FetchWindow(LocalDate start, LocalDate end) {

	public FetchWindow {
		if (start == null || end == null) {
			throw new InvalidSeriesRequestException("Fetch window bounds must not be null");
		}
		if (start.isAfter(end)) {
			throw new InvalidSeriesRequestException(
					"Fetch window start " + start + " is after end " + end);
		}
	}

	public static FetchWindow of(LocalDate start, LocalDate end) {
		return new FetchWindow(start, end);
	}

	/**
	 * Window covering {@code days} days back from {@code today}, both ends included.
	 */
	public static FetchWindow lastDays(LocalDate today, int days) {
		return new FetchWindow(today.minusDays(days), today);
	}

	public boolean contains(Observation observation) {
		return Period.parse(observation.period()).overlaps(this);
	}

	/**
	 * Smallest window covering both this window and {@code other}.
	 */
	public FetchWindow span(FetchWindow other) {
		LocalDate spanStart = start.isBefore(other.start) ? start : other.start;
		LocalDate spanEnd = end.isAfter(other.end) ? end : other.end;
		return new FetchWindow(spanStart, spanEnd);
	}
}
