package com.GlobeLine.series_cache.domain;

import java.math.BigDecimal;

/**
 * One sample of a series. {@code (seriesKey, period)} identifies it; status may be null.
 */
public record Observation(
		String seriesKey,
		String period,
		BigDecimal value,
		ObservationStatus status) {

	public boolean isRevised() {
		return status == ObservationStatus.REVISED;
	}

	/**
	 * Whether this observation may replace {@code existing} for the same period.
	 * Only upstream revisions overwrite; anything else keeps the stored value.
	 */
	public boolean supersedes(Observation existing) {
		return isRevised() && !this.equals(existing);
	}
}
