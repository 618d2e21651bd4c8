package com.GlobeLine.series_cache.domain;

import java.util.List;

/**
 * Fully decoded upstream answer for one series. Never partially populated.
 */
public record FetchedSeries(
		String seriesKey,
		String title,
		String unit,
		SeriesFrequency frequency,
		List<Observation> observations) {

	public FetchedSeries {
		observations = List.copyOf(observations);
	}
}
