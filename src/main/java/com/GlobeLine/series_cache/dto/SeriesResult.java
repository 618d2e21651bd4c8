package com.GlobeLine.series_cache.dto;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

import com.GlobeLine.series_cache.domain.Observation;
import com.GlobeLine.series_cache.domain.SeriesDescriptor;

/**
 * Answer to a series query: what the store holds for the window after any refresh attempt.
 * {@code warning} is set when a refresh was attempted and failed, so the data may be stale.
 */
public record SeriesResult(
		@JsonProperty("seriesKey") String seriesKey,
		@JsonProperty("descriptor") SeriesDescriptor descriptor,
		@JsonProperty("observations") List<Observation> observations,
		@JsonProperty("stale") boolean stale,
		@JsonProperty("warning") String warning) {

	public SeriesResult {
		observations = List.copyOf(observations);
	}

	public Optional<String> warningMessage() {
		return Optional.ofNullable(warning);
	}

	/**
	 * Most recent observation in the window, if any.
	 */
	public Optional<Observation> latest() {
		return observations.isEmpty() ? Optional.empty() : Optional.of(observations.get(observations.size() - 1));
	}
}
