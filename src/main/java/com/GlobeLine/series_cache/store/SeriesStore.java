package com.GlobeLine.series_cache.store;

import java.util.List;
import java.util.Optional;

import com.GlobeLine.series_cache.domain.FetchWindow;
import com.GlobeLine.series_cache.domain.Observation;
import com.GlobeLine.series_cache.domain.SeriesDescriptor;

/**
 * Durable keyed storage of series descriptors and observations.
 * The cache coordinator is the single writer; reads may happen from any thread.
 */
public interface SeriesStore {

	Optional<SeriesDescriptor> get(String seriesKey);

	/**
	 * Creates or replaces the descriptor for {@code descriptor.seriesKey()}.
	 */
	void put(SeriesDescriptor descriptor);

	/**
	 * Observations of the series overlapping {@code window}, ordered by period.
	 * Empty when the series is unknown or has nothing in the window.
	 */
	List<Observation> listObservations(String seriesKey, FetchWindow window);

	/**
	 * Merges a batch atomically: absent periods are inserted, present periods are replaced only
	 * when the incoming observation supersedes the stored one, everything else is left alone.
	 * Readers never observe part of a batch.
	 */
	MergeResult mergeObservations(String seriesKey, List<Observation> batch);

	List<SeriesDescriptor> listDescriptors();

	int countObservations(String seriesKey);
}
