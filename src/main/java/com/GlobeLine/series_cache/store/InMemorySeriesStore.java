package com.GlobeLine.series_cache.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import com.GlobeLine.series_cache.domain.FetchWindow;
import com.GlobeLine.series_cache.domain.Observation;
import com.GlobeLine.series_cache.domain.SeriesDescriptor;

/**
 * Process local series store.
 * Each series owns a period-ordered map guarded by its own read/write lock: a merge holds the
 * write lock for the whole batch, readers take the read lock and copy out what they need.
 */
@Repository
public class InMemorySeriesStore implements SeriesStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemorySeriesStore.class);

	private final Map<String, SeriesDescriptor> descriptors = new ConcurrentHashMap<>();
	private final Map<String, SeriesData> data = new ConcurrentHashMap<>();

	@Override
	public Optional<SeriesDescriptor> get(String seriesKey) {
		return Optional.ofNullable(descriptors.get(seriesKey));
	}

	@Override
	public void put(SeriesDescriptor descriptor) {
		descriptors.put(descriptor.seriesKey(), descriptor);
	}

	@Override
	public List<Observation> listObservations(String seriesKey, FetchWindow window) {
		SeriesData series = data.get(seriesKey);
		if (series == null) {
			return List.of();
		}
		series.lock.readLock().lock();
		try {
			List<Observation> result = new ArrayList<>();
			for (Observation observation : series.observations.values()) {
				if (window.contains(observation)) {
					result.add(observation);
				}
			}
			return result;
		} finally {
			series.lock.readLock().unlock();
		}
	}

	@Override
	public MergeResult mergeObservations(String seriesKey, List<Observation> batch) {
		if (batch.isEmpty()) {
			return MergeResult.EMPTY;
		}
		for (Observation observation : batch) {
			if (!seriesKey.equals(observation.seriesKey())) {
				throw new IllegalArgumentException("Observation for " + observation.seriesKey()
						+ " cannot be merged into series " + seriesKey);
			}
		}

		SeriesData series = data.computeIfAbsent(seriesKey, key -> new SeriesData());
		int inserted = 0;
		int updated = 0;
		int unchanged = 0;

		series.lock.writeLock().lock();
		try {
			for (Observation incoming : batch) {
				Observation existing = series.observations.get(incoming.period());
				if (existing == null) {
					series.observations.put(incoming.period(), incoming);
					inserted++;
				} else if (incoming.supersedes(existing)) {
					series.observations.put(incoming.period(), incoming);
					updated++;
				} else {
					unchanged++;
				}
			}
		} finally {
			series.lock.writeLock().unlock();
		}

		logger.debug("Merged batch into {}: {} inserted, {} updated, {} unchanged",
				seriesKey, inserted, updated, unchanged);
		return new MergeResult(inserted, updated, unchanged);
	}

	@Override
	public List<SeriesDescriptor> listDescriptors() {
		return List.copyOf(descriptors.values());
	}

	@Override
	public int countObservations(String seriesKey) {
		SeriesData series = data.get(seriesKey);
		if (series == null) {
			return 0;
		}
		series.lock.readLock().lock();
		try {
			return series.observations.size();
		} finally {
			series.lock.readLock().unlock();
		}
	}

	private static final class SeriesData {
		private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
		private final NavigableMap<String, Observation> observations = new TreeMap<>();
	}
}
