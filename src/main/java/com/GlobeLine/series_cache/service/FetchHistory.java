package com.GlobeLine.series_cache.service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.GlobeLine.series_cache.config.SeriesCacheProperties;

/**
 * Bounded log of refresh attempts, newest last.
 */
@Component
public class FetchHistory {

	private final int capacity;
	private final Deque<FetchLogEntry> entries = new ArrayDeque<>();

	public FetchHistory(SeriesCacheProperties properties) {
		this.capacity = properties.fetchHistorySize();
	}

	public synchronized void record(FetchLogEntry entry) {
		if (entries.size() == capacity) {
			entries.removeFirst();
		}
		entries.addLast(entry);
	}

	public synchronized List<FetchLogEntry> recent() {
		return new ArrayList<>(entries);
	}

	public synchronized Optional<Instant> lastSuccessfulRefresh() {
		var iterator = entries.descendingIterator();
		while (iterator.hasNext()) {
			FetchLogEntry entry = iterator.next();
			if (entry.success()) {
				return Optional.of(entry.timestamp());
			}
		}
		return Optional.empty();
	}
}
