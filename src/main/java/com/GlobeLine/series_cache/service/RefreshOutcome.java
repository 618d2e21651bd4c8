package com.GlobeLine.series_cache.service;

import java.time.Instant;

import com.GlobeLine.series_cache.store.MergeResult;

/**
 * What happened to one series during a refresh pass.
 */
public record RefreshOutcome(
		String seriesKey,
		Status status,
		MergeResult merge,
		int fetchedObservations,
		Throwable failure,
		Instant completedAt) {

	public enum Status {
		REFRESHED,
		SKIPPED,
		FAILED
	}

	public static RefreshOutcome refreshed(String seriesKey, MergeResult merge, int fetched, Instant at) {
		return new RefreshOutcome(seriesKey, Status.REFRESHED, merge, fetched, null, at);
	}

	public static RefreshOutcome skipped(String seriesKey, Instant at) {
		return new RefreshOutcome(seriesKey, Status.SKIPPED, MergeResult.EMPTY, 0, null, at);
	}

	public static RefreshOutcome failed(String seriesKey, Throwable failure, Instant at) {
		return new RefreshOutcome(seriesKey, Status.FAILED, MergeResult.EMPTY, 0, failure, at);
	}

	public boolean isFailed() {
		return status == Status.FAILED;
	}

	public String errorMessage() {
		return failure != null ? failure.getMessage() : null;
	}
}
