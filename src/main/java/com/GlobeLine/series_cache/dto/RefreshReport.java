package com.GlobeLine.series_cache.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.GlobeLine.series_cache.service.RefreshOutcome;

/**
 * Per-key outcomes of a refreshAll pass.
 */
public record RefreshReport(
		List<RefreshOutcome> outcomes,
		Instant startedAt,
		Instant finishedAt) {

	public RefreshReport {
		outcomes = List.copyOf(outcomes);
	}

	public long successful() {
		return outcomes.stream().filter(outcome -> !outcome.isFailed()).count();
	}

	public long failed() {
		return outcomes.stream().filter(RefreshOutcome::isFailed).count();
	}

	public Duration duration() {
		return Duration.between(startedAt, finishedAt);
	}
}
