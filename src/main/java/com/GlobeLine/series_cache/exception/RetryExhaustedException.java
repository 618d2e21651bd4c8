package com.GlobeLine.series_cache.exception;

/**
 * A transient failure survived every attempt allowed by the retry policy.
 * The cause is the last failure observed.
 */
public class RetryExhaustedException extends RuntimeException {

	private final long attempts;

	public RetryExhaustedException(long attempts, Throwable lastFailure) {
		super("Retries exhausted after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
		this.attempts = attempts;
	}

	public long getAttempts() {
		return attempts;
	}
}
