package com.GlobeLine.series_cache.retry;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.GlobeLine.series_cache.exception.RetryExhaustedException;
import com.GlobeLine.series_cache.exception.UpstreamException;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Bounded exponential backoff around an upstream operation.
 * The delay before retry k is baseDelay * 2^(k-1), capped at maxDelay.
 * Only failures classified as transient are retried.
 */
public class RetryPolicy {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	private final int maxAttempts;
	private final Retry retrySpec;

	public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		this.maxAttempts = maxAttempts;
		this.retrySpec = Retry.backoff(maxAttempts - 1, baseDelay)
				.maxBackoff(maxDelay)
				.jitter(jitter)
				.filter(RetryPolicy::isTransient)
				.doBeforeRetry(signal -> logger.warn("Transient upstream failure (attempt {} of {}), retrying: {}",
						signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage()))
				.onRetryExhaustedThrow((spec, signal) -> {
					logger.error("Giving up after {} attempts: {}", signal.totalRetries() + 1,
							signal.failure().getMessage());
					return new RetryExhaustedException(signal.totalRetries() + 1, signal.failure());
				});
	}

	/**
	 * Subscribes to {@code operation} up to maxAttempts times. The operation must be lazy
	 * (re-executed on every subscription).
	 */
	public <T> Mono<T> execute(Mono<T> operation) {
		return operation.retryWhen(retrySpec);
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public static boolean isTransient(Throwable failure) {
		return failure instanceof UpstreamException upstreamFailure && upstreamFailure.isTransient();
	}
}
