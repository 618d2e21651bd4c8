package com.GlobeLine.series_cache.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.GlobeLine.series_cache.exception.RetryExhaustedException;
import com.GlobeLine.series_cache.exception.SeriesNotFoundException;
import com.GlobeLine.series_cache.exception.UpstreamRateLimitedException;
import com.GlobeLine.series_cache.exception.UpstreamTransportException;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Unit tests for RetryPolicy, run on virtual time so backoff delays can be asserted exactly.
 */
class RetryPolicyTest {

	@Test
	void execute_TransientFailures_BacksOffExponentiallyThenGivesUp() {
		// Arrange
		RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(10), 0);
		AtomicInteger attempts = new AtomicInteger();
		Mono<String> operation = Mono.defer(() -> {
			attempts.incrementAndGet();
			return Mono.error(new UpstreamTransportException("EUR_USD_DAILY", "HTTP 503", 503, null));
		});

		// Act & Assert: attempts at t=0, t=100ms and t=300ms
		StepVerifier.withVirtualTime(() -> policy.execute(operation))
				.expectSubscription()
				.then(() -> assertThat(attempts).hasValue(1))
				.expectNoEvent(Duration.ofMillis(99))
				.thenAwait(Duration.ofMillis(1))
				.then(() -> assertThat(attempts).hasValue(2))
				.expectNoEvent(Duration.ofMillis(199))
				.thenAwait(Duration.ofMillis(1))
				.expectErrorSatisfies(error -> {
					assertThat(error).isInstanceOf(RetryExhaustedException.class);
					assertThat(((RetryExhaustedException) error).getAttempts()).isEqualTo(3);
					assertThat(error.getCause()).isInstanceOf(UpstreamTransportException.class);
				})
				.verify();

		assertThat(attempts).hasValue(3);
	}

	@Test
	void execute_DelayIsCappedAtMaxDelay() {
		// Arrange
		RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(100), Duration.ofMillis(150), 0);
		AtomicInteger attempts = new AtomicInteger();
		Mono<String> operation = Mono.defer(() -> {
			attempts.incrementAndGet();
			return Mono.error(new UpstreamRateLimitedException("EUR_USD_DAILY", null));
		});

		// Act & Assert: delays of 100, 150 and 150ms
		StepVerifier.withVirtualTime(() -> policy.execute(operation))
				.expectSubscription()
				.thenAwait(Duration.ofMillis(100))
				.then(() -> assertThat(attempts).hasValue(2))
				.thenAwait(Duration.ofMillis(150))
				.then(() -> assertThat(attempts).hasValue(3))
				.expectNoEvent(Duration.ofMillis(149))
				.thenAwait(Duration.ofMillis(1))
				.expectError(RetryExhaustedException.class)
				.verify();
	}

	@Test
	void execute_TransientFailureThenSuccess_ReturnsValue() {
		// Arrange
		RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 0);
		AtomicInteger attempts = new AtomicInteger();
		Mono<String> operation = Mono.defer(() -> attempts.incrementAndGet() == 1
				? Mono.error(new UpstreamRateLimitedException("EUR_USD_DAILY", null))
				: Mono.just("payload"));

		// Act & Assert
		StepVerifier.withVirtualTime(() -> policy.execute(operation))
				.expectSubscription()
				.thenAwait(Duration.ofMillis(100))
				.expectNext("payload")
				.verifyComplete();
	}

	@Test
	void execute_PermanentFailure_FailsImmediately() {
		// Arrange
		RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 0);
		AtomicInteger attempts = new AtomicInteger();
		Mono<String> operation = Mono.defer(() -> {
			attempts.incrementAndGet();
			return Mono.error(new SeriesNotFoundException("EUR_USD_DAILY", null));
		});

		// Act & Assert
		StepVerifier.withVirtualTime(() -> policy.execute(operation))
				.expectError(SeriesNotFoundException.class)
				.verify();

		assertThat(attempts).hasValue(1);
	}

	@Test
	void constructor_ZeroAttempts_IsRejected() {
		assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofMillis(100), Duration.ofSeconds(1), 0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void isTransient_ClassifiesByExceptionType() {
		assertThat(RetryPolicy.isTransient(new UpstreamRateLimitedException("K", null))).isTrue();
		assertThat(RetryPolicy.isTransient(new UpstreamTransportException("K", "down", null, null))).isTrue();
		assertThat(RetryPolicy.isTransient(new SeriesNotFoundException("K", null))).isFalse();
		assertThat(RetryPolicy.isTransient(new IllegalStateException("bug"))).isFalse();
	}
}
