package com.GlobeLine.series_cache.ratelimit;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import reactor.core.publisher.Mono;

/**
 * Bounds outbound requests per endpoint group so unrelated dataflows do not starve each other.
 *
 * Waiting is done by polling a non-reserving {@link RateLimiter#acquirePermission()} on a timer:
 * a permit is only taken at the moment it is granted, so a subscriber that cancels while waiting
 * leaves the budget untouched.
 */
public class EndpointRateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(EndpointRateLimiter.class);

	private final RateLimiterRegistry registry;
	private final Duration pollInterval;

	public EndpointRateLimiter(RateLimiterRegistry registry, Duration pollInterval) {
		this.registry = registry;
		this.pollInterval = pollInterval;
	}

	/**
	 * Completes once a permit for {@code endpointGroup} has been granted.
	 */
	public Mono<Void> acquire(String endpointGroup) {
		RateLimiter limiter = registry.rateLimiter(endpointGroup);
		return Mono.defer(() -> limiter.acquirePermission() ? Mono.just(Boolean.TRUE) : Mono.<Boolean>empty())
				.repeatWhenEmpty(attempts -> attempts.concatMap(attempt -> {
					if (attempt == 0) {
						logger.debug("Rate budget for endpoint group {} exhausted, waiting for the next window",
								endpointGroup);
					}
					return Mono.delay(pollInterval);
				}))
				.then();
	}

	public int availablePermits(String endpointGroup) {
		return registry.rateLimiter(endpointGroup).getMetrics().getAvailablePermissions();
	}
}
