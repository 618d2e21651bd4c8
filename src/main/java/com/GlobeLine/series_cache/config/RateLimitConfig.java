package com.GlobeLine.series_cache.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.resilience4j.micrometer.tagged.TaggedRateLimiterMetrics;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;

import com.GlobeLine.series_cache.ratelimit.EndpointRateLimiter;

@Configuration
public class RateLimitConfig {

	/**
	 * One limiter per endpoint group, created lazily from the shared default config.
	 * A zero timeout makes {@code acquirePermission()} a non-blocking try that never reserves.
	 */
	@Bean
	public RateLimiterRegistry upstreamRateLimiterRegistry(EcbApiProperties properties, MeterRegistry meterRegistry) {
		EcbApiProperties.RateLimit rateLimit = properties.rateLimit();
		RateLimiterConfig config = RateLimiterConfig.custom()
				.limitForPeriod(rateLimit.limitForPeriod())
				.limitRefreshPeriod(rateLimit.limitRefreshPeriod())
				.timeoutDuration(Duration.ZERO)
				.build();

		RateLimiterRegistry registry = RateLimiterRegistry.of(config);
		TaggedRateLimiterMetrics.ofRateLimiterRegistry(registry).bindTo(meterRegistry);
		return registry;
	}

	@Bean
	public EndpointRateLimiter endpointRateLimiter(RateLimiterRegistry upstreamRateLimiterRegistry,
			EcbApiProperties properties) {
		return new EndpointRateLimiter(upstreamRateLimiterRegistry, properties.rateLimit().pollInterval());
	}
}
