package com.GlobeLine.series_cache.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import com.GlobeLine.series_cache.service.RefreshFailure;

/**
 * Configuration for in-memory caching using Caffeine.
 * Observations themselves live in the series store; this cache only remembers the last failed
 * refresh per series so the coordinator can report it. Entries expire with the freshness
 * threshold, after which the series is stale by age anyway.
 */
@Configuration
public class CacheConfig {

	@Bean
	public Cache<String, RefreshFailure> refreshFailureCache(SeriesCacheProperties properties) {
		return Caffeine.newBuilder()
				.maximumSize(1000)
				.expireAfterWrite(properties.maxAge())
				.recordStats()
				.build();
	}
}
