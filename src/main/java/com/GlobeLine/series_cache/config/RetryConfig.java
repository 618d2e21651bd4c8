package com.GlobeLine.series_cache.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.GlobeLine.series_cache.retry.RetryPolicy;

@Configuration
public class RetryConfig {

	@Bean
	public RetryPolicy upstreamRetryPolicy(EcbApiProperties properties) {
		EcbApiProperties.Retry retry = properties.retry();
		return new RetryPolicy(retry.maxAttempts(), retry.baseDelay(), retry.maxDelay(), retry.jitter());
	}
}
