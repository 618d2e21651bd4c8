package com.GlobeLine.series_cache.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SeriesCacheProperties.class)
public class SeriesCacheConfig {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
