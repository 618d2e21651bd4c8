package com.GlobeLine.series_cache.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.GlobeLine.series_cache.connectors.SdmxExchangeLogger;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(EcbApiProperties.class)
public class WebClientConfig {

	private static final int MAX_PAYLOAD_BYTES = 4 * 1024 * 1024;

	@Bean
	public WebClient ecbWebClient(EcbApiProperties properties) {
		HttpClient httpClient = HttpClient.create()
				.responseTimeout(properties.responseTimeout())
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());

		return WebClient.builder()
				.baseUrl(properties.baseUrl())
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				.codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_PAYLOAD_BYTES))
				.filter(new SdmxExchangeLogger())
				.build();
	}
}
