package com.GlobeLine.series_cache.connectors;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;

import reactor.core.publisher.Mono;

/**
 * Logs every SDMX exchange against the series it was made for.
 * {@link EcbClient} tags each request with the series key and the endpoint group whose budget paid for it.
 */
public class SdmxExchangeLogger implements ExchangeFilterFunction {

	public static final String SERIES_KEY_ATTRIBUTE = SdmxExchangeLogger.class.getName() + ".seriesKey";
	public static final String ENDPOINT_GROUP_ATTRIBUTE = SdmxExchangeLogger.class.getName() + ".endpointGroup";

	private static final Logger logger = LoggerFactory.getLogger(SdmxExchangeLogger.class);

	@Override
	public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
		Instant startTime = Instant.now();
		String seriesKey = (String) request.attribute(SERIES_KEY_ATTRIBUTE).orElse("untagged");
		String endpointGroup = (String) request.attribute(ENDPOINT_GROUP_ATTRIBUTE).orElse("-");
		String resource = request.url().getRawPath();

		logger.debug("SDMX request for series {} [{}]: {}", seriesKey, endpointGroup, request.url());

		return next.exchange(request)
				.doOnSuccess(response -> logResponse(seriesKey, endpointGroup, resource, response,
						Duration.between(startTime, Instant.now())))
				.doOnError(error -> logger.warn("SDMX request for series {} [{}] did not complete after {}ms: {}",
						seriesKey, endpointGroup, Duration.between(startTime, Instant.now()).toMillis(),
						error.getMessage()));
	}

	private void logResponse(String seriesKey, String endpointGroup, String resource, ClientResponse response,
			Duration took) {
		int status = response.statusCode().value();
		if (status == 404) {
			// the data API answers 404 when no series matches the key or the window holds no observations
			logger.info("SDMX resource {} has no data for series {} ({}ms)", resource, seriesKey, took.toMillis());
		} else if (status == 429) {
			logger.warn("SDMX rate limit hit for series {} on endpoint group {}, Retry-After: {}",
					seriesKey, endpointGroup,
					response.headers().header(HttpHeaders.RETRY_AFTER).stream().findFirst().orElse("none"));
		} else if (response.statusCode().is5xxServerError()) {
			logger.warn("SDMX server error {} for series {} at {} ({}ms)",
					status, seriesKey, resource, took.toMillis());
		} else if (response.statusCode().isError()) {
			logger.warn("SDMX request for series {} rejected with {} at {}", seriesKey, status, resource);
		} else if (logger.isDebugEnabled()) {
			logger.debug("SDMX response {} for series {}: {} in {}ms", status, seriesKey,
					response.headers().contentType().map(Object::toString).orElse("no content type"),
					took.toMillis());
		}
	}
}
