package com.GlobeLine.series_cache.connectors;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;

import com.GlobeLine.series_cache.config.EcbApiProperties;
import com.GlobeLine.series_cache.domain.FetchWindow;
import com.GlobeLine.series_cache.domain.FetchedSeries;
import com.GlobeLine.series_cache.domain.SeriesDefinition;
import com.GlobeLine.series_cache.exception.MalformedResponseException;
import com.GlobeLine.series_cache.exception.SeriesNotFoundException;
import com.GlobeLine.series_cache.exception.UpstreamException;
import com.GlobeLine.series_cache.exception.UpstreamRateLimitedException;
import com.GlobeLine.series_cache.exception.UpstreamRequestRejectedException;
import com.GlobeLine.series_cache.exception.UpstreamTransportException;
import com.GlobeLine.series_cache.mapper.SdmxObservationMapper;
import com.GlobeLine.series_cache.ratelimit.EndpointRateLimiter;
import com.GlobeLine.series_cache.retry.RetryPolicy;

import reactor.core.publisher.Mono;

/**
 * Client for the ECB SDMX data API.
 * Every HTTP attempt (including retries) first takes a permit from the endpoint group's budget.
 */
@Component
public class EcbClient {

	private static final Logger logger = LoggerFactory.getLogger(EcbClient.class);

	private static final String SERIES_PATH = "/{dataflow}/{dimensionKey}";

	private final WebClient ecbWebClient;
	private final EndpointRateLimiter rateLimiter;
	private final RetryPolicy retryPolicy;
	private final SdmxObservationMapper mapper;
	private final String format;

	public EcbClient(
			@Qualifier("ecbWebClient") WebClient ecbWebClient,
			EndpointRateLimiter rateLimiter,
			RetryPolicy retryPolicy,
			SdmxObservationMapper mapper,
			EcbApiProperties properties) {
		this.ecbWebClient = ecbWebClient;
		this.rateLimiter = rateLimiter;
		this.retryPolicy = retryPolicy;
		this.mapper = mapper;
		this.format = properties.format();
	}

	/**
	 * Fetches the observations of a series inside a date window.
	 *
	 * @param definition upstream coordinates of the series
	 * @param window     inclusive date range sent as startPeriod/endPeriod
	 * @return Mono with the decoded series, observations ordered by period
	 */
	public Mono<FetchedSeries> fetchSeries(SeriesDefinition definition, FetchWindow window) {
		logger.info("Fetching series {} ({}) from {} to {}",
				definition.seriesKey(), definition.upstreamId(), window.start(), window.end());
		return execute(definition, uriBuilder -> uriBuilder
				.path(SERIES_PATH)
				.queryParam("format", format)
				.queryParam("startPeriod", window.start())
				.queryParam("endPeriod", window.end())
				.build(definition.dataflow(), definition.dimensionKey()))
				.doOnSuccess(fetched -> logger.info("Fetched {} observations for {}",
						fetched.observations().size(), definition.seriesKey()));
	}

	/**
	 * Asks only for the latest observation. Used to check that the upstream answers.
	 */
	public Mono<FetchedSeries> probe(SeriesDefinition definition) {
		return execute(definition, uriBuilder -> uriBuilder
				.path(SERIES_PATH)
				.queryParam("format", format)
				.queryParam("lastNObservations", 1)
				.build(definition.dataflow(), definition.dimensionKey()));
	}

	private Mono<FetchedSeries> execute(SeriesDefinition definition, Function<UriBuilder, URI> uri) {
		Mono<String> attempt = rateLimiter.acquire(definition.endpointGroup())
				.then(Mono.defer(() -> ecbWebClient.get()
						.uri(uri)
						.attribute(SdmxExchangeLogger.SERIES_KEY_ATTRIBUTE, definition.seriesKey())
						.attribute(SdmxExchangeLogger.ENDPOINT_GROUP_ATTRIBUTE, definition.endpointGroup())
						.retrieve()
						.bodyToMono(String.class)))
				.switchIfEmpty(Mono.error(() -> new MalformedResponseException(
						definition.seriesKey(), "empty response body", definition.upstreamId() + "@empty")))
				.onErrorMap(ex -> !(ex instanceof UpstreamException), ex -> classify(definition, ex));

		return retryPolicy.execute(attempt)
				.map(payload -> mapper.map(definition, payload));
	}

	private Throwable classify(SeriesDefinition definition, Throwable error) {
		String seriesKey = definition.seriesKey();
		if (error instanceof WebClientResponseException responseError) {
			int status = responseError.getStatusCode().value();
			if (status == 404) {
				return new SeriesNotFoundException(seriesKey, responseError);
			}
			if (status == 429) {
				return new UpstreamRateLimitedException(seriesKey, responseError);
			}
			if (responseError.getStatusCode().is5xxServerError()) {
				return new UpstreamTransportException(seriesKey,
						"Upstream server error " + status + " for series " + seriesKey, status, responseError);
			}
			return new UpstreamRequestRejectedException(seriesKey, status, responseError);
		}
		if (error instanceof WebClientRequestException || error instanceof TimeoutException
				|| error instanceof IOException) {
			return new UpstreamTransportException(seriesKey,
					"Transport failure for series " + seriesKey + ": " + error.getMessage(), null, error);
		}
		return error;
	}
}
