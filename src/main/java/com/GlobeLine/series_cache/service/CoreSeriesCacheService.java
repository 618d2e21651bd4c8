package com.GlobeLine.series_cache.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.github.benmanes.caffeine.cache.Cache;

import com.GlobeLine.series_cache.config.SeriesCacheProperties;
import com.GlobeLine.series_cache.connectors.EcbClient;
import com.GlobeLine.series_cache.domain.FetchWindow;
import com.GlobeLine.series_cache.domain.FetchedSeries;
import com.GlobeLine.series_cache.domain.Observation;
import com.GlobeLine.series_cache.domain.SeriesDefinition;
import com.GlobeLine.series_cache.domain.SeriesDescriptor;
import com.GlobeLine.series_cache.domain.SeriesState;
import com.GlobeLine.series_cache.dto.RefreshReport;
import com.GlobeLine.series_cache.dto.SeriesResult;
import com.GlobeLine.series_cache.dto.StoreStatistics;
import com.GlobeLine.series_cache.exception.InvalidSeriesRequestException;
import com.GlobeLine.series_cache.exception.NoDataException;
import com.GlobeLine.series_cache.exception.RequestTimeoutException;
import com.GlobeLine.series_cache.exception.UpstreamException;
import com.GlobeLine.series_cache.store.MergeResult;
import com.GlobeLine.series_cache.store.SeriesStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Core cache coordination: decides when stored data is fresh enough, refreshes it from the
 * upstream otherwise, and always answers from the store.
 *
 * Per series key at most one refresh runs at a time. Callers arriving while it runs wait on the
 * same result handle. The refresh itself is subscribed independently of any caller, so a caller
 * that times out or cancels does not stop it and its result still lands in the store.
 */
@Component
public class CoreSeriesCacheService {

	private static final Logger logger = LoggerFactory.getLogger(CoreSeriesCacheService.class);

	private static final int LATEST_UPDATES_LIMIT = 5;

	private final EcbClient ecbClient;
	private final SeriesStore seriesStore;
	private final SeriesCatalog catalog;
	private final Cache<String, RefreshFailure> refreshFailureCache;
	private final FetchHistory fetchHistory;
	private final SeriesCacheProperties properties;
	private final Clock clock;
	private SeriesCacheEventObserver eventObserver;
	private final ConcurrentHashMap<String, Mono<RefreshOutcome>> inFlightRefreshes = new ConcurrentHashMap<>();

	public CoreSeriesCacheService(
			EcbClient ecbClient,
			SeriesStore seriesStore,
			SeriesCatalog catalog,
			Cache<String, RefreshFailure> refreshFailureCache,
			FetchHistory fetchHistory,
			SeriesCacheProperties properties,
			Clock clock) {
		this.ecbClient = ecbClient;
		this.seriesStore = seriesStore;
		this.catalog = catalog;
		this.refreshFailureCache = refreshFailureCache;
		this.fetchHistory = fetchHistory;
		this.properties = properties;
		this.clock = clock;
	}

	public void setObserver(SeriesCacheEventObserver observer) {
		this.eventObserver = observer;
	}

	public Mono<SeriesResult> getSeries(String seriesKey, FetchWindow window, boolean forceRefresh) {
		return getSeries(seriesKey, window, forceRefresh, properties.requestTimeout());
	}

	/**
	 * Returns the stored observations of a series inside {@code window}, refreshing first when the
	 * series is unknown, stale or {@code forceRefresh} is set.
	 *
	 * @param timeout how long this caller waits for a refresh before failing with
	 *                {@link RequestTimeoutException}
	 * @return the window as stored after the refresh attempt; fails with {@link NoDataException}
	 *         when nothing is stored and the refresh failed
	 */
	public Mono<SeriesResult> getSeries(String seriesKey, FetchWindow window, boolean forceRefresh,
			Duration timeout) {
		return Mono.defer(() -> {
			SeriesDefinition definition;
			try {
				if (window == null) {
					throw new InvalidSeriesRequestException("Fetch window must not be null");
				}
				definition = catalog.resolve(seriesKey);
			} catch (InvalidSeriesRequestException ex) {
				return Mono.error(ex);
			}

			String key = definition.seriesKey();
			if (!forceRefresh && stateOfResolved(key) == SeriesState.FRESH) {
				logger.debug("Fresh data for series: {}, serving from store", key);
				notifyObserver(SeriesCacheEventObserver::onFreshHit);
				return Mono.fromCallable(() -> readWindow(key, window, null));
			}

			return joinRefresh(definition, window, forceRefresh)
					.timeout(timeout)
					.onErrorMap(TimeoutException.class, ex -> new RequestTimeoutException(key, timeout, ex))
					.map(outcome -> readWindow(key, window, outcome));
		});
	}

	public Mono<RefreshReport> refreshAll(Collection<String> seriesKeys) {
		return refreshAll(seriesKeys, false);
	}

	/**
	 * Refreshes every key over the default lookback window. Fresh series are skipped unless
	 * {@code force} is set. Never fails: per-key problems become FAILED outcomes.
	 */
	public Mono<RefreshReport> refreshAll(Collection<String> seriesKeys, boolean force) {
		Instant startedAt = now();
		return Flux.fromIterable(seriesKeys)
				.distinct()
				.flatMap(key -> refreshOne(key, force), properties.refreshConcurrency())
				.collectList()
				.map(outcomes -> {
					RefreshReport report = new RefreshReport(outcomes, startedAt, now());
					logger.info("Data refresh completed: {}/{} successful in {}ms",
							report.successful(), outcomes.size(), report.duration().toMillis());
					return report;
				});
	}

	/**
	 * State of a series by catalog name or direct upstream key. Keys that cannot be resolved are UNKNOWN.
	 */
	public SeriesState stateOf(String seriesKey) {
		try {
			return stateOfResolved(catalog.resolve(seriesKey).seriesKey());
		} catch (InvalidSeriesRequestException ex) {
			return SeriesState.UNKNOWN;
		}
	}

	private SeriesState stateOfResolved(String seriesKey) {
		if (inFlightRefreshes.containsKey(seriesKey)) {
			return SeriesState.REFRESHING;
		}
		Optional<SeriesDescriptor> descriptor = seriesStore.get(seriesKey);
		if (descriptor.isEmpty()) {
			return SeriesState.UNKNOWN;
		}
		return isFresh(descriptor.get()) ? SeriesState.FRESH : SeriesState.STALE;
	}

	public StoreStatistics statistics() {
		List<SeriesDescriptor> descriptors = seriesStore.listDescriptors();
		long totalObservations = descriptors.stream()
				.mapToLong(descriptor -> seriesStore.countObservations(descriptor.seriesKey()))
				.sum();
		List<SeriesDescriptor> latestUpdates = descriptors.stream()
				.sorted(Comparator.comparing(SeriesDescriptor::lastSyncedAt).reversed())
				.limit(LATEST_UPDATES_LIMIT)
				.toList();
		return new StoreStatistics(descriptors.size(), totalObservations, latestUpdates,
				fetchHistory.lastSuccessfulRefresh().orElse(null));
	}

	public List<String> staleSeries() {
		return seriesStore.listDescriptors().stream()
				.filter(descriptor -> !isFresh(descriptor))
				.map(SeriesDescriptor::seriesKey)
				.sorted()
				.toList();
	}

	public int refreshesInFlight() {
		return inFlightRefreshes.size();
	}

	private Mono<RefreshOutcome> refreshOne(String seriesKey, boolean force) {
		SeriesDefinition definition;
		try {
			definition = catalog.resolve(seriesKey);
		} catch (InvalidSeriesRequestException ex) {
			logger.warn("Skipping invalid series key {}: {}", seriesKey, ex.getMessage());
			return Mono.just(RefreshOutcome.failed(seriesKey, ex, now()));
		}

		String key = definition.seriesKey();
		if (!force && stateOfResolved(key) == SeriesState.FRESH) {
			logger.info("Skipping {} - recently updated", key);
			return Mono.just(RefreshOutcome.skipped(key, now()));
		}

		Duration timeout = properties.requestTimeout();
		return Mono.defer(() -> joinRefresh(definition, defaultWindow(), force))
				.timeout(timeout)
				.onErrorResume(TimeoutException.class, ex -> Mono.just(
						RefreshOutcome.failed(key, new RequestTimeoutException(key, timeout, ex), now())));
	}

	/**
	 * Joins the refresh in flight for the key or starts one. The returned handle never fails;
	 * refresh errors arrive as FAILED outcomes.
	 */
	private Mono<RefreshOutcome> joinRefresh(SeriesDefinition definition, FetchWindow requested, boolean force) {
		String key = definition.seriesKey();

		Mono<RefreshOutcome> inFlight = inFlightRefreshes.get(key);
		if (inFlight != null) {
			logger.debug("Refresh in flight for series: {}, sharing its result", key);
			notifyObserver(SeriesCacheEventObserver::onInFlightSharing);
			return inFlight;
		}

		Sinks.One<RefreshOutcome> sink = Sinks.one();
		Mono<RefreshOutcome> handle = sink.asMono();
		Mono<RefreshOutcome> existing = inFlightRefreshes.putIfAbsent(key, handle);
		if (existing != null) {
			logger.debug("Another caller started the refresh for series: {}, using it", key);
			notifyObserver(SeriesCacheEventObserver::onInFlightSharing);
			return existing;
		}

		// a refresh may have completed between the caller's state check and taking the slot
		if (!force && isFreshNow(key)) {
			inFlightRefreshes.remove(key, handle);
			sink.tryEmitValue(RefreshOutcome.skipped(key, now()));
			return handle;
		}

		FetchWindow fetchWindow = requested.span(defaultWindow());
		logger.debug("Starting refresh for series: {} over {} to {}", key, fetchWindow.start(), fetchWindow.end());
		notifyObserver(SeriesCacheEventObserver::onRefreshStarted);

		refresh(definition, fetchWindow)
				.doFinally(signalType -> {
					inFlightRefreshes.remove(key, handle);
					logger.debug("Removed in-flight refresh for series: {} (signal: {})", key, signalType);
				})
				.subscribe(
						sink::tryEmitValue,
						error -> sink.tryEmitValue(recordFailure(definition, error)));
		return handle;
	}

	private Mono<RefreshOutcome> refresh(SeriesDefinition definition, FetchWindow window) {
		return ecbClient.fetchSeries(definition, window)
				.timeout(properties.refreshTimeout())
				.map(fetched -> merge(definition, fetched))
				.switchIfEmpty(Mono.fromSupplier(() -> recordFailure(definition,
						new IllegalStateException("Upstream client completed without a result"))))
				.onErrorResume(ex -> Mono.just(recordFailure(definition, ex)));
	}

	private RefreshOutcome merge(SeriesDefinition definition, FetchedSeries fetched) {
		String key = definition.seriesKey();
		MergeResult result = seriesStore.mergeObservations(key, fetched.observations());

		Instant syncedAt = now();
		String label = fetched.title() != null ? fetched.title() : definition.label();
		seriesStore.put(new SeriesDescriptor(key, label, fetched.unit(), fetched.frequency(), syncedAt));
		refreshFailureCache.invalidate(key);
		fetchHistory.record(new FetchLogEntry(key, syncedAt, true, fetched.observations().size(), null));

		logger.info("Refreshed series {}: {} fetched, {} inserted, {} updated, {} unchanged",
				key, fetched.observations().size(), result.inserted(), result.updated(), result.unchanged());
		notifyObserver(observer -> observer.onRefreshSucceeded(result.inserted(), result.updated()));
		return RefreshOutcome.refreshed(key, result, fetched.observations().size(), syncedAt);
	}

	private RefreshOutcome recordFailure(SeriesDefinition definition, Throwable error) {
		String key = definition.seriesKey();
		Instant failedAt = now();
		String message = error instanceof TimeoutException
				? "Refresh did not complete within " + properties.refreshTimeout().toMillis() + "ms"
				: error.getMessage();

		refreshFailureCache.put(key, new RefreshFailure(failedAt, message));
		fetchHistory.record(new FetchLogEntry(key, failedAt, false, 0, message));

		if (error instanceof UpstreamException || error instanceof TimeoutException) {
			logger.warn("Refresh failed for series {}: {}", key, message);
		} else {
			logger.error("Unexpected error refreshing series: {}", key, error);
		}
		notifyObserver(SeriesCacheEventObserver::onRefreshFailed);
		return RefreshOutcome.failed(key, error, failedAt);
	}

	private SeriesResult readWindow(String key, FetchWindow window, RefreshOutcome outcome) {
		Optional<SeriesDescriptor> descriptor = seriesStore.get(key);
		if (descriptor.isEmpty()) {
			logger.warn("No data available for series: {}", key);
			notifyObserver(SeriesCacheEventObserver::onNoData);
			throw new NoDataException(key, outcome != null ? outcome.failure() : null);
		}

		List<Observation> observations = seriesStore.listObservations(key, window);
		boolean refreshFailed = outcome != null && outcome.isFailed();
		String warning = null;
		if (refreshFailed) {
			warning = "Refresh failed, serving data synced at " + descriptor.get().lastSyncedAt()
					+ ": " + outcome.errorMessage();
			logger.info("Returning stale data for series: {}", key);
			notifyObserver(SeriesCacheEventObserver::onStaleServed);
		}
		boolean stale = refreshFailed || !isFresh(descriptor.get());
		return new SeriesResult(key, descriptor.get(), observations, stale, warning);
	}

	private boolean isFreshNow(String key) {
		return seriesStore.get(key).map(this::isFresh).orElse(false);
	}

	private boolean isFresh(SeriesDescriptor descriptor) {
		boolean expired = Duration.between(descriptor.lastSyncedAt(), now()).compareTo(properties.maxAge()) > 0;
		if (expired) {
			return false;
		}
		RefreshFailure failure = refreshFailureCache.getIfPresent(descriptor.seriesKey());
		return failure == null || failure.failedAt().isBefore(descriptor.lastSyncedAt());
	}

	private FetchWindow defaultWindow() {
		return FetchWindow.lastDays(LocalDate.now(clock), properties.defaultLookbackDays());
	}

	private Instant now() {
		return clock.instant();
	}

	private void notifyObserver(Consumer<SeriesCacheEventObserver> event) {
		if (eventObserver != null) {
			event.accept(eventObserver);
		}
	}
}
