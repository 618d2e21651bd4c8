package com.GlobeLine.series_cache.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.GlobeLine.series_cache.config.SeriesCacheProperties;
import com.GlobeLine.series_cache.domain.SeriesDefinition;
import com.GlobeLine.series_cache.exception.InvalidSeriesRequestException;

/**
 * Resolves the keys callers use into upstream coordinates.
 * Configured names (EUR_USD_DAILY) come first; otherwise a direct upstream key such as
 * {@code EXR.D.USD.EUR.SP00.A} is accepted as long as it names exactly one series.
 * A direct key that points at a configured series resolves to that catalog entry, so both
 * spellings share one cache slot.
 */
@Component
public class SeriesCatalog {

	private static final Pattern DIRECT_KEY = Pattern.compile("[A-Z][A-Z0-9_]*(\\.[A-Za-z0-9_]+)+");

	private final Map<String, SeriesDefinition> definitions;
	private final Map<String, SeriesDefinition> byUpstreamId;

	public SeriesCatalog(SeriesCacheProperties properties) {
		Map<String, SeriesDefinition> configured = new LinkedHashMap<>();
		properties.series().forEach((name, entry) -> {
			if (entry.dataflow() == null || entry.dimensionKey() == null) {
				throw new IllegalStateException("Series " + name + " needs both dataflow and dimension-key");
			}
			configured.put(name, new SeriesDefinition(
					name,
					entry.dataflow(),
					entry.dimensionKey(),
					entry.label() != null ? entry.label() : name,
					entry.endpointGroup() != null ? entry.endpointGroup() : entry.dataflow()));
		});
		this.definitions = Map.copyOf(configured);

		Map<String, SeriesDefinition> upstream = new LinkedHashMap<>();
		configured.values().forEach(definition -> {
			SeriesDefinition previous = upstream.putIfAbsent(definition.upstreamId(), definition);
			if (previous != null) {
				throw new IllegalStateException("Series " + previous.seriesKey() + " and " + definition.seriesKey()
						+ " both point at " + definition.upstreamId());
			}
		});
		this.byUpstreamId = Map.copyOf(upstream);
	}

	/**
	 * @throws InvalidSeriesRequestException when the key is neither configured nor a direct upstream key
	 */
	public SeriesDefinition resolve(String seriesKey) {
		if (seriesKey == null || seriesKey.isBlank()) {
			throw new InvalidSeriesRequestException("Series key must not be blank");
		}
		SeriesDefinition configured = definitions.get(seriesKey);
		if (configured != null) {
			return configured;
		}
		if (!DIRECT_KEY.matcher(seriesKey).matches()) {
			throw new InvalidSeriesRequestException("Unknown series key format: " + seriesKey);
		}
		SeriesDefinition aliased = byUpstreamId.get(seriesKey);
		if (aliased != null) {
			return aliased;
		}
		int dot = seriesKey.indexOf('.');
		String dataflow = seriesKey.substring(0, dot);
		return new SeriesDefinition(seriesKey, dataflow, seriesKey.substring(dot + 1), seriesKey, dataflow);
	}

	public List<String> configuredKeys() {
		return definitions.keySet().stream().sorted().toList();
	}
}
