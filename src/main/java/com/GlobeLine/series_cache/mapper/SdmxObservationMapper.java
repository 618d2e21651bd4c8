package com.GlobeLine.series_cache.mapper;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.GlobeLine.series_cache.domain.FetchedSeries;
import com.GlobeLine.series_cache.domain.Observation;
import com.GlobeLine.series_cache.domain.ObservationStatus;
import com.GlobeLine.series_cache.domain.Period;
import com.GlobeLine.series_cache.domain.SeriesDefinition;
import com.GlobeLine.series_cache.domain.SeriesFrequency;
import com.GlobeLine.series_cache.dto.sdmx.SdmxComponent;
import com.GlobeLine.series_cache.dto.sdmx.SdmxComponentValue;
import com.GlobeLine.series_cache.dto.sdmx.SdmxComponents;
import com.GlobeLine.series_cache.dto.sdmx.SdmxDataMessage;
import com.GlobeLine.series_cache.dto.sdmx.SdmxDataSet;
import com.GlobeLine.series_cache.dto.sdmx.SdmxSeries;
import com.GlobeLine.series_cache.exception.MalformedResponseException;

/**
 * Decodes an SDMX-JSON payload into normalized observations.
 *
 * The decode is strict: anything that does not match the declared structure fails the whole
 * payload with {@link MalformedResponseException}, so callers either get every observation of
 * the batch or none. Null and NaN values are dropped.
 */
@Component
public class SdmxObservationMapper {

	private static final Logger logger = LoggerFactory.getLogger(SdmxObservationMapper.class);

	private static final String TIME_DIMENSION = "TIME_PERIOD";
	private static final String FREQUENCY_DIMENSION = "FREQ";
	private static final String STATUS_ATTRIBUTE = "OBS_STATUS";
	private static final String TITLE_ATTRIBUTE = "TITLE";
	private static final String UNIT_ATTRIBUTE = "UNIT";
	private static final int PAYLOAD_EXCERPT_LENGTH = 500;

	private final ObjectMapper objectMapper;

	public SdmxObservationMapper(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public FetchedSeries map(SeriesDefinition definition, String payload) {
		String reference = payloadReference(definition, payload);
		try {
			SdmxDataMessage message = decode(definition, payload, reference);
			return new Decoding(definition, reference).decode(message);
		} catch (MalformedResponseException ex) {
			logger.error("Malformed SDMX payload for series {} (ref={}, {} chars): {}",
					definition.seriesKey(), reference, payload.length(), ex.getMessage());
			if (logger.isDebugEnabled()) {
				logger.debug("Payload {}: {}", reference, excerpt(payload));
			}
			throw ex;
		}
	}

	private SdmxDataMessage decode(SeriesDefinition definition, String payload, String reference) {
		try {
			SdmxDataMessage message = objectMapper.readValue(payload, SdmxDataMessage.class);
			if (message == null) {
				throw new MalformedResponseException(definition.seriesKey(), "empty document", reference);
			}
			return message;
		} catch (JsonProcessingException ex) {
			throw new MalformedResponseException(definition.seriesKey(),
					"not a JSON document: " + ex.getOriginalMessage(), reference, ex);
		}
	}

	static String payloadReference(SeriesDefinition definition, String payload) {
		return definition.upstreamId() + "@" + Integer.toHexString(payload.hashCode());
	}

	private static String excerpt(String payload) {
		return payload.length() <= PAYLOAD_EXCERPT_LENGTH
				? payload
				: payload.substring(0, PAYLOAD_EXCERPT_LENGTH) + "...";
	}

	/**
	 * State of one decode run.
	 */
	private static final class Decoding {

		private final SeriesDefinition definition;
		private final String reference;

		Decoding(SeriesDefinition definition, String reference) {
			this.definition = definition;
			this.reference = reference;
		}

		FetchedSeries decode(SdmxDataMessage message) {
			if (message.dataSets() == null || message.dataSets().isEmpty()) {
				throw malformed("no dataSets in response");
			}
			if (message.structure() == null || message.structure().dimensions() == null) {
				throw malformed("structure block with dimensions is missing");
			}

			SdmxComponents dimensions = message.structure().dimensions();
			SdmxComponents attributes = message.structure().attributes() != null
					? message.structure().attributes()
					: new SdmxComponents(List.of(), List.of());
			List<SdmxComponent> seriesDimensions = dimensions.seriesOrEmpty();
			List<SdmxComponent> observationDimensions = dimensions.observationOrEmpty();
			if (seriesDimensions.isEmpty()) {
				throw malformed("no series dimensions declared");
			}
			int timePosition = timeDimensionPosition(observationDimensions);
			SdmxComponent timeDimension = observationDimensions.get(timePosition);

			SdmxDataSet dataSet = message.dataSets().get(0);
			if (dataSet == null || dataSet.series() == null) {
				throw malformed("data set has no series block");
			}

			Map<String, SdmxSeries> seriesByKey = new LinkedHashMap<>();
			Map<String, List<Integer>> indexesByKey = new LinkedHashMap<>();
			for (Map.Entry<String, SdmxSeries> entry : dataSet.series().entrySet()) {
				List<Integer> indexes = parseTuple(entry.getKey(), seriesDimensions.size(), "series key");
				String dimensionKey = dimensionKey(seriesDimensions, indexes);
				seriesByKey.put(dimensionKey, entry.getValue());
				indexesByKey.put(dimensionKey, indexes);
			}

			if (seriesByKey.isEmpty()) {
				logger.debug("Upstream returned no series for {}", definition.upstreamId());
				return new FetchedSeries(definition.seriesKey(), definition.label(), null,
						definition.declaredFrequency(), List.of());
			}

			String selectedKey = selectSeries(seriesByKey);
			SdmxSeries series = seriesByKey.get(selectedKey);
			if (series == null) {
				throw malformed("series " + selectedKey + " has no content");
			}
			List<Integer> seriesIndexes = indexesByKey.get(selectedKey);

			SeriesFrequency frequency = SdmxComponents.positionOf(seriesDimensions, FREQUENCY_DIMENSION)
					.map(position -> SeriesFrequency.fromCode(
							seriesDimensions.get(position).valuesOrEmpty().get(seriesIndexes.get(position)).id()))
					.filter(declared -> declared != SeriesFrequency.OTHER)
					.orElse(definition.declaredFrequency());

			String title = seriesAttribute(attributes.seriesOrEmpty(), series, TITLE_ATTRIBUTE)
					.orElse(definition.label());
			String unit = seriesAttribute(attributes.seriesOrEmpty(), series, UNIT_ATTRIBUTE).orElse(null);

			List<Observation> observations = decodeObservations(series, observationDimensions.size(), timePosition,
					timeDimension, attributes.observationOrEmpty(), frequency);

			return new FetchedSeries(definition.seriesKey(), title, unit, frequency, observations);
		}

		private int timeDimensionPosition(List<SdmxComponent> observationDimensions) {
			Optional<Integer> byId = SdmxComponents.positionOf(observationDimensions, TIME_DIMENSION);
			if (byId.isPresent()) {
				return byId.get();
			}
			if (observationDimensions.size() == 1) {
				return 0;
			}
			throw malformed("no " + TIME_DIMENSION + " observation dimension declared");
		}

		private String selectSeries(Map<String, SdmxSeries> seriesByKey) {
			for (String key : seriesByKey.keySet()) {
				if (key.equalsIgnoreCase(definition.dimensionKey())) {
					return key;
				}
			}
			if (seriesByKey.size() == 1) {
				String only = seriesByKey.keySet().iterator().next();
				logger.debug("Upstream series key {} differs from requested {}, using the only series returned",
						only, definition.dimensionKey());
				return only;
			}
			throw malformed("none of the " + seriesByKey.size() + " returned series matches "
					+ definition.dimensionKey());
		}

		private String dimensionKey(List<SdmxComponent> seriesDimensions, List<Integer> indexes) {
			Map<Integer, String> byPosition = new TreeMap<>();
			for (int i = 0; i < seriesDimensions.size(); i++) {
				SdmxComponent dimension = seriesDimensions.get(i);
				List<SdmxComponentValue> values = dimension.valuesOrEmpty();
				int index = indexes.get(i);
				if (index >= values.size() || values.get(index).id() == null) {
					throw malformed("series dimension " + dimension.id() + " has no value at index " + index);
				}
				int position = dimension.keyPosition() != null ? dimension.keyPosition() : i;
				byPosition.put(position, values.get(index).id());
			}
			return String.join(".", byPosition.values());
		}

		private Optional<String> seriesAttribute(List<SdmxComponent> seriesAttributes, SdmxSeries series,
				String attributeId) {
			return SdmxComponents.positionOf(seriesAttributes, attributeId)
					.flatMap(position -> {
						List<SdmxComponentValue> values = seriesAttributes.get(position).valuesOrEmpty();
						Integer valueIndex = series.attributes() != null && position < series.attributes().size()
								? series.attributes().get(position)
								: null;
						if (valueIndex != null && valueIndex >= 0 && valueIndex < values.size()) {
							return Optional.ofNullable(values.get(valueIndex).name());
						}
						// some payloads only declare the single value without indexing it
						return values.size() == 1 ? Optional.ofNullable(values.get(0).name()) : Optional.empty();
					});
		}

		private List<Observation> decodeObservations(SdmxSeries series, int observationDimensionCount,
				int timePosition, SdmxComponent timeDimension, List<SdmxComponent> observationAttributes,
				SeriesFrequency frequency) {
			if (series.observations() == null) {
				return List.of();
			}
			Optional<Integer> statusPosition = SdmxComponents.positionOf(observationAttributes, STATUS_ATTRIBUTE);

			Map<String, Observation> byPeriod = new LinkedHashMap<>();
			for (Map.Entry<String, JsonNode> entry : series.observations().entrySet()) {
				int index = parseTuple(entry.getKey(), observationDimensionCount, "observation key").get(timePosition);
				JsonNode cell = entry.getValue();
				if (cell == null || !cell.isArray()) {
					throw malformed("observation " + entry.getKey() + " is not an array");
				}

				BigDecimal value = decodeValue(entry.getKey(), cell.get(0));
				if (value == null) {
					continue;
				}

				String period = periodFor(timeDimension, index, frequency);
				ObservationStatus status = statusPosition
						.map(position -> decodeStatus(entry.getKey(), cell.get(position + 1),
								observationAttributes.get(position)))
						.orElse(null);

				Observation previous = byPeriod.put(period,
						new Observation(definition.seriesKey(), period, value, status));
				if (previous != null) {
					throw malformed("period " + period + " appears more than once");
				}
			}

			List<Observation> observations = new ArrayList<>(byPeriod.values());
			observations.sort(Comparator.comparing(Observation::period));
			return observations;
		}

		private BigDecimal decodeValue(String observationKey, JsonNode valueNode) {
			if (valueNode == null || valueNode.isNull()) {
				return null;
			}
			if (valueNode.isNumber()) {
				return valueNode.decimalValue();
			}
			if (valueNode.isTextual()) {
				String text = valueNode.asText().trim();
				if (text.isEmpty() || "NaN".equalsIgnoreCase(text)) {
					return null;
				}
				try {
					return new BigDecimal(text);
				} catch (NumberFormatException ex) {
					throw malformed("observation " + observationKey + " has non-numeric value '" + text + "'");
				}
			}
			throw malformed("observation " + observationKey + " has a value of type " + valueNode.getNodeType());
		}

		private ObservationStatus decodeStatus(String observationKey, JsonNode indexNode, SdmxComponent attribute) {
			if (indexNode == null || indexNode.isNull()) {
				return null;
			}
			if (!indexNode.canConvertToInt()) {
				throw malformed("observation " + observationKey + " has a non-integer status index");
			}
			int index = indexNode.asInt();
			List<SdmxComponentValue> values = attribute.valuesOrEmpty();
			if (index < 0 || index >= values.size()) {
				throw malformed("observation " + observationKey + " references undeclared status index " + index);
			}
			String code = values.get(index).id();
			Optional<ObservationStatus> status = ObservationStatus.fromCode(code);
			if (status.isEmpty()) {
				logger.debug("Unrecognised OBS_STATUS code {} for series {}", code, definition.seriesKey());
			}
			return status.orElse(null);
		}

		/**
		 * Declared period at the index when there is one, otherwise stepped from the first
		 * declared period using the series frequency.
		 */
		private String periodFor(SdmxComponent timeDimension, int index, SeriesFrequency frequency) {
			List<SdmxComponentValue> values = timeDimension.valuesOrEmpty();
			String period;
			if (index < values.size() && values.get(index).id() != null && !values.get(index).id().isBlank()) {
				period = values.get(index).id();
			} else {
				if (values.isEmpty() || values.get(0).id() == null || values.get(0).id().isBlank()) {
					throw malformed("observation index " + index + " has no declared period and no starting period");
				}
				try {
					period = frequency.periodAfter(values.get(0).id(), index);
				} catch (IllegalArgumentException ex) {
					throw malformed("cannot derive period for observation index " + index + ": " + ex.getMessage());
				}
			}
			try {
				Period.parse(period);
			} catch (IllegalArgumentException ex) {
				throw malformed(ex.getMessage());
			}
			return period;
		}

		private List<Integer> parseTuple(String key, int expectedParts, String what) {
			String[] parts = key.split(":", -1);
			if (parts.length != expectedParts) {
				throw malformed(what + " '" + key + "' has " + parts.length + " parts, expected " + expectedParts);
			}
			List<Integer> indexes = new ArrayList<>(parts.length);
			for (String part : parts) {
				try {
					int index = Integer.parseInt(part);
					if (index < 0) {
						throw malformed(what + " '" + key + "' has a negative index");
					}
					indexes.add(index);
				} catch (NumberFormatException ex) {
					throw malformed(what + " '" + key + "' is not an index tuple");
				}
			}
			return indexes;
		}

		private MalformedResponseException malformed(String message) {
			return new MalformedResponseException(definition.seriesKey(), message, reference);
		}
	}
}
