package com.GlobeLine.series_cache.dto.sdmx;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One series of a data set.
 * {@code attributes} holds value indexes for the series level attributes, {@code observations}
 * maps an observation index to {@code [value, attributeIndex...]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SdmxSeries(
		@JsonProperty("attributes") List<Integer> attributes,
		@JsonProperty("observations") Map<String, JsonNode> observations) {
}
