package com.GlobeLine.series_cache.dto.sdmx;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Series keyed by their dimension index tuple, e.g. "0:0:0:0:0".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SdmxDataSet(
		@JsonProperty("action") String action,
		@JsonProperty("series") Map<String, SdmxSeries> series) {
}
