package com.GlobeLine.series_cache.dto.sdmx;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SdmxStructure(
		@JsonProperty("name") String name,
		@JsonProperty("dimensions") SdmxComponents dimensions,
		@JsonProperty("attributes") SdmxComponents attributes) {
}
