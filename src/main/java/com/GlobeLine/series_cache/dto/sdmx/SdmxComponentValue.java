package com.GlobeLine.series_cache.dto.sdmx;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SdmxComponentValue(
		@JsonProperty("id") String id,
		@JsonProperty("name") String name,
		@JsonProperty("start") String start,
		@JsonProperty("end") String end) {
}
