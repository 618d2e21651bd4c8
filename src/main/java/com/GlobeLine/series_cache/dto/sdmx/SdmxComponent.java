package com.GlobeLine.series_cache.dto.sdmx;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SdmxComponent(
		@JsonProperty("id") String id,
		@JsonProperty("name") String name,
		@JsonProperty("keyPosition") Integer keyPosition,
		@JsonProperty("role") String role,
		@JsonProperty("values") List<SdmxComponentValue> values) {

	public List<SdmxComponentValue> valuesOrEmpty() {
		return values != null ? values : List.of();
	}
}
