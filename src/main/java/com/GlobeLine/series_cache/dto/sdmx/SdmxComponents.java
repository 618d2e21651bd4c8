package com.GlobeLine.series_cache.dto.sdmx;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dimensions or attributes declared at series and observation level, in positional order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SdmxComponents(
		@JsonProperty("series") List<SdmxComponent> series,
		@JsonProperty("observation") List<SdmxComponent> observation) {

	public List<SdmxComponent> seriesOrEmpty() {
		return series != null ? series : List.of();
	}

	public List<SdmxComponent> observationOrEmpty() {
		return observation != null ? observation : List.of();
	}

	public static Optional<Integer> positionOf(List<SdmxComponent> components, String id) {
		for (int i = 0; i < components.size(); i++) {
			if (id.equals(components.get(i).id())) {
				return Optional.of(i);
			}
		}
		return Optional.empty();
	}
}
