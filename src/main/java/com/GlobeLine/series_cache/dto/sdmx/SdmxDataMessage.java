package com.GlobeLine.series_cache.dto.sdmx;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Top level of an SDMX-JSON data message (ECB format=jsondata).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SdmxDataMessage(
		@JsonProperty("dataSets") List<SdmxDataSet> dataSets,
		@JsonProperty("structure") SdmxStructure structure) {
}
