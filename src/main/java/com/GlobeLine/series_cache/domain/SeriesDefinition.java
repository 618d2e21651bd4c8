package com.GlobeLine.series_cache.domain;

/**
 * Where a logical series key lives upstream.
 *
 * @param seriesKey     key callers use (catalog name or direct upstream key)
 * @param dataflow      SDMX dataflow id, e.g. EXR
 * @param dimensionKey  dot separated dimension values, e.g. D.USD.EUR.SP00.A
 * @param label         human readable name used until the upstream provides a title
 * @param endpointGroup rate limit budget this series draws from
 */
public record SeriesDefinition(
		String seriesKey,
		String dataflow,
		String dimensionKey,
		String label,
		String endpointGroup) {

	public String upstreamId() {
		return dataflow + "." + dimensionKey;
	}

	/**
	 * Frequency encoded in the first dimension, the SDMX convention for ECB dataflows.
	 */
	public SeriesFrequency declaredFrequency() {
		int dot = dimensionKey.indexOf('.');
		return SeriesFrequency.fromCode(dot > 0 ? dimensionKey.substring(0, dot) : dimensionKey);
	}
}
