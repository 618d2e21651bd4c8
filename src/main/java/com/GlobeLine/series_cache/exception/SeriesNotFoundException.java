package com.GlobeLine.series_cache.exception;

/**
 * The upstream does not recognise the requested series (HTTP 404).
 */
public class SeriesNotFoundException extends UpstreamException {
	public SeriesNotFoundException(String seriesKey, Throwable cause) {
		super(seriesKey, "Series not found: " + seriesKey, cause);
	}

	@Override
	public boolean isTransient() {
		return false;
	}
}
