package com.GlobeLine.series_cache.exception;

/**
 * Nothing is cached for the series and the refresh that should have filled the cache failed.
 */
public class NoDataException extends RuntimeException {

	private final String seriesKey;

	public NoDataException(String seriesKey, Throwable cause) {
		super("No data available for series " + seriesKey
				+ (cause != null ? " - refresh failed: " + cause.getMessage() : ""), cause);
		this.seriesKey = seriesKey;
	}

	public String getSeriesKey() {
		return seriesKey;
	}
}
