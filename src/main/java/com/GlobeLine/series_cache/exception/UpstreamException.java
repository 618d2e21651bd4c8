package com.GlobeLine.series_cache.exception;

/**
 * Base type for failures reported by the ECB data API or the transport in front of it.
 * Subclasses decide whether the failure is worth another attempt.
 */
public abstract class UpstreamException extends RuntimeException {

	private final String seriesKey;

	protected UpstreamException(String seriesKey, String message, Throwable cause) {
		super(message, cause);
		this.seriesKey = seriesKey;
	}

	public String getSeriesKey() {
		return seriesKey;
	}

	/**
	 * @return true when the same request may succeed if sent again later
	 */
	public abstract boolean isTransient();
}
