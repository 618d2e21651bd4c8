package com.GlobeLine.series_cache.exception;

/**
 * A 4xx answer other than 404 and 429. Sending the same request again will not help.
 */
public class UpstreamRequestRejectedException extends UpstreamException {

	private final int statusCode;

	public UpstreamRequestRejectedException(String seriesKey, int statusCode, Throwable cause) {
		super(seriesKey, "Upstream rejected request for series " + seriesKey + " with HTTP " + statusCode, cause);
		this.statusCode = statusCode;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Override
	public boolean isTransient() {
		return false;
	}
}
