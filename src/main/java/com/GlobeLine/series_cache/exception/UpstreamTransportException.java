package com.GlobeLine.series_cache.exception;

/**
 * Connection failures, timeouts and 5xx answers from the upstream.
 */
public class UpstreamTransportException extends UpstreamException {

	private final Integer statusCode;

	public UpstreamTransportException(String seriesKey, String message, Integer statusCode, Throwable cause) {
		super(seriesKey, message, cause);
		this.statusCode = statusCode;
	}

	/**
	 * @return HTTP status when the server answered, null for connection level failures
	 */
	public Integer getStatusCode() {
		return statusCode;
	}

	@Override
	public boolean isTransient() {
		return true;
	}
}
