package com.GlobeLine.series_cache.exception;

/**
 * Thrown when a caller asks for something malformed (bad window, unknown key format).
 * Raised before any network or store activity takes place.
 */
public class InvalidSeriesRequestException extends RuntimeException {
	public InvalidSeriesRequestException(String message) {
		super(message);
	}

	public InvalidSeriesRequestException(String message, Throwable cause) {
		super(message, cause);
	}
}
