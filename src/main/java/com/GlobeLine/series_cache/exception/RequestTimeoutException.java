package com.GlobeLine.series_cache.exception;

import java.time.Duration;

/**
 * The caller stopped waiting. A refresh started on its behalf keeps running.
 */
public class RequestTimeoutException extends RuntimeException {
	public RequestTimeoutException(String seriesKey, Duration timeout, Throwable cause) {
		super("Timed out after " + timeout.toMillis() + "ms waiting for series " + seriesKey, cause);
	}
}
