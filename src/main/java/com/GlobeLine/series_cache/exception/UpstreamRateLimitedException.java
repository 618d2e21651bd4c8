package com.GlobeLine.series_cache.exception;

/**
 * The upstream explicitly throttled us (HTTP 429). Independent of the local rate limiter.
 */
public class UpstreamRateLimitedException extends UpstreamException {
	public UpstreamRateLimitedException(String seriesKey, Throwable cause) {
		super(seriesKey, "Upstream rate limit exceeded for series: " + seriesKey, cause);
	}

	@Override
	public boolean isTransient() {
		return true;
	}
}
