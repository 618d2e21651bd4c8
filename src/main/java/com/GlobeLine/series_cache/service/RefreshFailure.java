package com.GlobeLine.series_cache.service;

import java.time.Instant;

/**
 * Last failed refresh of a series, kept until the next successful one.
 */
public record RefreshFailure(Instant failedAt, String message) {
}
