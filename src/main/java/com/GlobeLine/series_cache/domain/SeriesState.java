package com.GlobeLine.series_cache.domain;

public enum SeriesState {
	UNKNOWN,
	FRESH,
	STALE,
	REFRESHING
}
