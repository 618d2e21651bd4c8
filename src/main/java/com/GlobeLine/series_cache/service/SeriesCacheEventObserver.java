package com.GlobeLine.series_cache.service;

/**
 * Observer interface for cache coordination events.
 * Lets the core coordinator report what it did without knowing about metrics.
 */
public interface SeriesCacheEventObserver {

	void onFreshHit();
	void onRefreshStarted();
	void onInFlightSharing();
	void onRefreshSucceeded(int inserted, int updated);
	void onRefreshFailed();
	void onStaleServed();
	void onNoData();
}
