package com.GlobeLine.series_cache.store;

/**
 * Outcome of merging one fetched batch into the store.
 */
public record MergeResult(int inserted, int updated, int unchanged) {

	public static final MergeResult EMPTY = new MergeResult(0, 0, 0);

	public int total() {
		return inserted + updated + unchanged;
	}

	public boolean changedAnything() {
		return inserted > 0 || updated > 0;
	}
}
