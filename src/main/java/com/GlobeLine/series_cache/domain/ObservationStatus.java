package com.GlobeLine.series_cache.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * OBS_STATUS codes attached to observations by the ECB.
 */
public enum ObservationStatus {
	NORMAL("A"),
	BREAK("B"),
	ESTIMATED("E"),
	FORECAST("F"),
	MISSING("M"),
	PROVISIONAL("P"),
	REVISED("R");

	private final String code;

	ObservationStatus(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static Optional<ObservationStatus> fromCode(String code) {
		if (code == null) {
			return Optional.empty();
		}
		return Arrays.stream(values())
				.filter(status -> status.code.equalsIgnoreCase(code.trim()))
				.findFirst();
	}
}
