package com.GlobeLine.series_cache.domain;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Arrays;

/**
 * Sampling frequency of a series, keyed by the SDMX FREQ code.
 */
public enum SeriesFrequency {
	DAILY("D"),
	WEEKLY("W"),
	MONTHLY("M"),
	QUARTERLY("Q"),
	SEMIANNUAL("S"),
	ANNUAL("A"),
	OTHER("");

	private final String code;

	SeriesFrequency(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static SeriesFrequency fromCode(String code) {
		if (code == null || code.isBlank()) {
			return OTHER;
		}
		return Arrays.stream(values())
				.filter(frequency -> !frequency.code.isEmpty() && frequency.code.equalsIgnoreCase(code.trim()))
				.findFirst()
				.orElse(OTHER);
	}

	/**
	 * Label of the period {@code steps} periods after {@code startPeriod}.
	 *
	 * @throws IllegalArgumentException when the frequency cannot step periods or the label does not parse
	 */
	public String periodAfter(String startPeriod, long steps) {
		LocalDate start = Period.parse(startPeriod).start();
		return switch (this) {
			case DAILY -> start.plusDays(steps).toString();
			case WEEKLY -> {
				LocalDate week = start.plusWeeks(steps);
				yield String.format("%d-W%02d",
						week.get(IsoFields.WEEK_BASED_YEAR), week.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
			}
			case MONTHLY -> {
				LocalDate month = start.plusMonths(steps);
				yield String.format("%d-%02d", month.getYear(), month.getMonthValue());
			}
			case QUARTERLY -> {
				LocalDate quarter = start.plusMonths(3 * steps);
				yield quarter.getYear() + "-Q" + quarter.get(IsoFields.QUARTER_OF_YEAR);
			}
			case SEMIANNUAL -> {
				LocalDate half = start.plusMonths(6 * steps);
				yield half.getYear() + "-S" + (half.getMonthValue() <= 6 ? 1 : 2);
			}
			case ANNUAL -> String.valueOf(start.plusYears(steps).getYear());
			case OTHER -> throw new IllegalArgumentException(
					"Cannot derive periods for a series without a known frequency");
		};
	}
}
