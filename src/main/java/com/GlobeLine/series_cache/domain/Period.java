package com.GlobeLine.series_cache.domain;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calendar span covered by an SDMX period label.
 * Supported labels: 2024-01-02, 2024-01, 2024-Q1, 2024-S1, 2024-W05, 2024.
 */
public record Period(String label, LocalDate start, LocalDate end) {

	private static final Pattern DAY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
	private static final Pattern MONTH = Pattern.compile("(\\d{4})-(\\d{2})");
	private static final Pattern QUARTER = Pattern.compile("(\\d{4})-Q([1-4])");
	private static final Pattern SEMESTER = Pattern.compile("(\\d{4})-S([12])");
	private static final Pattern WEEK = Pattern.compile("(\\d{4})-W(\\d{2})");
	private static final Pattern YEAR = Pattern.compile("\\d{4}");

	public static Period parse(String label) {
		if (label == null || label.isBlank()) {
			throw new IllegalArgumentException("Period label must not be blank");
		}
		String trimmed = label.trim();
		try {
			if (DAY.matcher(trimmed).matches()) {
				LocalDate day = LocalDate.parse(trimmed);
				return new Period(trimmed, day, day);
			}
			Matcher matcher = MONTH.matcher(trimmed);
			if (matcher.matches()) {
				YearMonth month = YearMonth.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
				return new Period(trimmed, month.atDay(1), month.atEndOfMonth());
			}
			matcher = QUARTER.matcher(trimmed);
			if (matcher.matches()) {
				int firstMonth = (Integer.parseInt(matcher.group(2)) - 1) * 3 + 1;
				YearMonth first = YearMonth.of(Integer.parseInt(matcher.group(1)), firstMonth);
				return new Period(trimmed, first.atDay(1), first.plusMonths(2).atEndOfMonth());
			}
			matcher = SEMESTER.matcher(trimmed);
			if (matcher.matches()) {
				int firstMonth = matcher.group(2).equals("1") ? 1 : 7;
				YearMonth first = YearMonth.of(Integer.parseInt(matcher.group(1)), firstMonth);
				return new Period(trimmed, first.atDay(1), first.plusMonths(5).atEndOfMonth());
			}
			matcher = WEEK.matcher(trimmed);
			if (matcher.matches()) {
				LocalDate monday = LocalDate.of(Integer.parseInt(matcher.group(1)), 1, 4)
						.with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, Long.parseLong(matcher.group(2)))
						.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
				return new Period(trimmed, monday, monday.plusDays(6));
			}
			if (YEAR.matcher(trimmed).matches()) {
				int year = Integer.parseInt(trimmed);
				return new Period(trimmed, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
			}
		} catch (DateTimeException ex) {
			throw new IllegalArgumentException("Invalid period label: " + label, ex);
		}
		throw new IllegalArgumentException("Unsupported period label: " + label);
	}

	public boolean overlaps(FetchWindow window) {
		return !end.isBefore(window.start()) && !start.isAfter(window.end());
	}
}
