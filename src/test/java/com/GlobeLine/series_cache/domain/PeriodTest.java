package com.GlobeLine.series_cache.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class PeriodTest {

	@Test
	void parse_Day() {
		Period period = Period.parse("2024-02-29");
		assertThat(period.start()).isEqualTo(LocalDate.of(2024, 2, 29));
		assertThat(period.end()).isEqualTo(LocalDate.of(2024, 2, 29));
	}

	@Test
	void parse_Month() {
		Period period = Period.parse("2024-02");
		assertThat(period.start()).isEqualTo(LocalDate.of(2024, 2, 1));
		assertThat(period.end()).isEqualTo(LocalDate.of(2024, 2, 29));
	}

	@Test
	void parse_QuarterAndSemester() {
		assertThat(Period.parse("2024-Q3").start()).isEqualTo(LocalDate.of(2024, 7, 1));
		assertThat(Period.parse("2024-Q3").end()).isEqualTo(LocalDate.of(2024, 9, 30));
		assertThat(Period.parse("2024-S2").start()).isEqualTo(LocalDate.of(2024, 7, 1));
		assertThat(Period.parse("2024-S2").end()).isEqualTo(LocalDate.of(2024, 12, 31));
	}

	@Test
	void parse_IsoWeek() {
		Period period = Period.parse("2024-W05");
		assertThat(period.start()).isEqualTo(LocalDate.of(2024, 1, 29));
		assertThat(period.end()).isEqualTo(LocalDate.of(2024, 2, 4));
	}

	@Test
	void parse_Year() {
		Period period = Period.parse("2023");
		assertThat(period.start()).isEqualTo(LocalDate.of(2023, 1, 1));
		assertThat(period.end()).isEqualTo(LocalDate.of(2023, 12, 31));
	}

	@Test
	void parse_InvalidLabels_AreRejected() {
		assertThatThrownBy(() -> Period.parse("2024-13")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Period.parse("2024-02-30")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Period.parse("yesterday")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Period.parse(" ")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void periodAfter_StepsAcrossYearBoundaries() {
		assertThat(SeriesFrequency.DAILY.periodAfter("2023-12-31", 1)).isEqualTo("2024-01-01");
		assertThat(SeriesFrequency.MONTHLY.periodAfter("2023-11", 2)).isEqualTo("2024-01");
		assertThat(SeriesFrequency.QUARTERLY.periodAfter("2023-Q4", 1)).isEqualTo("2024-Q1");
		assertThat(SeriesFrequency.WEEKLY.periodAfter("2024-W05", 1)).isEqualTo("2024-W06");
		assertThat(SeriesFrequency.ANNUAL.periodAfter("2020", 4)).isEqualTo("2024");
	}

	@Test
	void periodAfter_UnknownFrequency_IsRejected() {
		assertThatThrownBy(() -> SeriesFrequency.OTHER.periodAfter("2024-01-02", 1))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
