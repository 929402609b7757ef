package com.statlens.tables.data;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class TimePeriodsTest {

    @Test
    void periodEnd_isTheLastDayOfThePeriod() {
        assertThat(TimePeriods.periodEnd("2023")).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(TimePeriods.periodEnd("2023-Q4")).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(TimePeriods.periodEnd("2024-M02")).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(TimePeriods.periodEnd("2024-06")).isEqualTo(LocalDate.of(2024, 6, 30));
        assertThat(TimePeriods.periodEnd("2024-05-17T00:00:00")).isEqualTo(LocalDate.of(2024, 5, 17));
    }

    @Test
    void periodStart_isTheFirstDayOfThePeriod() {
        assertThat(TimePeriods.periodStart("2023")).isEqualTo(LocalDate.of(2023, 1, 1));
        assertThat(TimePeriods.periodStart("2023-Q3")).isEqualTo(LocalDate.of(2023, 7, 1));
        assertThat(TimePeriods.periodStart("2023-M9")).isEqualTo(LocalDate.of(2023, 9, 1));
    }

    @Test
    void unrecognisedPeriods_giveNull() {
        assertThat(TimePeriods.periodEnd("2024-13")).isNull();
        assertThat(TimePeriods.periodStart("2024-M00")).isNull();
        assertThat(TimePeriods.periodEnd("latest")).isNull();
        assertThat(TimePeriods.periodEnd(" ")).isNull();
        assertThat(TimePeriods.isYearOnly(" 2024 ")).isTrue();
        assertThat(TimePeriods.isYearOnly("2024-Q1")).isFalse();
    }
}
