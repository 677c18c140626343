package com.nei10u.lunar.calendar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class LunarYearTableTest {

    @ParameterizedTest
    @CsvSource({
            "1900, 8",
            "2020, 4",
            "2023, 2",
            "2024, 0",
            "2025, 6"
    })
    void leapMonth(int year, int expected) {
        assertThat(LunarYearTable.leapMonth(year)).isEqualTo(expected);
    }

    @Test
    @DisplayName("超出 1900-2100 的年份按 1900 年数据处理")
    void outOfRangeYearsClampTo1900() {
        assertThat(LunarYearTable.leapMonth(1899)).isEqualTo(LunarYearTable.leapMonth(1900));
        assertThat(LunarYearTable.leapMonth(2101)).isEqualTo(LunarYearTable.leapMonth(1900));
        assertThat(LunarYearTable.yearDays(1800)).isEqualTo(LunarYearTable.yearDays(1900));
        assertThat(LunarYearTable.isSupported(1899)).isFalse();
        assertThat(LunarYearTable.isSupported(2100)).isTrue();
    }

    @Test
    void monthLengthsOf1900() {
        int[] expected = {29, 30, 29, 29, 30, 29, 30, 30, 30, 30, 29, 30};
        for (int month = 1; month <= 12; month++) {
            assertThat(LunarYearTable.monthDays(1900, month)).as("month %d", month).isEqualTo(expected[month - 1]);
        }
        assertThat(LunarYearTable.leapMonthDays(1900)).isEqualTo(29);
    }

    @Test
    void leapQueryWithoutLeapMonthIsSmall() {
        assertThat(LunarYearTable.isBigMonth(2024, LunarYearTable.LEAP_MONTH_QUERY)).isFalse();
        assertThat(LunarYearTable.leapMonthDays(2024)).isZero();
        assertThat(LunarYearTable.monthCount(2024)).isEqualTo(12);
        assertThat(LunarYearTable.monthCount(2023)).isEqualTo(13);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 14, 99})
    void invalidMonthIsNotBig(int month) {
        assertThat(LunarYearTable.isBigMonth(2023, month)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "1900, 384",
            "2023, 384",
            "2024, 354",
            "2025, 384"
    })
    void yearDays(int year, int expected) {
        assertThat(LunarYearTable.yearDays(year)).isEqualTo(expected);
    }

    @Test
    void yearDaysIsSumOfAllEffectiveMonths() {
        for (int year = LunarYearTable.MIN_YEAR; year <= LunarYearTable.MAX_YEAR; year++) {
            int sum = 0;
            for (int month = 1; month <= 12; month++) {
                sum += LunarYearTable.isBigMonth(year, month) ? 30 : 29;
            }
            if (LunarYearTable.leapMonth(year) > 0) {
                sum += LunarYearTable.isBigMonth(year, 13) ? 30 : 29;
            }
            assertThat(LunarYearTable.yearDays(year)).as("year %d", year).isEqualTo(sum);
            assertThat(sum).isBetween(353, 385);
        }
    }
}
