package com.nei10u.lunar.calendar;

import com.nei10u.lunar.model.LunarDate;
import com.nlf.calendar.Lunar;
import com.nlf.calendar.Solar;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 与 lunar-java 对照：干支、生肖，以及无闰月年份的逐日农历日期。
 */
class LunarReferenceCrossCheckTest {

    @Test
    void yearNamesMatchReference() {
        for (int year = LunarYearTable.MIN_YEAR; year <= LunarYearTable.MAX_YEAR; year++) {
            Lunar reference = Lunar.fromYmd(year, 1, 1);
            assertThat(LunarNames.yearStemBranch(year)).as("ganzhi %d", year).isEqualTo(reference.getYearInGanZhi());
            assertThat(LunarNames.zodiacAnimal(year)).as("animal %d", year).isEqualTo(reference.getYearShengXiao());
        }
    }

    @Test
    void lunarYear2024MatchesReferenceDayByDay() {
        LocalDate date = LocalDate.of(2024, 2, 10);
        LocalDate end = LocalDate.of(2025, 1, 28);
        while (!date.isAfter(end)) {
            LunarDate ours = SolarLunarConverter.toLunar(date);
            Lunar reference = Solar.fromYmd(date.getYear(), date.getMonthValue(), date.getDayOfMonth()).getLunar();
            assertThat(ours.year()).as("year at %s", date).isEqualTo(reference.getYear());
            assertThat(ours.month()).as("month at %s", date).isEqualTo(reference.getMonth());
            assertThat(ours.day()).as("day at %s", date).isEqualTo(reference.getDay());
            assertThat(ours.leapMonth()).isFalse();
            date = date.plusDays(1);
        }
    }

    @Test
    void festivalDatesMatchReference() {
        Lunar midAutumn = Solar.fromYmd(2024, 9, 17).getLunar();
        assertThat(midAutumn.getMonth()).isEqualTo(8);
        assertThat(midAutumn.getDay()).isEqualTo(15);
        assertThat(SolarLunarConverter.toLunar(LocalDate.of(2024, 9, 17)).key()).isEqualTo("8-15");
    }
}
