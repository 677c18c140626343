package com.nei10u.lunar.calendar;

import com.nei10u.lunar.model.LunarDate;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TraditionalFestivalsTest {

    @Test
    void lookupByMonthAndDay() {
        assertThat(TraditionalFestivals.of(new LunarDate(2024, 1, 1, false))).contains("春节");
        assertThat(TraditionalFestivals.of(new LunarDate(2024, 8, 15, false))).contains("中秋节");
        assertThat(TraditionalFestivals.of(new LunarDate(2024, 8, 16, false))).isEmpty();
    }

    @Test
    void newYearsEveOnBothLastDays() {
        assertThat(TraditionalFestivals.of(new LunarDate(2023, 12, 30, false))).contains("除夕");
        assertThat(TraditionalFestivals.of(new LunarDate(2024, 12, 29, false))).contains("除夕");
    }

    @Test
    void leapMonthsCarryNoFestival() {
        assertThat(TraditionalFestivals.of(new LunarDate(2023, 1, 1, true))).isEmpty();
        assertThat(TraditionalFestivals.of(new LunarDate(2023, 2, 2, true))).isEmpty();
    }

    @Test
    void thirteenEntries() {
        assertThat(TraditionalFestivals.all()).hasSize(13);
    }
}
