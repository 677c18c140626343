package com.nei10u.lunar.calendar;

import com.nei10u.lunar.model.LunarDate;
import com.nei10u.lunar.model.LunarInfo;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * 农历门面：公历转农历、农历文本、干支生肖、节气与传统节日。
 *
 * 展示优先级：节气 > 传统节日 > 农历日期。
 */
public class LunarCalendar {

    private final SolarTermCalculator solarTerms;

    public LunarCalendar(SolarTermCalculator solarTerms) {
        this.solarTerms = Objects.requireNonNull(solarTerms, "solarTerms");
    }

    public static LunarCalendar forZone(ZoneId zoneId) {
        return new LunarCalendar(new SolarTermCalculator(zoneId));
    }

    public SolarTermCalculator solarTerms() {
        return solarTerms;
    }

    public LunarDate toLunar(LocalDate solarDate) {
        return SolarLunarConverter.toLunar(solarDate);
    }

    /**
     * 农历日期文本，如 正月初一、闰二月十五。
     */
    public String lunarDateString(LocalDate solarDate) {
        return format(toLunar(solarDate));
    }

    public static String format(LunarDate lunar) {
        return LunarNames.monthName(lunar.month(), lunar.leapMonth()) + LunarNames.dayName(lunar.day());
    }

    public String yearStemBranch(int year) {
        return LunarNames.yearStemBranch(year);
    }

    public String zodiacAnimal(int year) {
        return LunarNames.zodiacAnimal(year);
    }

    public Optional<String> solarTerm(LocalDate solarDate) {
        return solarTerms.termOf(solarDate);
    }

    public Optional<String> festival(LocalDate solarDate) {
        return TraditionalFestivals.of(toLunar(solarDate));
    }

    public String fullLunarInfo(LocalDate solarDate) {
        LunarInfo info = lunarInfo(solarDate);
        return info.solarTerm()
                .or(info::festival)
                .orElse(info.lunarDate());
    }

    public LunarInfo lunarInfo(LocalDate solarDate) {
        return lunarInfo(toLunar(solarDate), solarDate);
    }

    /**
     * 已有换算结果时复用，lunar 须为 solarDate 的换算结果。
     */
    public LunarInfo lunarInfo(LunarDate lunar, LocalDate solarDate) {
        return new LunarInfo(format(lunar), solarTerm(solarDate), TraditionalFestivals.of(lunar));
    }
}
