package com.nei10u.lunar.calendar;

import com.nei10u.lunar.model.LunarDate;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 公历转农历。
 *
 * 以 1900-01-31（农历 1900 年正月初一）为基准，先逐年、再逐月扣减天数，
 * 直到剩余天数落在某个月之内。
 */
public final class SolarLunarConverter {

    public static final LocalDate EPOCH = LocalDate.of(1900, 1, 31);

    private SolarLunarConverter() {
    }

    public static LunarDate toLunar(LocalDate solarDate) {
        long offset = ChronoUnit.DAYS.between(EPOCH, solarDate);
        if (offset < 0) {
            return LunarDate.BEFORE_EPOCH;
        }

        int lunarYear = LunarYearTable.MIN_YEAR;
        while (lunarYear <= LunarYearTable.MAX_YEAR) {
            int yearDays = LunarYearTable.yearDays(lunarYear);
            if (offset < yearDays) {
                return locateInYear(lunarYear, (int) offset);
            }
            offset -= yearDays;
            lunarYear++;
        }
        // 表数据用尽：停在 2101 年正月初一
        return new LunarDate(lunarYear, 1, 1, false);
    }

    /**
     * 在已确定的农历年内逐月定位。有闰月的月份先判断闰月，再判断正常月份。
     */
    private static LunarDate locateInYear(int year, int offset) {
        int leapMonth = LunarYearTable.leapMonth(year);
        for (int month = 1; month <= 12; month++) {
            if (leapMonth == month) {
                int leapDays = LunarYearTable.leapMonthDays(year);
                if (offset < leapDays) {
                    return new LunarDate(year, month, offset + 1, true);
                }
                offset -= leapDays;
            }

            int monthDays = LunarYearTable.monthDays(year, month);
            if (offset < monthDays) {
                return new LunarDate(year, month, offset + 1, false);
            }
            offset -= monthDays;
        }
        // offset 已由 yearDays 限定，不会走到这里
        throw new IllegalStateException("offset exceeds lunar year " + year);
    }
}
