package com.nei10u.lunar.service;

import com.nei10u.lunar.calendar.LunarCalendar;
import com.nei10u.lunar.calendar.LunarNames;
import com.nei10u.lunar.calendar.LunarYearTable;
import com.nei10u.lunar.calendar.SolarTermCalculator;
import com.nei10u.lunar.model.LunarDate;
import com.nei10u.lunar.model.LunarDayResponse;
import com.nei10u.lunar.model.LunarInfo;
import com.nei10u.lunar.model.LunarMonthInfo;
import com.nei10u.lunar.model.LunarYearResponse;
import com.nei10u.lunar.model.SolarTermInfo;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LunarCalendarService {

    private static final Logger log = LoggerFactory.getLogger(LunarCalendarService.class);

    private final LunarCalendar lunarCalendar;

    public LunarDayResponse day(LocalDate date) {
        log.debug("lunar day query: {}", date);
        LunarDate lunar = lunarCalendar.toLunar(date);
        LunarInfo info = lunarCalendar.lunarInfo(lunar, date);

        LunarDayResponse resp = new LunarDayResponse();
        resp.setSolarDate(date);
        resp.setLunarYear(lunar.year());
        resp.setLunarMonth(lunar.month());
        resp.setLunarDay(lunar.day());
        resp.setLeapMonth(lunar.leapMonth());
        resp.setLunarDate(info.lunarDate());
        resp.setYearGanZhi(lunarCalendar.yearStemBranch(lunar.year()));
        resp.setAnimal(lunarCalendar.zodiacAnimal(lunar.year()));
        resp.setSolarTerm(info.solarTerm().orElse(null));
        resp.setFestival(info.festival().orElse(null));
        // 节气 > 节日 > 农历日期
        resp.setDisplay(info.solarTerm().or(info::festival).orElse(info.lunarDate()));
        return resp;
    }

    /**
     * 公历某月每一天的农历信息（月视图）。
     */
    public List<LunarDayResponse> month(YearMonth yearMonth) {
        requireSupported(yearMonth.getYear());
        log.info("lunar month query: {}", yearMonth);
        List<LunarDayResponse> days = new ArrayList<>(yearMonth.lengthOfMonth());
        for (int d = 1; d <= yearMonth.lengthOfMonth(); d++) {
            days.add(day(yearMonth.atDay(d)));
        }
        return days;
    }

    public LunarYearResponse year(int year) {
        requireSupported(year);
        log.info("lunar year query: {}", year);
        int leapMonth = LunarYearTable.leapMonth(year);

        List<LunarMonthInfo> months = new ArrayList<>(LunarYearTable.monthCount(year));
        for (int month = 1; month <= 12; month++) {
            // 与推算顺序一致：闰月排在同序号正常月之前
            if (leapMonth == month) {
                months.add(monthInfo(month, true, LunarYearTable.leapMonthDays(year)));
            }
            months.add(monthInfo(month, false, LunarYearTable.monthDays(year, month)));
        }

        LunarYearResponse resp = new LunarYearResponse();
        resp.setYear(year);
        resp.setGanZhi(LunarNames.yearStemBranch(year));
        resp.setAnimal(LunarNames.zodiacAnimal(year));
        resp.setLeapMonth(leapMonth);
        resp.setMonthCount(LunarYearTable.monthCount(year));
        resp.setTotalDays(LunarYearTable.yearDays(year));
        resp.setMonths(months);
        resp.setSolarTerms(solarTerms(year));
        return resp;
    }

    public List<SolarTermInfo> solarTerms(int year) {
        requireSupported(year);
        List<LocalDate> dates = lunarCalendar.solarTerms().termDates(year);
        List<SolarTermInfo> terms = new ArrayList<>(SolarTermCalculator.TERM_COUNT);
        for (int i = 0; i < SolarTermCalculator.TERM_COUNT; i++) {
            terms.add(SolarTermInfo.builder()
                    .index(i)
                    .name(LunarNames.SOLAR_TERMS.get(i))
                    .date(dates.get(i))
                    .build());
        }
        return terms;
    }

    private static LunarMonthInfo monthInfo(int month, boolean leap, int days) {
        return LunarMonthInfo.builder()
                .month(month)
                .leapMonth(leap)
                .name(LunarNames.monthName(month, leap))
                .days(days)
                .build();
    }

    private static void requireSupported(int year) {
        if (!LunarYearTable.isSupported(year)) {
            throw new IllegalArgumentException("年份超出支持范围 "
                    + LunarYearTable.MIN_YEAR + "-" + LunarYearTable.MAX_YEAR + ": " + year);
        }
    }
}
