package com.nei10u.lunar.calendar;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 二十四节气计算。
 *
 * 节气时刻 = 1900-01-06 02:05 UTC + (year - 1900) 个平均回归年 + 偏移分钟表[n]，
 * 再换算到 {@link #zoneId} 的当地日期。该经验公式只在 1900-2100 内可靠。
 */
public final class SolarTermCalculator {

    public static final int TERM_COUNT = 24;

    static final Instant BASE = ZonedDateTime.of(1900, 1, 6, 2, 5, 0, 0, ZoneOffset.UTC).toInstant();

    /** 平均回归年长度（毫秒）。 */
    static final double TROPICAL_YEAR_MILLIS = 31556925974.7;

    private static final long MILLIS_PER_MINUTE = 60_000L;

    /** 各节气相对小寒的分钟偏移。 */
    private static final int[] TERM_OFFSET_MINUTES = {
            0, 21208, 42467, 63836, 85337, 107014, 128867, 150921, 173149, 195551, 218072,
            240693, 263343, 285989, 308563, 331033, 353350, 375494, 397447, 419210, 440795,
            462224, 483532, 504758
    };

    private final ZoneId zoneId;

    // 仅缓存 1900-2100 的节气日期，其余年份每次现算
    private final ConcurrentHashMap<Integer, List<LocalDate>> termsByYear = new ConcurrentHashMap<>();

    public SolarTermCalculator(ZoneId zoneId) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    /**
     * 某年第 n 个节气的精确时刻（UTC）。
     *
     * @param termIndex 0-23，0 为小寒
     */
    public static Instant termInstant(int year, int termIndex) {
        checkIndex(termIndex);
        long millis = BASE.toEpochMilli()
                + Math.round((year - 1900) * TROPICAL_YEAR_MILLIS)
                + TERM_OFFSET_MINUTES[termIndex] * MILLIS_PER_MINUTE;
        return Instant.ofEpochMilli(millis);
    }

    /**
     * 某年第 n 个节气在当地时区的公历日期。
     */
    public LocalDate termDate(int year, int termIndex) {
        checkIndex(termIndex);
        return termDates(year).get(termIndex);
    }

    /**
     * 某年全部 24 个节气的日期，按小寒到冬至排列。
     */
    public List<LocalDate> termDates(int year) {
        if (!LunarYearTable.isSupported(year)) {
            return computeTermDates(year);
        }
        return termsByYear.computeIfAbsent(year, this::computeTermDates);
    }

    /**
     * 若 date 恰为节气日，返回节气名。
     */
    public Optional<String> termOf(LocalDate date) {
        List<LocalDate> dates = termDates(date.getYear());
        for (int i = 0; i < TERM_COUNT; i++) {
            if (dates.get(i).equals(date)) {
                return Optional.of(LunarNames.SOLAR_TERMS.get(i));
            }
        }
        return Optional.empty();
    }

    int cachedYearCount() {
        return termsByYear.size();
    }

    private List<LocalDate> computeTermDates(int year) {
        List<LocalDate> dates = new ArrayList<>(TERM_COUNT);
        for (int i = 0; i < TERM_COUNT; i++) {
            dates.add(termInstant(year, i).atZone(zoneId).toLocalDate());
        }
        return Collections.unmodifiableList(dates);
    }

    private static void checkIndex(int termIndex) {
        if (termIndex < 0 || termIndex >= TERM_COUNT) {
            throw new IllegalArgumentException("节气序号须在 0-23 之间: " + termIndex);
        }
    }
}
