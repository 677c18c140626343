package com.nei10u.lunar.calendar;

/**
 * 农历年份数据表（1900-2100）及月份大小解析。
 *
 * 每年一个压缩整数，位布局（低位到高位）：
 *   bit 0-3  ：闰月月份 1-12，0 表示当年无闰月
 *   bit 4-15 ：正月到腊月的大小月标记，第 m 月取 (info >> (16 - m)) & 1，1 为大月 30 天
 *   bit 16   ：闰月大小标记（仅当年有闰月时有意义）
 *
 * 超出表范围的年份一律按 1900 年数据处理。
 */
public final class LunarYearTable {

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2100;

    /** 用于 {@link #isBigMonth(int, int)} 查询闰月的月份编号。 */
    public static final int LEAP_MONTH_QUERY = 13;

    public static final int BIG_MONTH_DAYS = 30;
    public static final int SMALL_MONTH_DAYS = 29;

    private static final int LEAP_MASK = 0xf;
    private static final int LEAP_BIG_FLAG = 0x10000;

    private static final int[] LUNAR_INFO = {
            0x04bd8, 0x04ae0, 0x0a570, 0x054d5, 0x0d260, 0x0d950, 0x16554, 0x056a0, 0x09ad0, 0x055d2, // 1900
            0x04ae0, 0x0a5b6, 0x0a4d0, 0x0d250, 0x1d255, 0x0b540, 0x0d6a0, 0x0ada2, 0x095b0, 0x14977, // 1910
            0x04970, 0x0a4b0, 0x0b4b5, 0x06a50, 0x06d40, 0x1ab54, 0x02b60, 0x09570, 0x052f2, 0x04970, // 1920
            0x06566, 0x0d4a0, 0x0ea50, 0x06e95, 0x05ad0, 0x02b60, 0x186e3, 0x092e0, 0x1c8d7, 0x0c950, // 1930
            0x0d4a0, 0x1d8a6, 0x0b550, 0x056a0, 0x1a5b4, 0x025d0, 0x092d0, 0x0d2b2, 0x0a950, 0x0b557, // 1940
            0x06ca0, 0x0b550, 0x15355, 0x04da0, 0x0a5b0, 0x14573, 0x052b0, 0x0a9a8, 0x0e950, 0x06aa0, // 1950
            0x0aea6, 0x0ab50, 0x04b60, 0x0aae4, 0x0a570, 0x05260, 0x0f263, 0x0d950, 0x05b57, 0x056a0, // 1960
            0x096d0, 0x04dd5, 0x04ad0, 0x0a4d0, 0x0d4d4, 0x0d250, 0x0d558, 0x0b540, 0x0b6a0, 0x195a6, // 1970
            0x095b0, 0x049b0, 0x0a974, 0x0a4b0, 0x0b27a, 0x06a50, 0x06d40, 0x0af46, 0x0ab60, 0x09570, // 1980
            0x04af5, 0x04970, 0x064b0, 0x074a3, 0x0ea50, 0x06b58, 0x055c0, 0x0ab60, 0x096d5, 0x092e0, // 1990
            0x0c960, 0x0d954, 0x0d4a0, 0x0da50, 0x07552, 0x056a0, 0x0abb7, 0x025d0, 0x092d0, 0x0cab5, // 2000
            0x0a950, 0x0b4a0, 0x0baa4, 0x0ad50, 0x055d9, 0x04ba0, 0x0a5b0, 0x15176, 0x052b0, 0x0a930, // 2010
            0x07954, 0x06aa0, 0x0ad50, 0x05b52, 0x04b60, 0x0a6e6, 0x0a4e0, 0x0d260, 0x0ea65, 0x0d530, // 2020
            0x05aa0, 0x076a3, 0x096d0, 0x04bd7, 0x04ad0, 0x0a4d0, 0x1d0b6, 0x0d250, 0x0d520, 0x0dd45, // 2030
            0x0b5a0, 0x056d0, 0x055b2, 0x049b0, 0x0a577, 0x0a4b0, 0x0aa50, 0x1b255, 0x06d20, 0x0ada0, // 2040
            0x14b63, 0x09370, 0x049f8, 0x04970, 0x064b0, 0x168a6, 0x0ea50, 0x06b20, 0x1a6c4, 0x0aae0, // 2050
            0x0a2e0, 0x0d2e3, 0x0c960, 0x0d557, 0x0d4a0, 0x0da50, 0x05d55, 0x056a0, 0x0a6d0, 0x055d4, // 2060
            0x052d0, 0x0a9b8, 0x0a950, 0x0b4a0, 0x0b6a6, 0x0ad50, 0x055a0, 0x0aba4, 0x0a5b0, 0x052b0, // 2070
            0x0b273, 0x06930, 0x07337, 0x06aa0, 0x0ad50, 0x14b55, 0x04b60, 0x0a570, 0x054e4, 0x0d160, // 2080
            0x0e968, 0x0d520, 0x0daa0, 0x16aa6, 0x056d0, 0x04ae0, 0x0a9d4, 0x0a2d0, 0x0d150, 0x0f252, // 2090
            0x0d520                                                                                    // 2100
    };

    private LunarYearTable() {
    }

    public static boolean isSupported(int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    /**
     * 取某年的压缩数据，超出 1900-2100 时返回 1900 年的数据。
     */
    static int yearInfo(int year) {
        if (!isSupported(year)) {
            return LUNAR_INFO[0];
        }
        return LUNAR_INFO[year - MIN_YEAR];
    }

    /**
     * 闰月月份，0 表示无闰月。
     */
    public static int leapMonth(int year) {
        return yearInfo(year) & LEAP_MASK;
    }

    /**
     * 某月是否为大月（30 天）。
     *
     * @param month 1-12 为正常月份，13 表示当年的闰月；其它值一律返回 false
     */
    public static boolean isBigMonth(int year, int month) {
        int info = yearInfo(year);
        if (month >= 1 && month <= 12) {
            return ((info >> (16 - month)) & 0x1) == 1;
        }
        if (month == LEAP_MONTH_QUERY && leapMonth(year) > 0) {
            return (info & LEAP_BIG_FLAG) != 0;
        }
        return false;
    }

    public static int monthDays(int year, int month) {
        return isBigMonth(year, month) ? BIG_MONTH_DAYS : SMALL_MONTH_DAYS;
    }

    /**
     * 闰月天数，无闰月时为 0。
     */
    public static int leapMonthDays(int year) {
        if (leapMonth(year) == 0) {
            return 0;
        }
        return monthDays(year, LEAP_MONTH_QUERY);
    }

    public static int monthCount(int year) {
        return leapMonth(year) > 0 ? 13 : 12;
    }

    /**
     * 农历年总天数：12 个正常月加上闰月（若有）。
     */
    public static int yearDays(int year) {
        int days = 0;
        for (int month = 1; month <= 12; month++) {
            days += monthDays(year, month);
        }
        return days + leapMonthDays(year);
    }
}
