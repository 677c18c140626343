package com.nei10u.lunar.calendar;

import java.util.List;

/**
 * 农历相关的命名表：天干、地支、生肖、月名、日名、节气名。
 */
public final class LunarNames {

    public static final List<String> STEMS = List.of("甲", "乙", "丙", "丁", "戊", "己", "庚", "辛", "壬", "癸");

    public static final List<String> BRANCHES = List.of("子", "丑", "寅", "卯", "辰", "巳", "午", "未", "申", "酉", "戌", "亥");

    public static final List<String> ANIMALS = List.of("鼠", "牛", "虎", "兔", "龙", "蛇", "马", "羊", "猴", "鸡", "狗", "猪");

    public static final List<String> MONTHS = List.of("正", "二", "三", "四", "五", "六", "七", "八", "九", "十", "冬", "腊");

    public static final List<String> DAYS = List.of(
            "初一", "初二", "初三", "初四", "初五", "初六", "初七", "初八", "初九", "初十",
            "十一", "十二", "十三", "十四", "十五", "十六", "十七", "十八", "十九", "二十",
            "廿一", "廿二", "廿三", "廿四", "廿五", "廿六", "廿七", "廿八", "廿九", "三十");

    /** 从小寒开始，与 {@link SolarTermCalculator} 的偏移表一一对应。 */
    public static final List<String> SOLAR_TERMS = List.of(
            "小寒", "大寒", "立春", "雨水", "惊蛰", "春分",
            "清明", "谷雨", "立夏", "小满", "芒种", "夏至",
            "小暑", "大暑", "立秋", "处暑", "白露", "秋分",
            "寒露", "霜降", "立冬", "小雪", "大雪", "冬至");

    public static final String LEAP_PREFIX = "闰";
    public static final String MONTH_SUFFIX = "月";

    private LunarNames() {
    }

    /**
     * 年份干支，如 2024 -> 甲辰。
     */
    public static String yearStemBranch(int year) {
        return STEMS.get(Math.floorMod(year - 4, 10)) + BRANCHES.get(Math.floorMod(year - 4, 12));
    }

    public static String zodiacAnimal(int year) {
        return ANIMALS.get(Math.floorMod(year - 4, 12));
    }

    /**
     * 月名，如 正月、闰二月、腊月；月份越界时返回空串。
     */
    public static String monthName(int month, boolean leapMonth) {
        if (month < 1 || month > 12) {
            return "";
        }
        String name = MONTHS.get(month - 1);
        if (leapMonth) {
            name = LEAP_PREFIX + name;
        }
        return name + MONTH_SUFFIX;
    }

    public static String dayName(int day) {
        if (day < 1 || day > 30) {
            return "";
        }
        return DAYS.get(day - 1);
    }
}
