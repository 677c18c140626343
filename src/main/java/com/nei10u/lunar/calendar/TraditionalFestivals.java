package com.nei10u.lunar.calendar;

import com.nei10u.lunar.model.LunarDate;

import java.util.Map;
import java.util.Optional;

/**
 * 传统节日表（农历 月-日 -> 节日名）。闰月不计节日。
 */
public final class TraditionalFestivals {

    private static final Map<String, String> FESTIVALS = Map.ofEntries(
            Map.entry("1-1", "春节"),
            Map.entry("1-15", "元宵节"),
            Map.entry("2-2", "龙抬头"),
            Map.entry("5-5", "端午节"),
            Map.entry("7-7", "七夕"),
            Map.entry("7-15", "中元节"),
            Map.entry("8-15", "中秋节"),
            Map.entry("9-9", "重阳节"),
            Map.entry("10-15", "下元节"),
            Map.entry("12-8", "腊八节"),
            Map.entry("12-23", "小年"),
            Map.entry("12-30", "除夕"),
            // 腊月只有 29 天的年份
            Map.entry("12-29", "除夕")
    );

    private TraditionalFestivals() {
    }

    public static Optional<String> of(LunarDate lunar) {
        if (lunar.leapMonth()) {
            return Optional.empty();
        }
        return Optional.ofNullable(FESTIVALS.get(lunar.key()));
    }

    public static Map<String, String> all() {
        return FESTIVALS;
    }
}
