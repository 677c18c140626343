package com.nei10u.lunar.model;

/**
 * 农历日期。闰月只通过 leapMonth 标记，month 始终在 1-12 之间。
 */
public record LunarDate(int year, int month, int day, boolean leapMonth) {

    /** 早于 1900-01-31 的日期统一返回此值。 */
    public static final LunarDate BEFORE_EPOCH = new LunarDate(1900, 1, 1, false);

    public String key() {
        return month + "-" + day;
    }
}
