package com.nei10u.lunar.model;

import lombok.Data;

import java.time.LocalDate;

@Data
public class LunarDayResponse {
    private LocalDate solarDate;   // 公历日期
    private int lunarYear;         // 农历年
    private int lunarMonth;        // 农历月 1-12
    private int lunarDay;          // 农历日 1-30
    private boolean leapMonth;     // 是否闰月
    private String lunarDate;      // 农历文本 (如 闰二月初一)
    private String yearGanZhi;     // 年干支 (如 甲辰)
    private String animal;         // 生肖
    private String solarTerm;      // 节气，非节气日为 null
    private String festival;       // 传统节日，无则为 null
    private String display;        // 展示文本：节气 > 节日 > 农历日期
}
