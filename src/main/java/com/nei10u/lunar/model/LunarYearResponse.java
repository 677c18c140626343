package com.nei10u.lunar.model;

import lombok.Data;

import java.util.List;

@Data
public class LunarYearResponse {
    private int year;
    private String ganZhi;                 // 年干支
    private String animal;                 // 生肖
    private int leapMonth;                 // 闰月月份，0 表示无闰月
    private int monthCount;                // 12 或 13
    private int totalDays;                 // 农历年总天数
    private List<LunarMonthInfo> months;   // 按推算顺序排列
    private List<SolarTermInfo> solarTerms; // 同一公历年的 24 节气
}
