package com.nei10u.lunar.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LunarMonthInfo {
    private int month;         // 1-12
    private boolean leapMonth;
    private String name;       // 如 闰六月
    private int days;          // 29 或 30
}
