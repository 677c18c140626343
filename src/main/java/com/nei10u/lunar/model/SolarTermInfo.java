package com.nei10u.lunar.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolarTermInfo {
    private int index;        // 0-23，0 为小寒
    private String name;
    private LocalDate date;
}
