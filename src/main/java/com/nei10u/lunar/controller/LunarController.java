package com.nei10u.lunar.controller;

import com.nei10u.lunar.model.LunarDayResponse;
import com.nei10u.lunar.model.LunarYearResponse;
import com.nei10u.lunar.model.SolarTermInfo;
import com.nei10u.lunar.service.LunarCalendarService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

@RestController
@RequestMapping("/api/lunar")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class LunarController {

    private final LunarCalendarService lunarCalendarService;

    @GetMapping("/day")
    public ResponseEntity<LunarDayResponse> day(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(lunarCalendarService.day(date));
    }

    @GetMapping("/month")
    public ResponseEntity<List<LunarDayResponse>> month(@RequestParam int year, @RequestParam int month) {
        // YearMonth.of 对非法月份抛 DateTimeException，由全局处理器转成 400
        return ResponseEntity.ok(lunarCalendarService.month(YearMonth.of(year, month)));
    }

    @GetMapping("/year/{year}")
    public ResponseEntity<LunarYearResponse> year(@PathVariable int year) {
        return ResponseEntity.ok(lunarCalendarService.year(year));
    }

    @GetMapping("/terms/{year}")
    public ResponseEntity<List<SolarTermInfo>> terms(@PathVariable int year) {
        return ResponseEntity.ok(lunarCalendarService.solarTerms(year));
    }
}
