package com.nei10u.lunar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LunarCalendarApplication {

    public static void main(String[] args) {
        SpringApplication.run(LunarCalendarApplication.class, args);
    }
}
