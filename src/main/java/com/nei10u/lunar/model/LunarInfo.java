package com.nei10u.lunar.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 供展示层组合使用的农历信息：农历日期文本、节气、传统节日。
 */
public record LunarInfo(String lunarDate, Optional<String> solarTerm, Optional<String> festival) {

    public LunarInfo {
        Objects.requireNonNull(lunarDate, "lunarDate");
        Objects.requireNonNull(solarTerm, "solarTerm");
        Objects.requireNonNull(festival, "festival");
    }
}
