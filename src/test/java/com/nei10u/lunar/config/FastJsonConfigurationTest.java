package com.nei10u.lunar.config;

import com.alibaba.fastjson2.support.spring6.http.converter.FastJsonHttpMessageConverter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.http.HttpMessageConverters;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FastJsonConfigurationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private HttpMessageConverters httpMessageConverters;

    @Test
    void fastJsonIsTheFirstConverter() {
        assertThat(httpMessageConverters.getConverters().get(0)).isInstanceOf(FastJsonHttpMessageConverter.class);
    }

    @Test
    @DisplayName("公历日期输出 yyyy-MM-dd，空节气输出 null 字段")
    void dayResponseWrittenByFastJson() throws Exception {
        mockMvc.perform(get("/api/lunar/day").param("date", "2023-02-20"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().string(containsString("\"solarDate\":\"2023-02-20\"")))
                .andExpect(content().string(containsString("\"solarTerm\":null")))
                .andExpect(content().string(containsString("\"festival\":null")))
                .andExpect(jsonPath("$.lunarDate").value("闰二月初一"))
                .andExpect(jsonPath("$.yearGanZhi").value("癸卯"));
    }

    @Test
    void solarTermDatesWrittenAsPlainDates() throws Exception {
        mockMvc.perform(get("/api/lunar/terms/2024"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[23].date").value("2024-12-21"))
                .andExpect(jsonPath("$[23].name").value("冬至"));
    }
}
