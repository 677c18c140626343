package com.nei10u.lunar.config;

import com.alibaba.fastjson2.JSONWriter;
import com.alibaba.fastjson2.support.config.FastJsonConfig;
import com.alibaba.fastjson2.support.spring6.http.converter.FastJsonHttpMessageConverter;
import org.springframework.boot.autoconfigure.http.HttpMessageConverters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 全局启用 fastjson2 作为 HTTP JSON 序列化。
 *
 * 接口里的日期都是公历 LocalDate，统一输出 yyyy-MM-dd；干支、月名、节气等中文字段按 UTF-8 写出，
 * 并在 Content-Type 中声明 charset，避免客户端按 ISO-8859-1 解码。
 */
@Configuration
public class FastJsonConfiguration {

    static final String SOLAR_DATE_FORMAT = "yyyy-MM-dd";

    static final MediaType JSON_UTF8 = new MediaType("application", "json", StandardCharsets.UTF_8);

    @Bean
    public HttpMessageConverters fastJsonHttpMessageConverters() {
        FastJsonConfig config = new FastJsonConfig();
        config.setCharset(StandardCharsets.UTF_8);
        config.setDateFormat(SOLAR_DATE_FORMAT);
        // 非节气日、非节日时 solarTerm / festival 输出为 null，前端据此判断
        config.setWriterFeatures(
                JSONWriter.Feature.WriteMapNullValue,
                JSONWriter.Feature.WriteEnumUsingToString
        );

        FastJsonHttpMessageConverter converter = new FastJsonHttpMessageConverter();
        converter.setFastJsonConfig(config);
        converter.setDefaultCharset(StandardCharsets.UTF_8);
        converter.setSupportedMediaTypes(List.of(
                JSON_UTF8,
                MediaType.APPLICATION_JSON,
                new MediaType("application", "*+json")
        ));

        return new HttpMessageConverters(converter);
    }
}
