package com.hao.ntpgateway.config;

import exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * NTP 网关配置
 * <p>
 * 远端地址与日期窗口推导相关的参数，前缀 ntp.gateway。
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "ntp.gateway")
public class NtpGatewayProperties {

    /**
     * NTP 接口根地址，末尾斜杠可有可无
     */
    private String apiBaseUrl = "https://www.netztransparenz.de/api/ntp";

    /**
     * 无任何时间条件时使用的兜底窗口起始日，格式：yyyy-MM-dd
     */
    private String fallbackStartDate = "2024-10-18";

    /**
     * 兜底窗口结束日（不含），格式：yyyy-MM-dd
     */
    private String fallbackEndDate = "2024-10-25";

    /**
     * 只有单侧时间条件时补全的窗口天数
     */
    private int openEndedWindowDays = 7;

    /**
     * 是否在 ioTaskExecutor 上并行执行各拉取计划
     * false 时按计划顺序串行执行
     */
    private boolean parallelFetch = false;

    /**
     * 启动时校验，配置错误直接阻止启动
     */
    @PostConstruct
    public void validate() {
        LocalDate start = getFallbackStart();
        LocalDate end = getFallbackEnd();
        if (start.isAfter(end)) {
            throw new ConfigurationException(String.format(
                    "Fallback window reversed: fallback-start-date %s is after fallback-end-date %s", start, end));
        }
        if (openEndedWindowDays <= 0) {
            throw new ConfigurationException(
                    "open-ended-window-days must be positive, got " + openEndedWindowDays);
        }
        log.info("网关配置校验通过|Gateway_properties_validated,baseUrl={},fallback={}~{},windowDays={},parallelFetch={}",
                apiBaseUrl, start, end, openEndedWindowDays, parallelFetch);
    }

    public LocalDate getFallbackStart() {
        return parseDate("fallback-start-date", fallbackStartDate);
    }

    public LocalDate getFallbackEnd() {
        return parseDate("fallback-end-date", fallbackEndDate);
    }

    private static LocalDate parseDate(String key, String value) {
        if (value == null) {
            throw new ConfigurationException(String.format("Missing %s, expected yyyy-MM-dd", key));
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(String.format("Invalid %s: '%s', expected yyyy-MM-dd", key, value), e);
        }
    }
}
