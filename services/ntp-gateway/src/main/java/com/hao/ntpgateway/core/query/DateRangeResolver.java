package com.hao.ntpgateway.core.query;

import com.hao.ntpgateway.config.NtpGatewayProperties;
import exception.InvalidDateRangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 日期窗口推导器
 * <p>
 * 职责：把名义日期证据转换为远端可接受的左闭右开日期窗口。
 * <p>
 * 推导规则（按优先级）：
 * <ol>
 *   <li>无任何日期证据 → 配置的兜底窗口</li>
 *   <li>只有下界 → end = start + N 天</li>
 *   <li>只有上界 → start = end - N 天</li>
 *   <li>两端都有：start == end 时 end + 1 天；否则边界落入结束日当天时 end + 1 天；否则不变</li>
 * </ol>
 * N 取自 ntp.gateway.open-ended-window-days。
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DateRangeResolver {

    private final NtpGatewayProperties properties;

    /**
     * 推导日期窗口
     *
     * @param nominal 名义日期范围，可为空
     * @param bounds  时间戳边界，可为空
     * @return 校验后的日期窗口
     * @throws InvalidDateRangeException 调整后 start 晚于 end，或调整越出日期上下限
     */
    public DateRange resolve(NominalDateRange nominal, TimestampBounds bounds) {
        LocalDate start = nominal == null ? null : nominal.getStart();
        LocalDate end = nominal == null ? null : nominal.getEnd();
        int windowDays = properties.getOpenEndedWindowDays();

        if (nominal == null || nominal.isEmpty()) {
            DateRange fallback = new DateRange(properties.getFallbackStart(), properties.getFallbackEnd());
            log.warn("无日期条件_使用兜底窗口|No_date_evidence_use_fallback,range={}~{}",
                    fallback.getStart(), fallback.getEnd());
            return fallback;
        }
        try {
            if (end == null) {
                end = start.plusDays(windowDays);
            } else if (start == null) {
                start = end.minusDays(windowDays);
            } else if (start.equals(end)) {
                end = end.plusDays(1);
            } else if (bounds != null && bounds.reachesIntoEndDay()) {
                end = end.plusDays(1);
            }
        } catch (DateTimeException e) {
            throw new InvalidDateRangeException(String.format(
                    "Date range out of supported bounds: nominal %s~%s", start, end), e);
        }

        DateRange range = new DateRange(start, end);
        log.debug("日期窗口推导完成|Date_range_resolved,nominal={},range={}~{}", nominal, start, end);
        return range;
    }

    /**
     * 按原始日期字符串推导
     *
     * @param start yyyy-MM-dd，可为空
     * @param end   yyyy-MM-dd，可为空
     * @return 校验后的日期窗口
     * @throws InvalidDateRangeException 日期无法解析或 start 晚于 end
     */
    public DateRange resolve(String start, String end) {
        return resolve(new NominalDateRange(parseDay(start), parseDay(end)), null);
    }

    private static LocalDate parseDay(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateRangeException("Invalid date: '" + text + "', expected yyyy-MM-dd", e);
        }
    }
}
