package com.hao.ntpgateway.core.query;

import com.hao.ntpgateway.config.NtpGatewayProperties;
import exception.InvalidDateRangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DateRangeResolver 单元测试
 * <p>
 * 覆盖兜底窗口、单侧补全、同日扩展与时分秒扩展。
 *
 * @author hli
 * @date 2026-10-18
 */
@DisplayName("DateRangeResolver 日期窗口推导测试")
class DateRangeResolverTest {

    private DateRangeResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DateRangeResolver(new NtpGatewayProperties());
    }

    @Test
    @DisplayName("无日期证据时使用兜底窗口")
    void noEvidenceUsesFallback() {
        DateRange range = resolver.resolve((NominalDateRange) null, null);

        assertEquals(LocalDate.of(2024, 10, 18), range.getStart());
        assertEquals(LocalDate.of(2024, 10, 25), range.getEnd());
    }

    @Test
    @DisplayName("兜底窗口可配置")
    void fallbackIsConfigurable() {
        NtpGatewayProperties properties = new NtpGatewayProperties();
        properties.setFallbackStartDate("2025-01-01");
        properties.setFallbackEndDate("2025-01-03");

        DateRange range = new DateRangeResolver(properties).resolve(new NominalDateRange(null, null), null);

        assertEquals(LocalDate.of(2025, 1, 1), range.getStart());
        assertEquals(LocalDate.of(2025, 1, 3), range.getEnd());
    }

    @Test
    @DisplayName("只有下界：窗口长度 7 天")
    void lowerOnlySpansSevenDays() {
        DateRange range = resolver.resolve(new NominalDateRange(LocalDate.of(2024, 10, 20), null), null);

        assertEquals(LocalDate.of(2024, 10, 20), range.getStart());
        assertEquals(LocalDate.of(2024, 10, 27), range.getEnd());
        assertEquals(7, range.lengthInDays());
    }

    @Test
    @DisplayName("只有上界：窗口长度 7 天")
    void upperOnlySpansSevenDays() {
        DateRange range = resolver.resolve(new NominalDateRange(null, LocalDate.of(2024, 10, 20)), null);

        assertEquals(LocalDate.of(2024, 10, 13), range.getStart());
        assertEquals(LocalDate.of(2024, 10, 20), range.getEnd());
    }

    @ParameterizedTest(name = "{0} 同日 → 结束日 +1")
    @CsvSource({"2024-10-20", "2024-02-29", "2024-12-31"})
    @DisplayName("同一天：结束日顺延一天")
    void sameDayExtendsByOne(String day) {
        LocalDate date = LocalDate.parse(day);

        DateRange range = resolver.resolve(new NominalDateRange(date, date), null);

        assertEquals(date, range.getStart());
        assertEquals(date.plusDays(1), range.getEnd());
    }

    @Test
    @DisplayName("边界带时分秒且跨日：结束日顺延一天")
    void timeOfDayExtendsEnd() {
        TimestampBounds bounds = new TimestampBounds(
                new TimestampBound(Instant.parse("2024-10-20T23:00:00Z"), QualifierOperator.GE),
                new TimestampBound(Instant.parse("2024-10-21T01:00:00Z"), QualifierOperator.LT));

        DateRange range = resolver.resolve(
                new NominalDateRange(LocalDate.of(2024, 10, 20), LocalDate.of(2024, 10, 21)), bounds);

        assertEquals(LocalDate.of(2024, 10, 22), range.getEnd());
    }

    @Test
    @DisplayName("纯日期边界：窗口不变")
    void calendarOnlyIsUnchanged() {
        TimestampBounds bounds = new TimestampBounds(
                new TimestampBound(Instant.parse("2024-10-20T00:00:00Z"), QualifierOperator.GE),
                new TimestampBound(Instant.parse("2024-10-22T00:00:00Z"), QualifierOperator.LT));

        DateRange range = resolver.resolve(
                new NominalDateRange(LocalDate.of(2024, 10, 20), LocalDate.of(2024, 10, 22)), bounds);

        assertEquals(LocalDate.of(2024, 10, 20), range.getStart());
        assertEquals(LocalDate.of(2024, 10, 22), range.getEnd());
    }

    @Test
    @DisplayName("上界为 <= 零点：结束日顺延一天以覆盖边界时刻")
    void inclusiveUpperAtMidnightExtendsEnd() {
        TimestampBounds bounds = new TimestampBounds(
                new TimestampBound(Instant.parse("2024-10-20T00:00:00Z"), QualifierOperator.GE),
                new TimestampBound(Instant.parse("2024-10-22T00:00:00Z"), QualifierOperator.LE));

        DateRange range = resolver.resolve(
                new NominalDateRange(LocalDate.of(2024, 10, 20), LocalDate.of(2024, 10, 22)), bounds);

        assertEquals(LocalDate.of(2024, 10, 23), range.getEnd());
    }

    @Test
    @DisplayName("起始晚于结束抛出 InvalidDateRangeException")
    void reversedRangeThrows() {
        NominalDateRange nominal = new NominalDateRange(LocalDate.of(2024, 10, 25), LocalDate.of(2024, 10, 20));

        assertThrows(InvalidDateRangeException.class, () -> resolver.resolve(nominal, null));
    }

    @Test
    @DisplayName("补全窗口越出日期上下限抛出 InvalidDateRangeException")
    void windowBeyondSupportedDatesThrows() {
        NominalDateRange lowerOnly = new NominalDateRange(LocalDate.MAX.minusDays(1), null);
        NominalDateRange upperOnly = new NominalDateRange(null, LocalDate.MIN.plusDays(1));
        NominalDateRange sameDay = new NominalDateRange(LocalDate.MAX, LocalDate.MAX);

        assertThrows(InvalidDateRangeException.class, () -> resolver.resolve(lowerOnly, null));
        assertThrows(InvalidDateRangeException.class, () -> resolver.resolve(upperOnly, null));
        assertThrows(InvalidDateRangeException.class, () -> resolver.resolve(sameDay, null));
    }

    @Test
    @DisplayName("字符串日期重载")
    void resolvesStringDates() {
        DateRange range = resolver.resolve("2024-10-20", null);
        assertEquals(LocalDate.of(2024, 10, 27), range.getEnd());

        assertThrows(InvalidDateRangeException.class, () -> resolver.resolve("20/10/2024", "2024-10-21"));
    }
}
