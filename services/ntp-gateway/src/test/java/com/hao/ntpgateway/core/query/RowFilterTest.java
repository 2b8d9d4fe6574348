package com.hao.ntpgateway.core.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RowFilter 单元测试
 *
 * @author hli
 * @date 2026-10-18
 */
@DisplayName("RowFilter 行过滤测试")
class RowFilterTest {

    private RowFilter rowFilter;

    private List<SampleRow> rows;

    @BeforeEach
    void setUp() {
        rowFilter = new RowFilter();
        rows = List.of(
                SampleRow.at("2024-10-20T22:45:00Z"),
                SampleRow.at("2024-10-20T23:00:00Z"),
                SampleRow.at("2024-10-21T00:30:00+00:00"),
                SampleRow.at("2024-10-21T01:00:00Z"),
                SampleRow.at("2024-10-21T03:15:00+02:00"));
    }

    @Test
    @DisplayName("bounds 为空时原样返回")
    void nullBoundsIsIdentity() {
        List<SampleRow> result = rowFilter.filterRows(rows, null);

        assertEquals(rows, result);
    }

    @Test
    @DisplayName("按 >= 与 < 边界保留窗口内的行")
    void keepsRowsInsideWindow() {
        TimestampBounds bounds = new TimestampBounds(
                new TimestampBound(Instant.parse("2024-10-20T23:00:00Z"), QualifierOperator.GE),
                new TimestampBound(Instant.parse("2024-10-21T01:00:00Z"), QualifierOperator.LT));

        List<SampleRow> result = rowFilter.filterRows(rows, bounds);

        // 03:15+02:00 即 01:15Z，超出上界
        assertEquals(List.of(rows.get(1), rows.get(2)), result);
    }

    @Test
    @DisplayName("严格与非严格运算符的边界行为")
    void strictAndInclusiveOperators() {
        TimestampBounds bounds = new TimestampBounds(
                new TimestampBound(Instant.parse("2024-10-20T23:00:00Z"), QualifierOperator.GT),
                new TimestampBound(Instant.parse("2024-10-21T01:00:00Z"), QualifierOperator.LE));

        List<SampleRow> result = rowFilter.filterRows(rows, bounds);

        assertEquals(List.of(rows.get(2), rows.get(3)), result);
    }

    @Test
    @DisplayName("无法解析的时间戳被丢弃")
    void unparseableRowsAreDropped() {
        List<SampleRow> input = List.of(
                SampleRow.at("not-a-timestamp"),
                SampleRow.at("2024-10-21T00:00:00Z"),
                SampleRow.at(null));
        TimestampBounds bounds = new TimestampBounds(
                new TimestampBound(Instant.parse("2024-10-20T00:00:00Z"), QualifierOperator.GE), null);

        List<SampleRow> result = rowFilter.filterRows(input, bounds);

        assertEquals(List.of(input.get(1)), result);
    }

    @Test
    @DisplayName("行时间戳与边界一样按微秒精度比较")
    void rowTimestampComparedAtMicroPrecision() {
        List<SampleRow> input = List.of(SampleRow.at("2024-10-20T00:00:00.0000015Z"));
        TimestampBounds bounds = new TimestampBounds(null,
                new TimestampBound(Instant.parse("2024-10-20T00:00:00.000001Z"), QualifierOperator.LE));

        List<SampleRow> result = rowFilter.filterRows(input, bounds);

        assertEquals(input, result);
    }

    @Test
    @DisplayName("重复过滤结果不变")
    void filteringIsIdempotent() {
        TimestampBounds bounds = new TimestampBounds(
                new TimestampBound(Instant.parse("2024-10-20T23:00:00Z"), QualifierOperator.GE),
                new TimestampBound(Instant.parse("2024-10-21T01:00:00Z"), QualifierOperator.LT));

        List<SampleRow> once = rowFilter.filterRows(rows, bounds);
        List<SampleRow> twice = rowFilter.filterRows(once, bounds);

        assertEquals(once, twice);
    }
}
