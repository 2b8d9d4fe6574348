package com.hao.ntpgateway.core.query;

import exception.InvalidDateRangeException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 远端请求使用的日期窗口，左闭右开 [start, end)
 * <p>
 * 构造时校验 start &lt;= end。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@ToString
@EqualsAndHashCode
public class DateRange {

    private final LocalDate start;

    private final LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new InvalidDateRangeException(
                    String.format("Invalid date range: start %s is after end %s", start, end));
        }
        this.start = start;
        this.end = end;
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end);
    }
}
