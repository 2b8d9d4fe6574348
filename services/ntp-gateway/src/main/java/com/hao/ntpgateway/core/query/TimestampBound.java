package com.hao.ntpgateway.core.query;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * 单侧时间边界：保留完整精度的时间点及其比较运算符
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class TimestampBound {

    private final Instant instant;

    private final QualifierOperator operator;

    public boolean matches(Instant rowTimestamp) {
        return operator.test(rowTimestamp, instant);
    }

    /**
     * 边界时间是否落在 UTC 零点之外
     */
    public boolean hasTimeOfDay() {
        return !LocalTime.MIDNIGHT.equals(instant.atOffset(ZoneOffset.UTC).toLocalTime());
    }
}
