package com.hao.ntpgateway.core.query;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 时间戳上下界
 * <p>
 * 与 DateRange 相互独立：DateRange 只决定向远端请求哪几天，
 * 这里保存原始谓词的完整精度，用于拉取后的逐行过滤。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class TimestampBounds {

    /**
     * 下界，可为空
     */
    private final TimestampBound lower;

    /**
     * 上界，可为空
     */
    private final TimestampBound upper;

    public boolean matches(Instant rowTimestamp) {
        return (lower == null || lower.matches(rowTimestamp))
                && (upper == null || upper.matches(rowTimestamp));
    }

    public boolean hasTimeOfDay() {
        return (lower != null && lower.hasTimeOfDay()) || (upper != null && upper.hasTimeOfDay());
    }

    /**
     * 满足条件的行是否可能落在名义结束日当天
     * <p>
     * 边界带时分秒，或上界为 &lt;= 时，右开窗口 [start, end) 必须再延一天才能覆盖。
     */
    public boolean reachesIntoEndDay() {
        return hasTimeOfDay() || (upper != null && upper.getOperator() == QualifierOperator.LE);
    }
}
