package com.hao.ntpgateway.core.query;

import exception.InvalidTimestampException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * 过滤条件提取器
 * <p>
 * 职责：把宿主下推的 (字段, 运算符, 取值) 三元组整理为结构化的 QualFilters。
 * <p>
 * 提取规则：
 * <ul>
 *   <li>分类列：只接受 "=" 且取值为字符串的条件，不属于当前表的分类列忽略</li>
 *   <li>timestamp_utc：&gt;= / &gt; 设置下界，&lt; / &lt;= 设置上界，= 同时设置 &gt;= 下界与 &lt;= 上界</li>
 *   <li>同侧多个条件取最紧的一个（下界取最大、上界取最小，时间相同时严格运算符优先）</li>
 *   <li>名义日期取边界时间所在的 UTC 日期</li>
 * </ul>
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
public class QualifierExtractor {

    public static final String TIMESTAMP_COLUMN = "timestamp_utc";

    /**
     * 提取结构化过滤条件
     *
     * @param table      被扫描的逻辑表
     * @param qualifiers 宿主下推的条件，按宿主给出的顺序
     * @return 结构化过滤条件
     * @throws InvalidTimestampException 时间字面量无法解析、类型不支持或超出日期范围
     */
    public QualFilters extract(LogicalTable table, List<Qualifier> qualifiers) {
        CategoricalFilters categorical = CategoricalFilters.none();
        TimestampBound lower = null;
        TimestampBound upper = null;

        for (Qualifier qualifier : qualifiers) {
            Optional<QualifierOperator> operator = QualifierOperator.fromSymbol(qualifier.getOperator());
            if (operator.isEmpty()) {
                log.debug("运算符不支持下推_忽略|Operator_not_pushed_down,field={},operator={}",
                        qualifier.getField(), qualifier.getOperator());
                continue;
            }
            QualifierOperator op = operator.get();

            if (TIMESTAMP_COLUMN.equals(qualifier.getField())) {
                Instant instant = TimestampLiterals.toInstant(qualifier.getValue());
                switch (op) {
                    case GE, GT -> lower = tighterLower(lower, new TimestampBound(instant, op));
                    case LT, LE -> upper = tighterUpper(upper, new TimestampBound(instant, op));
                    case EQ -> {
                        lower = tighterLower(lower, new TimestampBound(instant, QualifierOperator.GE));
                        upper = tighterUpper(upper, new TimestampBound(instant, QualifierOperator.LE));
                    }
                }
                continue;
            }

            Optional<CategoricalColumn> column = CategoricalColumn.fromColumnName(qualifier.getField())
                    .filter(c -> table.getDimensions().contains(c));
            if (column.isPresent() && op == QualifierOperator.EQ && qualifier.getValue() instanceof String value) {
                categorical = categorical.with(column.get(), value);
            }
        }

        if (lower == null && upper == null) {
            log.debug("无时间条件|No_timestamp_qualifier,table={}", table.getTableName());
            return new QualFilters(table, categorical, null, null);
        }

        NominalDateRange nominal = new NominalDateRange(utcDate(lower), utcDate(upper));
        TimestampBounds bounds = new TimestampBounds(lower, upper);
        log.debug("条件提取完成|Qualifier_extract_done,table={},categorical={},nominal={},bounds={}",
                table.getTableName(), categorical, nominal, bounds);
        return new QualFilters(table, categorical, nominal, bounds);
    }

    private static TimestampBound tighterLower(TimestampBound current, TimestampBound candidate) {
        if (current == null) {
            return candidate;
        }
        int cmp = candidate.getInstant().compareTo(current.getInstant());
        if (cmp == 0) {
            return candidate.getOperator().isStrict() ? candidate : current;
        }
        return cmp > 0 ? candidate : current;
    }

    private static TimestampBound tighterUpper(TimestampBound current, TimestampBound candidate) {
        if (current == null) {
            return candidate;
        }
        int cmp = candidate.getInstant().compareTo(current.getInstant());
        if (cmp == 0) {
            return candidate.getOperator().isStrict() ? candidate : current;
        }
        return cmp < 0 ? candidate : current;
    }

    private static LocalDate utcDate(TimestampBound bound) {
        if (bound == null) {
            return null;
        }
        try {
            return LocalDate.ofInstant(bound.getInstant(), ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new InvalidTimestampException("Timestamp out of supported date range: " + bound.getInstant(), e);
        }
    }
}
