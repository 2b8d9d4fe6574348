package com.hao.ntpgateway.core.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * 可下推的比较运算符
 * <p>
 * 宿主传入的其它运算符（如 &lt;&gt;、LIKE）不会被识别，对应条件不下推。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@AllArgsConstructor
public enum QualifierOperator {

    EQ("="),

    GT(">"),

    GE(">="),

    LT("<"),

    LE("<=");

    private final String symbol;

    public static Optional<QualifierOperator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }

    /**
     * 严格比较（不含边界）
     */
    public boolean isStrict() {
        return this == GT || this == LT;
    }

    /**
     * 判断 value 与 bound 是否满足 "value op bound"
     *
     * @param value 行时间
     * @param bound 边界时间
     * @return 是否满足
     */
    public boolean test(Instant value, Instant bound) {
        int cmp = value.compareTo(bound);
        return switch (this) {
            case EQ -> cmp == 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
        };
    }
}
