package com.hao.ntpgateway.core.query;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 宿主下推的过滤条件三元组：(字段, 运算符, 取值)
 * <p>
 * operator 保留宿主给出的原始符号，由 QualifierExtractor 负责识别；
 * value 可能是字符串、时间类型或其它宿主字面量。
 *
 * @author hli
 * @date 2026-10-18
 */
@Data
@AllArgsConstructor
public class Qualifier {

    /**
     * 列名
     */
    private String field;

    /**
     * 运算符符号，如 "=", "&gt;="
     */
    private String operator;

    /**
     * 字面量取值
     */
    private Object value;

    public static Qualifier of(String field, String operator, Object value) {
        return new Qualifier(field, operator, value);
    }
}
