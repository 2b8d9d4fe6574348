package com.hao.ntpgateway.core.query;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 分类维度上的等值过滤
 * <p>
 * 未约束的维度在端点展开时取全部已知取值。实例不可变。
 *
 * @author hli
 * @date 2026-10-18
 */
@ToString
@EqualsAndHashCode
public class CategoricalFilters {

    private final Map<CategoricalColumn, String> values = new EnumMap<>(CategoricalColumn.class);

    public static CategoricalFilters none() {
        return new CategoricalFilters();
    }

    /**
     * 返回追加了一个约束的新实例，当前实例不变
     */
    public CategoricalFilters with(CategoricalColumn column, String value) {
        CategoricalFilters copy = new CategoricalFilters();
        copy.values.putAll(values);
        copy.values.put(column, value);
        return copy;
    }

    public Optional<String> get(CategoricalColumn column) {
        return Optional.ofNullable(values.get(column));
    }

    public boolean isConstrained(CategoricalColumn column) {
        return values.containsKey(column);
    }
}
