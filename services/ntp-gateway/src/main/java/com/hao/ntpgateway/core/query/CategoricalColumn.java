package com.hao.ntpgateway.core.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 分类维度列
 * <p>
 * 这些列上的等值条件决定调用哪些远端接口。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@AllArgsConstructor
public enum CategoricalColumn {

    PRODUCT_TYPE("product_type"),

    DATA_CATEGORY("data_category"),

    PRICE_TYPE("price_type");

    private final String columnName;

    public static Optional<CategoricalColumn> fromColumnName(String columnName) {
        return Arrays.stream(values())
                .filter(c -> c.columnName.equals(columnName))
                .findFirst();
    }
}
