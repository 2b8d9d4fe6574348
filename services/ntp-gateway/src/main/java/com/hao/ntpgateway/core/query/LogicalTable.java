package com.hao.ntpgateway.core.query;

import exception.UnknownCategoryException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 网关对外暴露的逻辑表
 * <p>
 * 每张表声明自己的分类维度（按端点展开的顺序）以及用于表识别的区分列。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@AllArgsConstructor
public enum LogicalTable {

    /**
     * 可再生能源时序：光伏、陆上风电、海上风电
     */
    RENEWABLE_ENERGY_TIMESERIES("renewable_energy_timeseries", "product_type",
            List.of(CategoricalColumn.PRODUCT_TYPE, CategoricalColumn.DATA_CATEGORY)),

    /**
     * 电力市场价格
     */
    ELECTRICITY_MARKET_PRICES("electricity_market_prices", "price_type",
            List.of(CategoricalColumn.PRICE_TYPE)),

    /**
     * 再调度事件
     */
    REDISPATCH_EVENTS("redispatch_events", "reason", List.of()),

    /**
     * 电网状态时序
     */
    GRID_STATUS_TIMESERIES("grid_status_timeseries", "grid_status", List.of());

    /**
     * 表名
     */
    private final String tableName;

    /**
     * 区分列：投影中出现该列即可认定为本表
     */
    private final String discriminatorColumn;

    /**
     * 分类维度，顺序即笛卡尔展开的嵌套顺序（外层在前）
     */
    private final List<CategoricalColumn> dimensions;

    /**
     * 按表名解析
     *
     * @param tableName 表名
     * @return 逻辑表
     * @throws UnknownCategoryException 表名未知
     */
    public static LogicalTable fromTableName(String tableName) {
        return Arrays.stream(values())
                .filter(t -> t.tableName.equals(tableName))
                .findFirst()
                .orElseThrow(() -> new UnknownCategoryException(String.format(
                        "Unknown table: '%s'. Expected one of: %s.", tableName, tableNames())));
    }

    public static Optional<LogicalTable> fromDiscriminator(String columnName) {
        return Arrays.stream(values())
                .filter(t -> t.discriminatorColumn.equals(columnName))
                .findFirst();
    }

    public static String tableNames() {
        return Arrays.stream(values()).map(LogicalTable::getTableName).collect(Collectors.joining(", "));
    }
}
