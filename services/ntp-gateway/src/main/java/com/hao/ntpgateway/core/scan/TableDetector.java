package com.hao.ntpgateway.core.scan;

import com.hao.ntpgateway.core.query.LogicalTable;
import exception.UnknownCategoryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 逻辑表识别
 * <p>
 * 识别顺序：
 * <ol>
 *   <li>表选项 table、object、name，取第一个存在的值</li>
 *   <li>投影列中第一个区分列：product_type、price_type、reason、grid_status</li>
 *   <li>都没有时默认为 renewable_energy_timeseries</li>
 * </ol>
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
public class TableDetector {

    private static final List<String> TABLE_OPTION_KEYS = List.of("table", "object", "name");

    /**
     * @throws UnknownCategoryException 表选项给出的表名未知
     */
    public LogicalTable detect(Map<String, String> options, List<String> columns) {
        if (options != null) {
            for (String key : TABLE_OPTION_KEYS) {
                String value = options.get(key);
                if (value != null) {
                    LogicalTable table = LogicalTable.fromTableName(value);
                    log.debug("按表选项识别|Table_detected_by_option,key={},table={}", key, table.getTableName());
                    return table;
                }
            }
        }
        if (columns != null) {
            for (String column : columns) {
                Optional<LogicalTable> table = LogicalTable.fromDiscriminator(column);
                if (table.isPresent()) {
                    log.debug("按区分列识别|Table_detected_by_column,column={},table={}",
                            column, table.get().getTableName());
                    return table.get();
                }
            }
        }
        log.warn("无法识别表_使用默认表|Table_undetected_use_default,columns={},default={}",
                columns, LogicalTable.RENEWABLE_ENERGY_TIMESERIES.getTableName());
        return LogicalTable.RENEWABLE_ENERGY_TIMESERIES;
    }
}
