package com.hao.ntpgateway.core.scan;

import com.hao.ntpgateway.core.query.LogicalTable;
import exception.UnknownCategoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TableDetector 单元测试
 *
 * @author hli
 * @date 2026-10-18
 */
@DisplayName("TableDetector 表识别测试")
class TableDetectorTest {

    private TableDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TableDetector();
    }

    @Test
    @DisplayName("表选项优先级：table > object > name")
    void optionKeysAreCheckedInOrder() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("name", "redispatch_events");
        options.put("object", "grid_status_timeseries");

        assertEquals(LogicalTable.GRID_STATUS_TIMESERIES, detector.detect(options, List.of("product_type")));

        options.put("table", "electricity_market_prices");
        assertEquals(LogicalTable.ELECTRICITY_MARKET_PRICES, detector.detect(options, List.of("product_type")));
    }

    @Test
    @DisplayName("表选项给出未知表名时抛出 UnknownCategoryException")
    void unknownOptionTableThrows() {
        Map<String, String> options = Map.of("table", "weather");

        UnknownCategoryException ex = assertThrows(UnknownCategoryException.class,
                () -> detector.detect(options, List.of()));
        assertEquals(4103, ex.getErrorCode());
    }

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "product_type, RENEWABLE_ENERGY_TIMESERIES",
            "price_type, ELECTRICITY_MARKET_PRICES",
            "reason, REDISPATCH_EVENTS",
            "grid_status, GRID_STATUS_TIMESERIES"
    })
    @DisplayName("无表选项时按区分列识别")
    void detectsByDiscriminatorColumn(String column, LogicalTable expected) {
        assertEquals(expected, detector.detect(Map.of(), List.of("timestamp_utc", column)));
    }

    @Test
    @DisplayName("无法识别时默认可再生能源表")
    void defaultsToRenewable() {
        assertEquals(LogicalTable.RENEWABLE_ENERGY_TIMESERIES, detector.detect(null, List.of("timestamp_utc")));
        assertEquals(LogicalTable.RENEWABLE_ENERGY_TIMESERIES, detector.detect(null, null));
    }
}
