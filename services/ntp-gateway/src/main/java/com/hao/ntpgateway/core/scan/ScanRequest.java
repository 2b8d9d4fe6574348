package com.hao.ntpgateway.core.scan;

import com.hao.ntpgateway.core.query.Qualifier;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 宿主发起的一次表扫描
 *
 * @author hli
 * @date 2026-10-18
 */
@Data
@AllArgsConstructor
public class ScanRequest {

    /**
     * 表选项，可能含 table / object / name
     */
    private Map<String, String> options;

    /**
     * 投影列名
     */
    private List<String> columns;

    /**
     * 下推的过滤条件
     */
    private List<Qualifier> qualifiers;
}
