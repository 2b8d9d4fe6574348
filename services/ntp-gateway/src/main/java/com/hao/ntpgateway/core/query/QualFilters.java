package com.hao.ntpgateway.core.query;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 结构化过滤条件
 * <p>
 * QualifierExtractor 的输出，QueryPlanner.plan 的输入。
 * 没有时间条件时 nominalRange 与 timestampBounds 均为空。
 *
 * @author hli
 * @date 2026-10-18
 */
@Data
@AllArgsConstructor
public class QualFilters {

    private LogicalTable table;

    private CategoricalFilters categorical;

    private NominalDateRange nominalRange;

    private TimestampBounds timestampBounds;
}
