package com.hao.ntpgateway.core.query;

import com.hao.ntpgateway.config.NtpGatewayProperties;
import exception.PlanningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 查询规划入口
 * <p>
 * 串联提取、日期推导、端点展开与计划构建。规划过程同步、无副作用，
 * 所有拉取计划在任何远端调用之前一次性生成。
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryPlanner {

    private final QualifierExtractor qualifierExtractor;

    private final DateRangeResolver dateRangeResolver;

    private final EndpointMapper endpointMapper;

    private final FetchPlanBuilder fetchPlanBuilder;

    private final NtpGatewayProperties properties;

    public QualFilters extract(LogicalTable table, List<Qualifier> qualifiers) {
        return qualifierExtractor.extract(table, qualifiers);
    }

    /**
     * 使用配置的根地址生成拉取计划
     */
    public List<FetchPlan> plan(QualFilters filters) {
        return plan(filters, properties.getApiBaseUrl());
    }

    /**
     * 生成拉取计划
     *
     * @param filters 结构化过滤条件
     * @param baseUrl 远端根地址
     * @return 有序拉取计划，可能为空（分类组合没有对应接口）
     * @throws PlanningException 任一规划步骤失败
     */
    public List<FetchPlan> plan(QualFilters filters, String baseUrl) {
        DateRange range = dateRangeResolver.resolve(filters.getNominalRange(), filters.getTimestampBounds());
        List<EndpointTarget> targets = endpointMapper.map(filters.getTable(), filters.getCategorical());
        List<FetchPlan> plans = fetchPlanBuilder.build(range, targets, baseUrl);
        log.info("查询规划完成|Query_plan_done,table={},range={}~{},planCount={}",
                filters.getTable().getTableName(), range.getStart(), range.getEnd(), plans.size());
        return plans;
    }
}
