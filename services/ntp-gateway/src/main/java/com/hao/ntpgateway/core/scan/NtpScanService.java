package com.hao.ntpgateway.core.scan;

import com.hao.ntpgateway.config.NtpGatewayProperties;
import com.hao.ntpgateway.core.query.FetchPlan;
import com.hao.ntpgateway.core.query.LogicalTable;
import com.hao.ntpgateway.core.query.ParsedRow;
import com.hao.ntpgateway.core.query.QualFilters;
import com.hao.ntpgateway.core.query.QueryPlanner;
import com.hao.ntpgateway.core.query.RowFilter;
import com.hao.ntpgateway.core.query.TimestampBounds;
import com.hao.ntpgateway.integration.ntp.EndpointFetcher;
import com.hao.ntpgateway.integration.ntp.RowProducer;
import exception.BusinessException;
import exception.DataException;
import exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 扫描编排服务
 * <p>
 * 一次扫描的完整流程：
 * <ol>
 *   <li>识别逻辑表</li>
 *   <li>提取过滤条件并生成全部拉取计划</li>
 *   <li>逐个计划：拉取、跳过空响应、解析、按时间边界过滤</li>
 *   <li>按计划顺序合并，封装为 ScanSession 交给宿主</li>
 * </ol>
 * 拉取失败包装为 ExternalServiceException，解析失败包装为 DataException，均不重试。
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NtpScanService {

    private final TableDetector tableDetector;

    private final QueryPlanner queryPlanner;

    private final RowFilter rowFilter;

    private final PlanExecutor planExecutor;

    private final NtpGatewayProperties properties;

    public <T extends ParsedRow> ScanSession<T> beginScan(ScanRequest request,
                                                         EndpointFetcher fetcher,
                                                         RowProducer<T> producer) {
        LogicalTable table = tableDetector.detect(request.getOptions(), request.getColumns());
        QualFilters filters = queryPlanner.extract(table, request.getQualifiers());
        List<FetchPlan> plans = queryPlanner.plan(filters);

        TimestampBounds bounds = filters.getTimestampBounds();
        List<T> rows = planExecutor.execute(plans,
                plan -> fetchAndFilter(plan, fetcher, producer, bounds),
                properties.isParallelFetch());

        log.info("扫描开始|Scan_begin,table={},planCount={},rowCount={}",
                table.getTableName(), plans.size(), rows.size());
        return new ScanSession<>(table, filters, plans, rows);
    }

    private <T extends ParsedRow> List<T> fetchAndFilter(FetchPlan plan,
                                                         EndpointFetcher fetcher,
                                                         RowProducer<T> producer,
                                                         TimestampBounds bounds) {
        String body = fetch(plan, fetcher);
        if (body == null || body.isBlank()) {
            log.info("远端无数据_跳过|Empty_response_skipped,requestTarget={}", plan.getRequestTarget());
            return List.of();
        }

        List<T> rows;
        try {
            rows = producer.produce(body, plan);
        } catch (BusinessException e) {
            throw e;
        } catch (Exception e) {
            log.error("响应解析失败|Response_parse_failed,requestTarget={}", plan.getRequestTarget(), e);
            throw new DataException("Failed to parse response from " + plan.getRequestTarget(), e);
        }
        return rowFilter.filterRows(rows, bounds);
    }

    private static String fetch(FetchPlan plan, EndpointFetcher fetcher) {
        try {
            return fetcher.fetch(plan);
        } catch (BusinessException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted while fetching " + plan.getRequestTarget(), e);
        } catch (Exception e) {
            log.error("远端拉取失败|Endpoint_fetch_failed,requestTarget={}", plan.getRequestTarget(), e);
            throw new ExternalServiceException("Failed to fetch " + plan.getRequestTarget(), e);
        }
    }
}
