package com.hao.ntpgateway.core.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 拉取计划构建器
 * <p>
 * 把日期窗口、端点列表与根地址组合为拉取计划，每个端点一个计划，共用同一窗口。
 * 地址格式由端点的 RequestTargetShape 决定。
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
public class FetchPlanBuilder {

    public List<FetchPlan> build(DateRange range, List<EndpointTarget> targets, String baseUrl) {
        String base = stripTrailingSlashes(baseUrl);
        List<FetchPlan> plans = new ArrayList<>(targets.size());
        for (EndpointTarget target : targets) {
            String requestTarget = requestTarget(base, target, range.getStart(), range.getEnd());
            plans.add(new FetchPlan(target.getEndpoint(), target.getParameter(),
                    range.getStart(), range.getEnd(), requestTarget));
            log.debug("生成拉取计划|Fetch_plan_built,requestTarget={}", requestTarget);
        }
        return plans;
    }

    private static String requestTarget(String base, EndpointTarget target, LocalDate from, LocalDate to) {
        String endpointId = target.getEndpoint().getEndpointId();
        return switch (target.getEndpoint().getShape()) {
            case YEAR_ONLY -> String.format("%s/%s/%04d", base, endpointId, from.getYear());
            case MONTH_RANGE -> String.format("%s/%s/%02d/%04d/%02d/%04d", base, endpointId,
                    from.getMonthValue(), from.getYear(), to.getMonthValue(), to.getYear());
            case STANDARD -> target.getParameter() == null
                    ? String.format("%s/%s/%s/%s", base, endpointId, from, to)
                    : String.format("%s/%s/%s/%s/%s", base, endpointId, target.getParameter(), from, to);
        };
    }

    private static String stripTrailingSlashes(String baseUrl) {
        String base = baseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
