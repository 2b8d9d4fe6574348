package com.hao.ntpgateway.core.query;

import enums.ntp.NtpEndpointEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FetchPlanBuilder 单元测试
 *
 * @author hli
 * @date 2026-10-18
 */
@DisplayName("FetchPlanBuilder 地址构建测试")
class FetchPlanBuilderTest {

    private static final String BASE_URL = "https://www.netztransparenz.de/api/ntp";

    private FetchPlanBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new FetchPlanBuilder();
    }

    @Test
    @DisplayName("标准端点带产品参数")
    void standardWithParameter() {
        DateRange range = new DateRange(LocalDate.of(2024, 10, 24), LocalDate.of(2024, 10, 25));

        FetchPlan plan = builder.build(range,
                List.of(new EndpointTarget(NtpEndpointEnum.PROGNOSE, "Solar")), BASE_URL).get(0);

        assertEquals(BASE_URL + "/prognose/Solar/2024-10-24/2024-10-25", plan.getRequestTarget());
        assertEquals("prognose", plan.getEndpointId());
        assertEquals("Solar", plan.getParameter());
        assertEquals(range.getStart(), plan.getDateFrom());
        assertEquals(range.getEnd(), plan.getDateTo());
    }

    @Test
    @DisplayName("标准端点无产品参数，根地址末尾斜杠被去除")
    void standardWithoutParameterStripsSlash() {
        DateRange range = new DateRange(LocalDate.of(2024, 10, 20), LocalDate.of(2024, 10, 27));

        FetchPlan plan = builder.build(range,
                List.of(new EndpointTarget(NtpEndpointEnum.SPOTMARKTPREISE, null)), BASE_URL + "/").get(0);

        assertEquals(BASE_URL + "/Spotmarktpreise/2024-10-20/2024-10-27", plan.getRequestTarget());
    }

    @Test
    @DisplayName("月度区间端点")
    void monthRange() {
        DateRange range = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31));

        FetchPlan plan = builder.build(range,
                List.of(new EndpointTarget(NtpEndpointEnum.MARKTPRAEMIE, null)), BASE_URL).get(0);

        assertEquals(BASE_URL + "/marktpraemie/01/2024/03/2024", plan.getRequestTarget());
    }

    @Test
    @DisplayName("年度端点只使用起始年份")
    void yearOnly() {
        DateRange range = new DateRange(LocalDate.of(2024, 12, 28), LocalDate.of(2025, 1, 4));

        FetchPlan plan = builder.build(range,
                List.of(new EndpointTarget(NtpEndpointEnum.JAHRESMARKTPRAEMIE, null)), BASE_URL).get(0);

        assertEquals(BASE_URL + "/Jahresmarktpraemie/2024", plan.getRequestTarget());
    }

    @Test
    @DisplayName("每个端点一个计划，顺序与窗口一致")
    void onePlanPerTarget() {
        DateRange range = new DateRange(LocalDate.of(2024, 10, 18), LocalDate.of(2024, 10, 25));
        List<EndpointTarget> targets = List.of(
                new EndpointTarget(NtpEndpointEnum.REDISPATCH, null),
                new EndpointTarget(NtpEndpointEnum.TRAFFIC_LIGHT, null));

        List<FetchPlan> plans = builder.build(range, targets, BASE_URL);

        assertEquals(2, plans.size());
        assertEquals("redispatch", plans.get(0).getEndpointId());
        assertEquals("TrafficLight", plans.get(1).getEndpointId());
        assertTrue(plans.stream().allMatch(p -> p.getDateFrom().equals(range.getStart())
                && p.getDateTo().equals(range.getEnd())));
    }
}
