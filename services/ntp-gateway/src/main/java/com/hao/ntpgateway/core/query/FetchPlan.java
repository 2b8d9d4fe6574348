package com.hao.ntpgateway.core.query;

import enums.ntp.NtpEndpointEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * 拉取计划
 * <p>
 * 一次远端调用所需的全部信息。由 FetchPlanBuilder 生成，生成后不可变，
 * 交给外部 HTTP 协作者执行。
 *
 * @author hli
 * @date 2026-10-18
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class FetchPlan {

    private final NtpEndpointEnum endpoint;

    /**
     * 产品参数，可为空
     */
    private final String parameter;

    /**
     * 窗口起始日（含）
     */
    private final LocalDate dateFrom;

    /**
     * 窗口结束日（不含）
     */
    private final LocalDate dateTo;

    /**
     * 完整请求地址
     */
    private final String requestTarget;

    public String getEndpointId() {
        return endpoint.getEndpointId();
    }
}
