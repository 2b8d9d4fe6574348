package com.hao.ntpgateway.integration.ntp;

import com.hao.ntpgateway.core.query.FetchPlan;

/**
 * 远端接口拉取协作者
 * <p>
 * 实现方负责 OAuth2 令牌的获取、缓存与刷新，以及 HTTP 请求与状态码处理。
 * 网关本身不做重试。
 *
 * @author hli
 * @date 2026-10-18
 */
@FunctionalInterface
public interface EndpointFetcher {

    /**
     * 执行一个拉取计划
     *
     * @param plan 拉取计划
     * @return 响应体；远端无数据（404）时返回空字符串
     * @throws Exception 网络或远端错误，由扫描驱动包装为 ExternalServiceException
     */
    String fetch(FetchPlan plan) throws Exception;
}
