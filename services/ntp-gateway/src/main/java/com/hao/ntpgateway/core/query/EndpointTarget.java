package com.hao.ntpgateway.core.query;

import enums.ntp.NtpEndpointEnum;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 端点展开结果：远端接口 + 可选的产品参数（如 Solar）
 *
 * @author hli
 * @date 2026-10-18
 */
@Data
@AllArgsConstructor
public class EndpointTarget {

    private NtpEndpointEnum endpoint;

    /**
     * 产品路径段，无产品维度的接口为空
     */
    private String parameter;
}
