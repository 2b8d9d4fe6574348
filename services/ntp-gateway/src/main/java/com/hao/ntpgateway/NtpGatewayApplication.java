package com.hao.ntpgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 类说明 / Class Description:
 * 中文：NTP 能源市场数据网关启动入口。
 * English: Startup entry for the NTP energy-market data gateway.
 *
 * 使用场景 / Use Cases:
 * 中文：将 Netztransparenz 远端接口暴露为可过滤的逻辑表，负责查询规划与拉取后的行过滤。
 * English: Exposes the Netztransparenz API as filterable logical tables; plans fetches and filters fetched rows.
 */
@SpringBootApplication
public class NtpGatewayApplication {

    /**
     * 启动 SpringBoot 应用。
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        SpringApplication.run(NtpGatewayApplication.class, args);
    }
}
