package com.hao.ntpgateway.core.query;

/**
 * 已解析的行
 * <p>
 * 行过滤只依赖规范化后的时间戳字段，其余列由各端点的解析器自行定义。
 *
 * @author hli
 * @date 2026-10-18
 */
public interface ParsedRow {

    /**
     * @return RFC 3339 格式的 UTC 时间戳，如 2024-10-20T23:15:00Z
     */
    String getTimestampUtc();
}
