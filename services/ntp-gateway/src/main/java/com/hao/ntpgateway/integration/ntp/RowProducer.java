package com.hao.ntpgateway.integration.ntp;

import com.hao.ntpgateway.core.query.FetchPlan;
import com.hao.ntpgateway.core.query.ParsedRow;

import java.util.List;

/**
 * 响应体解析协作者
 * <p>
 * 按端点把 CSV/JSON 响应解码为行对象。德式数字格式、单位换算、
 * 负电价按时长拆行等逻辑都属于实现方。
 *
 * @param <T> 行类型
 * @author hli
 * @date 2026-10-18
 */
@FunctionalInterface
public interface RowProducer<T extends ParsedRow> {

    /**
     * @param body 非空响应体
     * @param plan 产生该响应的拉取计划
     * @return 解析出的行，按远端顺序
     * @throws Exception 解码失败，由扫描驱动包装为 DataException
     */
    List<T> produce(String body, FetchPlan plan) throws Exception;
}
