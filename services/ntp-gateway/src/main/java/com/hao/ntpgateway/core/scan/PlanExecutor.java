package com.hao.ntpgateway.core.scan;

import com.hao.ntpgateway.core.query.FetchPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 拉取计划执行器
 * <p>
 * 职责：按计划列表执行拉取动作，合并结果。
 * <ul>
 *   <li>串行模式：按计划顺序逐个执行</li>
 *   <li>并行模式：使用 CompletableFuture 在 ioTaskExecutor 上并发执行，结果仍按计划顺序合并</li>
 *   <li>任一计划失败则整体失败，不返回部分结果；并行模式下取消尚未完成的计划</li>
 * </ul>
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Component
public class PlanExecutor {

    private final Executor ioTaskExecutor;

    public PlanExecutor(@Qualifier("ioTaskExecutor") Executor ioTaskExecutor) {
        this.ioTaskExecutor = ioTaskExecutor;
    }

    /**
     * 执行全部计划
     *
     * @param plans    拉取计划
     * @param action   单个计划的拉取与过滤动作
     * @param parallel 是否并行
     * @param <T>      行类型
     * @return 按计划顺序合并后的结果
     */
    public <T> List<T> execute(List<FetchPlan> plans, Function<FetchPlan, List<T>> action, boolean parallel) {
        if (plans == null || plans.isEmpty()) {
            log.debug("拉取计划为空_返回空列表|Empty_plans_return_empty_list");
            return Collections.emptyList();
        }

        if (!parallel || plans.size() == 1) {
            List<T> combined = new ArrayList<>();
            for (FetchPlan plan : plans) {
                log.info("执行拉取计划|Execute_plan,endpoint={},requestTarget={}",
                        plan.getEndpointId(), plan.getRequestTarget());
                combined.addAll(action.apply(plan));
            }
            log.info("串行拉取完成|Sequential_fetch_done,planCount={},totalCount={}", plans.size(), combined.size());
            return combined;
        }

        log.info("并行拉取开始|Parallel_fetch_start,planCount={}", plans.size());

        List<CompletableFuture<List<T>>> futures = plans.stream()
                .map(plan -> CompletableFuture.supplyAsync(
                        () -> {
                            log.info("执行拉取计划|Execute_plan,endpoint={},requestTarget={}",
                                    plan.getEndpointId(), plan.getRequestTarget());
                            return action.apply(plan);
                        },
                        ioTaskExecutor
                ))
                .collect(Collectors.toList());

        // 任一计划失败立即结束等待，不等其余计划完成
        CompletableFuture<Void> allDone = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        futures.forEach(future -> future.whenComplete((rows, ex) -> {
            if (ex != null) {
                firstFailure.completeExceptionally(ex);
            }
        }));

        try {
            CompletableFuture.anyOf(allDone, firstFailure).join();
        } catch (CompletionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e;
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            log.error("并行拉取失败_取消剩余计划|Parallel_fetch_failed_cancel_rest,planCount={}", plans.size(), cause);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }

        // 按计划顺序合并
        List<T> combined = new ArrayList<>();
        for (CompletableFuture<List<T>> future : futures) {
            combined.addAll(future.join());
        }

        log.info("并行拉取完成|Parallel_fetch_done,totalCount={}", combined.size());
        return combined;
    }
}
