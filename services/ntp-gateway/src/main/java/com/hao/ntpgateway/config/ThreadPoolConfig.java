package com.hao.ntpgateway.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 网关线程池配置
 *
 * 设计目的：
 * 1. 为并行拉取模式提供专用 IO 线程池。
 * 2. 远端调用以网络等待为主，线程数按 IO 密集型设置。
 *
 * @author hli
 * @date 2026-10-18
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    private static final int CPU_CORES = Runtime.getRuntime().availableProcessors();

    @Value("${ntp.executor.queue.capacity:200}")
    private Integer queueCapacity;

    @Value("${ntp.executor.keep.alive.seconds:60}")
    private Integer keepAliveSeconds;

    @Value("${ntp.executor.await.termination.seconds:30}")
    private Integer awaitTerminationSeconds;

    private ThreadPoolTaskExecutor ioTaskExecutor;

    /**
     * 远端拉取线程池
     * <p>
     * 单次扫描最多 7 个计划，核心线程数取 CPU 核数 × 2 已足够。
     *
     * @return ThreadPoolTaskExecutor 拉取专用线程池
     */
    @Bean("ioTaskExecutor")
    public ThreadPoolTaskExecutor ioTaskExecutor() {
        log.info("初始化拉取线程池|Init_io_thread_pool,cpuCores={}", CPU_CORES);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int corePoolSize = CPU_CORES * 2;
        executor.setCorePoolSize(corePoolSize);

        int maxPoolSize = CPU_CORES * 4;
        executor.setMaxPoolSize(maxPoolSize);

        executor.setQueueCapacity(queueCapacity);
        executor.setKeepAliveSeconds(keepAliveSeconds);

        // 线程名称前缀：便于日志追踪
        executor.setThreadNamePrefix("ntp-io-");

        executor.setAllowCoreThreadTimeOut(true);

        // 拒绝策略：调用者运行，计划不会丢失
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);

        executor.initialize();
        this.ioTaskExecutor = executor;

        log.info("拉取线程池初始化完成|Io_thread_pool_ready,coreSize={},maxSize={},queueSize={}",
                corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    /**
     * 应用关闭时清理线程池
     */
    @PreDestroy
    public void destroy() {
        if (ioTaskExecutor == null) {
            return;
        }
        log.info("开始关闭拉取线程池|Shutdown_io_pool");
        ioTaskExecutor.shutdown();
        ThreadPoolExecutor pool = ioTaskExecutor.getThreadPoolExecutor();
        try {
            if (!pool.awaitTermination(awaitTerminationSeconds, TimeUnit.SECONDS)) {
                log.warn("拉取线程池关闭超时_强制关闭|Io_pool_timeout_force_shutdown");
                pool.shutdownNow();
            }
            log.info("拉取线程池已关闭|Io_pool_shutdown_success");
        } catch (InterruptedException e) {
            log.warn("拉取线程池关闭被中断|Io_pool_shutdown_interrupted");
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
