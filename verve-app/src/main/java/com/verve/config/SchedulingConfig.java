package com.verve.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度器隔离配置：
 * 1) reconcileScheduler 只承载 PR 对账，外部平台慢调用不会拖住其它守护任务；
 * 2) daemonScheduler 承载失联恢复、Epic 完成检查与 SSE 心跳。
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean(name = "reconcileScheduler")
    public ThreadPoolTaskScheduler reconcileScheduler(
            @Value("${scheduling.reconcile.pool-size:1}") int poolSize,
            @Value("${scheduling.reconcile.await-termination-seconds:10}") int awaitTerminationSeconds) {
        return newScheduler(poolSize, "pr-reconcile-", awaitTerminationSeconds);
    }

    @Bean(name = "daemonScheduler")
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${scheduling.daemon.pool-size:3}") int poolSize,
            @Value("${scheduling.daemon.await-termination-seconds:10}") int awaitTerminationSeconds) {
        return newScheduler(poolSize, "verve-daemon-", awaitTerminationSeconds);
    }

    private ThreadPoolTaskScheduler newScheduler(int poolSize, String threadNamePrefix, int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        // 关停时中断守护任务，对账与恢复循环在条目之间检查中断标志
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Daemon run failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }
}
