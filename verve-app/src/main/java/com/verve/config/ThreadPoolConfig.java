package com.verve.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * <ul>
 *   <li>workPollExecutor：worker 长轮询的阻塞等待，默认直接交付不排队</li>
 *   <li>sseDeliveryExecutor：SSE 订阅队列的排空任务</li>
 * </ul>
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "workPollExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "workPollExecutor")
    public ThreadPoolExecutor workPollExecutor(ThreadPoolConfigProperties properties) {
        return buildExecutor(properties.getPoll(), true);
    }

    @Bean(name = "sseDeliveryExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "sseDeliveryExecutor")
    public ThreadPoolExecutor sseDeliveryExecutor(ThreadPoolConfigProperties properties) {
        return buildExecutor(properties.getSse(), true);
    }

    private ThreadPoolExecutor buildExecutor(ThreadPoolConfigProperties.Pool pool, boolean daemon) {
        int coreSize = Math.max(pool.getCorePoolSize() == null ? 1 : pool.getCorePoolSize(), 1);
        int maxSize = Math.max(pool.getMaxPoolSize() == null ? coreSize : pool.getMaxPoolSize(), coreSize);
        int queueCapacity = Math.max(pool.getQueueCapacity() == null ? 0 : pool.getQueueCapacity(), 0);
        long keepAliveSeconds = Math.max(pool.getKeepAliveSeconds() == null ? 60L : pool.getKeepAliveSeconds(), 0L);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        String prefix = pool.getThreadNamePrefix() == null ? "verve-pool-" : pool.getThreadNamePrefix();
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIndex.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(pool.getPolicy()));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
