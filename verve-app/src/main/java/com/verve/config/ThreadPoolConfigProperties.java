package com.verve.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 线程池配置属性，前缀 verve.executor。
 * <p>
 * poll 承载 worker 长轮询等待，sse 承载事件推送。两者都是有界的，饱和时拒绝而不是无限排队。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Data
@ConfigurationProperties(prefix = "verve.executor", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    private Pool poll = new Pool(16, 256, 0, "work-poll-");

    private Pool sse = new Pool(4, 8, 1024, "sse-delivery-");

    @Data
    public static class Pool {

        /** 核心线程数 */
        private Integer corePoolSize;

        /** 最大线程数 */
        private Integer maxPoolSize;

        /** 阻塞队列容量，0 表示直接交付（SynchronousQueue） */
        private Integer queueCapacity;

        private Long keepAliveSeconds = 60L;

        private String threadNamePrefix;

        /**
         * 拒绝策略，默认 AbortPolicy；调用方捕获 RejectedExecutionException 后降级。
         */
        private String policy = "AbortPolicy";

        public Pool() {
        }

        public Pool(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
