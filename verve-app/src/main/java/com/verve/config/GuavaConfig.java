package com.verve.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 本地缓存配置。
 * <p>
 * settingCache 缓存设置项读取，写入后短时过期，跨实例的修改最多延迟一个过期周期可见。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "settingCache")
    public Cache<String, String> settingCache(@Value("${verve.settings.cache-ttl-seconds:5}") long ttlSeconds) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(ttlSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(1000)
                .build();
    }

}
