package com.verve;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * verve 编排服务启动类。
 * <p>
 * 位于顶层包路径，扫描各子模块中的组件；存储后端由 {@code verve.store.type} 选择。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@SpringBootApplication
@EnableScheduling
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
