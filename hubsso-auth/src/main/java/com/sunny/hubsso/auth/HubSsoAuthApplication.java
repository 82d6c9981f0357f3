package com.sunny.hubsso.auth;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 认证启动类
 * 负责服务启动与基础组件装配
 *
 * @author Sunny
 * @date 2026-10-17
 */
@SpringBootApplication
@MapperScan("com.sunny.hubsso.auth.mapper")
public class HubSsoAuthApplication {
    public static void main(String[] args) {
        SpringApplication.run(HubSsoAuthApplication.class, args);
    }
}
