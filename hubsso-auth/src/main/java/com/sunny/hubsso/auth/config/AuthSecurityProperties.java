package com.sunny.hubsso.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;
/**
 * 认证安全配置属性
 * 承载认证安全配置项并完成参数绑定
 *
 * @author Sunny
 * @date 2026-10-17
 */

@Data
@ConfigurationProperties(prefix = "security")
public class AuthSecurityProperties {

    private Token token = new Token();
    private Recovery recovery = new Recovery();
    private Cookie cookie = new Cookie();
    private Login login = new Login();

    @Data
    public static class Token {
        /**
         * HS256 签名密钥，至少32字节
         */
        private String secret;
        private Duration sessionLifetime = Duration.ofDays(7);
        private Duration recoveryLifetime = Duration.ofDays(1);
    }

    @Data
    public static class Recovery {
        /**
         * 找回链接的对外访问地址，不含末尾斜杠
         */
        private String publicBaseUrl = "http://localhost:8080";
        private String from = "no-reply@localhost";
        private String subject = "密码找回";
    }

    @Data
    public static class Cookie {
        private String name = "hub-session";
        private boolean secure = false;
    }

    @Data
    public static class Login {
        private boolean enabled = true;
        private int maxAttempts = 5;
        private int windowSeconds = 600;
        private int lockSeconds = 900;
    }
}
