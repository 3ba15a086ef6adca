package com.blockhub.gameservice.platform.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 身份接口跨域放开（WebSocket 端点的来源限制在 WebSocketConfig 中配置）。
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${blockhub.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/auth/**")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods("GET", "HEAD", "OPTIONS", "PUT", "PATCH", "POST", "DELETE")
                .allowedHeaders("Origin", "X-Requested-With", "Content-Type", "Accept", "X-Access-Token")
                .allowCredentials(true);
    }
}
