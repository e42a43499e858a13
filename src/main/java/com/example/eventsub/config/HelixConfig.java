package com.example.eventsub.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Helix HTTP 客户端配置。
 */
@Configuration
public class HelixConfig {

    /**
     * 与 Helix 通信使用的 JDK HttpClient。
     *
     * @param connectTimeout 连接超时
     * @return HttpClient
     */
    @Bean
    public HttpClient helixHttpClient(@Value("${app.helix.connect-timeout:5s}") Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }
}
