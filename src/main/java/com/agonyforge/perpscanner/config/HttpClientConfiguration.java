package com.agonyforge.perpscanner.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * The shared HTTP client for REST polling and WebSocket streams. Each venue derives its own client from
 * this one with its own call timeout.
 */
@Configuration
public class HttpClientConfiguration {
    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(30))
            .pingInterval(Duration.ofSeconds(20))
            .retryOnConnectionFailure(true)
            .build();
    }
}
