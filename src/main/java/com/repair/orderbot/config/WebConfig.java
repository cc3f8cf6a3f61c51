package com.repair.orderbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Telegram Bot API 调用使用的 RestTemplate
 * 推送在定时任务线程上同步执行，超时必须有上限
 */
@Configuration
public class WebConfig {

    @Value("${telegram.bot.connect-timeout-ms:5000}")
    private long connectTimeoutMs = 5000;

    // 文档下载也走这个客户端，读取超时不宜过短
    @Value("${telegram.bot.read-timeout-ms:10000}")
    private long readTimeoutMs = 10000;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
