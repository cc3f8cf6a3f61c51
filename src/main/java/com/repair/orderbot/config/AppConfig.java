package com.repair.orderbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 业务时钟配置
 * 截止日期按自然日计算，提醒时间按操作员所在时区解析，统一使用同一个 Clock
 */
@Configuration
public class AppConfig {

    @Value("${orderbot.zone:America/Sao_Paulo}")
    private String zone;

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(zone));
    }
}
