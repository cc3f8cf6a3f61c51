package com.repair.orderbot.service.deadline;

import com.repair.orderbot.model.enums.AlertClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;

/**
 * 截止日期预警去重
 * 同一 (工单, 类别, 日期) 只允许一次投递：发送前先占位，投递失败也不释放
 */
@Slf4j
@Service
public class AlertDedupService {

    private static final String ALERT_KEY_PREFIX = "orderbot:alert:";

    private final StringRedisTemplate redisTemplate;

    // 占位有效期（小时），需覆盖一个完整自然日
    @Value("${orderbot.deadline.dedup-ttl-hours:48}")
    private long ttlHours = 48;

    public AlertDedupService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return true 表示本次占位成功，可以发送
     */
    public boolean claim(String businessId, AlertClass alertClass, LocalDate day) {
        String key = key(businessId, alertClass, day);
        Boolean claimed = redisTemplate.opsForValue().setIfAbsent(key, "1", Duration.ofHours(ttlHours));
        if (!Boolean.TRUE.equals(claimed)) {
            log.debug("预警已发送过，跳过：key={}", key);
            return false;
        }
        return true;
    }

    static String key(String businessId, AlertClass alertClass, LocalDate day) {
        return ALERT_KEY_PREFIX + businessId + ":" + alertClass.name() + ":" + day;
    }
}
