package com.repair.orderbot.service.deadline;

import com.repair.orderbot.model.enums.AlertClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertDedupServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 10, 20);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private AlertDedupService dedupService;

    @BeforeEach
    void setUp() {
        dedupService = new AlertDedupService(redisTemplate);
    }

    @Test
    void keyIsScopedByOrderClassAndDay() {
        assertThat(AlertDedupService.key("1001", AlertClass.OVERDUE, DAY))
                .isEqualTo("orderbot:alert:1001:OVERDUE:2025-10-20");
    }

    @Test
    void onlyFirstClaimSucceeds() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent("orderbot:alert:1001:DUE_TOMORROW:2025-10-20", "1", Duration.ofHours(48)))
                .thenReturn(true, false);

        assertThat(dedupService.claim("1001", AlertClass.DUE_TOMORROW, DAY)).isTrue();
        assertThat(dedupService.claim("1001", AlertClass.DUE_TOMORROW, DAY)).isFalse();
    }

    @Test
    void missingRedisAnswerIsNotAClaim() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertThat(dedupService.claim("1001", AlertClass.OVERDUE, DAY)).isFalse();
    }
}
