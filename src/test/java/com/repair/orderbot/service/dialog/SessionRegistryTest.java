package com.repair.orderbot.service.dialog;

import com.repair.orderbot.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    @Test
    void idleSessionsAreEvicted() {
        MutableClock clock = new MutableClock(Instant.parse("2025-10-20T12:00:00Z"), ZoneId.of("UTC"));
        SessionRegistry registry = new SessionRegistry(clock);

        registry.getOrCreate("a", "chat-a");
        clock.advance(Duration.ofMinutes(20));
        registry.getOrCreate("b", "chat-b");
        clock.advance(Duration.ofMinutes(15));

        registry.evictIdle();

        assertThat(registry.find("a")).isNull();
        assertThat(registry.find("b")).isNotNull();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void sameSessionIdReturnsSameSession() {
        SessionRegistry registry = new SessionRegistry(new MutableClock(Instant.EPOCH, ZoneId.of("UTC")));

        Session first = registry.getOrCreate("a", "chat-a");

        assertThat(registry.getOrCreate("a", null)).isSameAs(first);
        assertThat(first.getChannel()).isEqualTo("chat-a");
    }

    @Test
    void fetchingAnIdleSessionKeepsItFromEviction() {
        MutableClock clock = new MutableClock(Instant.parse("2025-10-20T12:00:00Z"), ZoneId.of("UTC"));
        SessionRegistry registry = new SessionRegistry(clock);
        Session idle = registry.getOrCreate("a", "chat-a");
        clock.advance(Duration.ofMinutes(45));

        // 新一轮输入取出会话后、加锁前恰好触发清理
        Session fetched = registry.getOrCreate("a", "chat-a");
        registry.evictIdle();

        assertThat(fetched).isSameAs(idle);
        assertThat(fetched.getLastActiveAt()).isEqualTo(clock.instant());
        assertThat(registry.find("a")).isSameAs(fetched);
    }
}
