package com.repair.orderbot.service.dialog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话注册表，按会话ID隔离对话状态
 */
@Slf4j
@Component
public class SessionRegistry {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    // 会话空闲过期时间（分钟）
    @Value("${orderbot.session.expire-minutes:30}")
    private long expireMinutes = 30;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * 获取或新建会话，并在同一原子操作内刷新活跃时间，避免刚取出的会话被并发清理
     */
    public Session getOrCreate(String sessionId, String channel) {
        return sessions.compute(sessionId, (id, existing) -> {
            Session session = existing;
            if (session == null) {
                log.debug("新建会话：sessionId={}", id);
                session = new Session(id);
            }
            session.setLastActiveAt(clock.instant());
            if (channel != null) {
                session.setChannel(channel);
            }
            return session;
        });
    }

    public Session find(String sessionId) {
        return sessions.get(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(fixedDelayString = "${orderbot.session.evict-interval-ms:60000}")
    public void evictIdle() {
        Instant threshold = clock.instant().minus(Duration.ofMinutes(expireMinutes));
        int before = sessions.size();
        for (String sessionId : sessions.keySet()) {
            // 与 getOrCreate 在同一个 key 上互斥，刷新与清理不会交错
            sessions.computeIfPresent(sessionId, (id, session) -> isIdle(session, threshold) ? null : session);
        }
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("清理空闲会话：evicted={}, remaining={}", evicted, sessions.size());
        }
    }

    private boolean isIdle(Session session, Instant threshold) {
        synchronized (session) {
            return session.getLastActiveAt() != null && session.getLastActiveAt().isBefore(threshold);
        }
    }
}
