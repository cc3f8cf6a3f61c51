package com.repair.orderbot.service.reminder;

import com.repair.orderbot.exception.NotificationException;
import com.repair.orderbot.exception.PersistenceException;
import com.repair.orderbot.exception.SchedulingException;
import com.repair.orderbot.model.dto.ManualReminder;
import com.repair.orderbot.model.enums.ReminderStatus;
import com.repair.orderbot.service.business.IReminderRepository;
import com.repair.orderbot.service.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 手动提醒：登记、取消、到点投递
 * 投递语义为至多一次：先把 PENDING 条件更新为 FIRED，更新成功的一方才投递
 */
@Slf4j
@Service
public class ReminderScheduler {

    private final IReminderRepository reminderRepository;
    private final Notifier notifier;
    private final Clock clock;

    // 允许登记的过去时间容差（秒），吸收输入与处理之间的延迟
    @Value("${orderbot.reminder.grace-seconds:30}")
    private long graceSeconds = 30;

    public ReminderScheduler(IReminderRepository reminderRepository, Notifier notifier, Clock clock) {
        this.reminderRepository = reminderRepository;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * 校验触发时间
     * @throws SchedulingException 早于 当前时间 - 容差
     */
    public void checkFiresAt(Instant firesAt) {
        if (firesAt == null) {
            throw new SchedulingException("提醒时间不能为空");
        }
        Instant earliest = clock.instant().minus(Duration.ofSeconds(graceSeconds));
        if (firesAt.isBefore(earliest)) {
            throw new SchedulingException("提醒时间已经过去，请输入一个将来的时间");
        }
    }

    /**
     * @param businessId 关联工单编号，可为空
     * @return 提醒ID
     */
    public Long schedule(Instant firesAt, String message, String channel, String businessId) {
        checkFiresAt(firesAt);
        if (!StringUtils.hasText(message)) {
            throw new SchedulingException("提醒内容不能为空");
        }
        if (!StringUtils.hasText(channel)) {
            throw new SchedulingException("提醒投递通道不能为空");
        }

        ManualReminder saved = reminderRepository.create(ManualReminder.builder()
                .firesAt(firesAt)
                .message(message.trim())
                .targetChannel(channel)
                .businessId(businessId)
                .status(ReminderStatus.PENDING)
                .build());
        log.info("提醒已登记：id={}, firesAt={}, channel={}, businessId={}", saved.getId(), firesAt, channel, businessId);
        return saved.getId();
    }

    /**
     * 取消单条提醒，重复调用无副作用
     * @return 本次是否取消了一条待触发的提醒
     */
    public boolean cancel(Long id) {
        boolean cancelled = reminderRepository.transition(id, ReminderStatus.PENDING, ReminderStatus.CANCELLED, clock.instant());
        if (cancelled) {
            log.info("提醒已取消：id={}", id);
        }
        return cancelled;
    }

    public int cancelAllFor(String businessId) {
        int count = reminderRepository.cancelAllFor(businessId);
        if (count > 0) {
            log.info("工单关联提醒已取消：businessId={}, count={}", businessId, count);
        }
        return count;
    }

    public int retarget(String oldBusinessId, String newBusinessId) {
        int count = reminderRepository.retarget(oldBusinessId, newBusinessId);
        if (count > 0) {
            log.info("提醒已改挂到新工单编号：{} -> {}, count={}", oldBusinessId, newBusinessId, count);
        }
        return count;
    }

    public List<ManualReminder> listPending(String channel) {
        return reminderRepository.findPending(StringUtils.hasText(channel) ? channel : null);
    }

    public List<ManualReminder> pendingFor(String businessId) {
        if (!StringUtils.hasText(businessId)) {
            return Collections.emptyList();
        }
        return reminderRepository.findPendingFor(businessId);
    }

    @Scheduled(fixedDelayString = "${orderbot.reminder.poll-interval-ms:30000}")
    public void pollDue() {
        try {
            fireDue();
        } catch (PersistenceException e) {
            log.error("提醒轮询失败，等待下次调度：error={}", e.getMessage(), e);
        }
    }

    /**
     * 投递所有已到期的提醒
     * @return 实际投递成功的条数
     */
    public int fireDue() {
        Instant now = clock.instant();
        List<ManualReminder> due = reminderRepository.findDue(now);
        int delivered = 0;
        for (ManualReminder reminder : due) {
            if (!reminderRepository.transition(reminder.getId(), ReminderStatus.PENDING, ReminderStatus.FIRED, now)) {
                log.debug("提醒已被其他实例处理：id={}", reminder.getId());
                continue;
            }
            try {
                notifier.send(reminder.getTargetChannel(), render(reminder));
                delivered++;
                log.info("提醒已投递：id={}, channel={}", reminder.getId(), reminder.getTargetChannel());
            } catch (NotificationException e) {
                // 不重试
                log.warn("提醒投递失败：id={}, channel={}, error={}", reminder.getId(), reminder.getTargetChannel(), e.getMessage());
            }
        }
        return delivered;
    }

    private String render(ManualReminder reminder) {
        StringBuilder text = new StringBuilder("⏰ 提醒：").append(reminder.getMessage());
        if (StringUtils.hasText(reminder.getBusinessId())) {
            text.append("\n关联工单：").append(reminder.getBusinessId());
        }
        return text.toString();
    }
}
