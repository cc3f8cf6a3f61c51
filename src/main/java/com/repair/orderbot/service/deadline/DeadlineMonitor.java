package com.repair.orderbot.service.deadline;

import com.repair.orderbot.exception.NotificationException;
import com.repair.orderbot.exception.PersistenceException;
import com.repair.orderbot.model.dto.SweepReport;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.enums.AlertClass;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.service.business.IWorkOrderRepository;
import com.repair.orderbot.service.dialog.WorkOrderFormatter;
import com.repair.orderbot.service.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 截止日期巡检：逾期、今日、明日、两天后到期的未完结工单推送预警
 */
@Slf4j
@Component
public class DeadlineMonitor {

    private static final String LOCK_KEY = "orderbot:deadline:lock";

    private final IWorkOrderRepository workOrderRepository;
    private final AlertDedupService alertDedupService;
    private final Notifier notifier;
    private final WorkOrderFormatter formatter;
    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    @Value("${orderbot.deadline.enabled:true}")
    private boolean enabled = true;

    @Value("${orderbot.deadline.alert-due-today:true}")
    private boolean alertDueToday = true;

    @Value("${orderbot.deadline.lock-seconds:300}")
    private long lockSeconds = 300;

    @Value("${orderbot.notify.default-channel:}")
    private String defaultChannel = "";

    public DeadlineMonitor(IWorkOrderRepository workOrderRepository,
                           AlertDedupService alertDedupService,
                           Notifier notifier,
                           WorkOrderFormatter formatter,
                           StringRedisTemplate redisTemplate,
                           Clock clock) {
        this.workOrderRepository = workOrderRepository;
        this.alertDedupService = alertDedupService;
        this.notifier = notifier;
        this.formatter = formatter;
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Scheduled(cron = "${orderbot.deadline.cron:0 0 8 * * *}", zone = "${orderbot.zone:America/Sao_Paulo}")
    public void scheduledSweep() {
        if (!enabled) {
            return;
        }

        // 多实例部署时只允许一个实例巡检
        Boolean locked = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY, "1", Duration.ofSeconds(lockSeconds));
        if (Boolean.FALSE.equals(locked)) {
            log.debug("其他实例正在巡检，跳过本次");
            return;
        }

        try {
            SweepReport report = sweep(LocalDate.now(clock));
            log.info("截止日期巡检完成：scanned={}, alerted={}, duplicates={}, skipped={}, failed={}",
                    report.getScanned(), report.getAlerted(), report.getDuplicates(),
                    report.getSkipped(), report.getFailed());
        } catch (PersistenceException e) {
            log.error("截止日期巡检失败，等待下次调度：error={}", e.getMessage(), e);
        } finally {
            redisTemplate.delete(LOCK_KEY);
        }
    }

    /**
     * 按给定日期执行一次巡检，单个工单的失败不影响其他工单
     */
    public SweepReport sweep(LocalDate today) {
        SweepReport report = new SweepReport();
        List<WorkOrder> orders = workOrderRepository.findOpen();

        for (WorkOrder order : orders) {
            report.setScanned(report.getScanned() + 1);
            String businessId = order.getBusinessId();

            LocalDate dueDate = order.getDueDate();
            if (dueDate == null) {
                log.warn("工单截止日期缺失或格式无效，跳过：businessId={}, dueDate={}",
                        businessId, order.get(FieldKey.DUE_DATE));
                report.setSkipped(report.getSkipped() + 1);
                continue;
            }

            long daysUntilDue = ChronoUnit.DAYS.between(today, dueDate);
            AlertClass alertClass = AlertClass.classify(daysUntilDue, alertDueToday);
            if (alertClass == null) {
                continue;
            }

            String channel = StringUtils.hasText(order.getNotifyChannel()) ? order.getNotifyChannel() : defaultChannel;
            if (!StringUtils.hasText(channel)) {
                log.warn("工单没有可用的通知通道，跳过：businessId={}", businessId);
                report.setSkipped(report.getSkipped() + 1);
                continue;
            }

            if (!alertDedupService.claim(businessId, alertClass, today)) {
                report.setDuplicates(report.getDuplicates() + 1);
                continue;
            }

            try {
                notifier.send(channel, formatter.deadlineAlert(order, alertClass, daysUntilDue));
                report.setAlerted(report.getAlerted() + 1);
                log.info("截止日期预警已发送：businessId={}, class={}, channel={}", businessId, alertClass, channel);
            } catch (NotificationException e) {
                // 占位保留：超时等情况下消息可能已送达，当天不再重发
                report.setFailed(report.getFailed() + 1);
                log.warn("截止日期预警发送失败，当天不再重试：businessId={}, class={}, error={}",
                        businessId, alertClass, e.getMessage());
            }
        }
        return report;
    }
}
