package com.repair.orderbot.service.business;

import com.repair.orderbot.model.dto.ManualReminder;
import com.repair.orderbot.model.enums.ReminderStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 手动提醒存储契约
 */
public interface IReminderRepository {

    /**
     * @return 带生成ID的提醒
     */
    ManualReminder create(ManualReminder reminder);

    Optional<ManualReminder> findById(Long id);

    /**
     * 已到触发时间的 PENDING 提醒，按触发时间升序
     */
    List<ManualReminder> findDue(Instant now);

    /**
     * 条件状态迁移：仅当当前状态为 from 时才改为 to
     * @return 是否由本次调用完成迁移
     */
    boolean transition(Long id, ReminderStatus from, ReminderStatus to, Instant at);

    /**
     * 取消某工单下所有 PENDING 提醒
     * @return 取消的条数
     */
    int cancelAllFor(String businessId);

    /**
     * 工单编号变更后，把 PENDING 提醒改挂到新编号
     */
    int retarget(String oldBusinessId, String newBusinessId);

    /**
     * 尚未触发的提醒，channel 为 null 时返回全部
     */
    List<ManualReminder> findPending(String channel);

    /**
     * 某工单下尚未触发的提醒，按触发时间升序
     */
    List<ManualReminder> findPendingFor(String businessId);
}
