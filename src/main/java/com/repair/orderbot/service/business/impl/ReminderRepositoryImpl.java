package com.repair.orderbot.service.business.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.repair.orderbot.exception.PersistenceException;
import com.repair.orderbot.mapper.ReminderMapper;
import com.repair.orderbot.model.dto.ManualReminder;
import com.repair.orderbot.model.entity.ReminderEntity;
import com.repair.orderbot.model.enums.ReminderStatus;
import com.repair.orderbot.service.business.IReminderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ReminderRepositoryImpl extends ServiceImpl<ReminderMapper, ReminderEntity> implements IReminderRepository {

    private final Clock clock;

    public ReminderRepositoryImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ManualReminder create(ManualReminder reminder) {
        try {
            ReminderEntity entity = new ReminderEntity();
            entity.setBusinessId(reminder.getBusinessId());
            entity.setMessage(reminder.getMessage());
            entity.setTargetChannel(reminder.getTargetChannel());
            entity.setFiresAt(reminder.getFiresAt().toEpochMilli());
            entity.setStatus(ReminderStatus.PENDING.name());
            entity.setCreatedAt(LocalDateTime.now(clock));
            this.save(entity);
            return toDomain(entity);
        } catch (DataAccessException e) {
            log.error("保存提醒失败：businessId={}, error={}", reminder.getBusinessId(), e.getMessage(), e);
            throw new PersistenceException("保存提醒失败：" + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ManualReminder> findById(Long id) {
        try {
            return Optional.ofNullable(this.getById(id)).map(this::toDomain);
        } catch (DataAccessException e) {
            throw new PersistenceException("查询提醒失败：" + e.getMessage(), e);
        }
    }

    @Override
    public List<ManualReminder> findDue(Instant now) {
        try {
            return toDomainList(this.list(new LambdaQueryWrapper<ReminderEntity>()
                    .eq(ReminderEntity::getStatus, ReminderStatus.PENDING.name())
                    .le(ReminderEntity::getFiresAt, now.toEpochMilli())
                    .orderByAsc(ReminderEntity::getFiresAt)));
        } catch (DataAccessException e) {
            log.error("查询到期提醒失败：error={}", e.getMessage(), e);
            throw new PersistenceException("查询到期提醒失败：" + e.getMessage(), e);
        }
    }

    @Override
    public boolean transition(Long id, ReminderStatus from, ReminderStatus to, Instant at) {
        try {
            LambdaUpdateWrapper<ReminderEntity> wrapper = new LambdaUpdateWrapper<ReminderEntity>()
                    .eq(ReminderEntity::getId, id)
                    .eq(ReminderEntity::getStatus, from.name())
                    .set(ReminderEntity::getStatus, to.name());
            if (to == ReminderStatus.FIRED) {
                wrapper.set(ReminderEntity::getFiredAt, LocalDateTime.ofInstant(at, clock.getZone()));
            }
            return this.update(wrapper);
        } catch (DataAccessException e) {
            log.error("提醒状态迁移失败：id={}, {}->{}, error={}", id, from, to, e.getMessage(), e);
            throw new PersistenceException("更新提醒失败：" + e.getMessage(), e);
        }
    }

    @Override
    public int cancelAllFor(String businessId) {
        try {
            return this.baseMapper.update(null, new LambdaUpdateWrapper<ReminderEntity>()
                    .eq(ReminderEntity::getBusinessId, businessId)
                    .eq(ReminderEntity::getStatus, ReminderStatus.PENDING.name())
                    .set(ReminderEntity::getStatus, ReminderStatus.CANCELLED.name()));
        } catch (DataAccessException e) {
            log.error("批量取消提醒失败：businessId={}, error={}", businessId, e.getMessage(), e);
            throw new PersistenceException("取消提醒失败：" + e.getMessage(), e);
        }
    }

    @Override
    public int retarget(String oldBusinessId, String newBusinessId) {
        try {
            return this.baseMapper.update(null, new LambdaUpdateWrapper<ReminderEntity>()
                    .eq(ReminderEntity::getBusinessId, oldBusinessId)
                    .eq(ReminderEntity::getStatus, ReminderStatus.PENDING.name())
                    .set(ReminderEntity::getBusinessId, newBusinessId));
        } catch (DataAccessException e) {
            log.error("提醒改挂工单失败：{} -> {}, error={}", oldBusinessId, newBusinessId, e.getMessage(), e);
            throw new PersistenceException("更新提醒失败：" + e.getMessage(), e);
        }
    }

    @Override
    public List<ManualReminder> findPending(String channel) {
        try {
            return toDomainList(this.list(new LambdaQueryWrapper<ReminderEntity>()
                    .eq(ReminderEntity::getStatus, ReminderStatus.PENDING.name())
                    .eq(channel != null, ReminderEntity::getTargetChannel, channel)
                    .orderByAsc(ReminderEntity::getFiresAt)));
        } catch (DataAccessException e) {
            log.error("查询待触发提醒失败：channel={}, error={}", channel, e.getMessage(), e);
            throw new PersistenceException("查询提醒失败：" + e.getMessage(), e);
        }
    }

    @Override
    public List<ManualReminder> findPendingFor(String businessId) {
        try {
            return toDomainList(this.list(new LambdaQueryWrapper<ReminderEntity>()
                    .eq(ReminderEntity::getBusinessId, businessId)
                    .eq(ReminderEntity::getStatus, ReminderStatus.PENDING.name())
                    .orderByAsc(ReminderEntity::getFiresAt)));
        } catch (DataAccessException e) {
            log.error("查询工单提醒失败：businessId={}, error={}", businessId, e.getMessage(), e);
            throw new PersistenceException("查询提醒失败：" + e.getMessage(), e);
        }
    }

    private List<ManualReminder> toDomainList(List<ReminderEntity> entities) {
        return entities.stream().map(this::toDomain).collect(Collectors.toList());
    }

    private ManualReminder toDomain(ReminderEntity entity) {
        return ManualReminder.builder()
                .id(entity.getId())
                .businessId(entity.getBusinessId())
                .message(entity.getMessage())
                .targetChannel(entity.getTargetChannel())
                .firesAt(Instant.ofEpochMilli(entity.getFiresAt()))
                .status(ReminderStatus.valueOf(entity.getStatus()))
                .createdAt(entity.getCreatedAt() != null ? entity.getCreatedAt().atZone(clock.getZone()).toInstant() : null)
                .firedAt(entity.getFiredAt() != null ? entity.getFiredAt().atZone(clock.getZone()).toInstant() : null)
                .build();
    }
}
