package com.repair.orderbot.service.business.impl;

import com.alibaba.fastjson.JSON;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.repair.orderbot.exception.DuplicateWorkOrderException;
import com.repair.orderbot.exception.NotFoundException;
import com.repair.orderbot.exception.PersistenceException;
import com.repair.orderbot.mapper.WorkOrderMapper;
import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.entity.WorkOrderEntity;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.OrderCategory;
import com.repair.orderbot.model.enums.OrderStatus;
import com.repair.orderbot.service.business.IWorkOrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
public class WorkOrderRepositoryImpl extends ServiceImpl<WorkOrderMapper, WorkOrderEntity> implements IWorkOrderRepository {

    private final Clock clock;

    public WorkOrderRepositoryImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WorkOrder create(WorkOrder order) {
        String businessId = order.getBusinessId();
        if (businessId == null) {
            throw new IllegalArgumentException("工单编号不能为空");
        }
        try {
            WorkOrderEntity existing = selectByBusinessId(businessId);
            if (existing != null) {
                throw new DuplicateWorkOrderException(businessId, WorkOrderConverter.toDomain(existing));
            }

            WorkOrderEntity entity = WorkOrderConverter.toEntity(order);
            LocalDateTime now = LocalDateTime.now(clock);
            entity.setId(null);
            entity.setCreatedAt(now);
            entity.setUpdatedAt(now);
            this.save(entity);
            log.info("工单已创建：businessId={}, id={}", businessId, entity.getId());
            return WorkOrderConverter.toDomain(entity);
        } catch (DuplicateKeyException e) {
            // 唯一索引兜底：检查与插入之间被并发占用
            log.warn("工单编号并发冲突：businessId={}", businessId);
            throw new DuplicateWorkOrderException(businessId, findByBusinessId(businessId).orElse(null));
        } catch (DataAccessException e) {
            log.error("创建工单失败：businessId={}, error={}", businessId, e.getMessage(), e);
            throw new PersistenceException("保存工单失败：" + e.getMessage(), e);
        }
    }

    @Override
    public Optional<WorkOrder> findByBusinessId(String businessId) {
        try {
            WorkOrderEntity entity = selectByBusinessId(businessId);
            return Optional.ofNullable(entity).map(WorkOrderConverter::toDomain);
        } catch (DataAccessException e) {
            log.error("查询工单失败：businessId={}, error={}", businessId, e.getMessage(), e);
            throw new PersistenceException("查询工单失败：" + e.getMessage(), e);
        }
    }

    @Override
    public WorkOrder update(String businessId, Map<FieldKey, FieldValue> changes) {
        try {
            WorkOrderEntity entity = selectByBusinessId(businessId);
            if (entity == null) {
                throw new NotFoundException(businessId);
            }

            FieldValue newId = changes.get(FieldKey.IDENTIFIER);
            if (newId != null && !businessId.equals(newId.getText())) {
                WorkOrderEntity taken = selectByBusinessId(newId.getText());
                if (taken != null) {
                    throw new DuplicateWorkOrderException(newId.getText(), WorkOrderConverter.toDomain(taken));
                }
            }

            LambdaUpdateWrapper<WorkOrderEntity> wrapper = new LambdaUpdateWrapper<WorkOrderEntity>()
                    .eq(WorkOrderEntity::getId, entity.getId());
            for (Map.Entry<FieldKey, FieldValue> change : changes.entrySet()) {
                wrapper.set(WorkOrderConverter.column(change.getKey()), WorkOrderConverter.encode(change.getValue()));
            }
            wrapper.set(WorkOrderEntity::getUpdatedAt, LocalDateTime.now(clock));

            if (!this.update(wrapper)) {
                // 查询与更新之间被删除
                throw new NotFoundException(businessId);
            }
            log.info("工单已更新：businessId={}, fields={}", businessId, changes.keySet());
            return WorkOrderConverter.toDomain(this.getById(entity.getId()));
        } catch (DuplicateKeyException e) {
            FieldValue newId = changes.get(FieldKey.IDENTIFIER);
            String taken = newId != null ? newId.getText() : businessId;
            throw new DuplicateWorkOrderException(taken, findByBusinessId(taken).orElse(null));
        } catch (DataAccessException e) {
            log.error("更新工单失败：businessId={}, error={}", businessId, e.getMessage(), e);
            throw new PersistenceException("更新工单失败：" + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String businessId) {
        try {
            WorkOrderEntity entity = selectByBusinessId(businessId);
            if (entity == null) {
                return false;
            }
            boolean removed = this.removeById(entity.getId());
            if (removed) {
                // 删除留痕，便于误删后人工恢复
                log.info("工单已删除：businessId={}, snapshot={}", businessId, JSON.toJSONString(entity));
            }
            return removed;
        } catch (DataAccessException e) {
            log.error("删除工单失败：businessId={}, error={}", businessId, e.getMessage(), e);
            throw new PersistenceException("删除工单失败：" + e.getMessage(), e);
        }
    }

    @Override
    public List<WorkOrder> query(OrderCategory category, OrderStatus status) {
        try {
            LambdaQueryWrapper<WorkOrderEntity> wrapper = new LambdaQueryWrapper<WorkOrderEntity>()
                    .eq(category != null, WorkOrderEntity::getCategory, category != null ? category.name() : null)
                    .eq(status != null, WorkOrderEntity::getStatus, status != null ? status.name() : null)
                    // yyyy-MM-dd 字符串序即日期序
                    .orderByAsc(WorkOrderEntity::getDueDate)
                    .orderByAsc(WorkOrderEntity::getBusinessId);
            return toDomainList(this.list(wrapper));
        } catch (DataAccessException e) {
            log.error("查询工单列表失败：category={}, status={}, error={}", category, status, e.getMessage(), e);
            throw new PersistenceException("查询工单列表失败：" + e.getMessage(), e);
        }
    }

    @Override
    public List<WorkOrder> findOpen() {
        List<String> terminal = new ArrayList<>();
        for (OrderStatus status : OrderStatus.values()) {
            if (status.isTerminal()) {
                terminal.add(status.name());
            }
        }
        try {
            LambdaQueryWrapper<WorkOrderEntity> wrapper = new LambdaQueryWrapper<WorkOrderEntity>()
                    .and(w -> w.isNull(WorkOrderEntity::getStatus)
                            .or()
                            .notIn(WorkOrderEntity::getStatus, terminal))
                    .orderByAsc(WorkOrderEntity::getDueDate);
            return toDomainList(this.list(wrapper));
        } catch (DataAccessException e) {
            log.error("查询未完结工单失败：error={}", e.getMessage(), e);
            throw new PersistenceException("查询未完结工单失败：" + e.getMessage(), e);
        }
    }

    private WorkOrderEntity selectByBusinessId(String businessId) {
        return this.getOne(new LambdaQueryWrapper<WorkOrderEntity>()
                .eq(WorkOrderEntity::getBusinessId, businessId));
    }

    private List<WorkOrder> toDomainList(List<WorkOrderEntity> entities) {
        return entities.stream().map(WorkOrderConverter::toDomain).collect(Collectors.toList());
    }
}
