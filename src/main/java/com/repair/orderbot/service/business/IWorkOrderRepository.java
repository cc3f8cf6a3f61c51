package com.repair.orderbot.service.business;

import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.OrderCategory;
import com.repair.orderbot.model.enums.OrderStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 工单存储契约：只做领域对象与存储之间的转换，不含对话逻辑
 * 所有方法在存储不可用时抛出 PersistenceException
 */
public interface IWorkOrderRepository {

    /**
     * 新建工单，createdAt / updatedAt 由存储层设置
     * @return 带存储主键的工单
     * @throws com.repair.orderbot.exception.DuplicateWorkOrderException 编号已存在
     */
    WorkOrder create(WorkOrder order);

    Optional<WorkOrder> findByBusinessId(String businessId);

    /**
     * 部分更新：只覆盖传入的字段，其余保持原值
     * @throws com.repair.orderbot.exception.NotFoundException 工单不存在
     * @throws com.repair.orderbot.exception.DuplicateWorkOrderException 修改后的编号已被占用
     */
    WorkOrder update(String businessId, Map<FieldKey, FieldValue> changes);

    /**
     * @return 是否删除了记录
     */
    boolean delete(String businessId);

    /**
     * 按类型、状态过滤，参数为 null 表示不过滤；按截止日期升序
     */
    List<WorkOrder> query(OrderCategory category, OrderStatus status);

    /**
     * 所有非终态工单，供截止日期巡检使用
     */
    List<WorkOrder> findOpen();
}
