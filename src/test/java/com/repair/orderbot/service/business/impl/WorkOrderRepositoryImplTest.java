package com.repair.orderbot.service.business.impl;

import com.baomidou.mybatisplus.core.MybatisConfiguration;
import com.baomidou.mybatisplus.core.conditions.AbstractWrapper;
import com.baomidou.mybatisplus.core.conditions.Wrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.metadata.TableInfoHelper;
import com.repair.orderbot.exception.DuplicateWorkOrderException;
import com.repair.orderbot.exception.NotFoundException;
import com.repair.orderbot.exception.PersistenceException;
import com.repair.orderbot.mapper.WorkOrderMapper;
import com.repair.orderbot.model.dto.FieldValue;
import com.repair.orderbot.model.dto.WorkOrder;
import com.repair.orderbot.model.entity.WorkOrderEntity;
import com.repair.orderbot.model.enums.FieldKey;
import com.repair.orderbot.model.enums.OrderStatus;
import com.repair.orderbot.support.MutableClock;
import org.apache.ibatis.builder.MapperBuilderAssistant;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkOrderRepositoryImplTest {

    @Mock
    private WorkOrderMapper mapper;

    private final Map<String, WorkOrderEntity> table = new LinkedHashMap<>();
    private WorkOrderRepositoryImpl repository;

    @BeforeAll
    static void initTableInfo() {
        // Lambda 条件解析列名依赖表信息缓存，单测中没有 Spring 启动流程
        TableInfoHelper.initTableInfo(new MapperBuilderAssistant(new MybatisConfiguration(), ""), WorkOrderEntity.class);
    }

    @BeforeEach
    void setUp() {
        repository = new WorkOrderRepositoryImpl(
                new MutableClock(Instant.parse("2025-10-20T12:00:00Z"), ZoneId.of("America/Sao_Paulo")));
        ReflectionTestUtils.setField(repository, "baseMapper", mapper);

        // getOne 在不同版本中走 selectOne 或 selectList，两者都按表内容应答
        lenient().when(mapper.selectList(any())).thenAnswer(inv -> select(inv.getArgument(0)));
        lenient().when(mapper.selectOne(any())).thenAnswer(inv -> {
            List<WorkOrderEntity> rows = select(inv.getArgument(0));
            return rows.isEmpty() ? null : rows.get(0);
        });
        lenient().when(mapper.selectById(any())).thenAnswer(inv -> table.values().stream()
                .filter(e -> e.getId().equals(inv.getArgument(0)))
                .findFirst()
                .orElse(null));
    }

    @Test
    void createRejectsExistingIdentifierBeforeInsert() {
        row(1L, "1001");

        assertThatThrownBy(() -> repository.create(order("1001")))
                .isInstanceOf(DuplicateWorkOrderException.class)
                .satisfies(e -> assertThat(((DuplicateWorkOrderException) e).getExisting().getBusinessId()).isEqualTo("1001"));
        verify(mapper, never()).insert(any(WorkOrderEntity.class));
    }

    @Test
    void createAssignsStoreId() {
        when(mapper.insert(any(WorkOrderEntity.class))).thenAnswer(insertAs(5L));

        WorkOrder created = repository.create(order("1001"));

        assertThat(created.getStoreId()).isEqualTo(5L);
        assertThat(created.getCreatedAt()).isNotNull();
    }

    @Test
    void uniqueIndexViolationOnInsertBecomesDuplicate() {
        // 检查之后、插入之前被另一会话占用
        when(mapper.insert(any(WorkOrderEntity.class))).thenAnswer(inv -> {
            row(9L, "1001");
            throw new DuplicateKeyException("Duplicate entry '1001' for key 'uk_business_id'");
        });

        assertThatThrownBy(() -> repository.create(order("1001")))
                .isInstanceOf(DuplicateWorkOrderException.class)
                .satisfies(e -> assertThat(((DuplicateWorkOrderException) e).getExisting().getStoreId()).isEqualTo(9L));
    }

    @Test
    void renameToTakenIdentifierIsRejected() {
        row(1L, "1001");
        row(2L, "1002");

        assertThatThrownBy(() -> repository.update("1001", changes(FieldKey.IDENTIFIER, FieldValue.text("1002"))))
                .isInstanceOf(DuplicateWorkOrderException.class)
                .hasMessageContaining("1002");
        verify(mapper, never()).update(any(), any());
    }

    @Test
    void updateOfMissingOrderIsNotFound() {
        assertThatThrownBy(() -> repository.update("9999", changes(FieldKey.ASSIGNEE, FieldValue.text("João"))))
                .isInstanceOf(NotFoundException.class);
        verify(mapper, never()).update(any(), any());
    }

    @Test
    void updateTouchingNoRowIsNotFound() {
        row(1L, "1001");
        when(mapper.update(any(), any())).thenReturn(0);

        assertThatThrownBy(() -> repository.update("1001", changes(FieldKey.ASSIGNEE, FieldValue.text("João"))))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void partialUpdateSetsOnlyTheChangedColumns() {
        row(1L, "1001").setSite("Agência Centro");
        when(mapper.update(any(), any())).thenReturn(1);

        WorkOrder updated = repository.update("1001", changes(FieldKey.ASSIGNEE, FieldValue.text("João")));

        ArgumentCaptor<Wrapper<WorkOrderEntity>> captor = ArgumentCaptor.forClass(Wrapper.class);
        verify(mapper).update(any(), captor.capture());
        String sqlSet = ((LambdaUpdateWrapper<WorkOrderEntity>) captor.getValue()).getSqlSet();
        assertThat(sqlSet).contains("assignee=", "updated_at=").doesNotContain("site");
        assertThat(updated.get(FieldKey.SITE).getText()).isEqualTo("Agência Centro");
    }

    @Test
    @SuppressWarnings("unchecked")
    void findOpenKeepsRowsWithoutStatus() {
        repository.findOpen();

        ArgumentCaptor<Wrapper<WorkOrderEntity>> captor = ArgumentCaptor.forClass(Wrapper.class);
        verify(mapper).selectList(captor.capture());
        AbstractWrapper<?, ?, ?> wrapper = (AbstractWrapper<?, ?, ?>) captor.getValue();
        assertThat(wrapper.getSqlSegment()).contains("status IS NULL", "status NOT IN");
        assertThat(wrapper.getParamNameValuePairs().values())
                .contains(OrderStatus.DONE.name(), OrderStatus.CANCELLED.name())
                .doesNotContain(OrderStatus.OPEN.name());
    }

    @Test
    void storeFailureBecomesPersistenceException() {
        lenient().doThrow(new QueryTimeoutException("timeout")).when(mapper).selectList(any());
        lenient().doThrow(new QueryTimeoutException("timeout")).when(mapper).selectOne(any());

        assertThatThrownBy(() -> repository.findByBusinessId("1001"))
                .isInstanceOf(PersistenceException.class);
    }

    private List<WorkOrderEntity> select(Wrapper<WorkOrderEntity> wrapper) {
        AbstractWrapper<?, ?, ?> w = (AbstractWrapper<?, ?, ?>) wrapper;
        if (!w.getSqlSegment().contains("business_id")) {
            return new ArrayList<>(table.values());
        }
        for (Object value : w.getParamNameValuePairs().values()) {
            WorkOrderEntity entity = table.get(String.valueOf(value));
            if (entity != null) {
                return new ArrayList<>(Collections.singletonList(entity));
            }
        }
        return new ArrayList<>();
    }

    private Answer<Integer> insertAs(long id) {
        return inv -> {
            WorkOrderEntity entity = inv.getArgument(0);
            entity.setId(id);
            table.put(entity.getBusinessId(), entity);
            return 1;
        };
    }

    private WorkOrderEntity row(Long id, String businessId) {
        WorkOrderEntity entity = new WorkOrderEntity();
        entity.setId(id);
        entity.setBusinessId(businessId);
        entity.setStatus(OrderStatus.OPEN.name());
        table.put(businessId, entity);
        return entity;
    }

    private WorkOrder order(String businessId) {
        WorkOrder order = new WorkOrder();
        order.put(FieldKey.IDENTIFIER, FieldValue.text(businessId));
        order.put(FieldKey.REQUEST_NUMBER, FieldValue.text("CH-1"));
        order.put(FieldKey.STATUS, FieldValue.choice(OrderStatus.OPEN));
        return order;
    }

    private Map<FieldKey, FieldValue> changes(FieldKey key, FieldValue value) {
        Map<FieldKey, FieldValue> changes = new EnumMap<>(FieldKey.class);
        changes.put(key, value);
        return changes;
    }
}
