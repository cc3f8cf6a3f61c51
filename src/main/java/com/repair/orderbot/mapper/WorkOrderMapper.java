package com.repair.orderbot.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.repair.orderbot.model.entity.WorkOrderEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface WorkOrderMapper extends BaseMapper<WorkOrderEntity> {
    // 基础的 CRUD 已经由 BaseMapper 自动提供
}
