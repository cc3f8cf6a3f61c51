package com.repair.orderbot.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.repair.orderbot.model.entity.ReminderEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ReminderMapper extends BaseMapper<ReminderEntity> {
    // 状态迁移使用条件更新（LambdaUpdateWrapper），保证同一提醒只被领取一次
}
