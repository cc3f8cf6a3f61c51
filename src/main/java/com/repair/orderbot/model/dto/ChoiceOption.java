package com.repair.orderbot.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一个按钮：展示文本 + 回调令牌
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChoiceOption {
    private String label;
    private String token;
}
