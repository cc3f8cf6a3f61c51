package com.repair.orderbot.service.extract;

import com.repair.orderbot.model.enums.FieldKey;

import java.util.Map;

/**
 * 从工单文档中提取字段原始值
 * 结果只是未经校验的文本，和键盘输入一样要经过字段校验
 */
public interface DocumentFieldExtractor {

    /**
     * @return 提取到的字段，未识别的字段不出现在结果中
     * @throws com.repair.orderbot.exception.ExtractionException 文档无法读取
     */
    Map<FieldKey, String> extract(byte[] content, String fileName, String mimeType);
}
