package com.repair.orderbot.model.enums;

/**
 * 可作为固定选项展示的枚举
 */
public interface LabeledChoice {

    String name();

    String getLabel();

    /**
     * 文档或旧数据中出现的其他写法
     */
    String[] getAliases();

    default boolean matches(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim();
        if (value.equalsIgnoreCase(name()) || value.equalsIgnoreCase(getLabel())) {
            return true;
        }
        for (String alias : getAliases()) {
            if (value.equalsIgnoreCase(alias)) {
                return true;
            }
        }
        return false;
    }
}
