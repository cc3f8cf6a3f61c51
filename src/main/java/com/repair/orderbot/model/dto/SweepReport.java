package com.repair.orderbot.model.dto;

import lombok.Data;

/**
 * 一次截止日期巡检的统计
 */
@Data
public class SweepReport {
    private int scanned;
    private int alerted;
    private int duplicates;
    private int skipped;
    private int failed;
}
