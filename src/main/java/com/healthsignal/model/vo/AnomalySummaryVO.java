package com.healthsignal.model.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 异常概览VO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalySummaryVO {
    private Integer total;

    /**
     * 未确认数
     */
    private Integer unacknowledged;

    /**
     * 按严重程度计数：HIGH / MEDIUM / LOW
     */
    private Map<String, Integer> bySeverity;

    /**
     * 按指标计数
     */
    private Map<String, Integer> byMetric;

    private Integer periodDays;
}
