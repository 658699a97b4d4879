package com.healthsignal.model.entity;

import com.healthsignal.model.enums.DetectorType;
import com.healthsignal.model.enums.Severity;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 异常检测结果实体
 * 每个 (userId, recordDate, metricName) 至多一条
 */
@Data
public class Anomaly {
    /**
     * 主键
     */
    private Long id;

    /**
     * 用户ID
     */
    private Long userId;

    /**
     * 异常发生日期
     */
    private LocalDate recordDate;

    /**
     * 来源表
     */
    private String sourceTable;

    /**
     * 指标名（HealthMetric.key）
     */
    private String metricName;

    /**
     * 当日指标值
     */
    private Double metricValue;

    /**
     * 基线值
     */
    private Double baselineValue;

    /**
     * 检测器类型
     */
    private DetectorType detectorType;

    /**
     * 严重程度
     */
    private Severity severity;

    /**
     * 异常分数 [0,1]
     */
    private Double anomalyScore;

    /**
     * 检测细节 JSON（z值、阈值、贡献指标等）
     */
    private String details;

    /**
     * 解释文案（可为空）
     */
    private String explanation;

    /**
     * 用户是否已确认
     */
    private Boolean isAcknowledged;

    /**
     * 检测时间
     */
    private LocalDateTime detectedAt;
}
