package com.healthsignal.model.entity;

import com.healthsignal.model.enums.CorrelationType;
import lombok.Data;

/**
 * 人群相关性参考统计（按指标对与方法）
 */
@Data
public class PopulationCorrelationStat {
    /**
     * 指标A
     */
    private String metricA;

    /**
     * 指标B
     */
    private String metricB;

    /**
     * 检测方法
     */
    private CorrelationType correlationType;

    /**
     * 平均相关值
     */
    private Double meanCorrelation;

    /**
     * 标准差
     */
    private Double stdCorrelation;

    /**
     * 参与统计的用户数
     */
    private Integer userCount;
}
