package com.healthsignal.model.dto.analysis;

import com.healthsignal.model.enums.HealthMetric;

import java.time.LocalDate;

/**
 * 单变量检测命中的 (日期, 指标)
 *
 * @param boundViolation 是否超出医学绝对范围
 * @param score          min(|z|/threshold, 1)，仅由绝对范围触发时同样按 z 计算
 */
public record ZScoreFlag(LocalDate date, HealthMetric metric, double value, Baseline baseline,
                         double zScore, double threshold, boolean boundViolation, double score) {

    public boolean zTriggered() {
        return Math.abs(zScore) > threshold;
    }
}
