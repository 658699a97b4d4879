package com.healthsignal.model.dto.analysis;

import com.healthsignal.model.enums.HealthMetric;

/**
 * 多变量异常的单指标贡献
 *
 * @param reference 最近正常日质心（原始单位）
 * @param deviation 标准化后与质心的距离
 */
public record FeatureContribution(HealthMetric metric, double value, double reference, double deviation) {
}
