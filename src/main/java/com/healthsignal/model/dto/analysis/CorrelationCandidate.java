package com.healthsignal.model.dto.analysis;

import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;

/**
 * 单个方法对单个指标对的检验结果（metricA 的 key 字典序小于 metricB）
 *
 * @param value      Pearson r / Granger 带符号偏相关 / 互相关峰值 / 信息系数
 * @param lagDays    非负滞后天数
 * @param fStatistic 仅 Granger 有值
 */
public record CorrelationCandidate(HealthMetric metricA, HealthMetric metricB, CorrelationType type,
                                   double value, double pValue, int lagDays, CausalDirection direction,
                                   Double fStatistic, int sampleSize, boolean significant) {
}
