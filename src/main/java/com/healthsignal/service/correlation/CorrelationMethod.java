package com.healthsignal.service.correlation;

import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;

import java.util.Optional;

/**
 * 单一相关性检验方法
 * 输入为按日期对齐的两列（缺失为 null），metricA 的 key 字典序小于 metricB。
 * 数据不足或数值退化时抛出 InsufficientDataException / DegenerateScaleException，由调用方转为跳过。
 */
public interface CorrelationMethod {

    CorrelationType type();

    /**
     * @return 检验结果；方法本身判定无结论时返回 empty
     */
    Optional<CorrelationCandidate> evaluate(HealthMetric metricA, HealthMetric metricB,
                                            Double[] seriesA, Double[] seriesB,
                                            CorrelationDetectionConfig config);
}
