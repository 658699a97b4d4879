package com.healthsignal.service.correlation;

import com.healthsignal.exception.DegenerateScaleException;
import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 相关性分析
 * 对所有可参与相关性分析的指标两两配对（metricA < metricB），依次运行启用的检验方法，
 * 只保留显著的结果。单个指标对/方法失败只跳过该组合。
 */
@Slf4j
@Component
public class CorrelationAnalyzer {

    private final Map<CorrelationType, CorrelationMethod> methods;

    public CorrelationAnalyzer(List<CorrelationMethod> methods) {
        this.methods = new EnumMap<>(CorrelationType.class);
        for (CorrelationMethod method : methods) {
            this.methods.put(method.type(), method);
        }
    }

    public List<CorrelationCandidate> analyze(FeatureMatrix matrix, CorrelationDetectionConfig config) {
        // 重叠天数不可能达标的指标直接排除
        List<HealthMetric> metrics = new ArrayList<>();
        for (HealthMetric metric : HealthMetric.correlationMetrics()) {
            if (matrix.observedCount(metric) >= config.getMinOverlap()) {
                metrics.add(metric);
            }
        }
        metrics.sort(Comparator.comparing(HealthMetric::getKey));

        Set<CorrelationType> enabled = config.enabledTypes();
        List<CorrelationCandidate> candidates = new ArrayList<>();
        int evaluated = 0;
        int skipped = 0;
        for (int i = 0; i < metrics.size(); i++) {
            for (int j = i + 1; j < metrics.size(); j++) {
                HealthMetric a = metrics.get(i);
                HealthMetric b = metrics.get(j);
                if (a.sharesRootWith(b)) {
                    continue;
                }
                Double[] seriesA = matrix.column(a);
                Double[] seriesB = matrix.column(b);
                for (CorrelationType type : enabled) {
                    CorrelationMethod method = methods.get(type);
                    if (method == null) {
                        continue;
                    }
                    evaluated++;
                    try {
                        Optional<CorrelationCandidate> result = method.evaluate(a, b, seriesA, seriesB, config);
                        if (result.isPresent() && result.get().significant()) {
                            candidates.add(result.get());
                        }
                    } catch (InsufficientDataException | DegenerateScaleException e) {
                        skipped++;
                        log.debug("跳过 {}: {}", CorrelationStatistics.subject(a, b, type), e.getMessage());
                    } catch (MathIllegalArgumentException e) {
                        skipped++;
                        log.debug("跳过 {}: 数值计算失败 {}", CorrelationStatistics.subject(a, b, type), e.getMessage());
                    }
                }
            }
        }
        log.debug("相关性检验完成: userId={}, 指标数={}, 检验数={}, 跳过={}, 显著={}",
                matrix.getUserId(), metrics.size(), evaluated, skipped, candidates.size());
        return candidates;
    }
}
