package com.healthsignal.service.correlation;

import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import com.healthsignal.service.correlation.CorrelationStatistics.Pairs;
import com.healthsignal.service.correlation.CorrelationStatistics.PearsonResult;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 同日线性相关
 */
@Component
public class PearsonCorrelationMethod implements CorrelationMethod {

    @Override
    public CorrelationType type() {
        return CorrelationType.PEARSON;
    }

    @Override
    public Optional<CorrelationCandidate> evaluate(HealthMetric metricA, HealthMetric metricB,
                                                   Double[] seriesA, Double[] seriesB,
                                                   CorrelationDetectionConfig config) {
        String subject = CorrelationStatistics.subject(metricA, metricB, type());
        Pairs pairs = CorrelationStatistics.aligned(seriesA, seriesB);
        CorrelationStatistics.requireOverlap(subject, pairs.size(), config.getMinOverlap());

        PearsonResult result = CorrelationStatistics.pearson(subject, pairs.x(), pairs.y());
        return Optional.of(new CorrelationCandidate(metricA, metricB, type(), result.r(), result.pValue(),
                0, CausalDirection.NONE, null, result.n(),
                isSignificant(result.r(), result.pValue(), config)));
    }

    /**
     * p 低于显著性水平且 |r| 达到最小相关系数
     */
    public static boolean isSignificant(double r, double pValue, CorrelationDetectionConfig config) {
        return pValue < config.getSignificanceLevel() && Math.abs(r) >= config.getMinCorrelation();
    }
}
