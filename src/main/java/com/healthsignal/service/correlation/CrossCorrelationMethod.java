package com.healthsignal.service.correlation;

import com.healthsignal.exception.DegenerateScaleException;
import com.healthsignal.exception.InsufficientDataException;
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
 * 滞后互相关
 * 在 [-maxLag, maxLag] 上扫描：正滞后表示 metricA 领先 metricB，负滞后表示 metricB 领先。
 * 取 |r| 最大的滞后作为结果，lagDays 记为滞后的绝对值。
 */
@Component
public class CrossCorrelationMethod implements CorrelationMethod {

    @Override
    public CorrelationType type() {
        return CorrelationType.CROSS_CORRELATION;
    }

    @Override
    public Optional<CorrelationCandidate> evaluate(HealthMetric metricA, HealthMetric metricB,
                                                   Double[] seriesA, Double[] seriesB,
                                                   CorrelationDetectionConfig config) {
        String subject = CorrelationStatistics.subject(metricA, metricB, type());
        int maxLag = config.getCrossMaxLag();

        PearsonResult best = null;
        int bestLag = 0;
        int bestOverlap = 0;
        for (int lag = -maxLag; lag <= maxLag; lag++) {
            Pairs pairs = lag >= 0
                    ? CorrelationStatistics.lagged(seriesA, seriesB, lag)
                    : CorrelationStatistics.lagged(seriesB, seriesA, -lag);
            bestOverlap = Math.max(bestOverlap, pairs.size());
            if (pairs.size() < config.getMinOverlap()) {
                continue;
            }
            PearsonResult result;
            try {
                result = CorrelationStatistics.pearson(subject, pairs.x(), pairs.y());
            } catch (DegenerateScaleException e) {
                continue;
            }
            if (best == null || isBetter(result, lag, best, bestLag)) {
                best = result;
                bestLag = lag;
            }
        }
        if (best == null) {
            throw new InsufficientDataException(subject, bestOverlap, config.getMinOverlap());
        }

        CausalDirection direction = bestLag > 0 ? CausalDirection.A_CAUSES_B
                : bestLag < 0 ? CausalDirection.B_CAUSES_A
                : CausalDirection.NONE;
        boolean significant = best.pValue() < config.getSignificanceLevel()
                && Math.abs(best.r()) >= config.getMinCorrelation();
        return Optional.of(new CorrelationCandidate(metricA, metricB, type(), best.r(), best.pValue(),
                Math.abs(bestLag), direction, null, best.n(), significant));
    }

    /**
     * |r| 更大者优先；相同时取绝对滞后更小的，再取正滞后
     */
    private static boolean isBetter(PearsonResult candidate, int lag, PearsonResult best, int bestLag) {
        double diff = Math.abs(candidate.r()) - Math.abs(best.r());
        if (diff > 1e-12) {
            return true;
        }
        if (diff < -1e-12) {
            return false;
        }
        if (Math.abs(lag) != Math.abs(bestLag)) {
            return Math.abs(lag) < Math.abs(bestLag);
        }
        return lag > bestLag;
    }
}
