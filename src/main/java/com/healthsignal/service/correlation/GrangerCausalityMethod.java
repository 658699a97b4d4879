package com.healthsignal.service.correlation;

import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Granger 因果检验
 * 对每个滞后 L（1..maxLag）比较 y 只用自身滞后项的受限回归与加入 x 滞后项的非受限回归，
 * F 检验取 p 值最小的滞后。两个方向分别检验后合成因果方向，任一方向显著才产出结果。
 * 结果值为 sign(x 滞后系数之和)·sqrt(偏 R²)。
 */
@Slf4j
@Component
public class GrangerCausalityMethod implements CorrelationMethod {

    /**
     * 单方向最优滞后的检验结果
     */
    record LagTest(int lag, double fStatistic, double pValue, double partialR2, double coefficientSum,
                   int observations) {

        double signedEffect() {
            double magnitude = Math.sqrt(Math.max(0.0, Math.min(1.0, partialR2)));
            return coefficientSum < 0 ? -magnitude : magnitude;
        }
    }

    @Override
    public CorrelationType type() {
        return CorrelationType.GRANGER;
    }

    @Override
    public Optional<CorrelationCandidate> evaluate(HealthMetric metricA, HealthMetric metricB,
                                                   Double[] seriesA, Double[] seriesB,
                                                   CorrelationDetectionConfig config) {
        String subject = CorrelationStatistics.subject(metricA, metricB, type());
        Optional<LagTest> aToB = bestLag(subject, seriesA, seriesB, config);
        Optional<LagTest> bToA = bestLag(subject, seriesB, seriesA, config);
        if (aToB.isEmpty() && bToA.isEmpty()) {
            throw new InsufficientDataException(subject, 0, config.getMinOverlap());
        }

        double alpha = config.getSignificanceLevel();
        boolean aCausesB = aToB.map(t -> t.pValue() < alpha).orElse(false);
        boolean bCausesA = bToA.map(t -> t.pValue() < alpha).orElse(false);
        CausalDirection direction = CausalDirection.of(aCausesB, bCausesA);
        if (direction == CausalDirection.NONE) {
            return Optional.empty();
        }

        // 报告更显著的方向
        LagTest reported;
        if (aToB.isPresent() && bToA.isPresent()) {
            reported = aToB.get().pValue() <= bToA.get().pValue() ? aToB.get() : bToA.get();
        } else {
            reported = aToB.orElseGet(bToA::get);
        }
        return Optional.of(new CorrelationCandidate(metricA, metricB, type(), reported.signedEffect(),
                reported.pValue(), reported.lag(), direction, reported.fStatistic(),
                reported.observations(), true));
    }

    /**
     * cause 是否有助于预测 effect，返回 p 值最小的滞后；并列时取较小滞后
     */
    Optional<LagTest> bestLag(String subject, Double[] cause, Double[] effect, CorrelationDetectionConfig config) {
        LagTest best = null;
        for (int lag = 1; lag <= config.getGrangerMaxLag(); lag++) {
            try {
                Optional<LagTest> test = testLag(cause, effect, lag, config.getMinOverlap());
                if (test.isPresent() && (best == null || test.get().pValue() < best.pValue())) {
                    best = test.get();
                }
            } catch (MathIllegalArgumentException e) {
                // 设计矩阵奇异（SingularMatrixException）也在此跳过
                log.debug("{} 滞后 {} 回归失败，跳过: {}", subject, lag, e.getMessage());
            }
        }
        return Optional.ofNullable(best);
    }

    static Optional<LagTest> testLag(Double[] cause, Double[] effect, int lag, int minObservations) {
        List<Integer> usable = new ArrayList<>();
        for (int t = lag; t < effect.length; t++) {
            if (complete(cause, effect, t, lag)) {
                usable.add(t);
            }
        }
        int n = usable.size();
        int unrestrictedParams = 2 * lag + 1;
        if (n < minObservations || n - unrestrictedParams < 1) {
            return Optional.empty();
        }

        double[] y = new double[n];
        double[][] restricted = new double[n][lag];
        double[][] unrestricted = new double[n][2 * lag];
        for (int row = 0; row < n; row++) {
            int t = usable.get(row);
            y[row] = effect[t];
            for (int k = 1; k <= lag; k++) {
                restricted[row][k - 1] = effect[t - k];
                unrestricted[row][k - 1] = effect[t - k];
                unrestricted[row][lag + k - 1] = cause[t - k];
            }
        }

        OLSMultipleLinearRegression restrictedModel = new OLSMultipleLinearRegression();
        restrictedModel.newSampleData(y, restricted);
        double rssRestricted = restrictedModel.calculateResidualSumOfSquares();

        OLSMultipleLinearRegression unrestrictedModel = new OLSMultipleLinearRegression();
        unrestrictedModel.newSampleData(y, unrestricted);
        double rssUnrestricted = unrestrictedModel.calculateResidualSumOfSquares();

        if (!(rssRestricted > 0) || !(rssUnrestricted > 0)
                || !Double.isFinite(rssRestricted) || !Double.isFinite(rssUnrestricted)) {
            return Optional.empty();
        }

        int dfDenominator = n - unrestrictedParams;
        double improvement = Math.max(0.0, rssRestricted - rssUnrestricted);
        double f = (improvement / lag) / (rssUnrestricted / dfDenominator);
        if (!Double.isFinite(f)) {
            return Optional.empty();
        }
        double p = 1 - new FDistribution(lag, dfDenominator).cumulativeProbability(f);

        // 参数顺序：截距、effect 滞后项、cause 滞后项
        double[] beta = unrestrictedModel.estimateRegressionParameters();
        double coefficientSum = 0;
        for (int k = 0; k < lag; k++) {
            coefficientSum += beta[1 + lag + k];
        }
        double partialR2 = improvement / rssRestricted;
        return Optional.of(new LagTest(lag, f, Math.max(0.0, Math.min(1.0, p)), partialR2, coefficientSum, n));
    }

    private static boolean complete(Double[] cause, Double[] effect, int t, int lag) {
        if (effect[t] == null) {
            return false;
        }
        for (int k = 1; k <= lag; k++) {
            if (effect[t - k] == null || cause[t - k] == null) {
                return false;
            }
        }
        return true;
    }
}
