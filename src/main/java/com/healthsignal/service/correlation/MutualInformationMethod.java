package com.healthsignal.service.correlation;

import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import com.healthsignal.service.correlation.CorrelationStatistics.Pairs;
import org.apache.commons.math3.special.Gamma;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

/**
 * 互信息（Kraskov k 近邻估计）
 * 标准化后加极小的带种子抖动打破并列，互信息换算为信息系数 sqrt(1 - e^(-2·MI)) ∈ [0,1]，
 * 显著性由带种子的置换检验给出。结果无符号、无方向。
 */
@Component
public class MutualInformationMethod implements CorrelationMethod {

    private static final double JITTER = 1e-10;

    @Override
    public CorrelationType type() {
        return CorrelationType.MUTUAL_INFO;
    }

    @Override
    public Optional<CorrelationCandidate> evaluate(HealthMetric metricA, HealthMetric metricB,
                                                   Double[] seriesA, Double[] seriesB,
                                                   CorrelationDetectionConfig config) {
        String subject = CorrelationStatistics.subject(metricA, metricB, type());
        Pairs pairs = CorrelationStatistics.aligned(seriesA, seriesB);
        int n = pairs.size();
        int k = config.getMiNeighbors();
        CorrelationStatistics.requireOverlap(subject, n, Math.max(config.getMinOverlap(), k + 2));

        Random random = new Random(config.getMiSeed());
        double[] x = jitter(CorrelationStatistics.standardize(subject, pairs.x()), random);
        double[] y = jitter(CorrelationStatistics.standardize(subject, pairs.y()), random);

        double observed = estimate(x, y, k);

        // 置换检验：打乱 y 破坏依赖关系
        int permutations = config.getMiPermutations();
        int atLeastAsLarge = 0;
        double[] shuffled = Arrays.copyOf(y, n);
        for (int p = 0; p < permutations; p++) {
            shuffle(shuffled, random);
            if (estimate(x, shuffled, k) >= observed) {
                atLeastAsLarge++;
            }
        }
        double pValue = (atLeastAsLarge + 1.0) / (permutations + 1.0);

        double coefficient = informationCoefficient(observed);
        boolean significant = pValue < config.getSignificanceLevel() && coefficient >= config.getMinCorrelation();
        return Optional.of(new CorrelationCandidate(metricA, metricB, type(), coefficient, pValue,
                0, CausalDirection.NONE, null, n, significant));
    }

    public static double informationCoefficient(double mutualInformation) {
        double mi = Math.max(0.0, mutualInformation);
        return Math.sqrt(1 - Math.exp(-2 * mi));
    }

    /**
     * KSG 估计（算法 1，最大范数），单位为 nat，负值截断为 0
     */
    static double estimate(double[] x, double[] y, int k) {
        int n = x.length;
        double sum = 0;
        double[] distances = new double[n - 1];
        for (int i = 0; i < n; i++) {
            int idx = 0;
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    distances[idx++] = Math.max(Math.abs(x[i] - x[j]), Math.abs(y[i] - y[j]));
                }
            }
            double[] sorted = distances.clone();
            Arrays.sort(sorted);
            double epsilon = sorted[k - 1];

            int nx = 0;
            int ny = 0;
            for (int j = 0; j < n; j++) {
                if (j == i) {
                    continue;
                }
                if (Math.abs(x[i] - x[j]) < epsilon) {
                    nx++;
                }
                if (Math.abs(y[i] - y[j]) < epsilon) {
                    ny++;
                }
            }
            sum += Gamma.digamma(nx + 1) + Gamma.digamma(ny + 1);
        }
        double mi = Gamma.digamma(k) + Gamma.digamma(n) - sum / n;
        return Math.max(0.0, mi);
    }

    private static double[] jitter(double[] values, Random random) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] + JITTER * random.nextGaussian();
        }
        return result;
    }

    private static void shuffle(double[] values, Random random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            double tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
