package com.healthsignal.service.correlation;

import com.healthsignal.exception.DegenerateScaleException;
import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.List;

/**
 * 相关性计算共用的统计工具
 */
public final class CorrelationStatistics {

    private CorrelationStatistics() {
    }

    /**
     * 两列均非空的配对样本
     */
    public record Pairs(double[] x, double[] y) {
        public int size() {
            return x.length;
        }
    }

    public record PearsonResult(double r, double pValue, int n) {
    }

    /**
     * 对齐 lead[t] 与 follow[t+lag]（lag >= 0），丢弃任一侧缺失的配对
     */
    public static Pairs lagged(Double[] lead, Double[] follow, int lag) {
        List<double[]> pairs = new ArrayList<>();
        for (int t = 0; t + lag < follow.length && t < lead.length; t++) {
            Double x = lead[t];
            Double y = follow[t + lag];
            if (x != null && y != null) {
                pairs.add(new double[]{x, y});
            }
        }
        double[] xs = new double[pairs.size()];
        double[] ys = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            xs[i] = pairs.get(i)[0];
            ys[i] = pairs.get(i)[1];
        }
        return new Pairs(xs, ys);
    }

    public static Pairs aligned(Double[] a, Double[] b) {
        return lagged(a, b, 0);
    }

    public static void requireOverlap(String subject, int observed, int required) {
        if (observed < required) {
            throw new InsufficientDataException(subject, observed, required);
        }
    }

    /**
     * Pearson r 与双侧 p 值（t 分布，自由度 n-2）
     */
    public static PearsonResult pearson(String subject, double[] x, double[] y) {
        int n = x.length;
        if (n < 3) {
            throw new InsufficientDataException(subject, n, 3);
        }
        double sx = new StandardDeviation().evaluate(x);
        double sy = new StandardDeviation().evaluate(y);
        if (!(sx > 0) || !(sy > 0)) {
            throw new DegenerateScaleException(subject, Math.min(sx, sy));
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        if (!Double.isFinite(r)) {
            throw new DegenerateScaleException(subject, Double.NaN);
        }
        r = Math.max(-1.0, Math.min(1.0, r));
        return new PearsonResult(r, pearsonPValue(r, n), n);
    }

    static double pearsonPValue(double r, int n) {
        double denominator = 1 - r * r;
        if (denominator <= 0) {
            return 0.0;
        }
        double t = Math.abs(r) * Math.sqrt((n - 2) / denominator);
        TDistribution distribution = new TDistribution(n - 2);
        return Math.min(1.0, 2 * (1 - distribution.cumulativeProbability(t)));
    }

    /**
     * z-score 标准化；常数列抛出 DegenerateScaleException
     */
    public static double[] standardize(String subject, double[] values) {
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation().evaluate(values);
        if (!(std > 0) || !Double.isFinite(std)) {
            throw new DegenerateScaleException(subject, std);
        }
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = (values[i] - mean) / std;
        }
        return scaled;
    }

    static String subject(HealthMetric metricA, HealthMetric metricB, CorrelationType type) {
        return String.format("%s~%s[%s]", metricA.getKey(), metricB.getKey(), type.getCode());
    }
}
