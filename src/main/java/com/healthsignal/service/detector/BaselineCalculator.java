package com.healthsignal.service.detector;

import com.healthsignal.exception.DegenerateScaleException;
import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.dto.analysis.Baseline;
import com.healthsignal.model.enums.HealthMetric;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 基线计算
 * 经典模式：均值 / 样本标准差；稳健模式：中位数 / 1.4826·MAD；
 * 自适应模式把中心换成 EWMA，离散度随之按相同权重计算。两个开关互不排斥。
 */
@Component
public class BaselineCalculator {

    /**
     * 正态分布下 MAD 与标准差的换算系数
     */
    static final double MAD_SCALE = 1.4826;

    /**
     * @param window 评估日之前窗口内的有效观测，按时间升序
     */
    public Baseline compute(HealthMetric metric, List<Double> window, AnomalyDetectionConfig config) {
        int n = window.size();
        if (n < config.getMinObservations()) {
            throw new InsufficientDataException(metric.getKey(), n, config.getMinObservations());
        }
        double[] values = toArray(window);

        double center;
        double scale;
        if (config.isUseAdaptive()) {
            double[] weights = ewmaWeights(n, config.ewmaAlpha());
            center = weightedMean(values, weights);
            scale = config.isUseRobust()
                    ? MAD_SCALE * medianAbsoluteDeviation(values, center)
                    : weightedStd(values, weights, center);
        } else if (config.isUseRobust()) {
            center = new Median().evaluate(values);
            scale = MAD_SCALE * medianAbsoluteDeviation(values, center);
        } else {
            center = new Mean().evaluate(values);
            scale = new StandardDeviation().evaluate(values);
        }

        if (!Double.isFinite(center) || !Double.isFinite(scale) || scale <= 0) {
            throw new DegenerateScaleException(metric.getKey(), scale);
        }
        return new Baseline(metric, center, scale, n, config.isUseRobust(), config.isUseAdaptive());
    }

    /**
     * 最新观测权重为 1，往前每一天乘以 (1 - alpha)
     */
    static double[] ewmaWeights(int n, double alpha) {
        double[] weights = new double[n];
        double w = 1.0;
        for (int i = n - 1; i >= 0; i--) {
            weights[i] = w;
            w *= (1 - alpha);
        }
        return weights;
    }

    static double weightedMean(double[] values, double[] weights) {
        double sum = 0;
        double totalWeight = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * weights[i];
            totalWeight += weights[i];
        }
        return sum / totalWeight;
    }

    /**
     * 带可靠性权重无偏修正的加权标准差
     */
    static double weightedStd(double[] values, double[] weights, double center) {
        double v1 = 0;
        double v2 = 0;
        double sq = 0;
        for (int i = 0; i < values.length; i++) {
            double d = values[i] - center;
            sq += weights[i] * d * d;
            v1 += weights[i];
            v2 += weights[i] * weights[i];
        }
        double denominator = v1 - v2 / v1;
        if (denominator <= 0) {
            return Double.NaN;
        }
        return Math.sqrt(sq / denominator);
    }

    static double medianAbsoluteDeviation(double[] values, double center) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return new Median().evaluate(deviations);
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
