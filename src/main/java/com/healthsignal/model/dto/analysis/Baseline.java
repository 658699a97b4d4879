package com.healthsignal.model.dto.analysis;

import com.healthsignal.model.enums.HealthMetric;

/**
 * 某指标在某一评估日之前窗口上的基线（中心 + 离散度），每次运行现算，不落库
 *
 * @param center       均值 / 中位数 / EWMA 中心
 * @param scale        标准差 / 1.4826·MAD
 * @param observations 窗口内有效观测数
 */
public record Baseline(HealthMetric metric, double center, double scale, int observations,
                       boolean robust, boolean adaptive) {

    public double zScore(double value) {
        return (value - center) / scale;
    }
}
