package com.healthsignal.model.dto.analysis;

import com.healthsignal.config.AnalysisProperties;
import com.healthsignal.exception.InvalidConfigurationException;
import com.healthsignal.model.dto.AnomalyDetectionDTO;
import com.healthsignal.model.enums.HealthMetric;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 单次异常检测运行的完整配置：请求覆盖项合并到默认值之上，构造后只读
 */
@Value
@Builder(toBuilder = true)
public class AnomalyDetectionConfig {

    @Builder.Default
    int days = 60;

    @Builder.Default
    int baselineWindowDays = 30;

    @Builder.Default
    int minObservations = 14;

    @Builder.Default
    double defaultThreshold = 2.5;

    @Builder.Default
    Map<HealthMetric, Double> thresholds = Map.of(
            HealthMetric.TOTAL_CALORIES, 3.0,
            HealthMetric.WEIGHT_KG, 2.0);

    @Builder.Default
    boolean useRobust = false;

    @Builder.Default
    boolean useAdaptive = false;

    @Builder.Default
    int ewmaSpan = 7;

    @Builder.Default
    boolean includeExplanation = false;

    @Builder.Default
    double contamination = 0.05;

    @Builder.Default
    int forestTrees = 100;

    @Builder.Default
    int forestSampleSize = 256;

    @Builder.Default
    long forestSeed = 42L;

    @Builder.Default
    double minFeatureCoverage = 0.5;

    @Builder.Default
    int topContributors = 2;

    @Builder.Default
    int attributionNeighbors = 5;

    @Builder.Default
    double zscoreWeight = 0.4;

    @Builder.Default
    double iforestWeight = 0.6;

    @Builder.Default
    int maxAnomalies = 50;

    public static AnomalyDetectionConfig defaults() {
        return builder().build();
    }

    /**
     * 以 application.yml 中的默认值为底，叠加请求中显式给出的选项
     */
    public static AnomalyDetectionConfig of(AnalysisProperties.Anomaly defaults, AnomalyDetectionDTO request) {
        Map<HealthMetric, Double> thresholds = new EnumMap<>(HealthMetric.class);
        defaults.getThresholds().forEach((key, value) -> {
            HealthMetric metric = HealthMetric.fromKey(key)
                    .orElseThrow(() -> new InvalidConfigurationException("未知的阈值指标: " + key));
            thresholds.put(metric, value);
        });

        AnomalyDetectionConfigBuilder builder = builder()
                .days(defaults.getLookbackDays())
                .baselineWindowDays(defaults.getBaselineWindowDays())
                .minObservations(defaults.getMinObservations())
                .defaultThreshold(defaults.getDefaultThreshold())
                .thresholds(Collections.unmodifiableMap(thresholds))
                .useRobust(defaults.isUseRobust())
                .useAdaptive(defaults.isUseAdaptive())
                .ewmaSpan(defaults.getEwmaSpan())
                .contamination(defaults.getContamination())
                .forestTrees(defaults.getForestTrees())
                .forestSampleSize(defaults.getForestSampleSize())
                .forestSeed(defaults.getForestSeed())
                .minFeatureCoverage(defaults.getMinFeatureCoverage())
                .topContributors(defaults.getTopContributors())
                .attributionNeighbors(defaults.getAttributionNeighbors())
                .zscoreWeight(defaults.getZscoreWeight())
                .iforestWeight(defaults.getIforestWeight())
                .maxAnomalies(defaults.getMaxAnomalies());

        if (request != null) {
            if (request.getDays() != null) {
                builder.days(request.getDays());
            }
            if (request.getUseRobust() != null) {
                builder.useRobust(request.getUseRobust());
            }
            if (request.getUseAdaptive() != null) {
                builder.useAdaptive(request.getUseAdaptive());
            }
            if (request.getIncludeExplanation() != null) {
                builder.includeExplanation(request.getIncludeExplanation());
            }
            if (request.getContamination() != null) {
                builder.contamination(request.getContamination());
            }
        }
        return builder.build();
    }

    public double thresholdFor(HealthMetric metric) {
        return thresholds.getOrDefault(metric, defaultThreshold);
    }

    /**
     * EWMA 平滑系数 alpha = 2 / (span + 1)
     */
    public double ewmaAlpha() {
        return 2.0 / (ewmaSpan + 1);
    }

    /**
     * 在读取任何数据之前校验，不合法直接拒绝本次运行
     */
    public AnomalyDetectionConfig validate() {
        if (days <= 0) {
            throw new InvalidConfigurationException("分析天数必须为正数: " + days);
        }
        if (minObservations < 2) {
            throw new InvalidConfigurationException("最少观测数不能小于2: " + minObservations);
        }
        if (baselineWindowDays < minObservations) {
            throw new InvalidConfigurationException(String.format(
                    "基线窗口(%d天)不能小于最少观测数(%d)", baselineWindowDays, minObservations));
        }
        if (!(defaultThreshold > 0)) {
            throw new InvalidConfigurationException("默认阈值必须为正数: " + defaultThreshold);
        }
        thresholds.forEach((metric, value) -> {
            if (value == null || !(value > 0)) {
                throw new InvalidConfigurationException("指标 " + metric.getKey() + " 的阈值必须为正数");
            }
        });
        if (ewmaSpan < 1) {
            throw new InvalidConfigurationException("EWMA 跨度不能小于1: " + ewmaSpan);
        }
        if (!(contamination > 0 && contamination < 1)) {
            throw new InvalidConfigurationException("污染率必须在 (0,1) 区间内: " + contamination);
        }
        if (forestTrees < 1 || forestSampleSize < 2) {
            throw new InvalidConfigurationException(String.format(
                    "孤立森林参数不合法: trees=%d, sampleSize=%d", forestTrees, forestSampleSize));
        }
        if (!(minFeatureCoverage > 0 && minFeatureCoverage <= 1)) {
            throw new InvalidConfigurationException("特征覆盖率下限必须在 (0,1] 区间内: " + minFeatureCoverage);
        }
        if (topContributors < 1 || attributionNeighbors < 1) {
            throw new InvalidConfigurationException("归因指标数与近邻数必须为正数");
        }
        if (zscoreWeight < 0 || iforestWeight < 0 || zscoreWeight + iforestWeight <= 0) {
            throw new InvalidConfigurationException(String.format(
                    "集成权重不合法: zscore=%s, iforest=%s", zscoreWeight, iforestWeight));
        }
        if (maxAnomalies < 1) {
            throw new InvalidConfigurationException("最大异常数必须为正数: " + maxAnomalies);
        }
        return this;
    }
}
