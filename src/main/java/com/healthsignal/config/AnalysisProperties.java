package com.healthsignal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 分析参数默认值，绑定 application.yml 中的 health.analysis.*
 * 单次请求的覆盖项在 AnomalyDetectionConfig / CorrelationDetectionConfig 中合并
 */
@Data
@Component
@ConfigurationProperties(prefix = "health.analysis")
public class AnalysisProperties {

    /**
     * 单用户分析互斥锁过期时间（秒）
     */
    private long runLockTtlSeconds = 600;

    private Anomaly anomaly = new Anomaly();

    private Correlation correlation = new Correlation();

    @Data
    public static class Anomaly {
        private int lookbackDays = 60;
        private int baselineWindowDays = 30;
        private int minObservations = 14;
        private double defaultThreshold = 2.5;
        /**
         * 按指标 key 覆盖的阈值，热量波动大放宽，体重变化慢收紧
         */
        private Map<String, Double> thresholds = new HashMap<>(Map.of(
                "total_calories", 3.0,
                "weight_kg", 2.0));
        private boolean useRobust = false;
        private boolean useAdaptive = false;
        private int ewmaSpan = 7;
        private double contamination = 0.05;
        private int forestTrees = 100;
        private int forestSampleSize = 256;
        private long forestSeed = 42L;
        private double minFeatureCoverage = 0.5;
        private int topContributors = 2;
        private int attributionNeighbors = 5;
        private double zscoreWeight = 0.4;
        private double iforestWeight = 0.6;
        private int maxAnomalies = 50;
    }

    @Data
    public static class Correlation {
        private int lookbackDays = 60;
        private int minOverlap = 20;
        private double significanceLevel = 0.05;
        private double minCorrelation = 0.3;
        private int grangerMaxLag = 7;
        private int crossMaxLag = 14;
        private int miNeighbors = 3;
        private int miPermutations = 100;
        private long miSeed = 42L;
        private double minConfidence = 0.3;
        private double weakFloor = 0.1;
        private double agreementBonus = 0.1;
        private int lagTolerance = 1;
        private double unusualZ = 1.5;
        private double extremePercentile = 90.0;
        private int minPopulationUsers = 10;
    }
}
