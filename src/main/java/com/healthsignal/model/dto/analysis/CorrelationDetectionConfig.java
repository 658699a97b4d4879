package com.healthsignal.model.dto.analysis;

import com.healthsignal.config.AnalysisProperties;
import com.healthsignal.exception.InvalidConfigurationException;
import com.healthsignal.model.dto.CorrelationDetectionDTO;
import com.healthsignal.model.enums.CorrelationType;
import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * 单次相关性检测运行的完整配置
 */
@Value
@Builder(toBuilder = true)
public class CorrelationDetectionConfig {

    @Builder.Default
    int days = 60;

    @Builder.Default
    boolean includePearson = true;

    @Builder.Default
    boolean includeGranger = true;

    @Builder.Default
    boolean includeCrossCorrelation = true;

    @Builder.Default
    boolean includeMutualInfo = true;

    @Builder.Default
    boolean includePopulationComparison = true;

    @Builder.Default
    int minOverlap = 20;

    @Builder.Default
    double significanceLevel = 0.05;

    @Builder.Default
    double minCorrelation = 0.3;

    @Builder.Default
    int grangerMaxLag = 7;

    @Builder.Default
    int crossMaxLag = 14;

    @Builder.Default
    int miNeighbors = 3;

    @Builder.Default
    int miPermutations = 100;

    @Builder.Default
    long miSeed = 42L;

    @Builder.Default
    double minConfidence = 0.3;

    @Builder.Default
    double weakFloor = 0.1;

    @Builder.Default
    double agreementBonus = 0.1;

    @Builder.Default
    int lagTolerance = 1;

    @Builder.Default
    double unusualZ = 1.5;

    @Builder.Default
    double extremePercentile = 90.0;

    @Builder.Default
    int minPopulationUsers = 10;

    public static CorrelationDetectionConfig defaults() {
        return builder().build();
    }

    public static CorrelationDetectionConfig of(AnalysisProperties.Correlation defaults,
                                                CorrelationDetectionDTO request) {
        CorrelationDetectionConfigBuilder builder = builder()
                .days(defaults.getLookbackDays())
                .minOverlap(defaults.getMinOverlap())
                .significanceLevel(defaults.getSignificanceLevel())
                .minCorrelation(defaults.getMinCorrelation())
                .grangerMaxLag(defaults.getGrangerMaxLag())
                .crossMaxLag(defaults.getCrossMaxLag())
                .miNeighbors(defaults.getMiNeighbors())
                .miPermutations(defaults.getMiPermutations())
                .miSeed(defaults.getMiSeed())
                .minConfidence(defaults.getMinConfidence())
                .weakFloor(defaults.getWeakFloor())
                .agreementBonus(defaults.getAgreementBonus())
                .lagTolerance(defaults.getLagTolerance())
                .unusualZ(defaults.getUnusualZ())
                .extremePercentile(defaults.getExtremePercentile())
                .minPopulationUsers(defaults.getMinPopulationUsers());

        if (request != null) {
            if (request.getDays() != null) {
                builder.days(request.getDays());
            }
            if (request.getIncludePearson() != null) {
                builder.includePearson(request.getIncludePearson());
            }
            if (request.getIncludeGranger() != null) {
                builder.includeGranger(request.getIncludeGranger());
            }
            if (request.getIncludeCrossCorrelation() != null) {
                builder.includeCrossCorrelation(request.getIncludeCrossCorrelation());
            }
            if (request.getIncludeMutualInfo() != null) {
                builder.includeMutualInfo(request.getIncludeMutualInfo());
            }
            if (request.getIncludePopulationComparison() != null) {
                builder.includePopulationComparison(request.getIncludePopulationComparison());
            }
            if (request.getMinConfidence() != null) {
                builder.minConfidence(request.getMinConfidence());
            }
            if (request.getMaxLag() != null) {
                builder.grangerMaxLag(request.getMaxLag());
            }
        }
        return builder.build();
    }

    public Set<CorrelationType> enabledTypes() {
        Set<CorrelationType> types = EnumSet.noneOf(CorrelationType.class);
        if (includePearson) {
            types.add(CorrelationType.PEARSON);
        }
        if (includeGranger) {
            types.add(CorrelationType.GRANGER);
        }
        if (includeCrossCorrelation) {
            types.add(CorrelationType.CROSS_CORRELATION);
        }
        if (includeMutualInfo) {
            types.add(CorrelationType.MUTUAL_INFO);
        }
        return types;
    }

    public CorrelationDetectionConfig validate() {
        if (days <= 0) {
            throw new InvalidConfigurationException("分析天数必须为正数: " + days);
        }
        if (enabledTypes().isEmpty()) {
            throw new InvalidConfigurationException("至少需要启用一种相关性检测方法");
        }
        if (minOverlap < 3) {
            throw new InvalidConfigurationException("最少重叠天数不能小于3: " + minOverlap);
        }
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new InvalidConfigurationException("显著性水平必须在 (0,1) 区间内: " + significanceLevel);
        }
        if (!(minCorrelation >= 0 && minCorrelation <= 1)) {
            throw new InvalidConfigurationException("最小相关系数必须在 [0,1] 区间内: " + minCorrelation);
        }
        if (grangerMaxLag <= 0) {
            throw new InvalidConfigurationException("Granger 最大滞后必须为正数: " + grangerMaxLag);
        }
        if (crossMaxLag <= 0) {
            throw new InvalidConfigurationException("互相关最大滞后必须为正数: " + crossMaxLag);
        }
        if (miNeighbors < 1 || miPermutations < 1) {
            throw new InvalidConfigurationException(String.format(
                    "互信息参数不合法: neighbors=%d, permutations=%d", miNeighbors, miPermutations));
        }
        if (!(minConfidence >= 0 && minConfidence <= 1)) {
            throw new InvalidConfigurationException("最低置信度必须在 [0,1] 区间内: " + minConfidence);
        }
        if (!(weakFloor >= 0 && weakFloor < 0.3)) {
            throw new InvalidConfigurationException("弱相关下限必须在 [0,0.3) 区间内: " + weakFloor);
        }
        if (agreementBonus < 0 || lagTolerance < 0) {
            throw new InvalidConfigurationException("一致性加成与滞后容差不能为负");
        }
        if (!(extremePercentile > 50 && extremePercentile < 100)) {
            throw new InvalidConfigurationException("极端百分位必须在 (50,100) 区间内: " + extremePercentile);
        }
        return this;
    }
}
