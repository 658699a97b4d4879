package com.healthsignal.model.dto.analysis;

import com.healthsignal.model.enums.HealthMetric;

import java.time.LocalDate;

/**
 * (日期, 指标) 键上两个检测器结果的连接
 * zscore / contribution 依 kind 可能为空
 */
public record EnsembleCandidate(LocalDate date, HealthMetric metric, MatchKind kind,
                                ZScoreFlag zscore, MultivariateFlag multivariate,
                                FeatureContribution contribution) {

    public enum MatchKind {
        ZSCORE_ONLY,
        IFOREST_ONLY,
        BOTH
    }

    public static EnsembleCandidate zscoreOnly(ZScoreFlag flag) {
        return new EnsembleCandidate(flag.date(), flag.metric(), MatchKind.ZSCORE_ONLY, flag, null, null);
    }

    public static EnsembleCandidate iforestOnly(MultivariateFlag flag, FeatureContribution contribution) {
        return new EnsembleCandidate(flag.date(), contribution.metric(), MatchKind.IFOREST_ONLY,
                null, flag, contribution);
    }

    public EnsembleCandidate join(MultivariateFlag flag, FeatureContribution contribution) {
        return new EnsembleCandidate(date, metric, MatchKind.BOTH, zscore, flag, contribution);
    }
}
