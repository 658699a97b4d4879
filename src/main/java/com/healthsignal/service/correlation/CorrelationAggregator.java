package com.healthsignal.service.correlation;

import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.dto.analysis.PopulationReference;
import com.healthsignal.model.entity.Correlation;
import com.healthsignal.model.enums.CorrelationStrength;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 相关性结果汇总
 * 各方法的结果分别保留；同一指标对上其他方法方向与滞后一致时提高置信度。
 * 按强度分档丢弃弱于下限的结果，按最低置信度过滤，再与人群参考分布比较得出百分位与是否值得关注。
 * insight / recommendation 留给外部文本生成服务回写。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationAggregator {

    public static final Comparator<Correlation> RANKING = Comparator
            .comparing(Correlation::getConfidenceScore, Comparator.reverseOrder())
            .thenComparing((Correlation c) -> Math.abs(c.getCorrelationValue()), Comparator.reverseOrder())
            .thenComparing(Correlation::getMetricA)
            .thenComparing(Correlation::getMetricB)
            .thenComparing(Correlation::getCorrelationType);

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final PopulationBaselineProvider populationBaselineProvider;

    public List<Correlation> aggregate(Long userId, List<CorrelationCandidate> candidates,
                                       LocalDate periodStart, LocalDate periodEnd,
                                       CorrelationDetectionConfig config, LocalDateTime detectedAt) {
        // 1. 按指标对分组
        Map<String, List<CorrelationCandidate>> byPair = new LinkedHashMap<>();
        for (CorrelationCandidate candidate : candidates) {
            byPair.computeIfAbsent(candidate.metricA().getKey() + "|" + candidate.metricB().getKey(),
                    k -> new ArrayList<>()).add(candidate);
        }

        List<Correlation> results = new ArrayList<>();
        int weak = 0;
        int lowConfidence = 0;
        for (List<CorrelationCandidate> group : byPair.values()) {
            for (CorrelationCandidate candidate : group) {
                // 2. 强度分档，低于弱相关下限直接丢弃
                CorrelationStrength strength = CorrelationStrength.fromValue(candidate.value(), config.getWeakFloor());
                if (strength == null) {
                    weak++;
                    continue;
                }

                // 3. 置信度 = (1-p)·|value| + 一致方法数·加成
                int agreements = countAgreements(candidate, group, config.getLagTolerance());
                double confidence = confidence(candidate.pValue(), candidate.value(), agreements,
                        config.getAgreementBonus());
                if (confidence < config.getMinConfidence()) {
                    lowConfidence++;
                    continue;
                }

                Correlation correlation = toEntity(userId, candidate, strength, confidence,
                        periodStart, periodEnd, detectedAt);

                // 4. 人群基线比较
                if (config.isIncludePopulationComparison()) {
                    PopulationReference reference = populationBaselineProvider.referenceFor(
                            candidate.metricA(), candidate.metricB(), candidate.type(), config);
                    enrich(correlation, reference, config);
                }
                results.add(correlation);
            }
        }

        results.sort(RANKING);
        log.debug("相关性汇总: userId={}, 候选={}, 弱相关丢弃={}, 低置信度丢弃={}, 保留={}",
                userId, candidates.size(), weak, lowConfidence, results.size());
        return results;
    }

    /**
     * 同一指标对中与该结果一致的其他方法数：符号相同（互信息不比较符号）且滞后相差不超过容差
     */
    static int countAgreements(CorrelationCandidate candidate, List<CorrelationCandidate> group, int lagTolerance) {
        int agreements = 0;
        for (CorrelationCandidate other : group) {
            if (other == candidate || other.type() == candidate.type()) {
                continue;
            }
            boolean signAgrees = !candidate.type().isSigned() || !other.type().isSigned()
                    || Math.signum(candidate.value()) == Math.signum(other.value());
            boolean lagAgrees = Math.abs(candidate.lagDays() - other.lagDays()) <= lagTolerance;
            if (signAgrees && lagAgrees) {
                agreements++;
            }
        }
        return agreements;
    }

    public static double confidence(double pValue, double value, int agreements, double agreementBonus) {
        double base = (1 - pValue) * Math.abs(value);
        double confidence = base + agreementBonus * agreements;
        if (!Double.isFinite(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    /**
     * 只写入人群均值、百分位与是否值得关注，不修改相关值和强度
     */
    public static void enrich(Correlation correlation, PopulationReference reference,
                              CorrelationDetectionConfig config) {
        if (reference == null || !(reference.std() > 0)) {
            return;
        }
        double z = (correlation.getCorrelationValue() - reference.mean()) / reference.std();
        if (!Double.isFinite(z)) {
            return;
        }
        double percentile = STANDARD_NORMAL.cumulativeProbability(z) * 100;
        double extreme = config.getExtremePercentile();
        boolean unusual = Math.abs(z) > config.getUnusualZ();
        boolean extremeAndMeaningful = correlation.getStrength().isAtLeast(CorrelationStrength.MODERATE)
                && (percentile <= 100 - extreme || percentile >= extreme);

        correlation.setPopulationAvg(reference.mean());
        correlation.setPercentileRank(percentile);
        correlation.setIsActionable(unusual || extremeAndMeaningful);
    }

    private static Correlation toEntity(Long userId, CorrelationCandidate candidate, CorrelationStrength strength,
                                        double confidence, LocalDate periodStart, LocalDate periodEnd,
                                        LocalDateTime detectedAt) {
        Correlation correlation = new Correlation();
        correlation.setUserId(userId);
        correlation.setMetricA(candidate.metricA().getKey());
        correlation.setMetricB(candidate.metricB().getKey());
        correlation.setCorrelationType(candidate.type());
        correlation.setCorrelationValue(candidate.value());
        correlation.setTestPValue(candidate.pValue());
        correlation.setLagDays(candidate.lagDays());
        correlation.setCausalDirection(candidate.direction());
        correlation.setGrangerFStat(candidate.fStatistic());
        correlation.setStrength(strength);
        correlation.setConfidenceScore(confidence);
        correlation.setIsSignificant(candidate.significant());
        correlation.setIsActionable(false);
        correlation.setSampleSize(candidate.sampleSize());
        correlation.setPeriodStart(periodStart);
        correlation.setPeriodEnd(periodEnd);
        correlation.setDetectedAt(detectedAt);
        return correlation;
    }
}
