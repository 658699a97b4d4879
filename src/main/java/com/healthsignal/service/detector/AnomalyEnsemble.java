package com.healthsignal.service.detector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.dto.analysis.EnsembleCandidate;
import com.healthsignal.model.dto.analysis.EnsembleCandidate.MatchKind;
import com.healthsignal.model.dto.analysis.FeatureContribution;
import com.healthsignal.model.dto.analysis.MultivariateFlag;
import com.healthsignal.model.dto.analysis.ZScoreFlag;
import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.enums.DetectorType;
import com.healthsignal.model.enums.HealthMetric;
import com.healthsignal.model.enums.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 异常集成
 * 以 (日期, 指标) 为键连接两个检测器的输出，同一键至多产出一条记录：
 * 两者都命中时按权重合成分数并标记为 ENSEMBLE，否则保留单个检测器的分数与类型。
 * 输出按 严重程度 > 分数 > 日期 倒序排列。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyEnsemble {

    /**
     * 排序：严重程度降序、分数降序、日期降序，最后按指标名保证稳定
     */
    public static final Comparator<Anomaly> RANKING = Comparator
            .comparing((Anomaly a) -> a.getSeverity().getRank(), Comparator.reverseOrder())
            .thenComparing(Anomaly::getAnomalyScore, Comparator.reverseOrder())
            .thenComparing(Anomaly::getRecordDate, Comparator.reverseOrder())
            .thenComparing(Anomaly::getMetricName);

    record Key(LocalDate date, HealthMetric metric) implements Comparable<Key> {
        @Override
        public int compareTo(Key other) {
            int byDate = date.compareTo(other.date);
            return byDate != 0 ? byDate : metric.compareTo(other.metric);
        }
    }

    private final ObjectMapper objectMapper;

    /**
     * 合并、去重、打分、排序，返回未落库的异常记录（最多 maxAnomalies 条）
     */
    public List<Anomaly> combine(Long userId, List<ZScoreFlag> zscoreFlags, List<MultivariateFlag> multivariateFlags,
                                 AnomalyDetectionConfig config, LocalDateTime detectedAt) {
        List<EnsembleCandidate> candidates = join(zscoreFlags, multivariateFlags);

        List<Anomaly> ranked = candidates.stream()
                .map(c -> toAnomaly(userId, c, config, detectedAt))
                .sorted(RANKING)
                .collect(Collectors.toList());

        if (ranked.size() > config.getMaxAnomalies()) {
            log.debug("异常数 {} 超过上限 {}，截断低优先级记录", ranked.size(), config.getMaxAnomalies());
            ranked = new ArrayList<>(ranked.subList(0, config.getMaxAnomalies()));
        }
        return ranked;
    }

    /**
     * (日期, 指标) 键上的连接；多变量命中按主要贡献指标展开成多个键
     */
    public static List<EnsembleCandidate> join(List<ZScoreFlag> zscoreFlags, List<MultivariateFlag> multivariateFlags) {
        Map<Key, EnsembleCandidate> joined = new TreeMap<>();
        for (ZScoreFlag flag : zscoreFlags) {
            joined.put(new Key(flag.date(), flag.metric()), EnsembleCandidate.zscoreOnly(flag));
        }
        for (MultivariateFlag flag : multivariateFlags) {
            for (FeatureContribution contribution : flag.contributors()) {
                Key key = new Key(flag.date(), contribution.metric());
                EnsembleCandidate existing = joined.get(key);
                if (existing == null) {
                    joined.put(key, EnsembleCandidate.iforestOnly(flag, contribution));
                } else if (existing.kind() == MatchKind.ZSCORE_ONLY) {
                    joined.put(key, existing.join(flag, contribution));
                }
            }
        }
        return new ArrayList<>(joined.values());
    }

    public static double combinedScore(double zscoreScore, double iforestScore, AnomalyDetectionConfig config) {
        double combined = config.getZscoreWeight() * zscoreScore + config.getIforestWeight() * iforestScore;
        return clip(combined);
    }

    Anomaly toAnomaly(Long userId, EnsembleCandidate candidate, AnomalyDetectionConfig config,
                      LocalDateTime detectedAt) {
        HealthMetric metric = candidate.metric();
        double score;
        double value;
        double baseline;
        DetectorType detectorType;
        switch (candidate.kind()) {
            case ZSCORE_ONLY -> {
                score = clip(candidate.zscore().score());
                value = candidate.zscore().value();
                baseline = candidate.zscore().baseline().center();
                detectorType = DetectorType.ZSCORE;
            }
            case IFOREST_ONLY -> {
                score = clip(candidate.multivariate().normalizedScore());
                value = candidate.contribution().value();
                baseline = candidate.contribution().reference();
                detectorType = DetectorType.ISOLATION_FOREST;
            }
            default -> {
                score = combinedScore(candidate.zscore().score(), candidate.multivariate().normalizedScore(), config);
                value = candidate.zscore().value();
                baseline = candidate.zscore().baseline().center();
                detectorType = DetectorType.ENSEMBLE;
            }
        }

        Anomaly anomaly = new Anomaly();
        anomaly.setUserId(userId);
        anomaly.setRecordDate(candidate.date());
        anomaly.setSourceTable(metric.getSourceTable());
        anomaly.setMetricName(metric.getKey());
        anomaly.setMetricValue(value);
        anomaly.setBaselineValue(baseline);
        anomaly.setDetectorType(detectorType);
        anomaly.setAnomalyScore(score);
        anomaly.setSeverity(Severity.fromScore(score));
        anomaly.setDetails(renderDetails(candidate, score));
        anomaly.setIsAcknowledged(false);
        anomaly.setDetectedAt(detectedAt);
        if (candidate.multivariate() != null) {
            anomaly.setExplanation(attributionSentence(candidate.multivariate()));
        }
        return anomaly;
    }

    /**
     * 多变量命中的归因说明，列出主要偏离指标及其参照值
     */
    public static String attributionSentence(MultivariateFlag flag) {
        String contributors = flag.contributors().stream()
                .map(c -> String.format("%s=%.1f（近期正常水平约 %.1f）", c.metric().getKey(), c.value(), c.reference()))
                .collect(Collectors.joining("、"));
        return String.format("%s 多项指标组合异常，主要偏离指标：%s", flag.date(), contributors);
    }

    private String renderDetails(EnsembleCandidate candidate, double score) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("match", candidate.kind().name());
        details.put("score", score);

        ZScoreFlag z = candidate.zscore();
        if (z != null) {
            Map<String, Object> zscore = new LinkedHashMap<>();
            zscore.put("z", z.zScore());
            zscore.put("threshold", z.threshold());
            zscore.put("center", z.baseline().center());
            zscore.put("scale", z.baseline().scale());
            zscore.put("observations", z.baseline().observations());
            zscore.put("robust", z.baseline().robust());
            zscore.put("adaptive", z.baseline().adaptive());
            zscore.put("boundViolation", z.boundViolation());
            ZScoreDetector.boundsOf(z.metric()).ifPresent(b -> zscore.put("bounds", b));
            zscore.put("score", z.score());
            details.put("zscore", zscore);
        }

        MultivariateFlag m = candidate.multivariate();
        if (m != null) {
            Map<String, Object> iforest = new LinkedHashMap<>();
            iforest.put("rawScore", m.rawScore());
            iforest.put("score", m.normalizedScore());
            iforest.put("contributors", m.contributors().stream().map(c -> {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("metric", c.metric().getKey());
                item.put("value", c.value());
                item.put("reference", c.reference());
                item.put("deviation", c.deviation());
                return item;
            }).collect(Collectors.toList()));
            details.put("iforest", iforest);
        }

        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.error("异常详情序列化失败: metric={}, date={}", candidate.metric().getKey(), candidate.date(), e);
            return null;
        }
    }

    private static double clip(double score) {
        if (!Double.isFinite(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
