package com.healthsignal.service.impl;

import com.healthsignal.config.AnalysisProperties;
import com.healthsignal.exception.EmptyFeatureMatrixException;
import com.healthsignal.mapper.CorrelationMapper;
import com.healthsignal.model.dto.CorrelationDetectionDTO;
import com.healthsignal.model.dto.analysis.CorrelationCandidate;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.entity.Correlation;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.vo.CorrelationDetectionVO;
import com.healthsignal.model.vo.CorrelationSummaryVO;
import com.healthsignal.service.CorrelationDetectionService;
import com.healthsignal.service.component.AnalysisRunGuard;
import com.healthsignal.service.correlation.CorrelationAggregator;
import com.healthsignal.service.correlation.CorrelationAnalyzer;
import com.healthsignal.service.feature.FeatureMatrixBuilder;
import com.healthsignal.service.manager.AnalysisResultManager;
import com.healthsignal.service.manager.InsightPayloadManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 相关性检测实现
 * 流程：特征矩阵 -> 各指标对 × 各方法 -> 汇总（置信度、强度、人群比较）-> 落库
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationDetectionServiceImpl implements CorrelationDetectionService {

    private static final int DEFAULT_QUERY_LIMIT = 50;
    private static final int DEFAULT_TOP_LIMIT = 5;
    private static final int SUMMARY_TOP_PAIRS = 5;

    private final FeatureMatrixBuilder featureMatrixBuilder;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final CorrelationAggregator correlationAggregator;
    private final AnalysisResultManager analysisResultManager;
    private final InsightPayloadManager insightPayloadManager;
    private final AnalysisRunGuard analysisRunGuard;
    private final CorrelationMapper correlationMapper;
    private final AnalysisProperties analysisProperties;

    @Override
    public CorrelationDetectionVO detectCorrelations(Long userId, CorrelationDetectionDTO request) {
        CorrelationDetectionConfig config = CorrelationDetectionConfig
                .of(analysisProperties.getCorrelation(), request).validate();
        LocalDate endDate = LocalDate.now();
        return analysisRunGuard.runExclusive(userId, "相关性检测", () -> detect(userId, config, endDate));
    }

    /**
     * 在给定截止日期上运行一次检测（调用方负责互斥）
     */
    public CorrelationDetectionVO detect(Long userId, CorrelationDetectionConfig config, LocalDate endDate) {
        long start = System.currentTimeMillis();
        log.info("开始相关性检测: userId={}, days={}, methods={}", userId, config.getDays(), config.enabledTypes());

        // 1. 构建特征矩阵
        FeatureMatrix matrix;
        try {
            matrix = featureMatrixBuilder.build(userId, endDate, config.getDays()).requireData();
        } catch (EmptyFeatureMatrixException e) {
            log.info("相关性检测结束: userId={}, {}", userId, e.getMessage());
            return CorrelationDetectionVO.nothingToAnalyze(endDate.minusDays(config.getDays() - 1L), endDate);
        }

        // 2. 各方法检验
        List<CorrelationCandidate> candidates = correlationAnalyzer.analyze(matrix, config);

        // 3. 汇总
        List<Correlation> ranked = correlationAggregator.aggregate(userId, candidates,
                matrix.getStartDate(), matrix.getEndDate(), config, LocalDateTime.now());

        // 4. 落库
        AnalysisResultManager.SaveOutcome<Correlation> outcome = analysisResultManager.saveCorrelations(userId, ranked);
        List<Correlation> saved = outcome.records();

        int significant = (int) saved.stream().filter(c -> Boolean.TRUE.equals(c.getIsSignificant())).count();
        int actionable = (int) saved.stream().filter(c -> Boolean.TRUE.equals(c.getIsActionable())).count();
        log.info("相关性检测完成: userId={}, 候选={}, 保留={}, 值得关注={}, 新增={}, 耗时={}ms",
                userId, candidates.size(), saved.size(), actionable, outcome.created(),
                System.currentTimeMillis() - start);
        return new CorrelationDetectionVO(saved.size(), significant, actionable, outcome.created(),
                countByType(saved), countByStrength(saved), false,
                matrix.getStartDate(), matrix.getEndDate(), saved);
    }

    @Override
    public List<Correlation> getCorrelations(Long userId, CorrelationType type, boolean actionableOnly,
                                             Integer limit) {
        if (limit == null || limit <= 0) {
            limit = DEFAULT_QUERY_LIMIT;
        }
        return correlationMapper.selectByUser(userId, type, actionableOnly, limit);
    }

    @Override
    public List<Correlation> getTopActionable(Long userId, Integer limit) {
        if (limit == null || limit <= 0) limit = DEFAULT_TOP_LIMIT;
        return correlationMapper.selectByUser(userId, null, true, limit);
    }

    @Override
    public CorrelationSummaryVO getCorrelationSummary(Long userId) {
        List<Correlation> all = correlationMapper.selectByUser(userId, null, false, null);
        int significant = (int) all.stream().filter(c -> Boolean.TRUE.equals(c.getIsSignificant())).count();
        int actionable = (int) all.stream().filter(c -> Boolean.TRUE.equals(c.getIsActionable())).count();

        List<CorrelationSummaryVO.TopPair> topPairs = all.stream()
                .sorted(CorrelationAggregator.RANKING)
                .limit(SUMMARY_TOP_PAIRS)
                .map(c -> new CorrelationSummaryVO.TopPair(c.getMetricA(), c.getMetricB(),
                        c.getCorrelationType().getCode(), c.getCorrelationValue(), c.getConfidenceScore(),
                        c.getLagDays(), c.getCausalDirection() == null ? null : c.getCausalDirection().name()))
                .collect(Collectors.toList());
        return new CorrelationSummaryVO(all.size(), significant, actionable,
                countByType(all), countByStrength(all), topPairs);
    }

    @Override
    public Correlation updateCorrelationInsight(Long userId, Long correlationId, String insight,
                                                String recommendation) {
        Correlation correlation = correlationMapper.selectById(userId, correlationId);
        if (correlation == null) {
            throw new IllegalArgumentException("相关性记录不存在: " + correlationId);
        }
        correlationMapper.updateInsight(userId, correlationId, insight, recommendation);
        correlation.setInsight(insight);
        correlation.setRecommendation(recommendation);
        log.info("回写相关性洞察: userId={}, id={}, {} ~ {}",
                userId, correlationId, correlation.getMetricA(), correlation.getMetricB());
        return correlation;
    }

    @Override
    public String buildInsightPayload(Long userId, Integer limit) {
        return insightPayloadManager.buildCorrelationPayload(userId, getTopActionable(userId, limit));
    }

    private static Map<String, Integer> countByType(List<Correlation> correlations) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Correlation c : correlations) {
            counts.merge(c.getCorrelationType().getCode(), 1, Integer::sum);
        }
        return counts;
    }

    private static Map<String, Integer> countByStrength(List<Correlation> correlations) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Correlation c : correlations) {
            if (c.getStrength() != null) {
                counts.merge(c.getStrength().name(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
