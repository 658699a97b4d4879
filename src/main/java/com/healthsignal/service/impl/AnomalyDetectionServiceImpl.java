package com.healthsignal.service.impl;

import com.healthsignal.config.AnalysisProperties;
import com.healthsignal.exception.EmptyFeatureMatrixException;
import com.healthsignal.mapper.AnomalyMapper;
import com.healthsignal.model.dto.AnomalyDetectionDTO;
import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.dto.analysis.MultivariateFlag;
import com.healthsignal.model.dto.analysis.ZScoreFlag;
import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.vo.AnomalyDetectionVO;
import com.healthsignal.model.vo.AnomalySummaryVO;
import com.healthsignal.service.AnomalyDetectionService;
import com.healthsignal.service.AnomalyExplanationService;
import com.healthsignal.service.component.AnalysisRunGuard;
import com.healthsignal.service.detector.AnomalyEnsemble;
import com.healthsignal.service.detector.MultivariateDetector;
import com.healthsignal.service.detector.ZScoreDetector;
import com.healthsignal.service.feature.FeatureMatrixBuilder;
import com.healthsignal.service.manager.AnalysisResultManager;
import com.healthsignal.service.manager.InsightPayloadManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 异常检测实现
 * 流程：特征矩阵 -> 单变量 Z 分数 + 多变量孤立森林 -> 集成排序 -> 解释 -> 落库
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyDetectionServiceImpl implements AnomalyDetectionService {

    private static final int DEFAULT_QUERY_LIMIT = 100;
    private static final int DEFAULT_SUMMARY_DAYS = 30;
    private static final int DEFAULT_PAYLOAD_LIMIT = 20;

    private final FeatureMatrixBuilder featureMatrixBuilder;
    private final ZScoreDetector zScoreDetector;
    private final MultivariateDetector multivariateDetector;
    private final AnomalyEnsemble anomalyEnsemble;
    private final AnomalyExplanationService anomalyExplanationService;
    private final AnalysisResultManager analysisResultManager;
    private final InsightPayloadManager insightPayloadManager;
    private final AnalysisRunGuard analysisRunGuard;
    private final AnomalyMapper anomalyMapper;
    private final AnalysisProperties analysisProperties;

    @Override
    public AnomalyDetectionVO detectAnomalies(Long userId, AnomalyDetectionDTO request) {
        // 参数在加锁前校验，非法配置不占用运行锁
        AnomalyDetectionConfig config = AnomalyDetectionConfig.of(analysisProperties.getAnomaly(), request).validate();
        LocalDate endDate = LocalDate.now();
        return analysisRunGuard.runExclusive(userId, "异常检测", () -> detect(userId, config, endDate));
    }

    /**
     * 在给定截止日期上运行一次检测（调用方负责互斥）
     */
    public AnomalyDetectionVO detect(Long userId, AnomalyDetectionConfig config, LocalDate endDate) {
        long start = System.currentTimeMillis();
        log.info("开始异常检测: userId={}, days={}, robust={}, adaptive={}",
                userId, config.getDays(), config.isUseRobust(), config.isUseAdaptive());

        // 1. 构建特征矩阵
        FeatureMatrix matrix;
        try {
            matrix = featureMatrixBuilder.build(userId, endDate, config.getDays()).requireData();
        } catch (EmptyFeatureMatrixException e) {
            log.info("异常检测结束: userId={}, {}", userId, e.getMessage());
            return AnomalyDetectionVO.nothingToAnalyze(endDate.minusDays(config.getDays() - 1L), endDate);
        }

        // 2. 两个检测器
        List<ZScoreFlag> zscoreFlags = zScoreDetector.detect(matrix, config);
        List<MultivariateFlag> multivariateFlags = multivariateDetector.detect(matrix, config);

        // 3. 集成、去重、排序
        List<Anomaly> ranked = anomalyEnsemble.combine(userId, zscoreFlags, multivariateFlags, config,
                LocalDateTime.now());

        // 4. 解释文案
        if (config.isIncludeExplanation()) {
            ranked.forEach(this::applyExplanation);
        }

        // 5. 落库
        AnalysisResultManager.SaveOutcome<Anomaly> outcome = analysisResultManager.saveAnomalies(userId, ranked);

        log.info("异常检测完成: userId={}, 单变量命中={}, 多变量命中={}, 异常={}, 新增={}, 耗时={}ms",
                userId, zscoreFlags.size(), multivariateFlags.size(), ranked.size(), outcome.created(),
                System.currentTimeMillis() - start);
        return new AnomalyDetectionVO(outcome.records().size(), outcome.created(), false,
                matrix.getStartDate(), matrix.getEndDate(), outcome.records());
    }

    private void applyExplanation(Anomaly anomaly) {
        String text;
        try {
            text = anomalyExplanationService.explain(anomaly);
        } catch (RuntimeException e) {
            log.warn("异常解释生成失败，保留检测结果: metric={}, date={}, {}",
                    anomaly.getMetricName(), anomaly.getRecordDate(), e.getMessage());
            return;
        }
        if (StringUtils.isBlank(text)) {
            return;
        }
        anomaly.setExplanation(joinExplanation(text, anomaly.getExplanation()));
    }

    /**
     * 多变量归因说明保留在模板文案之后，以空格分隔
     */
    static String joinExplanation(String text, String attribution) {
        if (StringUtils.isBlank(attribution)) {
            return text;
        }
        return StringUtils.stripEnd(text, null) + " " + attribution.strip();
    }

    @Override
    public List<Anomaly> getAnomalies(Long userId, LocalDate startDate, LocalDate endDate, Boolean acknowledged,
                                      Integer limit) {
        if (limit == null || limit <= 0) {
            limit = DEFAULT_QUERY_LIMIT;
        }
        return anomalyMapper.selectByUser(userId, startDate, endDate, acknowledged, limit);
    }

    @Override
    public Anomaly acknowledgeAnomaly(Long userId, Long anomalyId) {
        Anomaly anomaly = anomalyMapper.selectById(userId, anomalyId);
        if (anomaly == null) {
            throw new IllegalArgumentException("异常记录不存在: " + anomalyId);
        }
        if (!Boolean.TRUE.equals(anomaly.getIsAcknowledged())) {
            anomalyMapper.acknowledge(userId, anomalyId);
            anomaly.setIsAcknowledged(true);
            log.info("用户{}确认异常: id={}, metric={}, date={}",
                    userId, anomalyId, anomaly.getMetricName(), anomaly.getRecordDate());
        }
        return anomaly;
    }

    @Override
    public AnomalySummaryVO getAnomalySummary(Long userId, Integer days) {
        if (days == null || days <= 0) days = DEFAULT_SUMMARY_DAYS;
        LocalDate startDate = LocalDate.now().minusDays(days - 1L);

        Map<String, Integer> bySeverity = toCounts(anomalyMapper.countBySeverity(userId, startDate), "severity");
        Map<String, Integer> byMetric = toCounts(anomalyMapper.countByMetric(userId, startDate), "metricName");
        int total = bySeverity.values().stream().mapToInt(Integer::intValue).sum();
        int unacknowledged = anomalyMapper.countUnacknowledged(userId, startDate);
        return new AnomalySummaryVO(total, unacknowledged, bySeverity, byMetric, days);
    }

    @Override
    public String buildInsightPayload(Long userId, Integer limit) {
        if (limit == null || limit <= 0) limit = DEFAULT_PAYLOAD_LIMIT;
        List<Anomaly> pending = new ArrayList<>(anomalyMapper.selectByUser(userId, null, null, false, limit));
        pending.sort(AnomalyEnsemble.RANKING);
        return insightPayloadManager.buildAnomalyPayload(userId, pending);
    }

    static Map<String, Integer> toCounts(List<Map<String, Object>> rows, String keyColumn) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object key = row.get(keyColumn);
            Object cnt = row.get("cnt");
            if (key == null || !(cnt instanceof Number)) {
                continue;
            }
            counts.put(key.toString(), ((Number) cnt).intValue());
        }
        return counts;
    }
}
