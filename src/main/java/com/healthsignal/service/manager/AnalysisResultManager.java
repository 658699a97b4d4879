package com.healthsignal.service.manager;

import com.healthsignal.mapper.AnomalyMapper;
import com.healthsignal.mapper.CorrelationMapper;
import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.entity.Correlation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 分析结果落库
 * 一次运行的结果在同一事务中写入，要么全部生效要么全部回滚
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisResultManager {

    private static final double SCORE_EPSILON = 1e-9;

    private final AnomalyMapper anomalyMapper;
    private final CorrelationMapper correlationMapper;

    /**
     * 写入结果：记录列表与新增条数
     */
    public record SaveOutcome<T>(List<T> records, int created, int updated) {
    }

    /**
     * 按 (用户, 日期, 指标) 去重写入：
     * 不存在则插入；存在且未确认、检测内容有变化则原地覆盖；内容相同或已确认则保持不变
     */
    @Transactional(rollbackFor = Exception.class)
    public SaveOutcome<Anomaly> saveAnomalies(Long userId, List<Anomaly> ranked) {
        List<Anomaly> saved = new ArrayList<>(ranked.size());
        int created = 0;
        int updated = 0;
        for (Anomaly anomaly : ranked) {
            Anomaly existing = anomalyMapper.selectByKey(userId, anomaly.getRecordDate(), anomaly.getMetricName());
            if (existing == null) {
                anomalyMapper.insert(anomaly);
                created++;
                saved.add(anomaly);
            } else if (Boolean.TRUE.equals(existing.getIsAcknowledged()) || sameDetection(existing, anomaly)) {
                saved.add(existing);
            } else {
                anomaly.setId(existing.getId());
                anomaly.setIsAcknowledged(false);
                anomalyMapper.updateDetection(anomaly);
                updated++;
                saved.add(anomaly);
            }
        }
        log.info("异常结果写入完成: userId={}, 新增={}, 覆盖={}, 未变={}",
                userId, created, updated, ranked.size() - created - updated);
        return new SaveOutcome<>(saved, created, updated);
    }

    /**
     * 按 (用户, 指标A, 指标B, 方法) 写入：新记录插入，已有记录只更新统计字段，保留洞察文本
     */
    @Transactional(rollbackFor = Exception.class)
    public SaveOutcome<Correlation> saveCorrelations(Long userId, List<Correlation> correlations) {
        List<Correlation> saved = new ArrayList<>(correlations.size());
        int created = 0;
        int updated = 0;
        for (Correlation correlation : correlations) {
            Correlation existing = correlationMapper.selectByKey(userId, correlation.getMetricA(),
                    correlation.getMetricB(), correlation.getCorrelationType());
            if (existing == null) {
                correlationMapper.insert(correlation);
                created++;
            } else {
                correlation.setId(existing.getId());
                correlation.setInsight(existing.getInsight());
                correlation.setRecommendation(existing.getRecommendation());
                correlationMapper.updateStatistics(correlation);
                updated++;
            }
            saved.add(correlation);
        }
        log.info("相关性结果写入完成: userId={}, 新增={}, 更新={}", userId, created, updated);
        return new SaveOutcome<>(saved, created, updated);
    }

    /**
     * 检测内容是否一致（不含解释文案与检测时间）
     */
    static boolean sameDetection(Anomaly existing, Anomaly fresh) {
        return existing.getDetectorType() == fresh.getDetectorType()
                && existing.getSeverity() == fresh.getSeverity()
                && Objects.equals(existing.getSourceTable(), fresh.getSourceTable())
                && closeEnough(existing.getMetricValue(), fresh.getMetricValue())
                && closeEnough(existing.getBaselineValue(), fresh.getBaselineValue())
                && closeEnough(existing.getAnomalyScore(), fresh.getAnomalyScore());
    }

    private static boolean closeEnough(Double a, Double b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        return Math.abs(a - b) <= SCORE_EPSILON * Math.max(1.0, Math.abs(a));
    }
}
