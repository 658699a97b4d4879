package com.healthsignal.service;

import com.healthsignal.model.dto.AnomalyDetectionDTO;
import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.vo.AnomalyDetectionVO;
import com.healthsignal.model.vo.AnomalySummaryVO;

import java.time.LocalDate;
import java.util.List;

/**
 * 健康指标异常检测服务
 */
public interface AnomalyDetectionService {

    /**
     * 对截至今天的分析窗口运行一次异常检测并落库
     *
     * @param userId  用户ID
     * @param request 检测参数（可为空，为空时使用默认配置）
     * @return 本次检测结果，窗口内无数据时 nothingToAnalyze 为 true
     */
    AnomalyDetectionVO detectAnomalies(Long userId, AnomalyDetectionDTO request);

    /**
     * 查询已保存的异常，按日期倒序
     *
     * @param acknowledged 为 null 时不过滤确认状态
     */
    List<Anomaly> getAnomalies(Long userId, LocalDate startDate, LocalDate endDate, Boolean acknowledged,
                               Integer limit);

    /**
     * 确认异常；记录不存在或不属于该用户时抛出 IllegalArgumentException
     */
    Anomaly acknowledgeAnomaly(Long userId, Long anomalyId);

    AnomalySummaryVO getAnomalySummary(Long userId, Integer days);

    /**
     * 最近未确认异常的协作方载荷（JSON）
     */
    String buildInsightPayload(Long userId, Integer limit);
}
