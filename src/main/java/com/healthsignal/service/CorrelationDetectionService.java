package com.healthsignal.service;

import com.healthsignal.model.dto.CorrelationDetectionDTO;
import com.healthsignal.model.entity.Correlation;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.vo.CorrelationDetectionVO;
import com.healthsignal.model.vo.CorrelationSummaryVO;

import java.util.List;

/**
 * 健康指标相关性检测服务
 */
public interface CorrelationDetectionService {

    /**
     * 对截至今天的分析窗口运行一次相关性检测并落库
     *
     * @param userId  用户ID
     * @param request 检测参数（可为空）
     * @return 本次检测结果，按置信度倒序
     */
    CorrelationDetectionVO detectCorrelations(Long userId, CorrelationDetectionDTO request);

    /**
     * 查询已保存的相关性，按置信度倒序
     *
     * @param type 为 null 时返回所有方法的结果
     */
    List<Correlation> getCorrelations(Long userId, CorrelationType type, boolean actionableOnly, Integer limit);

    List<Correlation> getTopActionable(Long userId, Integer limit);

    CorrelationSummaryVO getCorrelationSummary(Long userId);

    /**
     * 外部文本生成服务回写洞察与建议
     */
    Correlation updateCorrelationInsight(Long userId, Long correlationId, String insight, String recommendation);

    /**
     * 值得关注的相关性的协作方载荷（JSON）
     */
    String buildInsightPayload(Long userId, Integer limit);
}
