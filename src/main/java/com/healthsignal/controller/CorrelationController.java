package com.healthsignal.controller;

import com.healthsignal.common.Result;
import com.healthsignal.model.dto.CorrelationDetectionDTO;
import com.healthsignal.model.dto.CorrelationInsightDTO;
import com.healthsignal.model.entity.Correlation;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.vo.CorrelationDetectionVO;
import com.healthsignal.model.vo.CorrelationSummaryVO;
import com.healthsignal.service.CorrelationDetectionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 健康指标相关性控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/correlations")
public class CorrelationController {

    @Autowired
    private CorrelationDetectionService correlationDetectionService;

    /**
     * 运行相关性检测
     * POST /api/correlations/{userId}/detect
     */
    @PostMapping("/{userId}/detect")
    public Result<CorrelationDetectionVO> detect(@PathVariable Long userId,
                                                 @RequestBody(required = false) @Validated CorrelationDetectionDTO dto) {
        CorrelationDetectionVO result = correlationDetectionService.detectCorrelations(userId, dto);
        if (Boolean.TRUE.equals(result.getNothingToAnalyze())) {
            return Result.success("分析窗口内暂无健康数据", result);
        }
        return Result.success(result);
    }

    /**
     * 查询相关性
     * GET /api/correlations/{userId}?type=PEARSON&actionableOnly=false&limit=50
     */
    @GetMapping("/{userId}")
    public Result<List<Correlation>> list(@PathVariable Long userId,
                                          @RequestParam(required = false) CorrelationType type,
                                          @RequestParam(required = false, defaultValue = "false") boolean actionableOnly,
                                          @RequestParam(required = false, defaultValue = "50") Integer limit) {
        return Result.success(correlationDetectionService.getCorrelations(userId, type, actionableOnly, limit));
    }

    /**
     * 最值得关注的相关性
     * GET /api/correlations/{userId}/top?limit=5
     */
    @GetMapping("/{userId}/top")
    public Result<List<Correlation>> top(@PathVariable Long userId,
                                         @RequestParam(required = false, defaultValue = "5") Integer limit) {
        return Result.success(correlationDetectionService.getTopActionable(userId, limit));
    }

    /**
     * 相关性概览
     * GET /api/correlations/{userId}/summary
     */
    @GetMapping("/{userId}/summary")
    public Result<CorrelationSummaryVO> summary(@PathVariable Long userId) {
        return Result.success(correlationDetectionService.getCorrelationSummary(userId));
    }

    /**
     * 回写洞察与建议
     * PUT /api/correlations/{userId}/{correlationId}/insight
     */
    @PutMapping("/{userId}/{correlationId}/insight")
    public Result<Correlation> updateInsight(@PathVariable Long userId, @PathVariable Long correlationId,
                                             @RequestBody @Validated CorrelationInsightDTO dto) {
        Correlation updated = correlationDetectionService.updateCorrelationInsight(userId, correlationId,
                dto.getInsight(), dto.getRecommendation());
        return Result.success("更新成功", updated);
    }

    /**
     * 值得关注的相关性的文本生成输入
     * GET /api/correlations/{userId}/insight-payload?limit=5
     */
    @GetMapping("/{userId}/insight-payload")
    public Result<String> insightPayload(@PathVariable Long userId,
                                         @RequestParam(required = false, defaultValue = "5") Integer limit) {
        return Result.success(correlationDetectionService.buildInsightPayload(userId, limit));
    }
}
