package com.healthsignal.controller;

import com.healthsignal.common.Result;
import com.healthsignal.model.dto.AnomalyDetectionDTO;
import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.vo.AnomalyDetectionVO;
import com.healthsignal.model.vo.AnomalySummaryVO;
import com.healthsignal.service.AnomalyDetectionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * 健康指标异常控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/anomalies")
public class AnomalyController {

    @Autowired
    private AnomalyDetectionService anomalyDetectionService;

    /**
     * 运行异常检测
     * POST /api/anomalies/{userId}/detect
     */
    @PostMapping("/{userId}/detect")
    public Result<AnomalyDetectionVO> detect(@PathVariable Long userId,
                                             @RequestBody(required = false) @Validated AnomalyDetectionDTO dto) {
        AnomalyDetectionVO result = anomalyDetectionService.detectAnomalies(userId, dto);
        if (Boolean.TRUE.equals(result.getNothingToAnalyze())) {
            return Result.success("分析窗口内暂无健康数据", result);
        }
        return Result.success(result);
    }

    /**
     * 查询异常
     * GET /api/anomalies/{userId}?startDate=2024-01-01&endDate=2024-01-31&acknowledged=false&limit=50
     */
    @GetMapping("/{userId}")
    public Result<List<Anomaly>> list(
            @PathVariable Long userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(required = false, defaultValue = "100") Integer limit) {
        return Result.success(anomalyDetectionService.getAnomalies(userId, startDate, endDate, acknowledged, limit));
    }

    /**
     * 异常概览
     * GET /api/anomalies/{userId}/summary?days=30
     */
    @GetMapping("/{userId}/summary")
    public Result<AnomalySummaryVO> summary(@PathVariable Long userId,
                                            @RequestParam(required = false, defaultValue = "30") Integer days) {
        return Result.success(anomalyDetectionService.getAnomalySummary(userId, days));
    }

    /**
     * 确认异常
     * PATCH /api/anomalies/{userId}/{anomalyId}/acknowledge
     */
    @PatchMapping("/{userId}/{anomalyId}/acknowledge")
    public Result<Anomaly> acknowledge(@PathVariable Long userId, @PathVariable Long anomalyId) {
        return Result.success("已确认", anomalyDetectionService.acknowledgeAnomaly(userId, anomalyId));
    }

    /**
     * 未确认异常的文本生成输入
     * GET /api/anomalies/{userId}/insight-payload?limit=20
     */
    @GetMapping("/{userId}/insight-payload")
    public Result<String> insightPayload(@PathVariable Long userId,
                                         @RequestParam(required = false, defaultValue = "20") Integer limit) {
        return Result.success(anomalyDetectionService.buildInsightPayload(userId, limit));
    }
}
