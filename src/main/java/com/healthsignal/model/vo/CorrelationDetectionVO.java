package com.healthsignal.model.vo;

import com.healthsignal.model.entity.Correlation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 相关性检测运行结果VO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationDetectionVO {
    private Integer totalCorrelations;

    private Integer significantCorrelations;

    private Integer actionableCount;

    /**
     * 本次新写入的相关性数
     */
    private Integer newCorrelations;

    /**
     * 按检测方法计数（key 为方法 code）
     */
    private Map<String, Integer> byType;

    /**
     * 按强度计数
     */
    private Map<String, Integer> byStrength;

    private Boolean nothingToAnalyze;

    private LocalDate periodStart;

    private LocalDate periodEnd;

    /**
     * 按置信度倒序
     */
    private List<Correlation> correlations;

    public static CorrelationDetectionVO nothingToAnalyze(LocalDate periodStart, LocalDate periodEnd) {
        return new CorrelationDetectionVO(0, 0, 0, 0, Collections.emptyMap(), Collections.emptyMap(),
                true, periodStart, periodEnd, Collections.emptyList());
    }
}
