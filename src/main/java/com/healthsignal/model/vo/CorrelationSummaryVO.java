package com.healthsignal.model.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 相关性概览VO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationSummaryVO {
    private Integer total;

    private Integer significant;

    private Integer actionable;

    private Map<String, Integer> byType;

    private Map<String, Integer> byStrength;

    /**
     * 置信度最高的指标对
     */
    private List<TopPair> topPairs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopPair {
        private String metricA;

        private String metricB;

        private String correlationType;

        private Double correlationValue;

        private Double confidenceScore;

        private Integer lagDays;

        private String causalDirection;
    }
}
