package com.healthsignal.service.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.entity.Correlation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 文本生成协作方的输入载荷
 * 职责：把排序后的异常、相关性结果渲染成结构化 JSON，交给外部文本生成服务产出解释与建议。
 * 本模块不调用任何大模型，生成的 insight / recommendation 通过回写接口落库。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InsightPayloadManager {

    private final ObjectMapper objectMapper;

    // ================= 输入协议说明 =================

    private static final String INSTRUCTION_TEMPLATE = """
            你是一名健康数据分析助手。

            【输入协议】
            系统将提供一个 JSON 数据包，包含以下字段：
            1. "userId": 用户标识。
            2. "kind": "anomalies" 或 "correlations"。
            3. "items": 已按优先级排序的检测结果，字段含义见各条目。

            【核心原则】
            1. 只能解释数据包中的事实，不得编造数值或新的指标关系。
            2. 相关性不等于因果，causalDirection 为 none 时不得使用因果措辞。
            3. isAcknowledged 为 true 的异常无需再次提醒。

            【输出格式】
            请仅输出 JSON 数组，每个元素包含 "id"、"insight"、"recommendation" 三个字段。
            """;

    public String buildInstruction() {
        return INSTRUCTION_TEMPLATE;
    }

    /**
     * 异常列表载荷
     */
    public String buildAnomalyPayload(Long userId, List<Anomaly> anomalies) {
        List<Map<String, Object>> items = anomalies.stream().map(a -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", a.getId());
            item.put("date", a.getRecordDate() == null ? null : a.getRecordDate().toString());
            item.put("metric", a.getMetricName());
            item.put("value", a.getMetricValue());
            item.put("baseline", a.getBaselineValue());
            item.put("detector", a.getDetectorType() == null ? null : a.getDetectorType().getCode());
            item.put("severity", a.getSeverity() == null ? null : a.getSeverity().name().toLowerCase());
            item.put("score", a.getAnomalyScore());
            if (StringUtils.isNotBlank(a.getExplanation())) {
                item.put("explanation", a.getExplanation());
            }
            item.put("isAcknowledged", Boolean.TRUE.equals(a.getIsAcknowledged()));
            return item;
        }).collect(Collectors.toList());
        return render(userId, "anomalies", items);
    }

    /**
     * 相关性列表载荷
     */
    public String buildCorrelationPayload(Long userId, List<Correlation> correlations) {
        List<Map<String, Object>> items = correlations.stream().map(c -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", c.getId());
            item.put("metricA", c.getMetricA());
            item.put("metricB", c.getMetricB());
            item.put("method", c.getCorrelationType() == null ? null : c.getCorrelationType().getCode());
            item.put("value", c.getCorrelationValue());
            item.put("pValue", c.getTestPValue());
            item.put("lagDays", c.getLagDays());
            item.put("causalDirection", c.getCausalDirection() == null ? null
                    : c.getCausalDirection().name().toLowerCase());
            item.put("strength", c.getStrength() == null ? null : c.getStrength().name().toLowerCase());
            item.put("confidence", c.getConfidenceScore());
            item.put("populationAvg", c.getPopulationAvg());
            item.put("percentileRank", c.getPercentileRank());
            item.put("isActionable", Boolean.TRUE.equals(c.getIsActionable()));
            return item;
        }).collect(Collectors.toList());
        return render(userId, "correlations", items);
    }

    private String render(Long userId, String kind, List<Map<String, Object>> items) {
        try {
            Map<String, Object> root = new HashMap<>();
            root.put("userId", userId);
            root.put("kind", kind);
            root.put("items", items);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            log.error("协作方载荷 JSON 序列化失败: userId={}, kind={}", userId, kind, e);
            throw new IllegalStateException("结果载荷生成失败", e);
        }
    }
}
