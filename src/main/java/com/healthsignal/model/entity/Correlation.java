package com.healthsignal.model.entity;

import com.healthsignal.model.enums.CausalDirection;
import com.healthsignal.model.enums.CorrelationStrength;
import com.healthsignal.model.enums.CorrelationType;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 指标相关性结果实体
 * 每个 (userId, metricA, metricB, correlationType) 一条，metricA 字典序小于 metricB
 */
@Data
public class Correlation {
    /**
     * 主键
     */
    private Long id;

    /**
     * 用户ID
     */
    private Long userId;

    /**
     * 指标A
     */
    private String metricA;

    /**
     * 指标B
     */
    private String metricB;

    /**
     * 检测方法
     */
    private CorrelationType correlationType;

    /**
     * 相关值：[-1,1]，互信息为 [0,1] 的信息相关系数
     */
    private Double correlationValue;

    /**
     * 显著性 p 值
     */
    private Double testPValue;

    /**
     * 滞后天数
     */
    private Integer lagDays;

    /**
     * 因果方向
     */
    private CausalDirection causalDirection;

    /**
     * Granger F 统计量
     */
    private Double grangerFStat;

    /**
     * 强度分档
     */
    private CorrelationStrength strength;

    /**
     * 置信度 [0,1]
     */
    private Double confidenceScore;

    /**
     * 是否显著
     */
    private Boolean isSignificant;

    /**
     * 是否值得给出建议
     */
    private Boolean isActionable;

    /**
     * 有效样本数
     */
    private Integer sampleSize;

    /**
     * 分析区间开始
     */
    private LocalDate periodStart;

    /**
     * 分析区间结束
     */
    private LocalDate periodEnd;

    /**
     * 人群平均相关值
     */
    private Double populationAvg;

    /**
     * 相对人群的百分位
     */
    private Double percentileRank;

    /**
     * 洞察文案（由外部文本生成服务回写）
     */
    private String insight;

    /**
     * 建议文案（由外部文本生成服务回写）
     */
    private String recommendation;

    /**
     * 检测时间
     */
    private LocalDateTime detectedAt;
}
