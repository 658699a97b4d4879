package com.healthsignal.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * 异常检测请求DTO，未填写的字段使用 health.analysis.anomaly 默认值
 */
@Data
public class AnomalyDetectionDTO {

    /**
     * 分析天数
     */
    @Min(value = 14, message = "分析天数不能少于14天")
    @Max(value = 365, message = "分析天数不能超过365天")
    private Integer days;

    /**
     * 使用中位数/MAD 稳健基线
     */
    private Boolean useRobust;

    /**
     * 使用 EWMA 自适应基线
     */
    private Boolean useAdaptive;

    /**
     * 是否生成解释文案
     */
    private Boolean includeExplanation;

    /**
     * 多变量检测污染率，取值 (0,1)
     */
    private Double contamination;
}
