package com.healthsignal.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * 相关性检测请求DTO，未填写的字段使用 health.analysis.correlation 默认值
 */
@Data
public class CorrelationDetectionDTO {

    /**
     * 分析天数
     */
    @Min(value = 20, message = "分析天数不能少于20天")
    @Max(value = 365, message = "分析天数不能超过365天")
    private Integer days;

    private Boolean includePearson;

    private Boolean includeGranger;

    private Boolean includeCrossCorrelation;

    private Boolean includeMutualInfo;

    /**
     * 是否与人群基线比较
     */
    private Boolean includePopulationComparison;

    /**
     * 最低置信度，低于该值的结果不保存
     */
    private Double minConfidence;

    /**
     * Granger 检验最大滞后天数
     */
    private Integer maxLag;
}
