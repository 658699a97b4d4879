package com.healthsignal.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 相关性洞察回写DTO（外部文本生成服务调用）
 */
@Data
public class CorrelationInsightDTO {

    @NotBlank(message = "洞察内容不能为空")
    @Size(max = 1000, message = "洞察内容不能超过1000字")
    private String insight;

    @Size(max = 500, message = "建议内容不能超过500字")
    private String recommendation;
}
