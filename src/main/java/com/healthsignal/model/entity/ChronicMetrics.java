package com.healthsignal.model.entity;

import com.healthsignal.model.enums.ChronicTimeOfDay;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 慢病指标记录实体（当前用于血糖）
 */
@Data
public class ChronicMetrics {
    /**
     * 主键
     */
    private Long id;

    /**
     * 用户ID
     */
    private Long userId;

    /**
     * 记录日期
     */
    private LocalDate recordDate;

    /**
     * 测量时机
     */
    private ChronicTimeOfDay timeOfDay;

    /**
     * 血糖(mg/dL)
     */
    private BigDecimal bloodGlucoseMgdl;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
