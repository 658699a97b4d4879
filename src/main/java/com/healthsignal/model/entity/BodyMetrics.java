package com.healthsignal.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 身体成分记录实体
 */
@Data
public class BodyMetrics {
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
     * 体重(kg)
     */
    private BigDecimal weightKg;

    /**
     * 体脂率(%)
     */
    private BigDecimal bodyFatPct;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
