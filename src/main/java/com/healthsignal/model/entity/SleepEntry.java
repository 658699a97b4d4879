package com.healthsignal.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 睡眠记录实体
 */
@Data
public class SleepEntry {
    /**
     * 主键
     */
    private Long id;

    /**
     * 用户ID
     */
    private Long userId;

    /**
     * 记录日期（以醒来当天计）
     */
    private LocalDate recordDate;

    /**
     * 睡眠时长(小时)
     */
    private BigDecimal durationHours;

    /**
     * 睡眠质量评分 1-10
     */
    private Integer qualityScore;

    /**
     * 夜间醒来次数
     */
    private Integer awakenings;

    /**
     * 深睡时长(分钟)
     */
    private Integer deepSleepMinutes;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
