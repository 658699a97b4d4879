package com.healthsignal.model.entity;

import com.healthsignal.model.enums.ExerciseIntensity;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 运动记录实体
 */
@Data
public class ExerciseEntry {
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
     * 运动名称
     */
    private String exerciseName;

    /**
     * 运动时长(分钟)
     */
    private Integer durationMinutes;

    /**
     * 运动强度
     */
    private ExerciseIntensity intensity;

    /**
     * 消耗热量(kcal)
     */
    private BigDecimal caloriesBurned;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
