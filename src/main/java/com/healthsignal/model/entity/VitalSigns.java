package com.healthsignal.model.entity;

import com.healthsignal.model.enums.TimeOfDay;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 生命体征记录实体
 */
@Data
public class VitalSigns {
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
     * 测量时段
     */
    private TimeOfDay timeOfDay;

    /**
     * 静息心率(bpm)
     */
    private Integer restingHeartRate;

    /**
     * 心率变异性(ms)
     */
    private Integer hrvMs;

    /**
     * 收缩压(mmHg)
     */
    private Integer bloodPressureSystolic;

    /**
     * 舒张压(mmHg)
     */
    private Integer bloodPressureDiastolic;

    /**
     * 血氧饱和度(%)
     */
    private Integer spo2;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
