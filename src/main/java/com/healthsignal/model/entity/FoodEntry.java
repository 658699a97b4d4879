package com.healthsignal.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 饮食记录实体（一餐/一项食物一条）
 */
@Data
public class FoodEntry {
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
     * 餐次：breakfast/lunch/dinner/snack
     */
    private String mealType;

    /**
     * 食物名称
     */
    private String foodName;

    /**
     * 热量(kcal)
     */
    private BigDecimal calories;

    /**
     * 蛋白质(g)
     */
    private BigDecimal proteinG;

    /**
     * 碳水化合物(g)
     */
    private BigDecimal carbsG;

    /**
     * 脂肪(g)
     */
    private BigDecimal fatsG;

    /**
     * 糖(g)
     */
    private BigDecimal sugarG;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
