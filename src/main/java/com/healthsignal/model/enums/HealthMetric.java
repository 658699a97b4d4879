package com.healthsignal.model.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 每日特征矩阵中的指标目录
 * key 为对外使用的蛇形命名（存库、接口、相关性配对排序均使用 key）
 */
public enum HealthMetric {

    // ---------- 睡眠 ----------
    SLEEP_HOURS("sleep_hours", "sleep_entries", false, true, true),
    SLEEP_QUALITY("sleep_quality", "sleep_entries", false, true, true),
    AWAKENINGS("awakenings", "sleep_entries", false, true, true),

    // ---------- 运动 ----------
    EXERCISE_MINUTES("exercise_minutes", "exercise_entries", false, true, true),
    EXERCISE_CALORIES("exercise_calories", "exercise_entries", false, true, true),
    EXERCISE_INTENSITY_AVG("exercise_intensity_avg", "exercise_entries", false, true, true),

    // ---------- 饮食 ----------
    TOTAL_CALORIES("total_calories", "food_entries", false, true, true),
    PROTEIN_G("protein_g", "food_entries", false, true, true),
    CARBS_G("carbs_g", "food_entries", false, true, true),
    FATS_G("fats_g", "food_entries", false, true, true),
    SUGAR_G("sugar_g", "food_entries", false, true, true),

    // ---------- 生命体征 ----------
    RESTING_HR("resting_hr", "vital_signs", false, true, true),
    HRV_MS("hrv_ms", "vital_signs", false, true, true),
    BP_SYSTOLIC("bp_systolic", "vital_signs", false, true, true),
    BP_DIASTOLIC("bp_diastolic", "vital_signs", false, true, true),
    SPO2("spo2", "vital_signs", false, true, false),

    // ---------- 身体成分 ----------
    WEIGHT_KG("weight_kg", "body_metrics", false, true, true),
    BODY_FAT_PCT("body_fat_pct", "body_metrics", false, true, true),

    // ---------- 慢病 ----------
    GLUCOSE_MGDL("glucose_mgdl", "chronic_metrics", false, true, true),
    GLUCOSE_POST_MEAL_MGDL("glucose_post_meal_mgdl", "chronic_metrics", false, true, true),

    // ---------- 派生指标（第二遍计算） ----------
    PROTEIN_RATIO("protein_ratio", "food_entries", true, false, false),
    BP_MEAN("bp_mean", "vital_signs", true, false, false),
    WEIGHT_CHANGE_7D("weight_change_7d", "body_metrics", true, true, false),
    GLUCOSE_VARIABILITY("glucose_variability", "chronic_metrics", true, true, false),

    // ---------- 7日滚动趋势（派生） ----------
    SLEEP_HOURS_7D_AVG("sleep_hours_7d_avg", "sleep_entries", true, false, true, "sleep_hours"),
    SLEEP_HOURS_DEVIATION("sleep_hours_deviation", "sleep_entries", true, false, true, "sleep_hours"),
    TOTAL_CALORIES_7D_AVG("total_calories_7d_avg", "food_entries", true, false, true, "total_calories"),
    TOTAL_CALORIES_DEVIATION("total_calories_deviation", "food_entries", true, false, true, "total_calories"),
    RESTING_HR_7D_AVG("resting_hr_7d_avg", "vital_signs", true, false, true, "resting_hr"),
    RESTING_HR_DEVIATION("resting_hr_deviation", "vital_signs", true, false, true, "resting_hr"),
    EXERCISE_MINUTES_7D_AVG("exercise_minutes_7d_avg", "exercise_entries", true, false, true, "exercise_minutes"),
    EXERCISE_MINUTES_DEVIATION("exercise_minutes_deviation", "exercise_entries", true, false, true, "exercise_minutes");

    private final String key;
    private final String sourceTable;
    private final boolean derived;
    private final boolean anomalyEligible;
    private final boolean correlationEligible;

    /**
     * 滚动趋势指标所依据的原始指标 key；其他指标为 null
     */
    private final String rollingBaseKey;

    HealthMetric(String key, String sourceTable, boolean derived, boolean anomalyEligible,
                 boolean correlationEligible) {
        this(key, sourceTable, derived, anomalyEligible, correlationEligible, null);
    }

    HealthMetric(String key, String sourceTable, boolean derived, boolean anomalyEligible,
                 boolean correlationEligible, String rollingBaseKey) {
        this.key = key;
        this.sourceTable = sourceTable;
        this.derived = derived;
        this.anomalyEligible = anomalyEligible;
        this.correlationEligible = correlationEligible;
        this.rollingBaseKey = rollingBaseKey;
    }

    public String getKey() {
        return key;
    }

    public String getSourceTable() {
        return sourceTable;
    }

    public boolean isDerived() {
        return derived;
    }

    public boolean isAnomalyEligible() {
        return anomalyEligible;
    }

    public boolean isCorrelationEligible() {
        return correlationEligible;
    }

    /**
     * 指标的来源指标：滚动趋势指标返回其原始指标，其余返回自身
     */
    public HealthMetric root() {
        return rollingBaseKey == null ? this : fromKey(rollingBaseKey).orElse(this);
    }

    /**
     * 两个指标是否出自同一原始指标（如 sleep_hours 与 sleep_hours_7d_avg），这类配对不做相关性检验
     */
    public boolean sharesRootWith(HealthMetric other) {
        return root() == other.root();
    }

    public static Optional<HealthMetric> fromKey(String key) {
        return Arrays.stream(values())
                .filter(m -> m.key.equals(key))
                .findFirst();
    }

    public static List<HealthMetric> anomalyMetrics() {
        return Arrays.stream(values())
                .filter(HealthMetric::isAnomalyEligible)
                .collect(Collectors.toList());
    }

    /**
     * 相关性分析指标，按 key 字典序排列，保证配对时 metricA < metricB
     */
    public static List<HealthMetric> correlationMetrics() {
        return Arrays.stream(values())
                .filter(HealthMetric::isCorrelationEligible)
                .sorted((a, b) -> a.key.compareTo(b.key))
                .collect(Collectors.toList());
    }
}
