package com.healthsignal.service.impl;

import com.healthsignal.model.entity.Anomaly;
import com.healthsignal.model.enums.HealthMetric;
import com.healthsignal.service.AnomalyExplanationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * 基于模板的异常解释
 */
@Slf4j
@Service
public class RuleBasedAnomalyExplanationService implements AnomalyExplanationService {

    private static final Map<HealthMetric, String> LABELS = new EnumMap<>(HealthMetric.class);

    static {
        LABELS.put(HealthMetric.SLEEP_HOURS, "睡眠时长");
        LABELS.put(HealthMetric.SLEEP_QUALITY, "睡眠质量");
        LABELS.put(HealthMetric.AWAKENINGS, "夜间醒来次数");
        LABELS.put(HealthMetric.EXERCISE_MINUTES, "运动时长");
        LABELS.put(HealthMetric.EXERCISE_CALORIES, "运动消耗");
        LABELS.put(HealthMetric.EXERCISE_INTENSITY_AVG, "运动强度");
        LABELS.put(HealthMetric.TOTAL_CALORIES, "摄入热量");
        LABELS.put(HealthMetric.PROTEIN_G, "蛋白质摄入");
        LABELS.put(HealthMetric.CARBS_G, "碳水摄入");
        LABELS.put(HealthMetric.FATS_G, "脂肪摄入");
        LABELS.put(HealthMetric.SUGAR_G, "糖摄入");
        LABELS.put(HealthMetric.RESTING_HR, "静息心率");
        LABELS.put(HealthMetric.HRV_MS, "心率变异性");
        LABELS.put(HealthMetric.BP_SYSTOLIC, "收缩压");
        LABELS.put(HealthMetric.BP_DIASTOLIC, "舒张压");
        LABELS.put(HealthMetric.SPO2, "血氧");
        LABELS.put(HealthMetric.WEIGHT_KG, "体重");
        LABELS.put(HealthMetric.BODY_FAT_PCT, "体脂率");
        LABELS.put(HealthMetric.GLUCOSE_MGDL, "空腹血糖");
        LABELS.put(HealthMetric.GLUCOSE_POST_MEAL_MGDL, "餐后血糖");
        LABELS.put(HealthMetric.PROTEIN_RATIO, "蛋白质供能比");
        LABELS.put(HealthMetric.BP_MEAN, "平均动脉压");
        LABELS.put(HealthMetric.WEIGHT_CHANGE_7D, "7日体重变化");
        LABELS.put(HealthMetric.GLUCOSE_VARIABILITY, "血糖波动");
    }

    @Override
    public String explain(Anomaly anomaly) {
        if (anomaly.getMetricValue() == null || anomaly.getSeverity() == null) {
            return null;
        }
        String label = HealthMetric.fromKey(anomaly.getMetricName())
                .map(LABELS::get)
                .orElse(anomaly.getMetricName());
        String level = switch (anomaly.getSeverity()) {
            case HIGH -> "明显";
            case MEDIUM -> "较为";
            case LOW -> "轻微";
        };

        Double baseline = anomaly.getBaselineValue();
        if (baseline == null) {
            return String.format("%s 的%s为 %.1f，%s异常。", anomaly.getRecordDate(), label,
                    anomaly.getMetricValue(), level);
        }
        String direction = anomaly.getMetricValue() >= baseline ? "高于" : "低于";
        return String.format("%s 的%s为 %.1f，%s%s近期正常水平（约 %.1f）。", anomaly.getRecordDate(), label,
                anomaly.getMetricValue(), level, direction, baseline);
    }
}
