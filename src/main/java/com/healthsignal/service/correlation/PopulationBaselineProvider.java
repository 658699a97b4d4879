package com.healthsignal.service.correlation;

import com.healthsignal.mapper.PopulationCorrelationMapper;
import com.healthsignal.model.dto.analysis.CorrelationDetectionConfig;
import com.healthsignal.model.dto.analysis.PopulationReference;
import com.healthsignal.model.entity.PopulationCorrelationStat;
import com.healthsignal.model.enums.CorrelationType;
import com.healthsignal.model.enums.HealthMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 人群相关性参考分布
 * 统计表中参与用户数不足时，退回到常见指标对的经验默认值，再退回到中性分布 (0, 0.25)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PopulationBaselineProvider {

    static final PopulationReference NEUTRAL = new PopulationReference(0.0, 0.25, 0, true);

    /**
     * 经验默认值，键为按 key 字典序排列的指标对
     */
    private static final Map<String, double[]> DEFAULT_BASELINES;

    static {
        Map<String, double[]> defaults = new HashMap<>();
        defaults.put(pairKey(HealthMetric.EXERCISE_MINUTES, HealthMetric.SLEEP_QUALITY), new double[]{0.35, 0.15});
        defaults.put(pairKey(HealthMetric.EXERCISE_MINUTES, HealthMetric.RESTING_HR), new double[]{-0.25, 0.12});
        defaults.put(pairKey(HealthMetric.TOTAL_CALORIES, HealthMetric.WEIGHT_KG), new double[]{0.20, 0.18});
        defaults.put(pairKey(HealthMetric.HRV_MS, HealthMetric.SLEEP_HOURS), new double[]{0.30, 0.14});
        defaults.put(pairKey(HealthMetric.SLEEP_QUALITY, HealthMetric.SUGAR_G), new double[]{-0.18, 0.10});
        defaults.put(pairKey(HealthMetric.RESTING_HR, HealthMetric.SLEEP_QUALITY), new double[]{-0.22, 0.11});
        defaults.put(pairKey(HealthMetric.EXERCISE_MINUTES, HealthMetric.HRV_MS), new double[]{0.28, 0.13});
        defaults.put(pairKey(HealthMetric.CARBS_G, HealthMetric.GLUCOSE_MGDL), new double[]{0.25, 0.15});
        DEFAULT_BASELINES = Collections.unmodifiableMap(defaults);
    }

    private final PopulationCorrelationMapper populationCorrelationMapper;

    public PopulationReference referenceFor(HealthMetric metricA, HealthMetric metricB, CorrelationType type,
                                            CorrelationDetectionConfig config) {
        PopulationCorrelationStat stat = populationCorrelationMapper.selectByPair(
                metricA.getKey(), metricB.getKey(), type);
        if (stat != null && stat.getUserCount() != null && stat.getUserCount() >= config.getMinPopulationUsers()
                && stat.getMeanCorrelation() != null && stat.getStdCorrelation() != null
                && stat.getStdCorrelation() > 0) {
            return new PopulationReference(stat.getMeanCorrelation(), stat.getStdCorrelation(),
                    stat.getUserCount(), false);
        }

        double[] fallback = DEFAULT_BASELINES.get(pairKey(metricA, metricB));
        if (fallback == null) {
            return NEUTRAL;
        }
        // 互信息系数无符号，取经验均值的绝对值
        double mean = type.isSigned() ? fallback[0] : Math.abs(fallback[0]);
        return new PopulationReference(mean, fallback[1], 0, true);
    }

    private static String pairKey(HealthMetric a, HealthMetric b) {
        return a.getKey().compareTo(b.getKey()) <= 0
                ? a.getKey() + "|" + b.getKey()
                : b.getKey() + "|" + a.getKey();
    }
}
