package com.healthsignal.service.detector;

import com.healthsignal.exception.DegenerateScaleException;
import com.healthsignal.exception.InsufficientDataException;
import com.healthsignal.model.dto.analysis.AnomalyDetectionConfig;
import com.healthsignal.model.dto.analysis.Baseline;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.dto.analysis.ZScoreFlag;
import com.healthsignal.model.enums.HealthMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单变量 Z-score 检测
 * 每个评估日与其之前 baselineWindowDays 天的滚动基线比较，当天数据不参与自身基线。
 * |z| 超过指标阈值，或读数超出医学绝对范围，二者任一即判定为异常。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZScoreDetector {

    /**
     * 医学绝对范围 [lower, upper]，范围内的读数不会单独触发
     */
    record Range(double lower, double upper) {
        boolean contains(double value) {
            return value >= lower && value <= upper;
        }
    }

    private static final Map<HealthMetric, Range> MEDICAL_BOUNDS;

    static {
        Map<HealthMetric, Range> bounds = new EnumMap<>(HealthMetric.class);
        bounds.put(HealthMetric.GLUCOSE_MGDL, new Range(70, 140));
        bounds.put(HealthMetric.RESTING_HR, new Range(40, 100));
        bounds.put(HealthMetric.BP_SYSTOLIC, new Range(90, 140));
        bounds.put(HealthMetric.BP_DIASTOLIC, new Range(60, 90));
        bounds.put(HealthMetric.SPO2, new Range(94, 100));
        MEDICAL_BOUNDS = Collections.unmodifiableMap(bounds);
    }

    private final BaselineCalculator baselineCalculator;

    public List<ZScoreFlag> detect(FeatureMatrix matrix, AnomalyDetectionConfig config) {
        List<ZScoreFlag> flags = new ArrayList<>();
        for (HealthMetric metric : HealthMetric.anomalyMetrics()) {
            try {
                flags.addAll(detectMetric(matrix, metric, config));
            } catch (InsufficientDataException e) {
                log.debug("跳过指标 {}: {}", metric.getKey(), e.getMessage());
            }
        }
        log.debug("Z-score 检测完成: userId={}, 命中={}", matrix.getUserId(), flags.size());
        return flags;
    }

    List<ZScoreFlag> detectMetric(FeatureMatrix matrix, HealthMetric metric, AnomalyDetectionConfig config) {
        Double[] column = matrix.column(metric);
        int observed = matrix.observedCount(metric);
        // 至少要有一个完整基线再加一个评估日
        if (observed <= config.getMinObservations()) {
            throw new InsufficientDataException(metric.getKey(), observed, config.getMinObservations() + 1);
        }

        double threshold = config.thresholdFor(metric);
        List<ZScoreFlag> flags = new ArrayList<>();
        int insufficient = 0;
        int degenerate = 0;
        for (int i = 0; i < column.length; i++) {
            if (column[i] == null) {
                continue;
            }
            List<Double> window = trailingWindow(column, i, config.getBaselineWindowDays());
            Baseline baseline;
            try {
                baseline = baselineCalculator.compute(metric, window, config);
            } catch (InsufficientDataException e) {
                insufficient++;
                continue;
            } catch (DegenerateScaleException e) {
                degenerate++;
                continue;
            }
            evaluate(matrix.dateAt(i), metric, column[i], baseline, threshold).ifPresent(flags::add);
        }

        if (insufficient > 0 || degenerate > 0) {
            log.debug("指标 {} 有 {} 天基线观测不足、{} 天离散度退化，已跳过", metric.getKey(), insufficient, degenerate);
        }
        return flags;
    }

    /**
     * 评估单个读数；z 非有限值时不产生检测
     */
    public static Optional<ZScoreFlag> evaluate(LocalDate date, HealthMetric metric, double value,
                                                Baseline baseline, double threshold) {
        double z = baseline.zScore(value);
        if (!Double.isFinite(z)) {
            return Optional.empty();
        }
        boolean boundViolation = violatesBounds(metric, value);
        if (Math.abs(z) <= threshold && !boundViolation) {
            return Optional.empty();
        }
        double score = Math.max(0.0, Math.min(Math.abs(z) / threshold, 1.0));
        return Optional.of(new ZScoreFlag(date, metric, value, baseline, z, threshold, boundViolation, score));
    }

    public static boolean violatesBounds(HealthMetric metric, double value) {
        Range range = MEDICAL_BOUNDS.get(metric);
        return range != null && !range.contains(value);
    }

    public static Optional<double[]> boundsOf(HealthMetric metric) {
        Range range = MEDICAL_BOUNDS.get(metric);
        return range == null ? Optional.empty() : Optional.of(new double[]{range.lower(), range.upper()});
    }

    /**
     * 取 index 之前 windowDays 天内的非空值，不含 index 当天
     */
    static List<Double> trailingWindow(Double[] column, int index, int windowDays) {
        List<Double> window = new ArrayList<>(windowDays);
        for (int j = Math.max(0, index - windowDays); j < index; j++) {
            if (column[j] != null) {
                window.add(column[j]);
            }
        }
        return window;
    }
}
