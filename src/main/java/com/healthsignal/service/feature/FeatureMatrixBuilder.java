package com.healthsignal.service.feature;

import com.healthsignal.exception.InvalidConfigurationException;
import com.healthsignal.mapper.BodyMetricsMapper;
import com.healthsignal.mapper.ChronicMetricsMapper;
import com.healthsignal.mapper.ExerciseEntryMapper;
import com.healthsignal.mapper.FoodEntryMapper;
import com.healthsignal.mapper.SleepEntryMapper;
import com.healthsignal.mapper.VitalSignsMapper;
import com.healthsignal.model.dto.analysis.DailyFeatureVector;
import com.healthsignal.model.dto.analysis.FeatureMatrix;
import com.healthsignal.model.entity.BodyMetrics;
import com.healthsignal.model.entity.ChronicMetrics;
import com.healthsignal.model.entity.ExerciseEntry;
import com.healthsignal.model.entity.FoodEntry;
import com.healthsignal.model.entity.SleepEntry;
import com.healthsignal.model.entity.VitalSigns;
import com.healthsignal.model.enums.ChronicTimeOfDay;
import com.healthsignal.model.enums.HealthMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 特征矩阵构建器
 * 把六张来源表的原始记录按天归约成一行数值指标，窗口内每天一行，
 * 无任何记录的日期保留为全空行。派生指标在第一遍归约完成后再计算。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureMatrixBuilder {

    /**
     * 7日体重变化取 [d-10, d-7] 内最近一次称重作为参照
     */
    private static final int WEIGHT_REFERENCE_MIN_DAYS = 7;
    private static final int WEIGHT_REFERENCE_MAX_DAYS = 10;

    private static final int GLUCOSE_VARIABILITY_DAYS = 7;
    private static final int GLUCOSE_VARIABILITY_MIN_READINGS = 3;

    /**
     * 7日滚动均值与当日偏离：原始指标 -> (均值指标, 偏离指标)
     */
    static final int ROLLING_DAYS = 7;
    private static final Map<HealthMetric, HealthMetric[]> ROLLING_FEATURES = new EnumMap<>(HealthMetric.class);

    static {
        ROLLING_FEATURES.put(HealthMetric.SLEEP_HOURS,
                new HealthMetric[]{HealthMetric.SLEEP_HOURS_7D_AVG, HealthMetric.SLEEP_HOURS_DEVIATION});
        ROLLING_FEATURES.put(HealthMetric.TOTAL_CALORIES,
                new HealthMetric[]{HealthMetric.TOTAL_CALORIES_7D_AVG, HealthMetric.TOTAL_CALORIES_DEVIATION});
        ROLLING_FEATURES.put(HealthMetric.RESTING_HR,
                new HealthMetric[]{HealthMetric.RESTING_HR_7D_AVG, HealthMetric.RESTING_HR_DEVIATION});
        ROLLING_FEATURES.put(HealthMetric.EXERCISE_MINUTES,
                new HealthMetric[]{HealthMetric.EXERCISE_MINUTES_7D_AVG, HealthMetric.EXERCISE_MINUTES_DEVIATION});
    }

    private static final Comparator<VitalSigns> VITALS_ORDER = Comparator
            .comparing(VitalSigns::getTimeOfDay, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(VitalSigns::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(VitalSigns::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<ChronicMetrics> CHRONIC_ORDER = Comparator
            .comparing(ChronicMetrics::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ChronicMetrics::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final SleepEntryMapper sleepEntryMapper;
    private final ExerciseEntryMapper exerciseEntryMapper;
    private final FoodEntryMapper foodEntryMapper;
    private final VitalSignsMapper vitalSignsMapper;
    private final BodyMetricsMapper bodyMetricsMapper;
    private final ChronicMetricsMapper chronicMetricsMapper;

    /**
     * 构建 [endDate-(days-1), endDate] 的特征矩阵
     */
    public FeatureMatrix build(Long userId, LocalDate endDate, int days) {
        if (days <= 0) {
            throw new InvalidConfigurationException("分析天数必须为正数: " + days);
        }
        LocalDate startDate = endDate.minusDays(days - 1L);
        // 派生指标需要窗口之前的体重与血糖读数
        LocalDate fetchStart = startDate.minusDays(WEIGHT_REFERENCE_MAX_DAYS);

        // 1. 读取快照
        Map<LocalDate, List<SleepEntry>> sleep = groupByDate(
                sleepEntryMapper.selectByUserIdAndDateRange(userId, fetchStart, endDate), SleepEntry::getRecordDate);
        Map<LocalDate, List<ExerciseEntry>> exercise = groupByDate(
                exerciseEntryMapper.selectByUserIdAndDateRange(userId, fetchStart, endDate), ExerciseEntry::getRecordDate);
        Map<LocalDate, List<FoodEntry>> food = groupByDate(
                foodEntryMapper.selectByUserIdAndDateRange(userId, fetchStart, endDate), FoodEntry::getRecordDate);
        Map<LocalDate, List<VitalSigns>> vitals = groupByDate(
                vitalSignsMapper.selectByUserIdAndDateRange(userId, fetchStart, endDate), VitalSigns::getRecordDate);
        Map<LocalDate, List<BodyMetrics>> body = groupByDate(
                bodyMetricsMapper.selectByUserIdAndDateRange(userId, fetchStart, endDate), BodyMetrics::getRecordDate);
        Map<LocalDate, List<ChronicMetrics>> chronic = groupByDate(
                chronicMetricsMapper.selectByUserIdAndDateRange(userId, fetchStart, endDate), ChronicMetrics::getRecordDate);

        // 2. 第一遍：逐日归约原始指标（含窗口前的预读日期）
        TreeMap<LocalDate, Map<HealthMetric, Double>> primary = new TreeMap<>();
        for (LocalDate date = fetchStart; !date.isAfter(endDate); date = date.plusDays(1)) {
            Map<HealthMetric, Double> values = new EnumMap<>(HealthMetric.class);
            reduceSleep(sleep.getOrDefault(date, Collections.emptyList()), values);
            reduceExercise(exercise.getOrDefault(date, Collections.emptyList()), values);
            reduceFood(food.getOrDefault(date, Collections.emptyList()), values);
            reduceVitals(vitals.getOrDefault(date, Collections.emptyList()), values);
            reduceBody(body.getOrDefault(date, Collections.emptyList()), values);
            reduceChronic(chronic.getOrDefault(date, Collections.emptyList()), values);
            primary.put(date, values);
        }

        // 3. 第二遍：派生指标，只输出窗口内的行
        List<DailyFeatureVector> rows = new ArrayList<>(days);
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            Map<HealthMetric, Double> values = primary.get(date);
            Map<HealthMetric, Double> derived = derive(date, values, primary, startDate);
            rows.add(DailyFeatureVector.of(userId, date, values).with(derived));
        }

        FeatureMatrix matrix = new FeatureMatrix(userId, startDate, endDate, rows);
        if (log.isDebugEnabled()) {
            long observedDays = rows.stream().filter(r -> !r.isEmpty()).count();
            log.debug("特征矩阵构建完成: userId={}, 区间={}~{}, 有数据天数={}/{}",
                    userId, startDate, endDate, observedDays, rows.size());
        }
        return matrix;
    }

    // ================== 第一遍：来源表归约 ==================

    /**
     * 睡眠时长求和（午睡累加），质量按时长加权平均，醒来次数求和
     */
    void reduceSleep(List<SleepEntry> entries, Map<HealthMetric, Double> values) {
        if (entries.isEmpty()) {
            return;
        }
        putIfPresent(values, HealthMetric.SLEEP_HOURS, sum(entries, SleepEntry::getDurationHours));
        putIfPresent(values, HealthMetric.AWAKENINGS, sumInts(entries, SleepEntry::getAwakenings));

        double weightedQuality = 0;
        double totalWeight = 0;
        List<Double> plainQuality = new ArrayList<>();
        for (SleepEntry entry : entries) {
            if (entry.getQualityScore() == null) {
                continue;
            }
            plainQuality.add(entry.getQualityScore().doubleValue());
            if (entry.getDurationHours() != null && entry.getDurationHours().signum() > 0) {
                double hours = entry.getDurationHours().doubleValue();
                weightedQuality += entry.getQualityScore() * hours;
                totalWeight += hours;
            }
        }
        if (totalWeight > 0) {
            values.put(HealthMetric.SLEEP_QUALITY, weightedQuality / totalWeight);
        } else if (!plainQuality.isEmpty()) {
            // 没有可用时长时退化为算术平均
            values.put(HealthMetric.SLEEP_QUALITY, mean(plainQuality));
        }
    }

    void reduceExercise(List<ExerciseEntry> entries, Map<HealthMetric, Double> values) {
        if (entries.isEmpty()) {
            return;
        }
        putIfPresent(values, HealthMetric.EXERCISE_MINUTES, sumInts(entries, ExerciseEntry::getDurationMinutes));
        putIfPresent(values, HealthMetric.EXERCISE_CALORIES, sum(entries, ExerciseEntry::getCaloriesBurned));

        List<Double> intensities = entries.stream()
                .map(ExerciseEntry::getIntensity)
                .filter(Objects::nonNull)
                .map(i -> (double) i.getScore())
                .collect(Collectors.toList());
        if (!intensities.isEmpty()) {
            values.put(HealthMetric.EXERCISE_INTENSITY_AVG, mean(intensities));
        }
    }

    void reduceFood(List<FoodEntry> entries, Map<HealthMetric, Double> values) {
        if (entries.isEmpty()) {
            return;
        }
        putIfPresent(values, HealthMetric.TOTAL_CALORIES, sum(entries, FoodEntry::getCalories));
        putIfPresent(values, HealthMetric.PROTEIN_G, sum(entries, FoodEntry::getProteinG));
        putIfPresent(values, HealthMetric.CARBS_G, sum(entries, FoodEntry::getCarbsG));
        putIfPresent(values, HealthMetric.FATS_G, sum(entries, FoodEntry::getFatsG));
        putIfPresent(values, HealthMetric.SUGAR_G, sum(entries, FoodEntry::getSugarG));
    }

    /**
     * 生命体征为点测量，每个指标取当天按时段、录入时间排序后的第一条读数
     */
    void reduceVitals(List<VitalSigns> entries, Map<HealthMetric, Double> values) {
        if (entries.isEmpty()) {
            return;
        }
        List<VitalSigns> ordered = new ArrayList<>(entries);
        ordered.sort(VITALS_ORDER);
        putIfPresent(values, HealthMetric.RESTING_HR, first(ordered, VitalSigns::getRestingHeartRate));
        putIfPresent(values, HealthMetric.HRV_MS, first(ordered, VitalSigns::getHrvMs));
        putIfPresent(values, HealthMetric.BP_SYSTOLIC, first(ordered, VitalSigns::getBloodPressureSystolic));
        putIfPresent(values, HealthMetric.BP_DIASTOLIC, first(ordered, VitalSigns::getBloodPressureDiastolic));
        putIfPresent(values, HealthMetric.SPO2, first(ordered, VitalSigns::getSpo2));
    }

    void reduceBody(List<BodyMetrics> entries, Map<HealthMetric, Double> values) {
        if (entries.isEmpty()) {
            return;
        }
        putIfPresent(values, HealthMetric.WEIGHT_KG, meanOf(entries, BodyMetrics::getWeightKg));
        putIfPresent(values, HealthMetric.BODY_FAT_PCT, meanOf(entries, BodyMetrics::getBodyFatPct));
    }

    /**
     * 血糖优先取空腹读数，没有空腹读数时取全天均值；餐后血糖取当天第一条餐后读数
     */
    void reduceChronic(List<ChronicMetrics> entries, Map<HealthMetric, Double> values) {
        List<ChronicMetrics> readings = entries.stream()
                .filter(e -> e.getBloodGlucoseMgdl() != null)
                .sorted(CHRONIC_ORDER)
                .collect(Collectors.toList());
        if (readings.isEmpty()) {
            return;
        }
        Double fasting = readings.stream()
                .filter(e -> e.getTimeOfDay() == ChronicTimeOfDay.FASTING)
                .map(e -> e.getBloodGlucoseMgdl().doubleValue())
                .findFirst()
                .orElse(null);
        values.put(HealthMetric.GLUCOSE_MGDL,
                fasting != null ? fasting : meanOf(readings, ChronicMetrics::getBloodGlucoseMgdl));

        readings.stream()
                .filter(e -> e.getTimeOfDay() == ChronicTimeOfDay.POST_MEAL)
                .findFirst()
                .ifPresent(e -> values.put(HealthMetric.GLUCOSE_POST_MEAL_MGDL, e.getBloodGlucoseMgdl().doubleValue()));
    }

    // ================== 第二遍：派生指标 ==================

    Map<HealthMetric, Double> derive(LocalDate date, Map<HealthMetric, Double> values,
                                     TreeMap<LocalDate, Map<HealthMetric, Double>> primary, LocalDate startDate) {
        Map<HealthMetric, Double> derived = new EnumMap<>(HealthMetric.class);

        Double calories = values.get(HealthMetric.TOTAL_CALORIES);
        Double protein = values.get(HealthMetric.PROTEIN_G);
        if (calories != null && protein != null && calories > 0) {
            derived.put(HealthMetric.PROTEIN_RATIO, protein * 4 / calories);
        }

        Double systolic = values.get(HealthMetric.BP_SYSTOLIC);
        Double diastolic = values.get(HealthMetric.BP_DIASTOLIC);
        if (systolic != null && diastolic != null) {
            derived.put(HealthMetric.BP_MEAN, (systolic + 2 * diastolic) / 3);
        }

        Double weight = values.get(HealthMetric.WEIGHT_KG);
        if (weight != null) {
            Double reference = latestIn(primary, HealthMetric.WEIGHT_KG,
                    date.minusDays(WEIGHT_REFERENCE_MAX_DAYS), date.minusDays(WEIGHT_REFERENCE_MIN_DAYS));
            if (reference != null) {
                derived.put(HealthMetric.WEIGHT_CHANGE_7D, weight - reference);
            }
        }

        List<Double> glucose = new ArrayList<>();
        primary.subMap(date.minusDays(GLUCOSE_VARIABILITY_DAYS - 1L), true, date, true)
                .values()
                .forEach(v -> {
                    Double g = v.get(HealthMetric.GLUCOSE_MGDL);
                    if (g != null) {
                        glucose.add(g);
                    }
                });
        if (glucose.size() >= GLUCOSE_VARIABILITY_MIN_READINGS) {
            double std = new StandardDeviation().evaluate(toArray(glucose));
            if (Double.isFinite(std)) {
                derived.put(HealthMetric.GLUCOSE_VARIABILITY, std);
            }
        }

        rolling(date, values, primary, startDate, derived);
        return derived;
    }

    /**
     * 7日滚动均值只取窗口内 [max(startDate, d-6), d] 的实测值，至少一个读数即可；
     * 偏离 = 当日值 - 滚动均值，当日缺测时不输出
     */
    private static void rolling(LocalDate date, Map<HealthMetric, Double> values,
                                TreeMap<LocalDate, Map<HealthMetric, Double>> primary, LocalDate startDate,
                                Map<HealthMetric, Double> derived) {
        LocalDate from = date.minusDays(ROLLING_DAYS - 1L);
        if (from.isBefore(startDate)) {
            from = startDate;
        }
        Map<LocalDate, Map<HealthMetric, Double>> window = primary.subMap(from, true, date, true);
        for (Map.Entry<HealthMetric, HealthMetric[]> feature : ROLLING_FEATURES.entrySet()) {
            HealthMetric base = feature.getKey();
            double total = 0;
            int count = 0;
            for (Map<HealthMetric, Double> day : window.values()) {
                Double value = day.get(base);
                if (value != null) {
                    total += value;
                    count++;
                }
            }
            if (count == 0) {
                continue;
            }
            double average = total / count;
            derived.put(feature.getValue()[0], average);
            Double today = values.get(base);
            if (today != null) {
                derived.put(feature.getValue()[1], today - average);
            }
        }
    }

    private static Double latestIn(TreeMap<LocalDate, Map<HealthMetric, Double>> primary, HealthMetric metric,
                                   LocalDate from, LocalDate to) {
        for (Map<HealthMetric, Double> values : primary.subMap(from, true, to, true).descendingMap().values()) {
            Double value = values.get(metric);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    // ================== 工具方法 ==================

    private static <T> Map<LocalDate, List<T>> groupByDate(List<T> rows, Function<T, LocalDate> dateOf) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyMap();
        }
        return rows.stream()
                .filter(r -> dateOf.apply(r) != null)
                .collect(Collectors.groupingBy(dateOf));
    }

    private static void putIfPresent(Map<HealthMetric, Double> values, HealthMetric metric, Double value) {
        if (value != null && Double.isFinite(value)) {
            values.put(metric, value);
        }
    }

    private static <T> Double sum(List<T> rows, Function<T, BigDecimal> getter) {
        BigDecimal total = null;
        for (T row : rows) {
            BigDecimal value = getter.apply(row);
            if (value != null) {
                total = total == null ? value : total.add(value);
            }
        }
        return total == null ? null : total.doubleValue();
    }

    private static <T> Double sumInts(List<T> rows, Function<T, Integer> getter) {
        Integer total = null;
        for (T row : rows) {
            Integer value = getter.apply(row);
            if (value != null) {
                total = total == null ? value : total + value;
            }
        }
        return total == null ? null : total.doubleValue();
    }

    private static <T> Double meanOf(List<T> rows, Function<T, BigDecimal> getter) {
        List<Double> present = rows.stream()
                .map(getter)
                .filter(Objects::nonNull)
                .map(BigDecimal::doubleValue)
                .collect(Collectors.toList());
        return present.isEmpty() ? null : mean(present);
    }

    private static <T> Double first(List<T> ordered, Function<T, Integer> getter) {
        for (T row : ordered) {
            Integer value = getter.apply(row);
            if (value != null) {
                return value.doubleValue();
            }
        }
        return null;
    }

    private static double mean(List<Double> values) {
        double total = 0;
        for (Double v : values) {
            total += v;
        }
        return total / values.size();
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

}
