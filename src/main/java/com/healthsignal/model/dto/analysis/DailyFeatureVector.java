package com.healthsignal.model.dto.analysis;

import com.healthsignal.model.enums.HealthMetric;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 单用户单日的指标向量
 * null 表示当天没有读数，与 0 区分；构建后不可修改
 */
public final class DailyFeatureVector {

    private final Long userId;
    private final LocalDate date;
    private final Map<HealthMetric, Double> values;

    private DailyFeatureVector(Long userId, LocalDate date, Map<HealthMetric, Double> values) {
        this.userId = userId;
        this.date = Objects.requireNonNull(date, "date");
        this.values = values;
    }

    public static DailyFeatureVector of(Long userId, LocalDate date, Map<HealthMetric, Double> values) {
        EnumMap<HealthMetric, Double> copy = new EnumMap<>(HealthMetric.class);
        values.forEach((metric, value) -> {
            // 非有限值视为缺失
            if (value != null && Double.isFinite(value)) {
                copy.put(metric, value);
            }
        });
        return new DailyFeatureVector(userId, date, Collections.unmodifiableMap(copy));
    }

    public static DailyFeatureVector empty(Long userId, LocalDate date) {
        return new DailyFeatureVector(userId, date, Collections.emptyMap());
    }

    /**
     * 返回追加了派生指标的新向量
     */
    public DailyFeatureVector with(Map<HealthMetric, Double> additions) {
        if (additions.isEmpty()) {
            return this;
        }
        EnumMap<HealthMetric, Double> merged = new EnumMap<>(HealthMetric.class);
        merged.putAll(values);
        merged.putAll(additions);
        return of(userId, date, merged);
    }

    public Long getUserId() {
        return userId;
    }

    public LocalDate getDate() {
        return date;
    }

    public Double get(HealthMetric metric) {
        return values.get(metric);
    }

    public boolean has(HealthMetric metric) {
        return values.containsKey(metric);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<HealthMetric, Double> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DailyFeatureVector)) {
            return false;
        }
        DailyFeatureVector that = (DailyFeatureVector) o;
        return Objects.equals(userId, that.userId) && date.equals(that.date) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, date, values);
    }

    @Override
    public String toString() {
        return "DailyFeatureVector{" + date + ", " + values + "}";
    }
}
