package com.healthsignal.model.dto.analysis;

import com.healthsignal.exception.EmptyFeatureMatrixException;
import com.healthsignal.model.enums.HealthMetric;

import java.time.LocalDate;
import java.util.List;

/**
 * 按日期升序排列的每日特征矩阵，窗口内每天恰好一行（无数据的日子为全空行）
 */
public final class FeatureMatrix {

    private final Long userId;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final List<DailyFeatureVector> rows;

    public FeatureMatrix(Long userId, LocalDate startDate, LocalDate endDate, List<DailyFeatureVector> rows) {
        this.userId = userId;
        this.startDate = startDate;
        this.endDate = endDate;
        this.rows = List.copyOf(rows);
    }

    public Long getUserId() {
        return userId;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public List<DailyFeatureVector> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public DailyFeatureVector row(int index) {
        return rows.get(index);
    }

    public LocalDate dateAt(int index) {
        return rows.get(index).getDate();
    }

    /**
     * 取一列，缺失值为 null
     */
    public Double[] column(HealthMetric metric) {
        Double[] column = new Double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            column[i] = rows.get(i).get(metric);
        }
        return column;
    }

    public int observedCount(HealthMetric metric) {
        int count = 0;
        for (DailyFeatureVector row : rows) {
            if (row.has(metric)) {
                count++;
            }
        }
        return count;
    }

    public double coverage(HealthMetric metric) {
        return rows.isEmpty() ? 0.0 : (double) observedCount(metric) / rows.size();
    }

    public boolean isEmpty() {
        return rows.stream().allMatch(DailyFeatureVector::isEmpty);
    }

    /**
     * 窗口内没有任何读数时抛出 EmptyFeatureMatrixException
     */
    public FeatureMatrix requireData() {
        if (isEmpty()) {
            throw new EmptyFeatureMatrixException(userId, startDate, endDate);
        }
        return this;
    }
}
