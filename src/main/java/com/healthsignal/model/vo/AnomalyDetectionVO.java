package com.healthsignal.model.vo;

import com.healthsignal.model.entity.Anomaly;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * 异常检测运行结果VO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetectionVO {
    /**
     * 本次排序后的异常总数
     */
    private Integer totalAnomalies;

    /**
     * 本次新写入的异常数
     */
    private Integer newAnomalies;

    /**
     * 窗口内无任何数据
     */
    private Boolean nothingToAnalyze;

    private LocalDate periodStart;

    private LocalDate periodEnd;

    /**
     * 按 严重程度 > 分数 > 日期 倒序
     */
    private List<Anomaly> anomalies;

    public static AnomalyDetectionVO nothingToAnalyze(LocalDate periodStart, LocalDate periodEnd) {
        return new AnomalyDetectionVO(0, 0, true, periodStart, periodEnd, Collections.emptyList());
    }
}
