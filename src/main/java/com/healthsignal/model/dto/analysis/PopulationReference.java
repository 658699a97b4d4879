package com.healthsignal.model.dto.analysis;

/**
 * 人群参考分布
 *
 * @param fallback 来自内置默认值而非统计表
 */
public record PopulationReference(double mean, double std, int userCount, boolean fallback) {
}
