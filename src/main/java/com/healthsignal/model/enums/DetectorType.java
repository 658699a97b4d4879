package com.healthsignal.model.enums;

/**
 * 异常检测器类型
 */
public enum DetectorType {
    ZSCORE("zscore"),
    ISOLATION_FOREST("isolation_forest"),
    ENSEMBLE("ensemble");

    private final String code;

    DetectorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
