package com.healthsignal.model.enums;

/**
 * 相关性检测方法
 */
public enum CorrelationType {
    PEARSON("pearson"),
    GRANGER("granger"),
    CROSS_CORRELATION("cross_correlation"),
    MUTUAL_INFO("mutual_info");

    private final String code;

    CorrelationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 是否带有方向（正/负相关），互信息只衡量依赖程度
     */
    public boolean isSigned() {
        return this != MUTUAL_INFO;
    }
}
