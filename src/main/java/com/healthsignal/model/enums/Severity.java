package com.healthsignal.model.enums;

/**
 * 异常严重程度
 * 由 [0,1] 区间的异常分数映射：>=0.75 高，>=0.45 中，其余为低
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private static final double HIGH_THRESHOLD = 0.75;
    private static final double MEDIUM_THRESHOLD = 0.45;

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static Severity fromScore(double score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
