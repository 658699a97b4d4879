package com.healthsignal.model.enums;

/**
 * 相关强度分档（按 |r| 或等价量）
 */
public enum CorrelationStrength {
    WEAK(1),
    MODERATE(2),
    STRONG(3),
    VERY_STRONG(4);

    private final int rank;

    CorrelationStrength(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * 分档；低于弱相关下限时返回 null，调用方应丢弃该记录
     */
    public static CorrelationStrength fromValue(double value, double weakFloor) {
        double abs = Math.abs(value);
        if (Double.isNaN(abs)) {
            return null;
        }
        if (abs >= 0.7) {
            return VERY_STRONG;
        }
        if (abs >= 0.5) {
            return STRONG;
        }
        if (abs >= 0.3) {
            return MODERATE;
        }
        if (abs >= weakFloor) {
            return WEAK;
        }
        return null;
    }

    public boolean isAtLeast(CorrelationStrength other) {
        return this.rank >= other.rank;
    }
}
