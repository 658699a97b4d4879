package com.healthsignal.model.enums;

/**
 * 因果（预测）方向，a/b 对应记录中的 metricA/metricB
 */
public enum CausalDirection {
    A_CAUSES_B,
    B_CAUSES_A,
    BIDIRECTIONAL,
    NONE;

    public static CausalDirection of(boolean aCausesB, boolean bCausesA) {
        if (aCausesB && bCausesA) {
            return BIDIRECTIONAL;
        }
        if (aCausesB) {
            return A_CAUSES_B;
        }
        if (bCausesA) {
            return B_CAUSES_A;
        }
        return NONE;
    }
}
