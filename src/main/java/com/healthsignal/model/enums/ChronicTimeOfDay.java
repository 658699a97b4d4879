package com.healthsignal.model.enums;

/**
 * 慢病指标（血糖）测量时机
 */
public enum ChronicTimeOfDay {
    FASTING,
    PRE_MEAL,
    POST_MEAL,
    BEDTIME,
    OTHER
}
