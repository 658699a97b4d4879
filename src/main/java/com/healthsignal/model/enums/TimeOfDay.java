package com.healthsignal.model.enums;

/**
 * 生命体征测量时段，按一天中的先后顺序声明
 */
public enum TimeOfDay {
    MORNING,
    AFTERNOON,
    EVENING,
    NIGHT
}
