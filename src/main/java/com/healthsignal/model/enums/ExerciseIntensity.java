package com.healthsignal.model.enums;

/**
 * 运动强度，score 用于计算日均强度
 */
public enum ExerciseIntensity {
    LOW(1),
    MODERATE(2),
    HIGH(3),
    VERY_HIGH(4);

    private final int score;

    ExerciseIntensity(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }
}
