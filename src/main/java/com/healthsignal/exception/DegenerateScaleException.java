package com.healthsignal.exception;

/**
 * 基线离散度为零或非有限值，无法计算标准分
 */
public class DegenerateScaleException extends AnalysisException {

    public DegenerateScaleException(String subject, double scale) {
        super(String.format("%s 基线离散度退化: scale=%s", subject, scale));
    }
}
