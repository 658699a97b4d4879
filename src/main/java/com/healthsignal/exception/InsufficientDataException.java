package com.healthsignal.exception;

/**
 * 有效观测数不足，对应指标/指标对被跳过，不影响本次运行的其他部分
 */
public class InsufficientDataException extends AnalysisException {

    private final int observed;
    private final int required;

    public InsufficientDataException(String subject, int observed, int required) {
        super(String.format("%s 有效观测数不足: %d < %d", subject, observed, required));
        this.observed = observed;
        this.required = required;
    }

    public int getObserved() {
        return observed;
    }

    public int getRequired() {
        return required;
    }
}
