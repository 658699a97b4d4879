package com.healthsignal.exception;

import java.time.LocalDate;

/**
 * 用户在分析窗口内没有任何数据
 */
public class EmptyFeatureMatrixException extends AnalysisException {

    public EmptyFeatureMatrixException(Long userId, LocalDate startDate, LocalDate endDate) {
        super(String.format("用户%d在 %s ~ %s 内无任何健康数据", userId, startDate, endDate));
    }
}
