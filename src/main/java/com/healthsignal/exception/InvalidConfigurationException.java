package com.healthsignal.exception;

/**
 * 分析参数非法，在开始计算前拒绝
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
