package com.healthsignal.service;

import com.healthsignal.model.entity.Anomaly;

/**
 * 异常解释文案
 * 内置实现按模板生成，可替换为外部文本生成服务
 */
public interface AnomalyExplanationService {

    /**
     * 生成一句面向用户的解释；无法生成时返回 null
     */
    String explain(Anomaly anomaly);
}
