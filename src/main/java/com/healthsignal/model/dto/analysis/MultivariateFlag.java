package com.healthsignal.model.dto.analysis;

import java.time.LocalDate;
import java.util.List;

/**
 * 孤立森林判定为离群的日期，按贡献度降序给出主要指标
 *
 * @param rawScore        孤立森林原始异常分
 * @param normalizedScore 本次运行内 min-max 归一化后的分数
 */
public record MultivariateFlag(LocalDate date, double rawScore, double normalizedScore,
                               List<FeatureContribution> contributors) {

    public MultivariateFlag {
        contributors = List.copyOf(contributors);
    }
}
