package com.healthsignal.mapper;

import com.healthsignal.model.entity.PopulationCorrelationStat;
import com.healthsignal.model.enums.CorrelationType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 人群相关性参考统计Mapper（只读，由离线任务维护）
 */
@Mapper
public interface PopulationCorrelationMapper {

    PopulationCorrelationStat selectByPair(
            @Param("metricA") String metricA,
            @Param("metricB") String metricB,
            @Param("correlationType") CorrelationType correlationType);
}
