package com.healthsignal.mapper;

import com.healthsignal.model.entity.ChronicMetrics;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * 慢病指标记录Mapper
 */
@Mapper
public interface ChronicMetricsMapper {

    /**
     * 查询用户指定日期范围内的慢病指标记录（含首尾）
     */
    List<ChronicMetrics> selectByUserIdAndDateRange(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
