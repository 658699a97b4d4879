package com.healthsignal.mapper;

import com.healthsignal.model.entity.BodyMetrics;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * 身体成分记录Mapper
 */
@Mapper
public interface BodyMetricsMapper {

    /**
     * 查询用户指定日期范围内的身体成分记录（含首尾）
     */
    List<BodyMetrics> selectByUserIdAndDateRange(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
