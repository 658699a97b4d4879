package com.healthsignal.mapper;

import com.healthsignal.model.entity.FoodEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * 饮食记录Mapper
 */
@Mapper
public interface FoodEntryMapper {

    /**
     * 查询用户指定日期范围内的饮食记录（含首尾）
     */
    List<FoodEntry> selectByUserIdAndDateRange(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
