package com.healthsignal.mapper;

import com.healthsignal.model.entity.ExerciseEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * 运动记录Mapper
 */
@Mapper
public interface ExerciseEntryMapper {

    /**
     * 查询用户指定日期范围内的运动记录（含首尾）
     */
    List<ExerciseEntry> selectByUserIdAndDateRange(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
