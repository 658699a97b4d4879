package com.healthsignal.mapper;

import com.healthsignal.model.entity.SleepEntry;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * 睡眠记录Mapper
 */
@Mapper
public interface SleepEntryMapper {

    /**
     * 查询用户指定日期范围内的睡眠记录（含首尾）
     */
    List<SleepEntry> selectByUserIdAndDateRange(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
