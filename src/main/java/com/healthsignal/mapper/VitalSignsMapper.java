package com.healthsignal.mapper;

import com.healthsignal.model.entity.VitalSigns;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * 生命体征记录Mapper
 */
@Mapper
public interface VitalSignsMapper {

    /**
     * 查询用户指定日期范围内的生命体征记录（含首尾）
     */
    List<VitalSigns> selectByUserIdAndDateRange(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
