package com.healthsignal.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 用户Mapper接口
 */
@Mapper
public interface UserMapper {

    /**
     * 查询最近 days 天内有任意健康记录的用户
     */
    List<Long> selectActiveUserIds(@Param("days") int days);
}
