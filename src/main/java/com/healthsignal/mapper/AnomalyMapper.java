package com.healthsignal.mapper;

import com.healthsignal.model.entity.Anomaly;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 异常检测结果Mapper
 */
@Mapper
public interface AnomalyMapper {

    /**
     * 插入异常记录（回填主键）
     */
    int insert(Anomaly anomaly);

    /**
     * 按 (用户, 日期, 指标) 查询已有记录
     */
    Anomaly selectByKey(
            @Param("userId") Long userId,
            @Param("recordDate") LocalDate recordDate,
            @Param("metricName") String metricName);

    /**
     * 覆盖检测字段，不修改确认状态
     */
    int updateDetection(Anomaly anomaly);

    Anomaly selectById(@Param("userId") Long userId, @Param("id") Long id);

    /**
     * 按条件查询，按日期倒序
     * @param acknowledged 为 null 时不过滤确认状态
     */
    List<Anomaly> selectByUser(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("acknowledged") Boolean acknowledged,
            @Param("limit") Integer limit);

    int acknowledge(@Param("userId") Long userId, @Param("id") Long id);

    /**
     * 按严重程度统计，返回 severity / cnt
     */
    List<Map<String, Object>> countBySeverity(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate);

    /**
     * 按指标统计，返回 metricName / cnt
     */
    List<Map<String, Object>> countByMetric(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate);

    int countUnacknowledged(
            @Param("userId") Long userId,
            @Param("startDate") LocalDate startDate);
}
