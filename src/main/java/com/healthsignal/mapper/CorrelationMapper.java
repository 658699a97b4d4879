package com.healthsignal.mapper;

import com.healthsignal.model.entity.Correlation;
import com.healthsignal.model.enums.CorrelationType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 指标相关性结果Mapper
 */
@Mapper
public interface CorrelationMapper {

    int insert(Correlation correlation);

    /**
     * 按 (用户, 指标A, 指标B, 方法) 查询
     */
    Correlation selectByKey(
            @Param("userId") Long userId,
            @Param("metricA") String metricA,
            @Param("metricB") String metricB,
            @Param("correlationType") CorrelationType correlationType);

    /**
     * 更新统计字段，保留 insight / recommendation
     */
    int updateStatistics(Correlation correlation);

    Correlation selectById(@Param("userId") Long userId, @Param("id") Long id);

    /**
     * 按置信度倒序查询
     * @param correlationType 为 null 时不过滤方法
     */
    List<Correlation> selectByUser(
            @Param("userId") Long userId,
            @Param("correlationType") CorrelationType correlationType,
            @Param("actionableOnly") boolean actionableOnly,
            @Param("limit") Integer limit);

    /**
     * 回写外部生成的洞察与建议
     */
    int updateInsight(
            @Param("userId") Long userId,
            @Param("id") Long id,
            @Param("insight") String insight,
            @Param("recommendation") String recommendation);
}
