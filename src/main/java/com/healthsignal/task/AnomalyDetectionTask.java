package com.healthsignal.task;

import com.healthsignal.mapper.UserMapper;
import com.healthsignal.service.AnomalyDetectionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每日异常检测定时任务
 * 在凌晨3点（可配置）为近期有健康记录的用户运行异常检测，不同用户并行执行
 *
 * 配置说明：
 * - 在 application.yml 中设置 schedule.anomaly-detection.enabled=false 可禁用定时任务
 * - 在 application.yml 中设置 schedule.anomaly-detection.cron 可自定义执行时间
 * - schedule.anomaly-detection.active-days 为活跃用户的判定天数
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "schedule.anomaly-detection", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AnomalyDetectionTask {

    private final AnomalyDetectionService anomalyDetectionService;
    private final UserMapper userMapper;
    private final ThreadPoolTaskExecutor analysisExecutor;

    @Value("${schedule.anomaly-detection.active-days:7}")
    private int activeDays = 7;

    public AnomalyDetectionTask(AnomalyDetectionService anomalyDetectionService,
                                UserMapper userMapper,
                                @Qualifier("analysisExecutor") ThreadPoolTaskExecutor analysisExecutor) {
        this.anomalyDetectionService = anomalyDetectionService;
        this.userMapper = userMapper;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * 每天凌晨3点执行（默认）
     * cron表达式：秒 分 时 日 月 周
     */
    @Scheduled(cron = "${schedule.anomaly-detection.cron:0 0 3 * * ?}")
    public void detectAnomaliesForActiveUsers() {
        log.info("========== 开始执行每日异常检测定时任务 ==========");
        long startTime = System.currentTimeMillis();

        try {
            // 1. 查询活跃用户
            List<Long> userIds = userMapper.selectActiveUserIds(activeDays);
            if (userIds == null || userIds.isEmpty()) {
                log.info("暂无活跃用户（{}天内有健康记录），跳过异常检测", activeDays);
                return;
            }
            log.info("筛选出 {} 位活跃用户（{}天内有健康记录），开始检测", userIds.size(), activeDays);

            AtomicInteger successCount = new AtomicInteger();
            AtomicInteger failCount = new AtomicInteger();

            // 2. 按用户并行检测，单个用户失败不影响其他用户
            List<CompletableFuture<Void>> futures = new ArrayList<>(userIds.size());
            for (Long userId : userIds) {
                try {
                    futures.add(CompletableFuture.runAsync(
                            () -> detectForUser(userId, successCount, failCount), analysisExecutor));
                } catch (TaskRejectedException e) {
                    // 线程池已满，改由调度线程直接执行
                    log.warn("分析线程池已满，用户 {} 的异常检测在调度线程中执行", userId);
                    detectForUser(userId, successCount, failCount);
                }
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            long duration = (System.currentTimeMillis() - startTime) / 1000;
            log.info("========== 每日异常检测任务完成 ==========");
            log.info("检测结果 - 用户数: {}, 成功: {}, 失败: {}, 耗时: {}秒",
                    userIds.size(), successCount.get(), failCount.get(), duration);

        } catch (Exception e) {
            log.error("每日异常检测任务执行异常", e);
        }
    }

    private void detectForUser(Long userId, AtomicInteger successCount, AtomicInteger failCount) {
        try {
            anomalyDetectionService.detectAnomalies(userId, null);
            successCount.incrementAndGet();
            log.debug("用户 {} 异常检测成功", userId);
        } catch (Exception e) {
            failCount.incrementAndGet();
            log.error("用户 {} 异常检测失败", userId, e);
        }
    }
}
