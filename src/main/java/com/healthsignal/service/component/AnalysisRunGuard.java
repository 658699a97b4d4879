package com.healthsignal.service.component;

import com.healthsignal.config.AnalysisProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 单用户分析互斥
 * 同一用户的异常检测与相关性检测不能并发执行，不同用户之间互不影响。
 * 锁带过期时间，释放时校验令牌，只删除自己持有的锁。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisRunGuard {

    static final String LOCK_KEY_PREFIX = "analysis:lock:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate analysisLockTemplate;
    private final AnalysisProperties analysisProperties;

    /**
     * 持锁执行；锁被占用时抛出 IllegalStateException
     *
     * @param runType 仅用于日志与提示
     */
    public <T> T runExclusive(Long userId, String runType, Supplier<T> action) {
        String key = lockKey(userId);
        String token = UUID.randomUUID().toString();
        Duration ttl = Duration.ofSeconds(analysisProperties.getRunLockTtlSeconds());

        Boolean acquired = analysisLockTemplate.opsForValue().setIfAbsent(key, token, ttl);
        if (!Boolean.TRUE.equals(acquired)) {
            log.warn("用户{}已有分析任务在运行，拒绝本次{}", userId, runType);
            throw new IllegalStateException("该用户已有分析任务正在运行，请稍后重试");
        }
        try {
            return action.get();
        } finally {
            release(key, token, userId);
        }
    }

    private void release(String key, String token, Long userId) {
        try {
            Long deleted = analysisLockTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), token);
            if (deleted == null || deleted == 0L) {
                log.warn("用户{}的分析锁已过期或被其他任务持有，未释放", userId);
            }
        } catch (RuntimeException e) {
            // 锁会按过期时间自动失效
            log.warn("释放用户{}的分析锁失败: {}", userId, e.getMessage());
        }
    }

    static String lockKey(Long userId) {
        return LOCK_KEY_PREFIX + userId;
    }
}
