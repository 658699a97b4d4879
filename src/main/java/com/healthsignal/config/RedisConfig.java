package com.healthsignal.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * 分析任务互斥锁使用的 Redis 连接
 * 锁的 key 与 token 均为字符串，命令超时较短，Redis 不可用时尽快失败
 */
@Configuration
public class RedisConfig {

    @Value("${health.analysis.lock.redis.host:127.0.0.1}")
    private String redisHost;

    @Value("${health.analysis.lock.redis.port:6379}")
    private int redisPort;

    @Value("${health.analysis.lock.redis.database:3}")
    private int database;

    @Value("${health.analysis.lock.redis.command-timeout-millis:2000}")
    private long commandTimeoutMillis;

    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        return lockConnectionFactory(redisHost, redisPort, database, Duration.ofMillis(commandTimeoutMillis));
    }

    @Bean
    public StringRedisTemplate analysisLockTemplate(LettuceConnectionFactory connectionFactory) {
        return lockTemplate(connectionFactory);
    }

    static LettuceConnectionFactory lockConnectionFactory(String host, int port, int database,
                                                          Duration commandTimeout) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(host, port);
        standalone.setDatabase(database);
        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
                .commandTimeout(commandTimeout)
                .build();
        return new LettuceConnectionFactory(standalone, client);
    }

    static StringRedisTemplate lockTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        template.setEnableDefaultSerializer(false);
        template.setKeySerializer(StringRedisSerializer.UTF_8);
        template.setValueSerializer(StringRedisSerializer.UTF_8);
        return template;
    }
}
