package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.repository.LeaderboardCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed leaderboard cache. Values are opaque JSON strings stored with SETEX.
 * Every operation throws on backend failure; the cache service decides how to degrade.
 */
@Repository
public class JedisLeaderboardCacheRepository implements LeaderboardCacheRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisLeaderboardCacheRepository.class);

    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(64);
            poolConfig.setMaxIdle(16);
            poolConfig.setMinIdle(4);
            poolConfig.setTestOnBorrow(true);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);
            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }
            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            // Reads fall back to direct computation until Redis answers a ping
            logger.warn("Redis unavailable at {}:{}, leaderboard reads will be computed directly: {}",
                redisHost, redisPort, e.getMessage());
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        if (jedisPool == null) {
            return false;
        }
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            if (!available) {
                logger.info("Redis connection restored at {}:{}", redisHost, redisPort);
            }
            available = true;
            return true;
        } catch (Exception e) {
            available = false;
            return false;
        }
    }

    @Override
    public Optional<String> get(String key) {
        requireKey(key);
        try (Jedis jedis = jedisPool.getResource()) {
            return Optional.ofNullable(jedis.get(key));
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        requireKey(key);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive for key " + key);
        }
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.setex(key, Math.max(1L, ttl.getSeconds()), value);
        }
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.del(key) > 0;
        }
    }

    private void requireKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Cache key cannot be null or empty");
        }
        if (jedisPool == null) {
            throw new IllegalStateException("Redis pool is not initialized");
        }
    }
}
