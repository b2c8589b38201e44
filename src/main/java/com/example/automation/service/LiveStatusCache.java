package com.example.automation.service;

import com.example.automation.config.ExecutorProperties;
import com.example.automation.config.RedisKeyConstants;
import com.example.automation.model.LiveStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * 任务实时状态缓存（Redis）
 *
 * <p>执行器在运行期间写入，任务结束后删除。Redis不可用时只影响实时消息，
 * 状态查询会回退到数据库。
 * </p>
 */
@Service
public class LiveStatusCache {

    private static final Logger logger = LoggerFactory.getLogger(LiveStatusCache.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final ExecutorProperties executorProperties;

    public LiveStatusCache(RedisTemplate<String, String> redisTemplate,
                           ObjectMapper objectMapper,
                           ExecutorProperties executorProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.executorProperties = executorProperties;
    }

    public void put(Long jobId, LiveStatus liveStatus) {
        try {
            String json = objectMapper.writeValueAsString(liveStatus);
            redisTemplate.opsForValue().set(RedisKeyConstants.buildLiveStatusKey(jobId), json,
                    Duration.ofMinutes(executorProperties.getLiveStatusTtlMinutes()));
            logger.debug("Updated live status in Redis for jobId: {}", jobId);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize live status for jobId: {}", jobId, e);
        } catch (DataAccessException e) {
            logger.warn("Failed to update live status for jobId {}: {}", jobId, e.getMessage());
        }
    }

    public Optional<LiveStatus> find(Long jobId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(RedisKeyConstants.buildLiveStatusKey(jobId));
        } catch (DataAccessException e) {
            logger.warn("Live status unavailable for jobId {}: {}", jobId, e.getMessage());
            return Optional.empty();
        }
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, LiveStatus.class));
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse live status JSON for jobId: {}", jobId, e);
            return Optional.empty();
        }
    }

    public void evict(Long jobId) {
        try {
            redisTemplate.delete(RedisKeyConstants.buildLiveStatusKey(jobId));
            logger.debug("Cleaned up live status in Redis for jobId: {}", jobId);
        } catch (DataAccessException e) {
            logger.warn("Failed to clean up live status for jobId {}: {}", jobId, e.getMessage());
        }
    }
}
