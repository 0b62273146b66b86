package com.odin.call_signaling_service.service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Connection registry in Redis: which pod currently holds a participant's WebSocket.
 *
 * Reachability is advisory. It only decides whether the UI offers "call", and a Redis
 * failure reports the participant as reachable rather than blocking calls.
 */
@Slf4j
@Service
public class PresenceService {

    private final StringRedisTemplate redisTemplate;

    @Value("${pod.name:dev}")
    private String podName;

    public PresenceService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Entry persists until {@link #unregisterConnection(String)} on WebSocket close.
     */
    public void registerConnection(String userId) {
        try {
            redisTemplate.opsForValue().set(registryKey(userId), podName);
            log.info("Registered connection for userId='{}' on pod='{}'", userId, podName);
        } catch (Exception e) {
            log.error("Failed to register connection for userId='{}': {}", userId, e.getMessage(), e);
        }
    }

    public void unregisterConnection(String userId) {
        try {
            redisTemplate.delete(registryKey(userId));
            log.info("Unregistered connection for userId='{}'", userId);
        } catch (Exception e) {
            log.error("Failed to unregister connection for userId='{}': {}", userId, e.getMessage(), e);
        }
    }

    public boolean isReachable(String userId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(registryKey(userId)));
        } catch (Exception e) {
            log.warn("Presence lookup failed for userId='{}', assuming reachable: {}", userId, e.getMessage());
            return true;
        }
    }

    public Optional<String> getConnectionPod(String userId) {
        try {
            String pod = redisTemplate.opsForValue().get(registryKey(userId));
            if (pod != null && !pod.isEmpty()) {
                return Optional.of(pod);
            }
        } catch (Exception e) {
            log.error("Failed to get connection pod for userId='{}': {}", userId, e.getMessage(), e);
        }
        return Optional.empty();
    }

    public String getPodName() {
        return podName;
    }

    private String registryKey(String userId) {
        return ApplicationConstants.CONNECTION_KEY_PREFIX + userId;
    }
}
