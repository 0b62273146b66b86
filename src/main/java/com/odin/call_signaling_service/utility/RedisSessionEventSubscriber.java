package com.odin.call_signaling_service.utility;

import com.odin.call_signaling_service.dto.CallSessionEvent;
import com.odin.call_signaling_service.repo.RedisCallSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Receives call session change events from the Redis events channel and hands them to
 * the store's local listeners.
 */
@Slf4j
public class RedisSessionEventSubscriber implements MessageListener {

    private final RedisCallSessionStore store;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    public RedisSessionEventSubscriber(RedisCallSessionStore store) {
        this.store = store;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            CallSessionEvent event = mapper.readValue(message.getBody(), CallSessionEvent.class);
            log.debug("Redis subscriber delivering {} for call {} (v{})", event.getType(),
                    event.getSession().getId(), event.getSession().getVersion());
            store.onRemoteEvent(event);
        } catch (Exception e) {
            log.error("Failed to process call session event: {}", e.getMessage(), e);
        }
    }
}
