package com.odin.call_signaling_service.service.impl;

import java.util.function.Consumer;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.exception.SignalingDeliveryException;
import com.odin.call_signaling_service.service.SignalingTransport;
import com.odin.call_signaling_service.utility.Subscription;

import lombok.extern.slf4j.Slf4j;

/**
 * Call channels on Redis pub/sub, one topic per call ({@code call:{callId}}). The topic
 * exists as soon as someone subscribes or publishes; Redis itself gives the no-replay,
 * FIFO-per-channel semantics.
 */
@Slf4j
public class RedisSignalingTransport implements SignalingTransport {

	private final StringRedisTemplate redisTemplate;
	private final RedisMessageListenerContainer container;
	private final ObjectMapper objectMapper;

	public RedisSignalingTransport(StringRedisTemplate redisTemplate, RedisMessageListenerContainer container,
			ObjectMapper objectMapper) {
		this.redisTemplate = redisTemplate;
		this.container = container;
		this.objectMapper = objectMapper;
	}

	public static ChannelTopic topicFor(String callId) {
		return new ChannelTopic(ApplicationConstants.CALL_SIGNAL_CHANNEL_PREFIX + callId);
	}

	@Override
	public void send(SignalingMessage message) {
		try {
			String json = objectMapper.writeValueAsString(message);
			redisTemplate.convertAndSend(topicFor(message.getCallId()).getTopic(), json);
			log.debug("SIGNAL SENT (REDIS) {} on call {} from {}", message.getType(), message.getCallId(),
					message.getFrom());
		} catch (JsonProcessingException | DataAccessException e) {
			throw new SignalingDeliveryException(message.getCallId(),
					"Failed to publish " + message.getType() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public Subscription subscribe(String callId, String participantId, Consumer<SignalingMessage> listener) {
		ChannelTopic topic = topicFor(callId);
		MessageListener redisListener = (message, pattern) -> {
			try {
				SignalingMessage signal = objectMapper.readValue(message.getBody(), SignalingMessage.class);
				if (participantId.equals(signal.getFrom())) {
					return;
				}
				listener.accept(signal);
			} catch (Exception e) {
				log.error("Failed to process signal on {} for {}: {}", topic.getTopic(), participantId,
						e.getMessage(), e);
			}
		};
		try {
			container.addMessageListener(redisListener, topic);
		} catch (RuntimeException e) {
			throw new SignalingDeliveryException(callId, "Failed to subscribe to " + topic.getTopic(), e);
		}
		log.debug("{} subscribed to {}", participantId, topic.getTopic());
		return () -> {
			try {
				container.removeMessageListener(redisListener, topic);
				log.debug("{} unsubscribed from {}", participantId, topic.getTopic());
			} catch (RuntimeException e) {
				log.warn("Failed to unsubscribe {} from {}: {}", participantId, topic.getTopic(), e.getMessage());
			}
		};
	}
}
