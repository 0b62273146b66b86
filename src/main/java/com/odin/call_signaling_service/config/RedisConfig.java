package com.odin.call_signaling_service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.repo.CallSessionStore;
import com.odin.call_signaling_service.repo.InMemoryCallSessionStore;
import com.odin.call_signaling_service.repo.RedisCallSessionStore;
import com.odin.call_signaling_service.service.SignalingTransport;
import com.odin.call_signaling_service.service.impl.InMemorySignalingTransport;
import com.odin.call_signaling_service.service.impl.RedisSignalingTransport;
import com.odin.call_signaling_service.utility.RedisSessionEventSubscriber;

import java.time.Clock;

@Slf4j
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        log.info("Initializing RedisConnectionFactory with host={} and port={}", redisHost, redisPort);
        return new LettuceConnectionFactory(redisHost, redisPort);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        log.info("Creating StringRedisTemplate with RedisConnectionFactory: {}", factory.getClass().getSimpleName());
        return new StringRedisTemplate(factory);
    }

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        var container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "call.store-mode", havingValue = "redis", matchIfMissing = true)
    public RedisCallSessionStore redisCallSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            Clock clock) {
        log.info("Call sessions are stored in Redis");
        return new RedisCallSessionStore(redisTemplate, objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "call.store-mode", havingValue = "redis", matchIfMissing = true)
    public RedisSessionEventSubscriber redisSessionEventSubscriber(RedisCallSessionStore store,
            RedisMessageListenerContainer container) {
        RedisSessionEventSubscriber subscriber = new RedisSessionEventSubscriber(store);
        container.addMessageListener(subscriber, RedisCallSessionStore.getTopic());
        return subscriber;
    }

    @Bean
    @ConditionalOnProperty(name = "call.store-mode", havingValue = "redis", matchIfMissing = true)
    public SignalingTransport redisSignalingTransport(StringRedisTemplate redisTemplate,
            RedisMessageListenerContainer container, ObjectMapper objectMapper) {
        return new RedisSignalingTransport(redisTemplate, container, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "call.store-mode", havingValue = "memory")
    public CallSessionStore inMemoryCallSessionStore(Clock clock) {
        log.warn("Call sessions are kept in memory; this only works for a single instance");
        return new InMemoryCallSessionStore(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "call.store-mode", havingValue = "memory")
    public SignalingTransport inMemorySignalingTransport() {
        return new InMemorySignalingTransport();
    }
}
