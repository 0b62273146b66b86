package com.odin.call_signaling_service.config;

import java.util.HashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import com.odin.call_signaling_service.exception.StoreWriteException;

/**
 * Retry policy for session store writes: only {@link StoreWriteException} is retried,
 * with exponential backoff. Version conflicts and illegal transitions are not retried
 * here; the writer handles those itself.
 */
@Slf4j
@Configuration
public class RetryConfig {

    @Bean("storeRetryTemplate")
    public RetryTemplate storeRetryTemplate(CallProperties properties) {
        return buildStoreRetryTemplate(properties.getRetry());
    }

    public static RetryTemplate buildStoreRetryTemplate(CallProperties.Retry retry) {
        RetryTemplate retryTemplate = new RetryTemplate();

        // at least one retry before a write failure surfaces
        int maxAttempts = Math.max(2, retry.getMaxAttempts());
        Map<Class<? extends Throwable>, Boolean> retryableExceptions = new HashMap<>();
        retryableExceptions.put(StoreWriteException.class, true);
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts, retryableExceptions, true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getInitialBackoff().toMillis());
        backOffPolicy.setMultiplier(retry.getMultiplier());
        backOffPolicy.setMaxInterval(retry.getMaxBackoff().toMillis());

        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);

        retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                    Throwable throwable) {
                if (throwable instanceof StoreWriteException) {
                    log.error("Session store write failed after {} attempt(s)", context.getRetryCount(), throwable);
                }
            }

            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                    Throwable throwable) {
                log.warn("Session store attempt {} failed: {}", context.getRetryCount(), throwable.getMessage());
            }
        });

        return retryTemplate;
    }
}
