package com.odin.call_signaling_service.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import com.odin.call_signaling_service.repo.CallSessionStore;
import com.odin.call_signaling_service.service.CallSessionWriter;

@Configuration
public class CallAgentConfig {

    /**
     * Blocking session store calls run here so agent loops never wait on Redis.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService storeExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(4, r -> {
            Thread thread = new Thread(r, "call-store-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public CallSessionWriter callSessionWriter(CallSessionStore store,
            @Qualifier("storeRetryTemplate") RetryTemplate storeRetryTemplate,
            @Qualifier("storeExecutor") ExecutorService storeExecutor, Clock clock) {
        return new CallSessionWriter(store, storeRetryTemplate, storeExecutor, clock);
    }
}
