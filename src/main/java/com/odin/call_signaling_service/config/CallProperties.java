package com.odin.call_signaling_service.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for call agents, the session store and media negotiation.
 */
@Data
@Component
@ConfigurationProperties(prefix = "call")
public class CallProperties {

    /**
     * How long a call may stay pending before the caller's agent marks it missed.
     *
     * Default: 30s
     */
    private Duration missedTimeout = Duration.ofSeconds(30);

    /**
     * How long a REST command waits for the call agent before answering 504.
     */
    private Duration commandTimeout = Duration.ofSeconds(15);

    /**
     * Where session records live: "redis" or "memory".
     * The in-memory store only makes sense for a single instance.
     */
    private String storeMode = "redis";

    private Retry retry = new Retry();

    private Signaling signaling = new Signaling();

    private Media media = new Media();

    @Data
    public static class Retry {

        /**
         * Total attempts for a session store write, the first one included.
         * Must be at least 2 so a failed write is retried once before it surfaces.
         */
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(200);

        private double multiplier = 2.0;

        private Duration maxBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Signaling {

        /**
         * Consecutive send failures on a call channel after which the participant is
         * told signaling is unavailable. The call itself is not ended.
         */
        private int maxDeliveryFailures = 3;
    }

    @Data
    public static class Media {

        /**
         * "webrtc" uses the native webrtc-java engine.
         */
        private String provider = "webrtc";

        private List<String> stunUrls = new ArrayList<>(List.of(
                "stun:stun.l.google.com:19302",
                "stun:stun1.l.google.com:19302"));
    }
}
