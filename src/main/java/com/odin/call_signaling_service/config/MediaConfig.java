package com.odin.call_signaling_service.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.odin.call_signaling_service.media.MediaDevices;
import com.odin.call_signaling_service.media.PeerConnectionFactory;
import com.odin.call_signaling_service.media.webrtc.WebRtcEngine;
import com.odin.call_signaling_service.media.webrtc.WebRtcMediaDevices;
import com.odin.call_signaling_service.media.webrtc.WebRtcPeerConnectionFactory;
import com.odin.call_signaling_service.service.MediaNegotiator;

@Slf4j
@Configuration
public class MediaConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService mediaExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "call-media-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnProperty(name = "call.media.provider", havingValue = "webrtc", matchIfMissing = true)
    public WebRtcEngine webRtcEngine() {
        return new WebRtcEngine();
    }

    @Bean
    @ConditionalOnProperty(name = "call.media.provider", havingValue = "webrtc", matchIfMissing = true)
    public MediaDevices webRtcMediaDevices(WebRtcEngine engine, @Qualifier("mediaExecutor") ExecutorService mediaExecutor) {
        return new WebRtcMediaDevices(engine, mediaExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "call.media.provider", havingValue = "webrtc", matchIfMissing = true)
    public PeerConnectionFactory webRtcPeerConnectionFactory(WebRtcEngine engine, CallProperties properties) {
        log.info("WebRTC peer connections use STUN servers {}", properties.getMedia().getStunUrls());
        return new WebRtcPeerConnectionFactory(engine, properties.getMedia().getStunUrls());
    }

    @Bean
    public MediaNegotiator mediaNegotiator(MediaDevices mediaDevices, PeerConnectionFactory peerConnectionFactory) {
        return new MediaNegotiator(mediaDevices, peerConnectionFactory);
    }
}
