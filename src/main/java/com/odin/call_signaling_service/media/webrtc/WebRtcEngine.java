package com.odin.call_signaling_service.media.webrtc;

import dev.onvoid.webrtc.PeerConnectionFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the native peer connection factory. The native library is loaded on first use so
 * that instances which never negotiate media never touch it.
 */
@Slf4j
public class WebRtcEngine {

	private PeerConnectionFactory factory;

	public synchronized PeerConnectionFactory getFactory() {
		if (factory == null) {
			log.info("Loading native WebRTC engine");
			factory = new PeerConnectionFactory();
		}
		return factory;
	}

	@PreDestroy
	public synchronized void dispose() {
		if (factory != null) {
			factory.dispose();
			factory = null;
			log.info("Native WebRTC engine disposed");
		}
	}
}
