package com.odin.call_signaling_service.media;

public interface PeerConnectionFactory {

	PeerConnection create(PeerConnectionListener listener);
}
