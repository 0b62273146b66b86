package com.odin.call_signaling_service.media;

import java.util.concurrent.CompletableFuture;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;

public interface PeerConnection {

	void addTrack(MediaTrack track, String streamId);

	CompletableFuture<SdpPayload> createOffer();

	CompletableFuture<SdpPayload> createAnswer();

	CompletableFuture<Void> setLocalDescription(SdpPayload description);

	CompletableFuture<Void> setRemoteDescription(SdpPayload description);

	void addIceCandidate(IceCandidatePayload candidate);

	void close();
}
