package com.odin.call_signaling_service.media.webrtc;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.exception.NegotiationFailureException;
import com.odin.call_signaling_service.media.MediaTrack;
import com.odin.call_signaling_service.media.PeerConnection;

import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCOfferOptions;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;
import lombok.extern.slf4j.Slf4j;

/**
 * Adapts the observer callbacks of {@link RTCPeerConnection} to futures.
 */
@Slf4j
class WebRtcPeerConnection implements PeerConnection {

	private RTCPeerConnection peerConnection;

	void attach(RTCPeerConnection peerConnection) {
		this.peerConnection = peerConnection;
	}

	@Override
	public void addTrack(MediaTrack track, String streamId) {
		peerConnection.addTrack(((WebRtcMediaTrack) track).unwrap(), List.of(streamId));
	}

	@Override
	public CompletableFuture<SdpPayload> createOffer() {
		CompletableFuture<SdpPayload> future = new CompletableFuture<>();
		peerConnection.createOffer(new RTCOfferOptions(), describe(future, SdpPayload::offer));
		return future;
	}

	@Override
	public CompletableFuture<SdpPayload> createAnswer() {
		CompletableFuture<SdpPayload> future = new CompletableFuture<>();
		peerConnection.createAnswer(new RTCAnswerOptions(), describe(future, SdpPayload::answer));
		return future;
	}

	@Override
	public CompletableFuture<Void> setLocalDescription(SdpPayload description) {
		CompletableFuture<Void> future = new CompletableFuture<>();
		peerConnection.setLocalDescription(toNative(description), applied(future, "local"));
		return future;
	}

	@Override
	public CompletableFuture<Void> setRemoteDescription(SdpPayload description) {
		CompletableFuture<Void> future = new CompletableFuture<>();
		peerConnection.setRemoteDescription(toNative(description), applied(future, "remote"));
		return future;
	}

	@Override
	public void addIceCandidate(IceCandidatePayload candidate) {
		int index = candidate.getSdpMLineIndex() == null ? 0 : candidate.getSdpMLineIndex();
		peerConnection.addIceCandidate(new RTCIceCandidate(candidate.getSdpMid(), index, candidate.getCandidate()));
	}

	@Override
	public void close() {
		if (peerConnection != null) {
			peerConnection.close();
		}
	}

	private static RTCSessionDescription toNative(SdpPayload description) {
		RTCSdpType type = "offer".equalsIgnoreCase(description.getType()) ? RTCSdpType.OFFER : RTCSdpType.ANSWER;
		return new RTCSessionDescription(type, description.getSdp());
	}

	private static CreateSessionDescriptionObserver describe(CompletableFuture<SdpPayload> future,
			Function<String, SdpPayload> wrap) {
		return new CreateSessionDescriptionObserver() {
			@Override
			public void onSuccess(RTCSessionDescription description) {
				future.complete(wrap.apply(description.sdp));
			}

			@Override
			public void onFailure(String error) {
				future.completeExceptionally(new NegotiationFailureException(null, "Description not created: " + error));
			}
		};
	}

	private static SetSessionDescriptionObserver applied(CompletableFuture<Void> future, String side) {
		return new SetSessionDescriptionObserver() {
			@Override
			public void onSuccess() {
				future.complete(null);
			}

			@Override
			public void onFailure(String error) {
				log.warn("Setting {} description failed: {}", side, error);
				future.completeExceptionally(new NegotiationFailureException(null,
						"Could not apply " + side + " description: " + error));
			}
		};
	}
}
