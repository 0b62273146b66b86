package com.odin.call_signaling_service.media.webrtc;

import java.util.ArrayList;
import java.util.List;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.enums.PeerConnectionState;
import com.odin.call_signaling_service.media.PeerConnection;
import com.odin.call_signaling_service.media.PeerConnectionFactory;
import com.odin.call_signaling_service.media.PeerConnectionListener;

import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import dev.onvoid.webrtc.RTCRtpTransceiver;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class WebRtcPeerConnectionFactory implements PeerConnectionFactory {

	private final WebRtcEngine engine;
	private final List<String> stunUrls;

	public WebRtcPeerConnectionFactory(WebRtcEngine engine, List<String> stunUrls) {
		this.engine = engine;
		this.stunUrls = stunUrls;
	}

	@Override
	public PeerConnection create(PeerConnectionListener listener) {
		RTCIceServer stunServer = new RTCIceServer();
		stunServer.urls.addAll(stunUrls);
		List<RTCIceServer> iceServers = new ArrayList<>();
		iceServers.add(stunServer);

		RTCConfiguration config = new RTCConfiguration();
		config.iceServers = iceServers;

		WebRtcPeerConnection connection = new WebRtcPeerConnection();
		connection.attach(engine.getFactory().createPeerConnection(config, new PeerConnectionObserver() {
			@Override
			public void onIceCandidate(RTCIceCandidate candidate) {
				listener.onIceCandidate(new IceCandidatePayload(candidate.sdp, candidate.sdpMid, candidate.sdpMLineIndex));
			}

			@Override
			public void onConnectionChange(RTCPeerConnectionState state) {
				log.debug("Peer connection state: {}", state);
				listener.onConnectionStateChange(map(state));
			}

			@Override
			public void onTrack(RTCRtpTransceiver transceiver) {
				listener.onRemoteTrack(WebRtcMediaTrack.remote(transceiver.getReceiver().getTrack()));
			}
		}));
		log.info("Peer connection created with {} STUN url(s)", stunUrls.size());
		return connection;
	}

	static PeerConnectionState map(RTCPeerConnectionState state) {
		try {
			return PeerConnectionState.valueOf(state.name());
		} catch (IllegalArgumentException e) {
			log.debug("Unmapped peer connection state {}, treating as NEW", state);
			return PeerConnectionState.NEW;
		}
	}
}
