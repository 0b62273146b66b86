package com.odin.call_signaling_service.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.enums.PeerConnectionState;
import com.odin.call_signaling_service.exception.MediaAccessDeniedException;
import com.odin.call_signaling_service.exception.NegotiationFailureException;
import com.odin.call_signaling_service.media.LocalMediaStream;
import com.odin.call_signaling_service.media.MediaConstraints;
import com.odin.call_signaling_service.media.MediaDevices;
import com.odin.call_signaling_service.media.MediaTrack;
import com.odin.call_signaling_service.media.PeerConnection;
import com.odin.call_signaling_service.media.PeerConnectionFactory;
import com.odin.call_signaling_service.media.PeerConnectionListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives local media and the peer connection for one {@link NegotiatorState}.
 *
 * The negotiator keeps no state of its own. Every asynchronous step (media capture,
 * description creation, peer connection callbacks) reports back as a {@link CallEvent}
 * posted to the owning agent, which calls the matching {@code on*} method from its loop.
 * Each of those methods is a no-op once the state has been torn down.
 *
 * Outbound ICE candidates are held until the local offer or answer has gone out, since
 * before that the peer has nothing to apply them to. Inbound candidates are held until the
 * remote description is applied.
 */
@Slf4j
public class MediaNegotiator {

	private final MediaDevices mediaDevices;
	private final PeerConnectionFactory peerConnectionFactory;

	public MediaNegotiator(MediaDevices mediaDevices, PeerConnectionFactory peerConnectionFactory) {
		this.mediaDevices = mediaDevices;
		this.peerConnectionFactory = peerConnectionFactory;
	}

	/**
	 * Requests capture devices for the call type. The outcome is posted as
	 * {@code MEDIA_ACQUIRED} or {@code MEDIA_FAILED}; a denial is never retried.
	 */
	public void acquireMedia(NegotiatorState state, NegotiationSink sink) {
		if (state.isClosed() || state.isMediaRequested()) {
			return;
		}
		state.setMediaRequested(true);
		MediaConstraints constraints = new MediaConstraints(state.getCallType().wantsVideo(), true);
		log.info("Requesting local media for call {} (video={}, audio={})", state.getCallId(),
				constraints.isVideo(), constraints.isAudio());
		try {
			mediaDevices.getUserMedia(constraints).whenComplete((stream, error) -> {
				if (error != null) {
					sink.post(CallEvent.mediaFailed(state, unwrap(error)));
				} else {
					sink.post(CallEvent.mediaAcquired(state, stream));
				}
			});
		} catch (RuntimeException e) {
			sink.post(CallEvent.mediaFailed(state, e));
		}
	}

	/**
	 * Attaches freshly captured media and opens the peer connection. A stream that arrives
	 * after teardown is stopped straight away.
	 *
	 * @return false when the state was already torn down
	 */
	public boolean onMediaAcquired(NegotiatorState state, LocalMediaStream stream, NegotiationSink sink) {
		if (state.isClosed()) {
			log.info("Media for call {} arrived after teardown, releasing it", state.getCallId());
			stream.stop();
			return false;
		}
		state.setStream(stream);
		stream.getVideoTracks().forEach(t -> t.setEnabled(state.isVideoEnabled()));
		stream.getAudioTracks().forEach(t -> t.setEnabled(state.isAudioEnabled()));

		PeerConnection peerConnection = peerConnectionFactory.create(listenerFor(state, sink));
		state.setPeerConnection(peerConnection);
		for (MediaTrack track : stream.getTracks()) {
			peerConnection.addTrack(track, stream.getId());
		}
		log.info("Peer connection ready for call {} as {}", state.getCallId(), state.getRole());

		if (state.isOfferer()) {
			peerConnection.createOffer().whenComplete((offer, error) -> {
				if (error != null) {
					sink.post(CallEvent.negotiationFailed(state, unwrap(error)));
				} else {
					sink.post(CallEvent.localDescriptionCreated(state, offer));
				}
			});
		} else if (state.getPendingRemoteOffer() != null) {
			SdpPayload offer = state.getPendingRemoteOffer();
			state.setPendingRemoteOffer(null);
			applyRemoteDescription(state, offer, sink);
		}
		return true;
	}

	public void onLocalDescriptionCreated(NegotiatorState state, SdpPayload description, NegotiationSink sink) {
		if (state.isClosed()) {
			return;
		}
		state.getPeerConnection().setLocalDescription(description).whenComplete((ignored, error) -> {
			if (error != null) {
				sink.post(CallEvent.negotiationFailed(state, unwrap(error)));
			} else {
				sink.post(CallEvent.localDescriptionReady(state, description));
			}
		});
	}

	/**
	 * The local description is applied. The answer goes out immediately; the offer waits
	 * until the peer is known to be listening.
	 */
	public void onLocalDescriptionReady(NegotiatorState state, SdpPayload description, NegotiationSink sink) {
		if (state.isClosed()) {
			return;
		}
		if (state.isOfferer()) {
			state.setPendingOffer(description);
			releaseOffer(state, sink);
		} else {
			sink.send(SignalingMessage.answer(state.getCallId(), state.getParticipantId(), description));
			log.info("Answer sent for call {}", state.getCallId());
			markLocalDescriptionSent(state, sink);
		}
	}

	/**
	 * Called once the answerer has persisted ACCEPTED, which it only does after joining the
	 * call channel.
	 */
	public void onPeerListening(NegotiatorState state, NegotiationSink sink) {
		if (state.isClosed()) {
			return;
		}
		state.setPeerListening(true);
		releaseOffer(state, sink);
	}

	public void handleOffer(NegotiatorState state, SdpPayload offer, NegotiationSink sink) {
		if (state.isClosed()) {
			return;
		}
		if (state.isOfferer()) {
			log.warn("Ignoring offer on call {}: this side is the offerer", state.getCallId());
			return;
		}
		if (state.getPeerConnection() == null) {
			log.debug("Offer for call {} arrived before media, holding it", state.getCallId());
			state.setPendingRemoteOffer(offer);
			return;
		}
		applyRemoteDescription(state, offer, sink);
	}

	public void handleAnswer(NegotiatorState state, SdpPayload answer, NegotiationSink sink) {
		if (state.isClosed()) {
			return;
		}
		if (!state.isOfferer() || state.getPeerConnection() == null || state.isRemoteDescriptionSet()) {
			log.warn("Ignoring unexpected answer on call {}", state.getCallId());
			return;
		}
		applyRemoteDescription(state, answer, sink);
	}

	/**
	 * Remote description is in place: flush held candidates and, on the answering side,
	 * produce the answer.
	 */
	public void onRemoteDescriptionApplied(NegotiatorState state, NegotiationSink sink) {
		if (state.isClosed()) {
			return;
		}
		state.setRemoteDescriptionSet(true);
		List<IceCandidatePayload> held = new ArrayList<>(state.getPendingRemoteCandidates());
		state.getPendingRemoteCandidates().clear();
		if (!held.isEmpty()) {
			log.debug("Applying {} held remote candidate(s) for call {}", held.size(), state.getCallId());
		}
		held.forEach(c -> state.getPeerConnection().addIceCandidate(c));

		if (!state.isOfferer()) {
			state.getPeerConnection().createAnswer().whenComplete((answer, error) -> {
				if (error != null) {
					sink.post(CallEvent.negotiationFailed(state, unwrap(error)));
				} else {
					sink.post(CallEvent.localDescriptionCreated(state, answer));
				}
			});
		}
	}

	public void handleRemoteCandidate(NegotiatorState state, IceCandidatePayload candidate) {
		if (state.isClosed()) {
			return;
		}
		if (!state.isRemoteDescriptionSet()) {
			log.debug("Holding remote candidate for call {} until the remote description is set", state.getCallId());
			state.getPendingRemoteCandidates().add(candidate);
			return;
		}
		state.getPeerConnection().addIceCandidate(candidate);
	}

	public void onLocalCandidate(NegotiatorState state, IceCandidatePayload candidate, NegotiationSink sink) {
		if (state.isClosed()) {
			return;
		}
		if (!state.isLocalDescriptionSent()) {
			state.getPendingLocalCandidates().add(candidate);
			return;
		}
		sink.send(SignalingMessage.iceCandidate(state.getCallId(), state.getParticipantId(), candidate));
	}

	public void onRemoteTrack(NegotiatorState state, MediaTrack track) {
		if (state.isClosed()) {
			return;
		}
		log.info("Remote {} track received on call {}", track.getKind(), state.getCallId());
		state.setRemoteMediaAvailable(true);
	}

	/**
	 * Records the new connection state.
	 *
	 * @return true when the connection is disconnected or failed and the call has to end
	 */
	public boolean onConnectionStateChange(NegotiatorState state, PeerConnectionState connectionState) {
		if (state.isClosed()) {
			return false;
		}
		log.info("Peer connection for call {} is {}", state.getCallId(), connectionState);
		state.setConnected(connectionState == PeerConnectionState.CONNECTED);
		return connectionState.isBroken();
	}

	public boolean toggleVideo(NegotiatorState state) {
		state.setVideoEnabled(!state.isVideoEnabled());
		if (state.getStream() != null) {
			state.getStream().getVideoTracks().forEach(t -> t.setEnabled(state.isVideoEnabled()));
		}
		log.info("Video {} on call {}", state.isVideoEnabled() ? "enabled" : "disabled", state.getCallId());
		return state.isVideoEnabled();
	}

	public boolean toggleAudio(NegotiatorState state) {
		state.setAudioEnabled(!state.isAudioEnabled());
		if (state.getStream() != null) {
			state.getStream().getAudioTracks().forEach(t -> t.setEnabled(state.isAudioEnabled()));
		}
		log.info("Audio {} on call {}", state.isAudioEnabled() ? "enabled" : "disabled", state.getCallId());
		return state.isAudioEnabled();
	}

	/**
	 * Closes the peer connection and stops every local track. Safe to call repeatedly;
	 * anything still in flight for this state is discarded when it lands.
	 */
	public void teardown(NegotiatorState state) {
		if (state == null || state.isClosed()) {
			return;
		}
		state.setClosed(true);
		if (state.getPeerConnection() != null) {
			try {
				state.getPeerConnection().close();
			} catch (RuntimeException e) {
				log.warn("Failed to close peer connection for call {}: {}", state.getCallId(), e.getMessage());
			}
		}
		if (state.getStream() != null) {
			try {
				state.getStream().stop();
			} catch (RuntimeException e) {
				log.warn("Failed to stop local media for call {}: {}", state.getCallId(), e.getMessage());
			}
		}
		state.setPeerConnection(null);
		state.setStream(null);
		state.setPendingOffer(null);
		state.setPendingRemoteOffer(null);
		state.setConnected(false);
		state.setRemoteMediaAvailable(false);
		state.getPendingLocalCandidates().clear();
		state.getPendingRemoteCandidates().clear();
		log.info("Negotiator torn down for call {}", state.getCallId());
	}

	/**
	 * Maps a failed media request to the error the agent reports.
	 */
	public static MediaAccessDeniedException asMediaFailure(String callId, Throwable error) {
		if (error instanceof MediaAccessDeniedException) {
			return (MediaAccessDeniedException) error;
		}
		return new MediaAccessDeniedException(callId, "Local media unavailable: " + error.getMessage(), error);
	}

	private void releaseOffer(NegotiatorState state, NegotiationSink sink) {
		if (!state.isPeerListening() || state.getPendingOffer() == null || state.isLocalDescriptionSent()) {
			return;
		}
		sink.send(SignalingMessage.offer(state.getCallId(), state.getParticipantId(), state.getPendingOffer()));
		log.info("Offer sent for call {}", state.getCallId());
		state.setPendingOffer(null);
		markLocalDescriptionSent(state, sink);
	}

	private void markLocalDescriptionSent(NegotiatorState state, NegotiationSink sink) {
		state.setLocalDescriptionSent(true);
		List<IceCandidatePayload> held = new ArrayList<>(state.getPendingLocalCandidates());
		state.getPendingLocalCandidates().clear();
		if (!held.isEmpty()) {
			log.debug("Sending {} held local candidate(s) for call {}", held.size(), state.getCallId());
		}
		for (IceCandidatePayload candidate : held) {
			sink.send(SignalingMessage.iceCandidate(state.getCallId(), state.getParticipantId(), candidate));
		}
	}

	private void applyRemoteDescription(NegotiatorState state, SdpPayload description, NegotiationSink sink) {
		state.getPeerConnection().setRemoteDescription(description).whenComplete((ignored, error) -> {
			if (error != null) {
				sink.post(CallEvent.negotiationFailed(state, unwrap(error)));
			} else {
				sink.post(CallEvent.remoteDescriptionApplied(state));
			}
		});
	}

	private PeerConnectionListener listenerFor(NegotiatorState state, NegotiationSink sink) {
		return new PeerConnectionListener() {
			@Override
			public void onIceCandidate(IceCandidatePayload candidate) {
				sink.post(CallEvent.localCandidate(state, candidate));
			}

			@Override
			public void onConnectionStateChange(PeerConnectionState connectionState) {
				sink.post(CallEvent.connectionStateChanged(state, connectionState));
			}

			@Override
			public void onRemoteTrack(MediaTrack track) {
				sink.post(CallEvent.remoteTrack(state, track));
			}
		};
	}

	static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	static NegotiationFailureException asNegotiationFailure(String callId, Throwable error) {
		if (error instanceof NegotiationFailureException) {
			return (NegotiationFailureException) error;
		}
		return new NegotiationFailureException(callId, "Negotiation failed: " + error.getMessage(), error);
	}
}
