package com.odin.call_signaling_service.service;

import java.util.ArrayList;
import java.util.List;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.enums.NegotiationRole;
import com.odin.call_signaling_service.media.LocalMediaStream;
import com.odin.call_signaling_service.media.PeerConnection;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Media and negotiation state of one participant in one call. Created by the call agent
 * when a call starts or is accepted, handed to {@link MediaNegotiator} by reference and
 * only ever touched on the agent's event loop. Once {@link #isClosed()} it is inert: any
 * late result that still references it is dropped.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class NegotiatorState {

	private final String callId;
	private final String participantId;
	private final NegotiationRole role;
	private final CallType callType;

	private LocalMediaStream stream;
	private PeerConnection peerConnection;

	private boolean videoEnabled;
	private boolean audioEnabled;

	private boolean mediaRequested;
	private boolean closed;

	/** The peer has persisted ACCEPTED, so it is listening on the call channel. */
	private boolean peerListening;
	/** Offer created by the offerer, held until {@link #peerListening}. */
	private SdpPayload pendingOffer;
	/** Offer that reached the answerer before its peer connection existed. */
	private SdpPayload pendingRemoteOffer;

	private boolean localDescriptionSent;
	private boolean remoteDescriptionSet;

	private boolean connected;
	private boolean remoteMediaAvailable;

	private final List<IceCandidatePayload> pendingLocalCandidates = new ArrayList<>();
	private final List<IceCandidatePayload> pendingRemoteCandidates = new ArrayList<>();

	public NegotiatorState(String callId, String participantId, NegotiationRole role, CallType callType) {
		this.callId = callId;
		this.participantId = participantId;
		this.role = role;
		this.callType = callType;
		this.videoEnabled = callType.wantsVideo();
		this.audioEnabled = true;
	}

	public boolean isOfferer() {
		return role == NegotiationRole.OFFERER;
	}
}
