package com.odin.call_signaling_service.service;

import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallSessionEvent;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.enums.PeerConnectionState;
import com.odin.call_signaling_service.media.LocalMediaStream;
import com.odin.call_signaling_service.media.MediaTrack;

import lombok.Builder;
import lombok.Value;

/**
 * Everything that reaches a call agent from outside its loop. Events raised for one
 * negotiation carry the {@link NegotiatorState} they belong to, so results arriving after
 * that state was torn down can be recognised and discarded.
 */
@Value
@Builder
public class CallEvent {

	public enum Type {
		SESSION_CHANGED,
		SIGNAL_RECEIVED,
		CALL_CREATED,
		CREATE_FAILED,
		WRITE_COMPLETED,
		WRITE_FAILED,
		MEDIA_ACQUIRED,
		MEDIA_FAILED,
		LOCAL_DESCRIPTION_CREATED,
		LOCAL_DESCRIPTION_READY,
		REMOTE_DESCRIPTION_APPLIED,
		NEGOTIATION_FAILED,
		LOCAL_CANDIDATE,
		CONNECTION_STATE_CHANGED,
		REMOTE_TRACK,
		MISSED_TIMEOUT
	}

	Type type;
	NegotiatorState state;
	String callId;
	CallSessionEvent sessionEvent;
	CallSession session;
	SignalingMessage signal;
	LocalMediaStream stream;
	SdpPayload description;
	IceCandidatePayload candidate;
	PeerConnectionState connectionState;
	MediaTrack track;
	Throwable error;

	public static CallEvent sessionChanged(CallSessionEvent event) {
		return builder().type(Type.SESSION_CHANGED).sessionEvent(event).callId(event.getSession().getId()).build();
	}

	public static CallEvent signalReceived(SignalingMessage signal) {
		return builder().type(Type.SIGNAL_RECEIVED).signal(signal).callId(signal.getCallId()).build();
	}

	public static CallEvent callCreated(CallSession session) {
		return builder().type(Type.CALL_CREATED).session(session).callId(session.getId()).build();
	}

	public static CallEvent createFailed(Throwable error) {
		return builder().type(Type.CREATE_FAILED).error(error).build();
	}

	public static CallEvent writeCompleted(CallSession session) {
		return builder().type(Type.WRITE_COMPLETED).session(session).callId(session.getId()).build();
	}

	public static CallEvent writeFailed(String callId, Throwable error) {
		return builder().type(Type.WRITE_FAILED).callId(callId).error(error).build();
	}

	public static CallEvent mediaAcquired(NegotiatorState state, LocalMediaStream stream) {
		return builder().type(Type.MEDIA_ACQUIRED).state(state).callId(state.getCallId()).stream(stream).build();
	}

	public static CallEvent mediaFailed(NegotiatorState state, Throwable error) {
		return builder().type(Type.MEDIA_FAILED).state(state).callId(state.getCallId()).error(error).build();
	}

	public static CallEvent localDescriptionCreated(NegotiatorState state, SdpPayload description) {
		return builder().type(Type.LOCAL_DESCRIPTION_CREATED).state(state).callId(state.getCallId())
				.description(description).build();
	}

	public static CallEvent localDescriptionReady(NegotiatorState state, SdpPayload description) {
		return builder().type(Type.LOCAL_DESCRIPTION_READY).state(state).callId(state.getCallId())
				.description(description).build();
	}

	public static CallEvent remoteDescriptionApplied(NegotiatorState state) {
		return builder().type(Type.REMOTE_DESCRIPTION_APPLIED).state(state).callId(state.getCallId()).build();
	}

	public static CallEvent negotiationFailed(NegotiatorState state, Throwable error) {
		return builder().type(Type.NEGOTIATION_FAILED).state(state).callId(state.getCallId()).error(error).build();
	}

	public static CallEvent localCandidate(NegotiatorState state, IceCandidatePayload candidate) {
		return builder().type(Type.LOCAL_CANDIDATE).state(state).callId(state.getCallId()).candidate(candidate)
				.build();
	}

	public static CallEvent connectionStateChanged(NegotiatorState state, PeerConnectionState connectionState) {
		return builder().type(Type.CONNECTION_STATE_CHANGED).state(state).callId(state.getCallId())
				.connectionState(connectionState).build();
	}

	public static CallEvent remoteTrack(NegotiatorState state, MediaTrack track) {
		return builder().type(Type.REMOTE_TRACK).state(state).callId(state.getCallId()).track(track).build();
	}

	public static CallEvent missedTimeout(String callId) {
		return builder().type(Type.MISSED_TIMEOUT).callId(callId).build();
	}
}
