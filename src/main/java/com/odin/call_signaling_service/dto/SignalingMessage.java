package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.SignalType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ephemeral negotiation payload carried on a call channel. Exactly one of
 * {@code sdp} (offer, answer) or {@code candidate} (ice-candidate) is set.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalingMessage {

    private SignalType type;
    private String callId;
    private String from;

    private SdpPayload sdp;
    private IceCandidatePayload candidate;

    public static SignalingMessage offer(String callId, String from, SdpPayload sdp) {
        return new SignalingMessage(SignalType.OFFER, callId, from, sdp, null);
    }

    public static SignalingMessage answer(String callId, String from, SdpPayload sdp) {
        return new SignalingMessage(SignalType.ANSWER, callId, from, sdp, null);
    }

    public static SignalingMessage iceCandidate(String callId, String from, IceCandidatePayload candidate) {
        return new SignalingMessage(SignalType.ICE_CANDIDATE, callId, from, null, candidate);
    }
}
