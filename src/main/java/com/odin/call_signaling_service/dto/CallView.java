package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.CallFailure;
import com.odin.call_signaling_service.enums.NegotiationRole;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one participant's call agent, pushed over the WebSocket on every change
 * and returned by the REST view endpoint.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallView {

	private String participantId;
	private CallSession currentCall;
	private CallSession incomingCall;
	private NegotiationRole role;
	private boolean callActive;
	private boolean connected;
	private boolean remoteMediaAvailable;
	private boolean videoEnabled;
	private boolean audioEnabled;
	private CallFailure failure;
}
