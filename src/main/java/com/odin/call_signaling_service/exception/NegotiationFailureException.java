package com.odin.call_signaling_service.exception;

/**
 * The peer connection could not be negotiated or dropped to a failed/disconnected
 * state. Fatal for the session.
 */
public class NegotiationFailureException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public NegotiationFailureException(String callId, String message) {
		super(callId, message);
	}

	public NegotiationFailureException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
