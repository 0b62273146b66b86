package com.odin.call_signaling_service.exception;

import lombok.Getter;

/**
 * Root of the call signaling failures. Carries the id of the call the failure
 * belongs to, or null when no session exists yet.
 */
@Getter
public class CallSignalingException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String callId;

	public CallSignalingException(String callId, String message) {
		super(message);
		this.callId = callId;
	}

	public CallSignalingException(String callId, String message, Throwable cause) {
		super(message, cause);
		this.callId = callId;
	}
}
