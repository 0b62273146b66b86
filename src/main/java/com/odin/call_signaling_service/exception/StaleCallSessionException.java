package com.odin.call_signaling_service.exception;

/**
 * Compare-and-swap on the session version lost against a newer write.
 */
public class StaleCallSessionException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public StaleCallSessionException(String callId, String message) {
		super(callId, message);
	}

	public StaleCallSessionException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
