package com.odin.call_signaling_service.exception;

/**
 * Requested status change is not allowed from the current status.
 */
public class InvalidCallTransitionException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public InvalidCallTransitionException(String callId, String message) {
		super(callId, message);
	}

	public InvalidCallTransitionException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
