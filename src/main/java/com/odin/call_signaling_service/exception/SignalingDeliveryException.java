package com.odin.call_signaling_service.exception;

/**
 * Publishing to or subscribing on a call channel failed. Treated as transient.
 */
public class SignalingDeliveryException extends CallSignalingException {

	private static final long serialVersionUID = 1L;

	public SignalingDeliveryException(String callId, String message) {
		super(callId, message);
	}

	public SignalingDeliveryException(String callId, String message, Throwable cause) {
		super(callId, message, cause);
	}
}
