package com.odin.call_signaling_service.service;

import com.odin.call_signaling_service.dto.SignalingMessage;

/**
 * What the negotiator needs from the agent that owns it: a way back onto the agent's
 * loop and a way out onto the call channel.
 */
public interface NegotiationSink {

	void post(CallEvent event);

	/**
	 * @throws com.odin.call_signaling_service.exception.SignalingDeliveryException if the message was not published
	 */
	void send(SignalingMessage message);
}
