package com.odin.call_signaling_service.service;

import java.util.function.Consumer;

import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.utility.Subscription;

/**
 * Per-call publish/subscribe channel for offers, answers and ICE candidates.
 *
 * Messages reach only the subscribers present when they are sent; there is no replay.
 * Delivery is FIFO per channel. A subscriber never receives messages it sent itself.
 */
public interface SignalingTransport {

	/**
	 * @throws com.odin.call_signaling_service.exception.SignalingDeliveryException if the message could not be published
	 */
	void send(SignalingMessage message);

	/**
	 * @throws com.odin.call_signaling_service.exception.SignalingDeliveryException if the channel could not be joined
	 */
	Subscription subscribe(String callId, String participantId, Consumer<SignalingMessage> listener);
}
