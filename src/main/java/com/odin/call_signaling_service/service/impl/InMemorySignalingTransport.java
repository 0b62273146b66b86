package com.odin.call_signaling_service.service.impl;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.service.SignalingTransport;
import com.odin.call_signaling_service.utility.Subscription;

import lombok.extern.slf4j.Slf4j;

/**
 * Channels held in process memory; delivery happens synchronously on the sender's thread.
 */
@Slf4j
public class InMemorySignalingTransport implements SignalingTransport {

	private final Map<String, List<ChannelMember>> channels = new ConcurrentHashMap<>();

	@Override
	public void send(SignalingMessage message) {
		List<ChannelMember> members = channels.get(message.getCallId());
		if (members == null || members.isEmpty()) {
			log.debug("No subscriber on call {} for {}; message dropped", message.getCallId(), message.getType());
			return;
		}
		for (ChannelMember member : members) {
			if (member.participantId.equals(message.getFrom())) {
				continue;
			}
			try {
				member.listener.accept(message);
			} catch (RuntimeException e) {
				log.error("Signal listener of {} failed on call {}: {}", member.participantId, message.getCallId(),
						e.getMessage(), e);
			}
		}
	}

	@Override
	public Subscription subscribe(String callId, String participantId, Consumer<SignalingMessage> listener) {
		ChannelMember member = new ChannelMember(participantId, listener);
		channels.computeIfAbsent(callId, k -> new CopyOnWriteArrayList<>()).add(member);
		log.debug("{} joined call channel {}", participantId, callId);
		return () -> {
			List<ChannelMember> members = channels.get(callId);
			if (members != null) {
				members.remove(member);
				channels.computeIfPresent(callId, (k, v) -> v.isEmpty() ? null : v);
			}
		};
	}

	private static final class ChannelMember {
		private final String participantId;
		private final Consumer<SignalingMessage> listener;

		private ChannelMember(String participantId, Consumer<SignalingMessage> listener) {
			this.participantId = participantId;
			this.listener = listener;
		}
	}
}
