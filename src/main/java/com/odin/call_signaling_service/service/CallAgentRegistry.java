package com.odin.call_signaling_service.service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.config.CallProperties;
import com.odin.call_signaling_service.repo.CallSessionStore;
import com.odin.call_signaling_service.service.impl.ExecutorCallEventLoop;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Call agents of the participants connected to this instance, one per participant.
 */
@Slf4j
@Service
public class CallAgentRegistry {

	private final Map<String, CallSessionController> agents = new ConcurrentHashMap<>();
	private final Function<String, CallSessionController> agentFactory;

	@Autowired
	public CallAgentRegistry(CallSessionStore store, SignalingTransport transport, MediaNegotiator negotiator,
			CallSessionWriter writer, CallProperties properties, MissedCallNotificationService missedCallNotifier) {
		this(participantId -> new CallSessionController(participantId, store, transport, negotiator, writer,
				new ExecutorCallEventLoop(participantId), properties, missedCallNotifier));
	}

	CallAgentRegistry(Function<String, CallSessionController> agentFactory) {
		this.agentFactory = agentFactory;
	}

	public CallSessionController getOrCreate(String participantId) {
		return agents.computeIfAbsent(participantId, id -> {
			CallSessionController agent = agentFactory.apply(id);
			agent.start();
			log.info("Created call agent for {}", id);
			return agent;
		});
	}

	public Optional<CallSessionController> find(String participantId) {
		return Optional.ofNullable(agents.get(participantId));
	}

	/**
	 * Shuts the participant's agent down, ending any live call it holds.
	 */
	public void release(String participantId) {
		CallSessionController agent = agents.remove(participantId);
		if (agent == null) {
			return;
		}
		agent.shutdown().whenComplete((ignored, error) -> {
			if (error != null) {
				log.error("Call agent of {} did not shut down cleanly: {}", participantId, error.getMessage(), error);
			} else {
				log.info("Released call agent for {}", participantId);
			}
		});
	}

	public int size() {
		return agents.size();
	}

	@PreDestroy
	public void shutdownAll() {
		log.info("Shutting down {} call agent(s)", agents.size());
		agents.keySet().forEach(this::release);
	}
}
