package com.odin.call_signaling_service.repo;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallSessionEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * Single-process store. Events are dispatched synchronously on the writing thread.
 */
@Slf4j
public class InMemoryCallSessionStore extends AbstractCallSessionStore {

	private final ConcurrentHashMap<String, CallSession> sessions = new ConcurrentHashMap<>();

	public InMemoryCallSessionStore(Clock clock) {
		super(clock);
	}

	@Override
	public CallSession create(CallSession draft) {
		CallSession session = prepareInsert(draft);
		CallSession existing = sessions.putIfAbsent(session.getId(), session);
		if (existing != null) {
			return existingInsert(existing, session);
		}
		log.info("CALL SESSION CREATED: {} ({} -> {}, {})", session.getId(), session.getCallerId(),
				session.getReceiverId(), session.getCallType());
		dispatch(CallSessionEvent.insert(session));
		return session;
	}

	@Override
	public CallSession update(CallSession proposed) {
		CallSession next;
		synchronized (sessions) {
			next = prepareUpdate(sessions.get(proposed.getId()), proposed);
			sessions.put(next.getId(), next);
		}
		log.info("CALL SESSION [{}] STATE UPDATED → {} (v{})", next.getId(), next.getStatus(), next.getVersion());
		dispatch(CallSessionEvent.update(next));
		return next;
	}

	@Override
	public Optional<CallSession> find(String callId) {
		return Optional.ofNullable(sessions.get(callId));
	}

	@Override
	public List<CallSession> findByParticipant(String participantId, int limit) {
		return sessions.values().stream()
				.filter(s -> s.involves(participantId))
				.sorted(Comparator.comparing(CallSession::getCreatedAt).reversed())
				.limit(limit)
				.collect(Collectors.toList());
	}
}
