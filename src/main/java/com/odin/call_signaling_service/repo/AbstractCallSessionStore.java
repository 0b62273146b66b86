package com.odin.call_signaling_service.repo;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallSessionEvent;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.exception.InvalidCallSessionException;
import com.odin.call_signaling_service.exception.StaleCallSessionException;
import com.odin.call_signaling_service.utility.Subscription;

import lombok.extern.slf4j.Slf4j;

/**
 * Validation and listener fan-out shared by the store implementations.
 */
@Slf4j
public abstract class AbstractCallSessionStore implements CallSessionStore {

	private final List<ScopedListener> listeners = new CopyOnWriteArrayList<>();

	protected final Clock clock;

	protected AbstractCallSessionStore(Clock clock) {
		this.clock = clock;
	}

	@Override
	public Subscription subscribe(Predicate<CallSession> scope, Consumer<CallSessionEvent> listener) {
		ScopedListener scoped = new ScopedListener(scope, listener);
		listeners.add(scoped);
		return () -> listeners.remove(scoped);
	}

	protected void dispatch(CallSessionEvent event) {
		for (ScopedListener scoped : listeners) {
			if (!scoped.scope.test(event.getSession())) {
				continue;
			}
			try {
				scoped.listener.accept(event);
			} catch (RuntimeException e) {
				log.error("Call session listener failed for call {}: {}", event.getSession().getId(), e.getMessage(), e);
			}
		}
	}

	/**
	 * New PENDING record for a draft. A draft that already carries an id keeps it, which is
	 * how a retried create finds the record an earlier attempt stored.
	 */
	protected CallSession prepareInsert(CallSession draft) {
		if (draft == null || isBlank(draft.getCallerId()) || isBlank(draft.getReceiverId())) {
			throw new InvalidCallSessionException(null, "Caller and receiver are required");
		}
		if (draft.getCallerId().equals(draft.getReceiverId())) {
			throw new InvalidCallSessionException(null, "Caller and receiver must differ: " + draft.getCallerId());
		}
		return CallSession.builder()
				.id(isBlank(draft.getId()) ? UUID.randomUUID().toString() : draft.getId())
				.callerId(draft.getCallerId())
				.receiverId(draft.getReceiverId())
				.callType(draft.getCallType() != null ? draft.getCallType() : CallType.VIDEO)
				.status(CallStatus.PENDING)
				.createdAt(clock.instant())
				.version(0L)
				.build();
	}

	/**
	 * Next stored record for a proposed write, or an exception leaving {@code stored}
	 * untouched. Timestamps are derived from the stored record so startedAt and endedAt
	 * can only ever be set once.
	 */
	protected CallSession prepareUpdate(CallSession stored, CallSession proposed) {
		if (stored == null) {
			throw new InvalidCallSessionException(proposed.getId(), "Call session not found: " + proposed.getId());
		}
		if (!stored.getCallerId().equals(proposed.getCallerId())
				|| !stored.getReceiverId().equals(proposed.getReceiverId())
				|| stored.getCallType() != proposed.getCallType()) {
			throw new InvalidCallSessionException(stored.getId(), "Participants and call type are immutable");
		}
		if (stored.getVersion() != proposed.getVersion()) {
			throw new StaleCallSessionException(stored.getId(), "Expected version " + proposed.getVersion()
					+ " but store holds " + stored.getVersion() + " (" + stored.getStatus() + ")");
		}
		CallStatus next = proposed.getStatus();
		Instant at = next == CallStatus.ACCEPTED ? proposed.getStartedAt() : proposed.getEndedAt();
		return stored.transitionTo(next, at != null ? at : clock.instant())
				.toBuilder()
				.version(stored.getVersion() + 1)
				.build();
	}

	/**
	 * Result of a create whose id is already stored: the stored record, provided it is the
	 * same call.
	 */
	protected CallSession existingInsert(CallSession stored, CallSession attempted) {
		if (!stored.getCallerId().equals(attempted.getCallerId())
				|| !stored.getReceiverId().equals(attempted.getReceiverId())) {
			throw new InvalidCallSessionException(stored.getId(), "Call id already used by another call: " + stored.getId());
		}
		log.info("Call session {} already stored, returning it", stored.getId());
		return stored;
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	private static final class ScopedListener {
		private final Predicate<CallSession> scope;
		private final Consumer<CallSessionEvent> listener;

		private ScopedListener(Predicate<CallSession> scope, Consumer<CallSessionEvent> listener) {
			this.scope = scope;
			this.listener = listener;
		}
	}
}
