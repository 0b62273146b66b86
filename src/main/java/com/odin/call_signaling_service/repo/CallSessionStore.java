package com.odin.call_signaling_service.repo;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallSessionEvent;
import com.odin.call_signaling_service.utility.Subscription;

/**
 * Durable record of call lifecycles. Writes are blocking; agents call them off their
 * event loop through {@link com.odin.call_signaling_service.service.CallSessionWriter}.
 */
public interface CallSessionStore {

	/**
	 * Inserts a new PENDING session for the draft's caller, receiver and call type. When the
	 * draft carries an id that is already stored for the same participants, the stored
	 * session is returned and nothing is written.
	 *
	 * @throws com.odin.call_signaling_service.exception.InvalidCallSessionException if caller equals receiver
	 * @throws com.odin.call_signaling_service.exception.StoreWriteException if the store is unreachable
	 */
	CallSession create(CallSession draft);

	/**
	 * Compare-and-swap write. {@code proposed.version} must match the stored version and
	 * the stored status must allow {@code proposed.status}; otherwise nothing changes.
	 *
	 * @return the stored record with its version bumped
	 * @throws com.odin.call_signaling_service.exception.StaleCallSessionException on a version mismatch
	 * @throws com.odin.call_signaling_service.exception.InvalidCallTransitionException on an illegal transition
	 * @throws com.odin.call_signaling_service.exception.StoreWriteException if the store is unreachable
	 */
	CallSession update(CallSession proposed);

	Optional<CallSession> find(String callId);

	/**
	 * Sessions where the participant is caller or receiver, newest first.
	 */
	List<CallSession> findByParticipant(String participantId, int limit);

	/**
	 * Delivers INSERT and UPDATE events for every session matching {@code scope}.
	 */
	Subscription subscribe(Predicate<CallSession> scope, Consumer<CallSessionEvent> listener);
}
