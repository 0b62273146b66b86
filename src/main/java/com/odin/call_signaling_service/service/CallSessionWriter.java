package com.odin.call_signaling_service.service;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.retry.support.RetryTemplate;

import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.exception.InvalidCallSessionException;
import com.odin.call_signaling_service.exception.InvalidCallTransitionException;
import com.odin.call_signaling_service.exception.StaleCallSessionException;
import com.odin.call_signaling_service.exception.StoreWriteException;
import com.odin.call_signaling_service.repo.CallSessionStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs session store writes off the agent loop.
 *
 * A {@link StoreWriteException} is retried through the {@link RetryTemplate}. A lost
 * compare-and-swap reloads the record and tries again while the transition is still
 * legal. When the reloaded record has already moved past the requested status (the peer
 * ended the call, or accepted it while this side was marking it missed) that record is
 * returned instead of an error so the agent can mirror it.
 */
@Slf4j
public class CallSessionWriter {

	private static final int MAX_STALE_RELOADS = 5;

	private final CallSessionStore store;
	private final RetryTemplate retryTemplate;
	private final Executor executor;
	private final Clock clock;

	public CallSessionWriter(CallSessionStore store, RetryTemplate retryTemplate, Executor executor, Clock clock) {
		this.store = store;
		this.retryTemplate = retryTemplate;
		this.executor = executor;
		this.clock = clock;
	}

	/**
	 * The call id is fixed before the first attempt, so a retry after a lost reply finds
	 * the session the earlier attempt stored instead of adding a second one.
	 */
	public CompletableFuture<CallSession> create(CallSession draft) {
		CallSession keyed = draft.getId() != null ? draft : draft.toBuilder().id(UUID.randomUUID().toString()).build();
		return CompletableFuture.supplyAsync(() -> retryTemplate.execute(ctx -> {
			if (ctx.getRetryCount() > 0) {
				log.warn("Retrying creation of call {} ({} -> {}, attempt {})", keyed.getId(), keyed.getCallerId(),
						keyed.getReceiverId(), ctx.getRetryCount() + 1);
			}
			return store.create(keyed);
		}), executor);
	}

	/**
	 * Moves {@code known} to {@code next}. The returned record is either the one just
	 * written or, when a concurrent write got there first and made {@code next}
	 * unreachable, the stored record.
	 */
	public CompletableFuture<CallSession> transition(CallSession known, CallStatus next) {
		return CompletableFuture.supplyAsync(() -> write(known, next), executor);
	}

	CallSession write(CallSession known, CallStatus next) {
		CallSession current = known;
		for (int reload = 0; ; reload++) {
			if (current.getStatus() == next) {
				return current;
			}
			if (!current.getStatus().canTransitionTo(next)) {
				if (current.isTerminal() || reload > 0) {
					log.info("Call {} already {}, adopting stored record instead of writing {}", current.getId(),
							current.getStatus(), next);
					return current;
				}
				throw new InvalidCallTransitionException(current.getId(),
						"Cannot move call from " + current.getStatus() + " to " + next);
			}
			CallSession proposed = current.transitionTo(next, clock.instant());
			try {
				return retryTemplate.execute(ctx -> {
					if (ctx.getRetryCount() > 0) {
						log.warn("Retrying {} write for call {} (attempt {})", next, proposed.getId(),
								ctx.getRetryCount() + 1);
					}
					return store.update(proposed);
				});
			} catch (StaleCallSessionException e) {
				if (reload >= MAX_STALE_RELOADS) {
					throw e;
				}
				log.warn("Stale write of {} for call {} at v{}, reloading", next, current.getId(), current.getVersion());
				current = reload(current.getId());
			}
		}
	}

	private CallSession reload(String callId) {
		return retryTemplate.execute(ctx -> store.find(callId))
				.orElseThrow(() -> new InvalidCallSessionException(callId, "Call session disappeared: " + callId));
	}
}
