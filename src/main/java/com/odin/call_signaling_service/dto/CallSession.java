package com.odin.call_signaling_service.dto;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.exception.InvalidCallTransitionException;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted record of one call attempt. Owned by the session store; agents only ever
 * hold copies and propose new versions through {@link #transitionTo(CallStatus, Instant)}.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallSession {

	private String id;
	private String callerId;
	private String receiverId;
	private CallType callType;
	private CallStatus status;
	private Instant createdAt;
	private Instant startedAt;     // set once, on entry to ACCEPTED
	private Instant endedAt;       // set once, on entry to a terminal status
	private long version;

	public boolean involves(String userId) {
		return userId != null && (userId.equals(callerId) || userId.equals(receiverId));
	}

	public String peerOf(String userId) {
		return Objects.equals(userId, callerId) ? receiverId : callerId;
	}

	@JsonIgnore
	public boolean isTerminal() {
		return status != null && status.isTerminal();
	}

	@JsonIgnore
	public boolean isLive() {
		return status == CallStatus.PENDING || status == CallStatus.ACCEPTED;
	}

	/**
	 * Copy of this session moved to {@code next}, stamped with {@code at}. The copy keeps
	 * the current version so the store can compare-and-swap against it.
	 */
	public CallSession transitionTo(CallStatus next, Instant at) {
		if (status == null || !status.canTransitionTo(next)) {
			throw new InvalidCallTransitionException(id, "Cannot move call from " + status + " to " + next);
		}
		CallSessionBuilder builder = toBuilder().status(next);
		if (next == CallStatus.ACCEPTED) {
			builder.startedAt(at);
		}
		if (next.isTerminal()) {
			builder.endedAt(at);
		}
		return builder.build();
	}

	public boolean isNewerThan(CallSession other) {
		return other == null || version > other.version;
	}
}
