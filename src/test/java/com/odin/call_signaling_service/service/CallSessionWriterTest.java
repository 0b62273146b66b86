package com.odin.call_signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.odin.call_signaling_service.config.CallProperties;
import com.odin.call_signaling_service.config.RetryConfig;
import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.exception.InvalidCallTransitionException;
import com.odin.call_signaling_service.exception.StaleCallSessionException;
import com.odin.call_signaling_service.exception.StoreWriteException;
import com.odin.call_signaling_service.repo.CallSessionStore;

@ExtendWith(MockitoExtension.class)
class CallSessionWriterTest {

	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

	@Mock
	private CallSessionStore store;

	private CallSessionWriter writer;

	@BeforeEach
	void setUp() {
		CallProperties.Retry retry = new CallProperties.Retry();
		retry.setMaxAttempts(3);
		retry.setInitialBackoff(Duration.ofMillis(1));
		retry.setMaxBackoff(Duration.ofMillis(2));
		writer = new CallSessionWriter(store, RetryConfig.buildStoreRetryTemplate(retry), Runnable::run,
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private static CallSession session(CallStatus status, long version) {
		return CallSession.builder()
				.id("call-1")
				.callerId("alice")
				.receiverId("bob")
				.callType(CallType.VIDEO)
				.status(status)
				.createdAt(NOW.minusSeconds(10))
				.version(version)
				.build();
	}

	@Test
	void transientStoreFailureIsRetried() {
		CallSession saved = session(CallStatus.ACCEPTED, 1);
		when(store.update(any())).thenThrow(new StoreWriteException("call-1", "timeout")).thenReturn(saved);

		CallSession result = writer.transition(session(CallStatus.PENDING, 0), CallStatus.ACCEPTED).join();

		assertThat(result).isSameAs(saved);
		ArgumentCaptor<CallSession> proposed = ArgumentCaptor.forClass(CallSession.class);
		verify(store, times(2)).update(proposed.capture());
		assertThat(proposed.getValue().getStatus()).isEqualTo(CallStatus.ACCEPTED);
		assertThat(proposed.getValue().getStartedAt()).isEqualTo(NOW);
		assertThat(proposed.getValue().getVersion()).isZero();
	}

	@Test
	void persistentStoreFailureSurfacesAfterTheLastAttempt() {
		when(store.update(any())).thenThrow(new StoreWriteException("call-1", "down"));

		assertThatThrownBy(() -> writer.transition(session(CallStatus.PENDING, 0), CallStatus.ENDED).join())
				.hasCauseInstanceOf(StoreWriteException.class);
		verify(store, times(3)).update(any());
	}

	@Test
	void staleWriteReloadsAndRetriesWhenStillLegal() {
		CallSession accepted = session(CallStatus.ACCEPTED, 1);
		CallSession ended = session(CallStatus.ENDED, 2);
		when(store.update(any())).thenThrow(new StaleCallSessionException("call-1", "v0 is old")).thenReturn(ended);
		when(store.find("call-1")).thenReturn(Optional.of(accepted));

		CallSession result = writer.transition(session(CallStatus.PENDING, 0), CallStatus.ENDED).join();

		assertThat(result).isSameAs(ended);
		ArgumentCaptor<CallSession> proposed = ArgumentCaptor.forClass(CallSession.class);
		verify(store, times(2)).update(proposed.capture());
		assertThat(proposed.getAllValues().get(1).getVersion()).isEqualTo(1);
	}

	@Test
	void staleWriteAgainstATerminalRecordAdoptsIt() {
		CallSession endedByPeer = session(CallStatus.ENDED, 1);
		when(store.update(any())).thenThrow(new StaleCallSessionException("call-1", "v0 is old"));
		when(store.find("call-1")).thenReturn(Optional.of(endedByPeer));

		CallSession result = writer.transition(session(CallStatus.PENDING, 0), CallStatus.ACCEPTED).join();

		assertThat(result).isSameAs(endedByPeer);
		verify(store, times(1)).update(any());
	}

	@Test
	void writingTheStatusAlreadyHeldIsANoOp() {
		CallSession ended = session(CallStatus.ENDED, 3);

		assertThat(writer.transition(ended, CallStatus.ENDED).join()).isSameAs(ended);
		verify(store, never()).update(any());
	}

	@Test
	void illegalTransitionOnALiveCallFailsWithoutWriting() {
		assertThatThrownBy(() -> writer.transition(session(CallStatus.ACCEPTED, 1), CallStatus.MISSED).join())
				.hasCauseInstanceOf(InvalidCallTransitionException.class);
		verify(store, never()).update(any());
	}

	@Test
	void createIsRetriedOnTransientFailure() {
		CallSession created = session(CallStatus.PENDING, 0);
		when(store.create(any())).thenThrow(new StoreWriteException(null, "timeout")).thenReturn(created);

		CallSession draft = CallSession.builder().callerId("alice").receiverId("bob").build();

		assertThat(writer.create(draft).join()).isSameAs(created);
		ArgumentCaptor<CallSession> attempts = ArgumentCaptor.forClass(CallSession.class);
		verify(store, times(2)).create(attempts.capture());
		assertThat(attempts.getAllValues().get(0).getId()).isNotBlank()
				.isEqualTo(attempts.getAllValues().get(1).getId());
	}

	@Test
	void staleWriteAgainstANewerLiveRecordAdoptsIt() {
		CallSession acceptedByPeer = session(CallStatus.ACCEPTED, 1);
		when(store.update(any())).thenThrow(new StaleCallSessionException("call-1", "v0 is old"));
		when(store.find("call-1")).thenReturn(Optional.of(acceptedByPeer));

		CallSession result = writer.transition(session(CallStatus.PENDING, 0), CallStatus.MISSED).join();

		assertThat(result).isSameAs(acceptedByPeer);
		verify(store, times(1)).update(any());
	}
}
