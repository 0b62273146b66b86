package com.odin.call_signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.odin.call_signaling_service.config.CallProperties;
import com.odin.call_signaling_service.config.RetryConfig;
import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallView;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.enums.CallFailure;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.enums.MediaKind;
import com.odin.call_signaling_service.enums.NegotiationRole;
import com.odin.call_signaling_service.enums.PeerConnectionState;
import com.odin.call_signaling_service.enums.SignalType;
import com.odin.call_signaling_service.exception.CallAlreadyActiveException;
import com.odin.call_signaling_service.exception.InvalidCallSessionException;
import com.odin.call_signaling_service.exception.MediaAccessDeniedException;
import com.odin.call_signaling_service.exception.NoActiveCallException;
import com.odin.call_signaling_service.exception.SignalingDeliveryException;
import com.odin.call_signaling_service.exception.StoreWriteException;
import com.odin.call_signaling_service.repo.InMemoryCallSessionStore;
import com.odin.call_signaling_service.service.impl.InMemorySignalingTransport;
import com.odin.call_signaling_service.support.FakeLocalMediaStream;
import com.odin.call_signaling_service.support.FakeMediaDevices;
import com.odin.call_signaling_service.support.FakeMediaTrack;
import com.odin.call_signaling_service.support.FakePeerConnection;
import com.odin.call_signaling_service.support.FakePeerConnectionFactory;
import com.odin.call_signaling_service.support.ManualEventLoop;
import com.odin.call_signaling_service.support.MutableClock;
import com.odin.call_signaling_service.utility.Subscription;

/**
 * Two or three call agents wired to an in-memory store and call channel, with fake media.
 * Every loop is drained by hand, so each test runs deterministically on the test thread.
 */
@ExtendWith(MockitoExtension.class)
class CallSessionControllerTest {

	@Mock
	private MissedCallNotificationService missedCallNotifier;

	private MutableClock clock;
	private OutageStore store;
	private RecordingTransport transport;
	private CallProperties properties;
	private CallSessionWriter writer;
	private final List<Participant> participants = new ArrayList<>();

	private Participant alice;
	private Participant bob;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
		store = new OutageStore(clock);
		transport = new RecordingTransport();
		properties = new CallProperties();
		properties.getRetry().setInitialBackoff(Duration.ofMillis(1));
		properties.getRetry().setMaxBackoff(Duration.ofMillis(2));
		properties.getSignaling().setMaxDeliveryFailures(2);
		writer = new CallSessionWriter(store, RetryConfig.buildStoreRetryTemplate(properties.getRetry()),
				Runnable::run, clock);

		alice = participant("alice");
		bob = participant("bob");
	}

	private Participant participant(String id) {
		Participant participant = new Participant(id);
		participants.add(participant);
		participant.agent.start();
		drain();
		return participant;
	}

	private void drain() {
		int ran;
		do {
			ran = 0;
			for (Participant participant : participants) {
				ran += participant.loop.runAll();
			}
		} while (ran > 0);
	}

	private CallSession stored(CallSession session) {
		return store.find(session.getId()).orElseThrow();
	}

	/**
	 * alice calls bob, bob accepts, both peer connections come up.
	 */
	private CallSession connectedCall() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();
		bob.agent.acceptCall();
		drain();
		alice.pc().emitState(PeerConnectionState.CONNECTED);
		bob.pc().emitState(PeerConnectionState.CONNECTED);
		alice.pc().emitRemoteTrack(new FakeMediaTrack("bob-video", MediaKind.VIDEO));
		bob.pc().emitRemoteTrack(new FakeMediaTrack("alice-video", MediaKind.VIDEO));
		drain();
		return stored(started.join());
	}

	@Test
	void callerSeesPendingCallAndReceiverSeesIncomingCall() {
		List<CallView> bobViews = new ArrayList<>();
		bob.agent.addViewListener(bobViews::add);

		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();

		CallSession call = started.join();
		assertThat(call.getStatus()).isEqualTo(CallStatus.PENDING);
		assertThat(call.getCallerId()).isEqualTo("alice");
		assertThat(alice.agent.view().isCallActive()).isTrue();
		assertThat(alice.agent.view().getRole()).isEqualTo(NegotiationRole.OFFERER);
		assertThat(bob.agent.view().getIncomingCall().getId()).isEqualTo(call.getId());
		assertThat(bobViews).last().extracting(CallView::getIncomingCall).isNotNull();

		assertThat(alice.devices.getRequests()).hasSize(1);
		assertThat(alice.pc().getLocalDescription().getType()).isEqualTo("offer");
		assertThat(transport.sent).isEmpty();
		assertThat(bob.devices.getRequests()).isEmpty();
		assertThat(alice.loop.pendingDelays()).containsExactly(Duration.ofSeconds(30));
	}

	@Test
	void acceptedCallNegotiatesAndEndsCleanly() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();
		clock.advance(Duration.ofSeconds(4));

		CompletableFuture<CallSession> accepted = bob.agent.acceptCall();
		drain();

		CallSession call = stored(started.join());
		assertThat(accepted.join().getStatus()).isEqualTo(CallStatus.ACCEPTED);
		assertThat(call.getStatus()).isEqualTo(CallStatus.ACCEPTED);
		assertThat(call.getStartedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:04Z"));
		assertThat(transport.sent).extracting(SignalingMessage::getType)
				.containsExactly(SignalType.OFFER, SignalType.ANSWER);
		assertThat(bob.pc().getRemoteDescription().getType()).isEqualTo("offer");
		assertThat(alice.pc().getRemoteDescription().getType()).isEqualTo("answer");
		assertThat(alice.loop.pendingDelays()).isEmpty();

		alice.pc().emitCandidate(new IceCandidatePayload("candidate:1", "0", 0));
		bob.pc().emitCandidate(new IceCandidatePayload("candidate:2", "0", 0));
		alice.pc().emitState(PeerConnectionState.CONNECTED);
		bob.pc().emitState(PeerConnectionState.CONNECTED);
		bob.pc().emitRemoteTrack(new FakeMediaTrack("alice-video", MediaKind.VIDEO));
		drain();

		assertThat(bob.pc().getAddedCandidates()).extracting(IceCandidatePayload::getCandidate)
				.containsExactly("candidate:1");
		assertThat(alice.pc().getAddedCandidates()).extracting(IceCandidatePayload::getCandidate)
				.containsExactly("candidate:2");
		assertThat(alice.agent.view().isConnected()).isTrue();
		assertThat(bob.agent.view().isRemoteMediaAvailable()).isTrue();

		clock.advance(Duration.ofMinutes(2));
		CompletableFuture<CallSession> ended = alice.agent.endCall();
		drain();

		CallSession finished = stored(call);
		assertThat(ended.join().getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(finished.getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(finished.getEndedAt()).isEqualTo(Instant.parse("2024-05-01T10:02:04Z"));
		assertThat(alice.pc().getCloseCount()).isEqualTo(1);
		assertThat(bob.pc().getCloseCount()).isEqualTo(1);
		assertThat(alice.stream().isStopped()).isTrue();
		assertThat(bob.stream().isStopped()).isTrue();
		assertThat(alice.agent.view().isCallActive()).isFalse();
		assertThat(bob.agent.view().getCurrentCall().getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(bob.agent.view().isConnected()).isFalse();
	}

	@Test
	void endingTwiceChangesNothing() {
		CallSession call = connectedCall();

		bob.agent.endCall();
		drain();
		CallSession afterFirst = stored(call);

		CompletableFuture<CallSession> second = bob.agent.endCall();
		drain();

		assertThat(second.join()).isEqualTo(afterFirst);
		assertThat(stored(call).getVersion()).isEqualTo(afterFirst.getVersion());
		assertThat(alice.pc().getCloseCount()).isEqualTo(1);
		assertThat(bob.pc().getCloseCount()).isEqualTo(1);
	}

	@Test
	void rejectedCallNeverTouchesReceiverMedia() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.AUDIO);
		drain();

		CompletableFuture<CallSession> rejected = bob.agent.rejectCall();
		drain();

		assertThat(rejected.join().getStatus()).isEqualTo(CallStatus.REJECTED);
		assertThat(stored(started.join()).getEndedAt()).isNotNull();
		assertThat(bob.devices.getRequests()).isEmpty();
		assertThat(alice.agent.view().getCurrentCall().getStatus()).isEqualTo(CallStatus.REJECTED);
		assertThat(alice.agent.view().isCallActive()).isFalse();
		assertThat(alice.pc().isClosed()).isTrue();
		assertThat(alice.stream().isStopped()).isTrue();
		assertThat(alice.loop.pendingDelays()).isEmpty();
		assertThat(bob.agent.view().getIncomingCall()).isNull();
	}

	@Test
	void receiverWithoutMediaPermissionRejectsTheCall() {
		bob.devices.setMode(FakeMediaDevices.Mode.DENY);
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();

		CompletableFuture<CallSession> accepted = bob.agent.acceptCall();
		drain();

		assertThatThrownBy(accepted::join).hasCauseInstanceOf(MediaAccessDeniedException.class);
		assertThat(bob.agent.view().getFailure()).isEqualTo(CallFailure.MEDIA_ACCESS_DENIED);
		assertThat(bob.factory.getCreated()).isEmpty();
		assertThat(stored(started.join()).getStatus()).isEqualTo(CallStatus.REJECTED);
		assertThat(alice.pc().isClosed()).isTrue();
		assertThat(alice.agent.view().isCallActive()).isFalse();
		assertThat(transport.sent).isEmpty();
	}

	@Test
	void callerWithoutMediaPermissionEndsTheCall() {
		alice.devices.setMode(FakeMediaDevices.Mode.DENY);

		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();

		assertThat(stored(started.join()).getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(alice.agent.view().getFailure()).isEqualTo(CallFailure.MEDIA_ACCESS_DENIED);
		assertThat(alice.factory.getCreated()).isEmpty();
		assertThat(bob.agent.view().getIncomingCall()).isNull();
	}

	@Test
	void lostPeerConnectionEndsTheCallOnBothSides() {
		CallSession call = connectedCall();

		alice.pc().emitState(PeerConnectionState.DISCONNECTED);
		bob.pc().emitState(PeerConnectionState.FAILED);
		drain();

		CallSession finished = stored(call);
		assertThat(finished.getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(finished.getVersion()).isEqualTo(call.getVersion() + 1);
		for (Participant participant : List.of(alice, bob)) {
			assertThat(participant.agent.view().getFailure()).isEqualTo(CallFailure.CALL_ENDED);
			assertThat(participant.agent.view().isCallActive()).isFalse();
			assertThat(participant.pc().getCloseCount()).isEqualTo(1);
			assertThat(participant.stream().isStopped()).isTrue();
		}
	}

	@Test
	void unansweredCallIsMarkedMissedByTheCaller() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();
		clock.advance(Duration.ofSeconds(30));

		alice.loop.fireScheduled();
		drain();

		CallSession missed = stored(started.join());
		assertThat(missed.getStatus()).isEqualTo(CallStatus.MISSED);
		assertThat(missed.getEndedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:30Z"));
		ArgumentCaptor<CallSession> notified = ArgumentCaptor.forClass(CallSession.class);
		verify(missedCallNotifier).publishMissedCall(notified.capture());
		assertThat(notified.getValue().getStatus()).isEqualTo(CallStatus.MISSED);
		assertThat(alice.pc().isClosed()).isTrue();
		assertThat(bob.agent.view().getIncomingCall()).isNull();
		assertThat(bob.agent.view().getCurrentCall().getStatus()).isEqualTo(CallStatus.MISSED);
	}

	@Test
	void answeredCallIsNeverMarkedMissed() {
		CallSession call = connectedCall();

		alice.loop.fireScheduled();
		drain();

		assertThat(stored(call).getStatus()).isEqualTo(CallStatus.ACCEPTED);
		verify(missedCallNotifier, never()).publishMissedCall(any());
	}

	@Test
	void missedTimerFiringAsTheReceiverAcceptsLetsTheCallProceed() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();
		clock.advance(Duration.ofSeconds(30));

		CompletableFuture<CallSession> accepted = bob.agent.acceptCall();
		bob.loop.runAll();
		assertThat(accepted.join().getStatus()).isEqualTo(CallStatus.ACCEPTED);

		// alice has not yet seen the ACCEPTED when her timer fires
		alice.loop.fireScheduled();
		drain();

		assertThat(stored(started.join()).getStatus()).isEqualTo(CallStatus.ACCEPTED);
		assertThat(transport.sent).extracting(SignalingMessage::getType)
				.containsExactly(SignalType.OFFER, SignalType.ANSWER);
		assertThat(bob.pc().getRemoteDescription().getType()).isEqualTo("offer");
		assertThat(alice.pc().getRemoteDescription().getType()).isEqualTo("answer");
		assertThat(alice.pc().isClosed()).isFalse();
		assertThat(alice.agent.view().isCallActive()).isTrue();
		assertThat(alice.agent.view().getRole()).isEqualTo(NegotiationRole.OFFERER);
		verify(missedCallNotifier, never()).publishMissedCall(any());
	}

	@Test
	void acceptThatCannotBeStoredEndsTheCallInsteadOfLeavingItRinging() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();
		store.failNextUpdates(3);

		CompletableFuture<CallSession> accepted = bob.agent.acceptCall();
		drain();

		assertThatThrownBy(accepted::join).hasCauseInstanceOf(StoreWriteException.class);
		assertThat(stored(started.join()).getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(bob.agent.view().isCallActive()).isFalse();
		assertThat(bob.agent.view().getFailure()).isEqualTo(CallFailure.CALL_ENDED);
		assertThat(bob.pc().isClosed()).isTrue();
		assertThat(bob.stream().isStopped()).isTrue();
		assertThat(alice.pc().isClosed()).isTrue();
		assertThat(alice.agent.view().isCallActive()).isFalse();
		assertThat(transport.sent).isEmpty();

		CompletableFuture<CallSession> callBack = bob.agent.startCall("alice", CallType.AUDIO);
		drain();
		assertThat(callBack.join().getStatus()).isEqualTo(CallStatus.PENDING);
	}

	@Test
	void secondOutgoingCallWhileBusyIsRefused() {
		alice.agent.startCall("bob", CallType.VIDEO);
		drain();

		CompletableFuture<CallSession> second = alice.agent.startCall("carol", CallType.AUDIO);
		drain();

		assertThatThrownBy(second::join).hasCauseInstanceOf(CallAlreadyActiveException.class);
		assertThat(store.findByParticipant("carol", 10)).isEmpty();
	}

	@Test
	void busyReceiverRejectsAnotherIncomingCall() {
		Participant carol = participant("carol");
		CompletableFuture<CallSession> first = alice.agent.startCall("bob", CallType.VIDEO);
		drain();

		CompletableFuture<CallSession> second = carol.agent.startCall("bob", CallType.VIDEO);
		drain();

		assertThat(stored(second.join()).getStatus()).isEqualTo(CallStatus.REJECTED);
		assertThat(carol.agent.view().isCallActive()).isFalse();
		assertThat(carol.pc().isClosed()).isTrue();
		assertThat(bob.agent.view().getIncomingCall().getId()).isEqualTo(first.join().getId());
		assertThat(stored(first.join()).getStatus()).isEqualTo(CallStatus.PENDING);
	}

	@Test
	void callingYourselfFailsAndLeavesTheAgentIdle() {
		CompletableFuture<CallSession> self = alice.agent.startCall("alice", CallType.VIDEO);
		drain();

		assertThatThrownBy(self::join).hasCauseInstanceOf(InvalidCallSessionException.class);

		CompletableFuture<CallSession> next = alice.agent.startCall("bob", CallType.VIDEO);
		drain();
		assertThat(next.join().getStatus()).isEqualTo(CallStatus.PENDING);
	}

	@Test
	void callerCanCancelWhileRinging() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();

		alice.agent.endCall();
		drain();

		assertThat(stored(started.join()).getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(bob.agent.view().getIncomingCall()).isNull();
		assertThat(alice.loop.pendingDelays()).isEmpty();

		CompletableFuture<CallSession> accepted = bob.agent.acceptCall();
		drain();
		assertThatThrownBy(accepted::join).hasCauseInstanceOf(NoActiveCallException.class);
	}

	@Test
	void endBeforeCreationCompletesEndsTheNewCall() {
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		alice.agent.endCall();
		drain();

		assertThat(stored(started.join()).getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(alice.devices.getRequests()).isEmpty();
		assertThat(bob.agent.view().getIncomingCall()).isNull();
	}

	@Test
	void mediaGrantedAfterHangUpIsReleased() {
		alice.devices.setMode(FakeMediaDevices.Mode.HOLD);
		CompletableFuture<CallSession> started = alice.agent.startCall("bob", CallType.VIDEO);
		drain();
		alice.agent.endCall();
		drain();

		FakeLocalMediaStream late = alice.devices.releaseHeld();
		drain();

		assertThat(late.isStopped()).isTrue();
		assertThat(alice.factory.getCreated()).isEmpty();
		assertThat(stored(started.join()).getStatus()).isEqualTo(CallStatus.ENDED);
	}

	@Test
	void togglesFlipTracksWithoutSignaling() {
		connectedCall();
		int sent = transport.sent.size();

		CompletableFuture<Boolean> video = alice.agent.toggleVideo();
		CompletableFuture<Boolean> audio = alice.agent.toggleAudio();
		drain();

		assertThat(video.join()).isFalse();
		assertThat(audio.join()).isFalse();
		assertThat(alice.agent.view().isVideoEnabled()).isFalse();
		assertThat(alice.agent.view().isAudioEnabled()).isFalse();
		assertThat(alice.stream().getVideoTracks()).allMatch(t -> !t.isEnabled());
		assertThat(transport.sent).hasSize(sent);
		assertThat(alice.factory.getCreated()).hasSize(1);
	}

	@Test
	void toggleWithoutACallFails() {
		CompletableFuture<Boolean> video = alice.agent.toggleVideo();
		drain();

		assertThatThrownBy(video::join).hasCauseInstanceOf(NoActiveCallException.class);
	}

	@Test
	void repeatedSignalingFailuresAreReportedButDoNotEndTheCall() {
		CallSession call = connectedCall();

		transport.failing = true;
		alice.pc().emitCandidate(new IceCandidatePayload("candidate:a", "0", 0));
		drain();
		assertThat(alice.agent.view().getFailure()).isEqualTo(CallFailure.NONE);

		alice.pc().emitCandidate(new IceCandidatePayload("candidate:b", "0", 0));
		drain();
		assertThat(alice.agent.view().getFailure()).isEqualTo(CallFailure.SIGNALING_UNAVAILABLE);
		assertThat(alice.agent.view().isCallActive()).isTrue();
		assertThat(stored(call).getStatus()).isEqualTo(CallStatus.ACCEPTED);

		transport.failing = false;
		alice.pc().emitCandidate(new IceCandidatePayload("candidate:c", "0", 0));
		drain();
		assertThat(alice.agent.view().getFailure()).isEqualTo(CallFailure.NONE);
		assertThat(bob.pc().getAddedCandidates()).extracting(IceCandidatePayload::getCandidate)
				.containsExactly("candidate:c");
	}

	@Test
	void shutdownEndsTheLiveCall() {
		CallSession call = connectedCall();

		CompletableFuture<Void> done = alice.agent.shutdown();
		drain();

		assertThat(done).isDone();
		assertThat(alice.loop.isShutdown()).isTrue();
		assertThat(stored(call).getStatus()).isEqualTo(CallStatus.ENDED);
		assertThat(bob.pc().isClosed()).isTrue();
	}

	@Test
	void removedViewListenerStopsReceiving() {
		List<CallView> views = new ArrayList<>();
		Consumer<CallView> listener = views::add;
		alice.agent.addViewListener(listener);
		alice.agent.removeViewListener(listener);
		int initial = views.size();

		alice.agent.startCall("bob", CallType.VIDEO);
		drain();

		assertThat(views).hasSize(initial);
	}

	private final class Participant {
		private final ManualEventLoop loop = new ManualEventLoop();
		private final FakeMediaDevices devices;
		private final FakePeerConnectionFactory factory;
		private final CallSessionController agent;

		private Participant(String id) {
			devices = new FakeMediaDevices(id);
			factory = new FakePeerConnectionFactory(id);
			agent = new CallSessionController(id, store, transport, new MediaNegotiator(devices, factory), writer,
					loop, properties, missedCallNotifier);
		}

		FakePeerConnection pc() {
			return factory.last();
		}

		FakeLocalMediaStream stream() {
			return devices.lastStream();
		}
	}

	private static final class OutageStore extends InMemoryCallSessionStore {
		private int failuresLeft;

		private OutageStore(Clock clock) {
			super(clock);
		}

		void failNextUpdates(int count) {
			failuresLeft = count;
		}

		@Override
		public CallSession update(CallSession proposed) {
			if (failuresLeft > 0) {
				failuresLeft--;
				throw new StoreWriteException(proposed.getId(), "store unavailable");
			}
			return super.update(proposed);
		}
	}

	private static final class RecordingTransport implements SignalingTransport {
		private final InMemorySignalingTransport delegate = new InMemorySignalingTransport();
		private final List<SignalingMessage> sent = new ArrayList<>();
		private boolean failing;

		@Override
		public void send(SignalingMessage message) {
			if (failing) {
				throw new SignalingDeliveryException(message.getCallId(), "channel unavailable");
			}
			sent.add(message);
			delegate.send(message);
		}

		@Override
		public Subscription subscribe(String callId, String participantId, Consumer<SignalingMessage> listener) {
			return delegate.subscribe(callId, participantId, listener);
		}
	}
}
