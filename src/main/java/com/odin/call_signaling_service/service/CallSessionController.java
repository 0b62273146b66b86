package com.odin.call_signaling_service.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.MDC;

import com.odin.call_signaling_service.config.CallProperties;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallSessionEvent;
import com.odin.call_signaling_service.dto.CallView;
import com.odin.call_signaling_service.dto.SignalingMessage;
import com.odin.call_signaling_service.enums.CallFailure;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.enums.NegotiationRole;
import com.odin.call_signaling_service.exception.CallAlreadyActiveException;
import com.odin.call_signaling_service.exception.CallSignalingException;
import com.odin.call_signaling_service.exception.MediaAccessDeniedException;
import com.odin.call_signaling_service.exception.NegotiationFailureException;
import com.odin.call_signaling_service.exception.NoActiveCallException;
import com.odin.call_signaling_service.exception.SignalingDeliveryException;
import com.odin.call_signaling_service.media.LocalMediaStream;
import com.odin.call_signaling_service.repo.CallSessionStore;
import com.odin.call_signaling_service.utility.Subscription;

import lombok.extern.slf4j.Slf4j;

/**
 * Call agent of one participant.
 *
 * Public methods may be called from any thread; they only post work to the agent's
 * {@link CallEventLoop}. Everything else (store change events, call channel messages,
 * media and peer connection callbacks, write completions, the missed call timer) arrives
 * as a {@link CallEvent} on the same loop, so the fields below are only ever read and
 * written by one thread at a time.
 *
 * The caller creates its offer as soon as media is up but only sends it once it sees the
 * receiver's ACCEPTED in the store. The receiver joins the call channel and opens its
 * media before writing ACCEPTED, so the stored status doubles as proof that the offer
 * will be heard.
 */
@Slf4j
public class CallSessionController implements NegotiationSink {

	private final String participantId;
	private final CallSessionStore store;
	private final SignalingTransport transport;
	private final MediaNegotiator negotiator;
	private final CallSessionWriter writer;
	private final CallEventLoop loop;
	private final CallProperties properties;
	private final MissedCallNotificationService missedCallNotifier;

	private final List<Consumer<CallView>> viewListeners = new CopyOnWriteArrayList<>();

	private Subscription storeSubscription = Subscription.noop();
	private Subscription channelSubscription = Subscription.noop();
	private Subscription missedTimer = Subscription.noop();

	private CallSession currentCall;
	private CallSession incomingCall;
	private NegotiatorState state;

	private CompletableFuture<CallSession> pendingCreate;
	private CompletableFuture<CallSession> pendingStart;
	private CompletableFuture<CallSession> pendingAccept;
	private boolean endAfterCreate;

	private CallFailure failure = CallFailure.NONE;
	private int deliveryFailures;
	private boolean shutdown;

	private volatile CallView view;

	public CallSessionController(String participantId, CallSessionStore store, SignalingTransport transport,
			MediaNegotiator negotiator, CallSessionWriter writer, CallEventLoop loop, CallProperties properties,
			MissedCallNotificationService missedCallNotifier) {
		this.participantId = participantId;
		this.store = store;
		this.transport = transport;
		this.negotiator = negotiator;
		this.writer = writer;
		this.loop = loop;
		this.properties = properties;
		this.missedCallNotifier = missedCallNotifier;
		this.view = CallView.builder().participantId(participantId).failure(CallFailure.NONE).build();
	}

	/**
	 * Starts listening for sessions this participant is part of.
	 */
	public void start() {
		loop.execute(() -> {
			storeSubscription = store.subscribe(s -> s.involves(participantId),
					event -> post(CallEvent.sessionChanged(event)));
			log.info("Call agent started for {}", participantId);
			publishView();
		});
	}

	public String getParticipantId() {
		return participantId;
	}

	public CallView view() {
		return view;
	}

	public void addViewListener(Consumer<CallView> listener) {
		viewListeners.add(listener);
		listener.accept(view);
	}

	public void removeViewListener(Consumer<CallView> listener) {
		viewListeners.remove(listener);
	}


	public CompletableFuture<CallSession> startCall(String receiverId, CallType callType) {
		CompletableFuture<CallSession> result = new CompletableFuture<>();
		loop.execute(() -> {
			doStartCall(receiverId, callType, result);
			publishView();
		});
		return result;
	}

	public CompletableFuture<CallSession> acceptCall() {
		CompletableFuture<CallSession> result = new CompletableFuture<>();
		loop.execute(() -> {
			doAcceptCall(result);
			publishView();
		});
		return result;
	}

	public CompletableFuture<CallSession> rejectCall() {
		CompletableFuture<CallSession> result = new CompletableFuture<>();
		loop.execute(() -> {
			doRejectCall(result);
			publishView();
		});
		return result;
	}

	/**
	 * Ends the live call from either side. Ending when there is nothing to end completes
	 * with the last known session and has no other effect.
	 */
	public CompletableFuture<CallSession> endCall() {
		CompletableFuture<CallSession> result = new CompletableFuture<>();
		loop.execute(() -> {
			doEndCall(result);
			publishView();
		});
		return result;
	}

	public CompletableFuture<Boolean> toggleVideo() {
		CompletableFuture<Boolean> result = new CompletableFuture<>();
		loop.execute(() -> {
			if (state == null) {
				result.completeExceptionally(new NoActiveCallException(null, "No call to toggle video on"));
				return;
			}
			result.complete(negotiator.toggleVideo(state));
			publishView();
		});
		return result;
	}

	public CompletableFuture<Boolean> toggleAudio() {
		CompletableFuture<Boolean> result = new CompletableFuture<>();
		loop.execute(() -> {
			if (state == null) {
				result.completeExceptionally(new NoActiveCallException(null, "No call to toggle audio on"));
				return;
			}
			result.complete(negotiator.toggleAudio(state));
			publishView();
		});
		return result;
	}

	/**
	 * Stops the agent. A live call is ended and torn down first; a call still ringing on
	 * this side is left to the caller's missed call timer.
	 */
	public CompletableFuture<Void> shutdown() {
		CompletableFuture<Void> done = new CompletableFuture<>();
		loop.execute(() -> doShutdown(done));
		return done.whenComplete((ignored, error) -> loop.shutdown());
	}

	private void doStartCall(String receiverId, CallType callType, CompletableFuture<CallSession> result) {
		if (shutdown) {
			result.completeExceptionally(new CallSignalingException(null, "Call agent is shut down"));
			return;
		}
		if (isBusy()) {
			String busyWith = currentCall != null ? currentCall.getId()
					: incomingCall != null ? incomingCall.getId() : null;
			log.warn("{} tried to call {} while busy with call {}", participantId, receiverId, busyWith);
			result.completeExceptionally(new CallAlreadyActiveException(busyWith,
					"A call is already in progress for " + participantId));
			return;
		}
		log.info("{} starting {} call to {}", participantId, callType, receiverId);
		failure = CallFailure.NONE;
		currentCall = null;
		endAfterCreate = false;
		pendingStart = result;
		CallSession draft = CallSession.builder()
				.callerId(participantId)
				.receiverId(receiverId)
				.callType(callType != null ? callType : CallType.VIDEO)
				.build();
		pendingCreate = writer.create(draft);
		pendingCreate.whenComplete((created, error) -> {
			if (error != null) {
				post(CallEvent.createFailed(MediaNegotiator.unwrap(error)));
			} else {
				post(CallEvent.callCreated(created));
			}
		});
	}

	private void doAcceptCall(CompletableFuture<CallSession> result) {
		if (incomingCall == null || incomingCall.getStatus() != CallStatus.PENDING) {
			result.completeExceptionally(new NoActiveCallException(null, "No incoming call to accept"));
			return;
		}
		if (state != null) {
			result.completeExceptionally(new CallAlreadyActiveException(state.getCallId(), "Call is already being set up"));
			return;
		}
		CallSession call = incomingCall;
		incomingCall = null;
		currentCall = call;
		failure = CallFailure.NONE;
		pendingAccept = result;
		MDC.put(ApplicationConstants.MDC_CALL_ID, call.getId());
		log.info("{} accepting call {} from {}", participantId, call.getId(), call.getCallerId());

		// join the channel before ACCEPTED is persisted so the offer cannot be missed
		channelSubscription = joinChannel(call.getId());
		state = new NegotiatorState(call.getId(), participantId, NegotiationRole.ANSWERER, call.getCallType());
		negotiator.acquireMedia(state, this);
	}

	private void doRejectCall(CompletableFuture<CallSession> result) {
		if (incomingCall == null || incomingCall.getStatus() != CallStatus.PENDING) {
			result.completeExceptionally(new NoActiveCallException(null, "No incoming call to reject"));
			return;
		}
		CallSession call = incomingCall;
		incomingCall = null;
		currentCall = call;
		log.info("{} rejecting call {} from {}", participantId, call.getId(), call.getCallerId());
		writeStatus(call, CallStatus.REJECTED, result);
	}

	private void doEndCall(CompletableFuture<CallSession> result) {
		if (currentCall != null && currentCall.isLive()) {
			CallSession call = currentCall;
			log.info("{} ending call {} ({})", participantId, call.getId(), call.getStatus());
			finishLocally();
			writeStatus(call, CallStatus.ENDED, result);
		} else if (incomingCall != null) {
			CallSession call = incomingCall;
			incomingCall = null;
			currentCall = call;
			log.info("{} ending incoming call {} before answering", participantId, call.getId());
			writeStatus(call, CallStatus.ENDED, result);
		} else if (pendingStart != null) {
			log.info("{} ending a call that is still being created", participantId);
			endAfterCreate = true;
			result.complete(null);
		} else {
			log.debug("endCall for {}: nothing to end", participantId);
			result.complete(currentCall);
		}
	}

	private void doShutdown(CompletableFuture<Void> done) {
		if (shutdown) {
			done.complete(null);
			return;
		}
		shutdown = true;
		storeSubscription.cancel();
		viewListeners.clear();
		log.info("Shutting down call agent for {}", participantId);

		CompletableFuture<CallSession> ending;
		if (currentCall != null && currentCall.isLive()) {
			CallSession call = currentCall;
			finishLocally();
			ending = writer.transition(call, CallStatus.ENDED);
		} else if (pendingStart != null) {
			ending = pendingCreate.thenCompose(created -> writer.transition(created, CallStatus.ENDED));
		} else {
			finishLocally();
			ending = CompletableFuture.completedFuture(currentCall);
		}
		ending.whenComplete((ended, error) -> {
			if (error != null) {
				log.error("Could not end call of {} on shutdown: {}", participantId, error.getMessage(), error);
			}
			done.complete(null);
		});
	}


	@Override
	public void post(CallEvent event) {
		loop.execute(() -> {
			handle(event);
			publishView();
		});
	}

	void handle(CallEvent event) {
		if (event.getCallId() != null) {
			MDC.put(ApplicationConstants.MDC_CALL_ID, event.getCallId());
		}
		if (event.getState() != null && event.getState() != state) {
			// results for a torn-down negotiation; captured media still has to be released
			if (event.getType() == CallEvent.Type.MEDIA_ACQUIRED) {
				negotiator.onMediaAcquired(event.getState(), event.getStream(), this);
			} else {
				log.debug("Dropping {} for a closed negotiation of call {}", event.getType(), event.getCallId());
			}
			return;
		}
		switch (event.getType()) {
		case SESSION_CHANGED:
			onSessionChanged(event.getSessionEvent());
			break;
		case SIGNAL_RECEIVED:
			onSignal(event.getSignal());
			break;
		case CALL_CREATED:
			onCallCreated(event.getSession());
			break;
		case CREATE_FAILED:
			onCreateFailed(event.getError());
			break;
		case WRITE_COMPLETED:
			onWriteCompleted(event.getSession());
			break;
		case WRITE_FAILED:
			onWriteFailed(event.getCallId(), event.getError());
			break;
		case MEDIA_ACQUIRED:
			onMediaAcquired(event.getStream());
			break;
		case MEDIA_FAILED:
			onMediaFailed(event.getError());
			break;
		case LOCAL_DESCRIPTION_CREATED:
			negotiator.onLocalDescriptionCreated(state, event.getDescription(), this);
			break;
		case LOCAL_DESCRIPTION_READY:
			negotiator.onLocalDescriptionReady(state, event.getDescription(), this);
			break;
		case REMOTE_DESCRIPTION_APPLIED:
			negotiator.onRemoteDescriptionApplied(state, this);
			break;
		case NEGOTIATION_FAILED:
			endOnNegotiationFailure(MediaNegotiator.asNegotiationFailure(state.getCallId(), event.getError()));
			break;
		case LOCAL_CANDIDATE:
			negotiator.onLocalCandidate(state, event.getCandidate(), this);
			break;
		case CONNECTION_STATE_CHANGED:
			if (negotiator.onConnectionStateChange(state, event.getConnectionState())) {
				endOnNegotiationFailure(new NegotiationFailureException(state.getCallId(),
						"Peer connection " + event.getConnectionState()));
			}
			break;
		case REMOTE_TRACK:
			negotiator.onRemoteTrack(state, event.getTrack());
			break;
		case MISSED_TIMEOUT:
			onMissedTimeout(event.getCallId());
			break;
		default:
			log.warn("Unhandled call event {}", event.getType());
		}
	}

	private void onCallCreated(CallSession session) {
		CompletableFuture<CallSession> reply = pendingStart;
		pendingStart = null;
		if (shutdown) {
			return;
		}
		currentCall = session;
		if (endAfterCreate) {
			endAfterCreate = false;
			log.info("Call {} was ended while being created", session.getId());
			complete(reply, session);
			writeStatus(session, CallStatus.ENDED, null);
			return;
		}
		log.info("Call {} created: {} -> {} ({})", session.getId(), session.getCallerId(), session.getReceiverId(),
				session.getCallType());
		channelSubscription = joinChannel(session.getId());
		state = new NegotiatorState(session.getId(), participantId, NegotiationRole.OFFERER, session.getCallType());
		missedTimer = loop.schedule(() -> {
			handle(CallEvent.missedTimeout(session.getId()));
			publishView();
		}, properties.getMissedTimeout());
		negotiator.acquireMedia(state, this);
		complete(reply, session);
	}

	private void onCreateFailed(Throwable error) {
		CompletableFuture<CallSession> reply = pendingStart;
		pendingStart = null;
		endAfterCreate = false;
		log.error("{} could not create call: {}", participantId, error.getMessage(), error);
		failure = CallFailure.CALL_ENDED;
		if (reply != null) {
			reply.completeExceptionally(error);
		}
	}

	private void onSessionChanged(CallSessionEvent event) {
		CallSession session = event.getSession();
		if (currentCall != null && currentCall.getId().equals(session.getId())) {
			applyToCurrentCall(session);
		} else if (incomingCall != null && incomingCall.getId().equals(session.getId())) {
			if (!session.isNewerThan(incomingCall)) {
				return;
			}
			incomingCall = session;
			if (session.isTerminal()) {
				log.info("Incoming call {} is now {}", session.getId(), session.getStatus());
				incomingCall = null;
				if (currentCall == null || !currentCall.isLive()) {
					currentCall = session;
				}
			}
		} else if (event.getType() == CallSessionEvent.Type.INSERT
				&& participantId.equals(session.getReceiverId())
				&& session.getStatus() == CallStatus.PENDING) {
			onIncomingCall(session);
		} else {
			log.debug("Ignoring {} of unrelated call {} ({})", event.getType(), session.getId(), session.getStatus());
		}
	}

	private void onIncomingCall(CallSession session) {
		if (shutdown) {
			return;
		}
		if (isBusy()) {
			log.info("{} is busy, rejecting incoming call {} from {}", participantId, session.getId(),
					session.getCallerId());
			writer.transition(session, CallStatus.REJECTED).whenComplete((rejected, error) -> {
				if (error != null) {
					log.error("Could not reject call {} while busy: {}", session.getId(), error.getMessage(), error);
				}
			});
			return;
		}
		log.info("Incoming {} call {} from {}", session.getCallType(), session.getId(), session.getCallerId());
		incomingCall = session;
		failure = CallFailure.NONE;
	}

	/**
	 * Mirrors a newer version of the current call, whether it came from the peer through
	 * the store subscription or from this agent's own write.
	 */
	private void applyToCurrentCall(CallSession session) {
		if (!session.isNewerThan(currentCall)) {
			return;
		}
		CallStatus previous = currentCall.getStatus();
		currentCall = session;
		if (session.getStatus() == previous) {
			return;
		}
		log.info("Call {} moved {} -> {} (v{})", session.getId(), previous, session.getStatus(), session.getVersion());

		if (session.getStatus() == CallStatus.ACCEPTED) {
			missedTimer.cancel();
			if (state != null && state.isOfferer()) {
				negotiator.onPeerListening(state, this);
			}
			if (pendingAccept != null && participantId.equals(session.getReceiverId())) {
				complete(pendingAccept, session);
				pendingAccept = null;
			}
		} else if (session.isTerminal()) {
			finishLocally();
		}
	}

	private void onWriteCompleted(CallSession saved) {
		if (currentCall != null && currentCall.getId().equals(saved.getId())) {
			applyToCurrentCall(saved);
		}
		if (saved.getStatus() == CallStatus.MISSED && participantId.equals(saved.getCallerId())) {
			missedCallNotifier.publishMissedCall(saved);
		}
	}

	private void onWriteFailed(String callId, Throwable error) {
		log.error("Session write failed for call {}: {}", callId, error.getMessage(), error);
		if (currentCall == null || !currentCall.getId().equals(callId)) {
			return;
		}
		failure = CallFailure.CALL_ENDED;
		if (pendingAccept != null) {
			pendingAccept.completeExceptionally(error);
			pendingAccept = null;
		}
		CallSession call = currentCall;
		currentCall = null;
		finishLocally();
		if (call.isLive()) {
			log.info("Ending call {} after the failed write", callId);
			writer.transition(call, CallStatus.ENDED).whenComplete((ended, endError) -> {
				if (endError != null) {
					log.error("Could not end call {} after a failed write: {}", callId, endError.getMessage(), endError);
				}
			});
		}
	}

	private void onMediaAcquired(LocalMediaStream stream) {
		if (!negotiator.onMediaAcquired(state, stream, this)) {
			return;
		}
		if (state.getRole() == NegotiationRole.ANSWERER && currentCall != null
				&& currentCall.getStatus() == CallStatus.PENDING) {
			writeStatus(currentCall, CallStatus.ACCEPTED, null);
		}
	}

	private void onMediaFailed(Throwable error) {
		MediaAccessDeniedException cause = MediaNegotiator.asMediaFailure(state.getCallId(), error);
		log.warn("Media unavailable for call {}: {}", state.getCallId(), cause.getMessage());
		failure = CallFailure.MEDIA_ACCESS_DENIED;
		CallSession call = currentCall;
		boolean answering = state.getRole() == NegotiationRole.ANSWERER;
		if (pendingAccept != null) {
			pendingAccept.completeExceptionally(cause);
			pendingAccept = null;
		}
		finishLocally();
		if (call != null && call.isLive()) {
			writeStatus(call, answering ? CallStatus.REJECTED : CallStatus.ENDED, null);
		}
	}

	private void onSignal(SignalingMessage signal) {
		if (state == null || !state.getCallId().equals(signal.getCallId())) {
			log.debug("Dropping {} for call {}: no negotiation in progress", signal.getType(), signal.getCallId());
			return;
		}
		switch (signal.getType()) {
		case OFFER:
			negotiator.handleOffer(state, signal.getSdp(), this);
			break;
		case ANSWER:
			negotiator.handleAnswer(state, signal.getSdp(), this);
			break;
		case ICE_CANDIDATE:
			negotiator.handleRemoteCandidate(state, signal.getCandidate());
			break;
		default:
			log.warn("Unknown signal type {} on call {}", signal.getType(), signal.getCallId());
		}
	}

	private void onMissedTimeout(String callId) {
		if (currentCall == null || !currentCall.getId().equals(callId)
				|| currentCall.getStatus() != CallStatus.PENDING
				|| !participantId.equals(currentCall.getCallerId())) {
			return;
		}
		// teardown waits for the stored MISSED; if the receiver's ACCEPTED won, the call goes on
		log.info("Call {} unanswered after {}, marking missed", callId, properties.getMissedTimeout());
		writeStatus(currentCall, CallStatus.MISSED, null);
	}

	/**
	 * A failed or disconnected peer connection ends the call right here; the peer reaches
	 * the same conclusion on its own.
	 */
	private void endOnNegotiationFailure(NegotiationFailureException error) {
		log.warn("Ending call {}: {}", error.getCallId(), error.getMessage());
		CallSession call = currentCall;
		failure = CallFailure.CALL_ENDED;
		finishLocally();
		if (call != null && call.isLive()) {
			writeStatus(call, CallStatus.ENDED, null);
		}
	}


	@Override
	public void send(SignalingMessage message) {
		try {
			transport.send(message);
			if (deliveryFailures > 0) {
				deliveryFailures = 0;
				if (failure == CallFailure.SIGNALING_UNAVAILABLE) {
					failure = CallFailure.NONE;
				}
			}
		} catch (SignalingDeliveryException e) {
			onDeliveryFailure(e);
		}
	}

	private Subscription joinChannel(String callId) {
		try {
			return transport.subscribe(callId, participantId, signal -> post(CallEvent.signalReceived(signal)));
		} catch (SignalingDeliveryException e) {
			onDeliveryFailure(e);
			return Subscription.noop();
		}
	}

	private void onDeliveryFailure(SignalingDeliveryException e) {
		deliveryFailures++;
		log.warn("Signaling failure {} on call {}: {}", deliveryFailures, e.getCallId(), e.getMessage());
		if (deliveryFailures >= properties.getSignaling().getMaxDeliveryFailures()) {
			failure = CallFailure.SIGNALING_UNAVAILABLE;
		}
	}

	private void writeStatus(CallSession known, CallStatus next, CompletableFuture<CallSession> reply) {
		writer.transition(known, next).whenComplete((saved, error) -> {
			Throwable cause = error != null ? MediaNegotiator.unwrap(error) : null;
			post(cause == null ? CallEvent.writeCompleted(saved) : CallEvent.writeFailed(known.getId(), cause));
			if (reply != null) {
				// queued behind the event so callers observe the updated view
				loop.execute(() -> {
					if (cause != null) {
						reply.completeExceptionally(cause);
					} else {
						reply.complete(saved);
					}
				});
			}
		});
	}

	/**
	 * Local teardown shared by every path that ends a call. Idempotent.
	 */
	private void finishLocally() {
		negotiator.teardown(state);
		state = null;
		channelSubscription.cancel();
		channelSubscription = Subscription.noop();
		missedTimer.cancel();
		missedTimer = Subscription.noop();
		deliveryFailures = 0;
		if (pendingAccept != null) {
			complete(pendingAccept, currentCall);
			pendingAccept = null;
		}
	}

	private boolean isBusy() {
		return state != null || incomingCall != null
				|| (currentCall != null && currentCall.isLive())
				|| pendingStart != null;
	}

	private static <T> void complete(CompletableFuture<T> future, T value) {
		if (future != null) {
			future.complete(value);
		}
	}

	private void publishView() {
		CallView next = CallView.builder()
				.participantId(participantId)
				.currentCall(currentCall)
				.incomingCall(incomingCall)
				.role(state != null ? state.getRole() : null)
				.callActive(currentCall != null && currentCall.isLive())
				.connected(state != null && state.isConnected())
				.remoteMediaAvailable(state != null && state.isRemoteMediaAvailable())
				.videoEnabled(state != null && state.isVideoEnabled())
				.audioEnabled(state != null && state.isAudioEnabled())
				.failure(failure)
				.build();
		if (next.equals(view)) {
			return;
		}
		view = next;
		for (Consumer<CallView> listener : viewListeners) {
			try {
				listener.accept(next);
			} catch (RuntimeException e) {
				log.warn("View listener of {} failed: {}", participantId, e.getMessage());
			}
		}
	}
}
