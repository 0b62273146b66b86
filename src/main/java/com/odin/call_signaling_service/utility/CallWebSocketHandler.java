package com.odin.call_signaling_service.utility;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import com.odin.call_signaling_service.dto.CallView;
import com.odin.call_signaling_service.service.CallAgentRegistry;
import com.odin.call_signaling_service.service.CallSessionController;
import com.odin.call_signaling_service.service.PresenceService;
import com.odin.call_signaling_service.service.SessionRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * The participant's live link to its call agent. Opening the socket creates the agent
 * and subscribes it to view updates; closing it shuts the agent down, which ends any live
 * call. Commands arrive over REST, so the only inbound frame handled here is the ping.
 */
@Slf4j
@Component
public class CallWebSocketHandler implements WebSocketHandler {

    private final JwtUtil jwtUtil;
    private final SessionRegistryService sessionRegistryService;
    private final PresenceService presenceService;
    private final CallAgentRegistry callAgentRegistry;

    // sessionId -> view listener registered on the agent
    private final Map<String, Consumer<CallView>> viewListeners = new ConcurrentHashMap<>();

    public CallWebSocketHandler(JwtUtil jwtUtil,
                                SessionRegistryService sessionRegistryService,
                                PresenceService presenceService,
                                CallAgentRegistry callAgentRegistry) {
        this.jwtUtil = jwtUtil;
        this.sessionRegistryService = sessionRegistryService;
        this.presenceService = presenceService;
        this.callAgentRegistry = callAgentRegistry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String token = getQueryParam(session, "token");
        if (token == null || !jwtUtil.validateToken(token)) {
            log.warn("Invalid or missing token. Closing session: {}", session.getId());
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        String userId = jwtUtil.getUserId(token);
        sessionRegistryService.registerSession(userId, session);
        presenceService.registerConnection(userId);

        CallSessionController agent = callAgentRegistry.getOrCreate(userId);
        Consumer<CallView> listener = view -> sessionRegistryService.sendView(userId, view);
        viewListeners.put(session.getId(), listener);
        agent.addViewListener(listener);

        log.info("User {} connected on pod {} with session {}", userId, presenceService.getPodName(), session.getId());
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) throws Exception {
        String payload = message.getPayload().toString();
        if (payload.contains("\"type\":\"ping\"")) {
            log.debug("Received heartbeat ping on session {}", session.getId());
            session.sendMessage(new TextMessage("{\"type\":\"pong\"}"));
            return;
        }
        log.debug("Ignoring unsupported frame on session {} ({} chars)", session.getId(), payload.length());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        String userId = sessionRegistryService.getUserIdBySession(session);
        log.error("Transport error for session {} (userId={}): {}",
                session.getId(), userId, exception.getMessage(), exception);
        session.close(CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
        String userId = sessionRegistryService.removeSession(session);
        Consumer<CallView> listener = viewListeners.remove(session.getId());
        if (userId == null) {
            log.warn("Closed session {} not found in registry (status={})", session.getId(), closeStatus);
            return;
        }
        if (listener != null) {
            callAgentRegistry.find(userId).ifPresent(agent -> agent.removeViewListener(listener));
        }
        presenceService.unregisterConnection(userId);
        callAgentRegistry.release(userId);
        log.info("User {} disconnected and unregistered (session={}, status={})", userId, session.getId(), closeStatus);
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    private String getQueryParam(WebSocketSession session, String param) {
        String query = session.getUri() != null ? session.getUri().getQuery() : null;
        if (query != null) {
            for (String pair : query.split("&")) {
                String[] parts = pair.split("=");
                if (parts.length == 2 && parts[0].equals(param)) {
                    return parts[1];
                }
            }
        }
        return null;
    }
}
