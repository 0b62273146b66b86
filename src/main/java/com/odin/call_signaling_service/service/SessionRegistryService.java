package com.odin.call_signaling_service.service;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.dto.CallView;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class SessionRegistryService {

	// userId -> WebSocketSession
	private final Map<String, WebSocketSession> activeSessions = new ConcurrentHashMap<>();

	private final ObjectMapper objectMapper;

	public SessionRegistryService(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public void registerSession(String userId, WebSocketSession session) {
		if (userId == null || session == null) return;
		activeSessions.put(userId, session);
		log.info("Registered session for user: {}", userId);
	}

	/**
	 * Remove session by WebSocketSession instance and return userId if found.
	 */
	public String removeSession(WebSocketSession session) {
		if (session == null) return null;
		String foundUserId = getUserIdBySession(session);
		if (foundUserId != null) {
			activeSessions.remove(foundUserId, session);
			log.info("Removed session for user: {}", foundUserId);
		}
		return foundUserId;
	}

	public WebSocketSession getSession(String userId) {
		return activeSessions.get(userId);
	}

	public String getUserIdBySession(WebSocketSession session) {
		for (var entry : activeSessions.entrySet()) {
			if (entry.getValue().equals(session)) {
				return entry.getKey();
			}
		}
		return null;
	}

	/**
	 * Pushes the agent's current view to the participant's socket, if one is open here.
	 */
	public void sendView(String userId, CallView view) {
		WebSocketSession session = activeSessions.get(userId);
		if (session == null || !session.isOpen()) {
			log.debug("No open session for {}, view not pushed", userId);
			return;
		}
		try {
			String json = objectMapper.writeValueAsString(Map.of("type", "call-view", "view", view));
			// WebSocketSession is not safe for concurrent sends
			synchronized (session) {
				session.sendMessage(new TextMessage(json));
			}
		} catch (JsonProcessingException e) {
			log.error("Failed to serialise call view for {}: {}", userId, e.getMessage(), e);
		} catch (IOException e) {
			log.warn("Failed to push call view to {}: {}", userId, e.getMessage());
		}
	}
}
