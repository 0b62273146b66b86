package com.odin.call_signaling_service.controller;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.odin.call_signaling_service.config.CallProperties;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallView;
import com.odin.call_signaling_service.dto.ResponseDTO;
import com.odin.call_signaling_service.dto.StartCallRequest;
import com.odin.call_signaling_service.dto.UserStatusResponse;
import com.odin.call_signaling_service.exception.CallSignalingException;
import com.odin.call_signaling_service.repo.CallSessionStore;
import com.odin.call_signaling_service.service.CallAgentRegistry;
import com.odin.call_signaling_service.service.CallSessionController;
import com.odin.call_signaling_service.service.PresenceService;
import com.odin.call_signaling_service.utility.JwtUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Commands for the caller's or receiver's call agent. The participant is the subject of
 * the Bearer token; each command is handed to that participant's agent and the response
 * waits for the agent's answer.
 */
@Slf4j
@RestController
@RequestMapping(ApplicationConstants.API_VERSION + ApplicationConstants.CALL)
public class CallController {

    private static final int MAX_HISTORY = 100;

    private final CallAgentRegistry callAgentRegistry;
    private final CallSessionStore callSessionStore;
    private final PresenceService presenceService;
    private final JwtUtil jwtUtil;
    private final CallProperties properties;

    public CallController(CallAgentRegistry callAgentRegistry,
                          CallSessionStore callSessionStore,
                          PresenceService presenceService,
                          JwtUtil jwtUtil,
                          CallProperties properties) {
        this.callAgentRegistry = callAgentRegistry;
        this.callSessionStore = callSessionStore;
        this.presenceService = presenceService;
        this.jwtUtil = jwtUtil;
        this.properties = properties;
    }

    @PostMapping(ApplicationConstants.START)
    public ResponseEntity<ResponseDTO> startCall(@RequestHeader HttpHeaders headers,
                                                 @RequestBody StartCallRequest request) {
        String userId = authenticate(headers);
        if (request == null || request.getReceiverId() == null || request.getReceiverId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "receiverId is required");
        }
        log.info("startCall called by {} → {} ({})", userId, request.getReceiverId(), request.getCallType());
        CallSession session = await(agent(userId).startCall(request.getReceiverId(), request.getCallType()));
        return ResponseEntity.ok(ResponseDTO.ok(session));
    }

    @PostMapping(ApplicationConstants.ACCEPT)
    public ResponseEntity<ResponseDTO> acceptCall(@RequestHeader HttpHeaders headers) {
        String userId = authenticate(headers);
        log.info("acceptCall called by {}", userId);
        return ResponseEntity.ok(ResponseDTO.ok(await(agent(userId).acceptCall())));
    }

    @PostMapping(ApplicationConstants.REJECT)
    public ResponseEntity<ResponseDTO> rejectCall(@RequestHeader HttpHeaders headers) {
        String userId = authenticate(headers);
        log.info("rejectCall called by {}", userId);
        return ResponseEntity.ok(ResponseDTO.ok(await(agent(userId).rejectCall())));
    }

    @PostMapping(ApplicationConstants.END)
    public ResponseEntity<ResponseDTO> endCall(@RequestHeader HttpHeaders headers) {
        String userId = authenticate(headers);
        log.info("endCall called by {}", userId);
        return ResponseEntity.ok(ResponseDTO.ok(await(agent(userId).endCall())));
    }

    @PostMapping(ApplicationConstants.TOGGLE_VIDEO)
    public ResponseEntity<ResponseDTO> toggleVideo(@RequestHeader HttpHeaders headers) {
        String userId = authenticate(headers);
        return ResponseEntity.ok(ResponseDTO.ok(await(agent(userId).toggleVideo())));
    }

    @PostMapping(ApplicationConstants.TOGGLE_AUDIO)
    public ResponseEntity<ResponseDTO> toggleAudio(@RequestHeader HttpHeaders headers) {
        String userId = authenticate(headers);
        return ResponseEntity.ok(ResponseDTO.ok(await(agent(userId).toggleAudio())));
    }

    @GetMapping(ApplicationConstants.VIEW)
    public ResponseEntity<CallView> view(@RequestHeader HttpHeaders headers) {
        String userId = authenticate(headers);
        return ResponseEntity.ok(agent(userId).view());
    }

    /**
     * The participant's own calls, newest first.
     */
    @GetMapping(ApplicationConstants.HISTORY)
    public ResponseEntity<List<CallSession>> history(@RequestHeader HttpHeaders headers,
                                                     @RequestParam(name = "limit", defaultValue = "20") int limit) {
        String userId = authenticate(headers);
        int bounded = Math.max(1, Math.min(limit, MAX_HISTORY));
        return ResponseEntity.ok(callSessionStore.findByParticipant(userId, bounded));
    }

    /**
     * Whether the UI should offer to call this user. Never blocks a call attempt.
     */
    @GetMapping(ApplicationConstants.USER_STATUS)
    public ResponseEntity<UserStatusResponse> userStatus(@PathVariable("userId") String userId) {
        boolean reachable = presenceService.isReachable(userId);
        String pod = presenceService.getConnectionPod(userId).orElse(null);
        log.info("User status for {} => reachable={}, pod={}", userId, reachable, pod);
        return ResponseEntity.ok(new UserStatusResponse(reachable, pod));
    }

    private CallSessionController agent(String userId) {
        return callAgentRegistry.getOrCreate(userId);
    }

    private String authenticate(HttpHeaders headers) {
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(ApplicationConstants.BEARER_PREFIX)) {
            log.warn("Missing or invalid Authorization header");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing Authorization");
        }
        String token = authHeader.substring(ApplicationConstants.BEARER_PREFIX.length()).trim();
        if (!jwtUtil.validateToken(token)) {
            log.warn("Invalid token provided");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid token");
        }
        return jwtUtil.getUserId(token);
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(properties.getCommandTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CallSignalingException(null, "Call agent failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new ResponseStatusException(HttpStatus.GATEWAY_TIMEOUT, "Call agent did not answer in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Interrupted");
        }
    }
}
