package com.odin.call_signaling_service.repo;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.CallSessionEvent;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.exception.StaleCallSessionException;
import com.odin.call_signaling_service.exception.StoreWriteException;

import lombok.extern.slf4j.Slf4j;

/**
 * Session store on Redis. Each call is a hash under {@code call:session:{id}}, indexed per
 * participant in a sorted set scored by creation time. A create writes the hash and both
 * index entries in one Lua script. Status writes go through a Lua script that swaps only
 * when the stored version is the expected one; every successful
 * write is announced on {@code call:session:events} so agents on every pod see it.
 */
@Slf4j
public class RedisCallSessionStore extends AbstractCallSessionStore {

	private static final String PARTICIPANT_INDEX_PREFIX = "call:participant:";

	// KEYS: session hash, caller index, receiver index; ARGV: id, score, then hash field/value pairs
	static final RedisScript<Long> CREATE_SESSION = new DefaultRedisScript<>(
			"if redis.call('EXISTS', KEYS[1]) == 1 then return 0 end\n"
					+ "redis.call('HSET', KEYS[1], unpack(ARGV, 3))\n"
					+ "redis.call('ZADD', KEYS[2], ARGV[2], ARGV[1])\n"
					+ "redis.call('ZADD', KEYS[3], ARGV[2], ARGV[1])\n"
					+ "return 1",
			Long.class);

	static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
			"local current = redis.call('HGET', KEYS[1], 'version')\n"
					+ "if not current then return -1 end\n"
					+ "if current ~= ARGV[1] then return 0 end\n"
					+ "redis.call('HSET', KEYS[1], 'status', ARGV[2], 'startedAt', ARGV[3], 'endedAt', ARGV[4], 'version', ARGV[5])\n"
					+ "return 1",
			Long.class);

	private final StringRedisTemplate redisTemplate;
	private final ObjectMapper objectMapper;

	public RedisCallSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock) {
		super(clock);
		this.redisTemplate = redisTemplate;
		this.objectMapper = objectMapper;
	}

	public static ChannelTopic getTopic() {
		return new ChannelTopic(ApplicationConstants.CALL_SESSION_EVENTS_CHANNEL);
	}

	@Override
	public CallSession create(CallSession draft) {
		CallSession session = prepareInsert(draft);
		Long result;
		try {
			result = redisTemplate.execute(CREATE_SESSION,
					List.of(sessionKey(session.getId()), participantKey(session.getCallerId()),
							participantKey(session.getReceiverId())),
					createArgs(session));
		} catch (DataAccessException e) {
			log.error("Failed to create call session {} in Redis: {}", session.getId(), e.getMessage(), e);
			throw new StoreWriteException(session.getId(), "Could not create call session", e);
		}
		if (result == null || result != 1L) {
			CallSession stored;
			try {
				stored = find(session.getId()).orElse(null);
			} catch (DataAccessException e) {
				throw new StoreWriteException(session.getId(), "Could not read existing call session", e);
			}
			if (stored == null) {
				throw new StoreWriteException(session.getId(), "Call session was not created (result=" + result + ")");
			}
			CallSession existing = existingInsert(stored, session);
			// the earlier attempt may have failed before announcing it
			if (existing.getStatus() == CallStatus.PENDING) {
				publish(CallSessionEvent.insert(existing));
			}
			return existing;
		}
		log.info("CALL SESSION CREATED: {} ({} -> {}, {})", session.getId(), session.getCallerId(),
				session.getReceiverId(), session.getCallType());
		publish(CallSessionEvent.insert(session));
		return session;
	}

	private static Object[] createArgs(CallSession session) {
		List<String> args = new ArrayList<>();
		args.add(session.getId());
		args.add(String.valueOf(session.getCreatedAt().toEpochMilli()));
		toHash(session).forEach((field, value) -> {
			args.add(field);
			args.add(value);
		});
		return args.toArray();
	}

	@Override
	public CallSession update(CallSession proposed) {
		CallSession stored;
		try {
			stored = find(proposed.getId()).orElse(null);
		} catch (DataAccessException e) {
			throw new StoreWriteException(proposed.getId(), "Could not read call session before update", e);
		}
		CallSession next = prepareUpdate(stored, proposed);
		Long result;
		try {
			result = redisTemplate.execute(COMPARE_AND_SET, List.of(sessionKey(next.getId())),
					String.valueOf(proposed.getVersion()),
					next.getStatus().getValue(),
					epochOrEmpty(next.getStartedAt()),
					epochOrEmpty(next.getEndedAt()),
					String.valueOf(next.getVersion()));
		} catch (DataAccessException e) {
			log.error("Failed to update call session {} in Redis: {}", next.getId(), e.getMessage(), e);
			throw new StoreWriteException(next.getId(), "Could not update call session", e);
		}
		if (result == null || result != 1L) {
			log.warn("Compare-and-set lost for call {} at version {} (result={})", next.getId(),
					proposed.getVersion(), result);
			throw new StaleCallSessionException(next.getId(), "Call session changed concurrently");
		}
		log.info("CALL SESSION [{}] STATE UPDATED → {} (v{})", next.getId(), next.getStatus(), next.getVersion());
		publish(CallSessionEvent.update(next));
		return next;
	}

	@Override
	public Optional<CallSession> find(String callId) {
		HashOperations<String, String, String> ops = redisTemplate.opsForHash();
		Map<String, String> hash = ops.entries(sessionKey(callId));
		if (hash == null || hash.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(fromHash(hash));
	}

	@Override
	public List<CallSession> findByParticipant(String participantId, int limit) {
		Set<String> ids = redisTemplate.opsForZSet().reverseRange(participantKey(participantId), 0, limit - 1L);
		List<CallSession> result = new ArrayList<>();
		if (ids == null) {
			return result;
		}
		for (String id : ids) {
			find(id).ifPresent(result::add);
		}
		return result;
	}

	/**
	 * Called by the pub/sub subscriber for every event, including this pod's own writes.
	 */
	public void onRemoteEvent(CallSessionEvent event) {
		dispatch(event);
	}

	private void publish(CallSessionEvent event) {
		try {
			redisTemplate.convertAndSend(ApplicationConstants.CALL_SESSION_EVENTS_CHANNEL,
					objectMapper.writeValueAsString(event));
			log.debug("Published {} event for call {}", event.getType(), event.getSession().getId());
		} catch (JsonProcessingException | DataAccessException e) {
			// agents only learn of this write from the event; a caller that misses an ACCEPTED
			// finds it when its missed timer write reloads the record
			log.error("Failed to publish {} event for call {}: {}", event.getType(), event.getSession().getId(),
					e.getMessage(), e);
		}
	}

	static Map<String, String> toHash(CallSession session) {
		Map<String, String> hash = new HashMap<>();
		hash.put("id", session.getId());
		hash.put("callerId", session.getCallerId());
		hash.put("receiverId", session.getReceiverId());
		hash.put("callType", session.getCallType().getValue());
		hash.put("status", session.getStatus().getValue());
		hash.put("createdAt", epochOrEmpty(session.getCreatedAt()));
		hash.put("startedAt", epochOrEmpty(session.getStartedAt()));
		hash.put("endedAt", epochOrEmpty(session.getEndedAt()));
		hash.put("version", String.valueOf(session.getVersion()));
		return hash;
	}

	static CallSession fromHash(Map<String, String> hash) {
		return CallSession.builder()
				.id(hash.get("id"))
				.callerId(hash.get("callerId"))
				.receiverId(hash.get("receiverId"))
				.callType(CallType.fromString(hash.get("callType")))
				.status(CallStatus.fromString(hash.get("status")))
				.createdAt(instantOrNull(hash.get("createdAt")))
				.startedAt(instantOrNull(hash.get("startedAt")))
				.endedAt(instantOrNull(hash.get("endedAt")))
				.version(Long.parseLong(hash.getOrDefault("version", "0")))
				.build();
	}

	private static String epochOrEmpty(Instant instant) {
		return instant == null ? "" : String.valueOf(instant.toEpochMilli());
	}

	private static Instant instantOrNull(String raw) {
		return raw == null || raw.isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(raw));
	}

	private static String sessionKey(String callId) {
		return ApplicationConstants.CALL_SESSION_KEY_PREFIX + callId;
	}

	private static String participantKey(String participantId) {
		return PARTICIPANT_INDEX_PREFIX + participantId;
	}
}
