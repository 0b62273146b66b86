package com.odin.call_signaling_service.service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.NotificationMessage;
import com.odin.call_signaling_service.enums.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes a notification for the receiver of a call that was marked missed, in the
 * format the notification consumer expects.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MissedCallNotificationService {

    private final KafkaTemplate<String, NotificationMessage> kafkaTemplate;

    @Value("${kafka.missed-call.topic:" + ApplicationConstants.KAFKA_MISSED_CALL_TOPIC + "}")
    private String missedCallTopic;

    @Value("${missed-call.notification.channel:INAPP}")
    private String notificationChannel;

    @Value("${missed-call.notification.enabled:true}")
    private boolean notificationEnabled;

    public void publishMissedCall(CallSession session) {
        try {
            if (!notificationEnabled) {
                log.debug("Missed call notifications are disabled via configuration");
                return;
            }
            if (session == null || session.getReceiverId() == null) {
                log.warn("publishMissedCall: no receiver on session {}", session);
                return;
            }

            Map<String, String> notificationMap = new HashMap<>();
            notificationMap.put(ApplicationConstants.NOTIFICATION_MAP_CALL_ID, session.getId());
            notificationMap.put(ApplicationConstants.NOTIFICATION_MAP_CALLER_ID, session.getCallerId());
            notificationMap.put(ApplicationConstants.NOTIFICATION_MAP_CALL_TYPE, session.getCallType().getValue());
            if (session.getEndedAt() != null) {
                notificationMap.put(ApplicationConstants.NOTIFICATION_MAP_MISSED_AT,
                        String.valueOf(session.getEndedAt().toEpochMilli()));
            }

            NotificationMessage notification = NotificationMessage.builder()
                    .customerId(session.getReceiverId())
                    .notificationId(ApplicationConstants.MISSED_CALL_NOTIFICATION_ID)
                    .channel(NotificationChannel.valueOf(notificationChannel))
                    .map(notificationMap)
                    .build();

            // receiver id as key keeps one user's notifications on one partition
            kafkaTemplate.send(missedCallTopic, session.getReceiverId(), notification);

            log.info("Published missed call notification - topic={}, receiverId={}, callId={}",
                    missedCallTopic, session.getReceiverId(), session.getId());
        } catch (Exception e) {
            log.error("Failed to publish missed call notification for call={}: {}",
                    session != null ? session.getId() : null, e.getMessage(), e);
        }
    }
}
