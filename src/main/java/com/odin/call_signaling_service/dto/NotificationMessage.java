package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.NotificationChannel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Notification event handed to the notification pipeline over Kafka.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationMessage {

    private String customerId;    // receiver of the notification
    private Long notificationId;  // 3001 for missed calls
    private NotificationChannel channel;
    private Map<String, String> map;  // callId, callerId, callType, missedAt
}
