package com.odin.call_signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import com.odin.call_signaling_service.dto.CallSession;
import com.odin.call_signaling_service.dto.NotificationMessage;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.enums.NotificationChannel;

@ExtendWith(MockitoExtension.class)
class MissedCallNotificationServiceTest {

	@Mock
	private KafkaTemplate<String, NotificationMessage> kafkaTemplate;

	private MissedCallNotificationService service;

	@BeforeEach
	void setUp() {
		service = new MissedCallNotificationService(kafkaTemplate);
		ReflectionTestUtils.setField(service, "missedCallTopic", "call.missed.notification");
		ReflectionTestUtils.setField(service, "notificationChannel", "INAPP");
		ReflectionTestUtils.setField(service, "notificationEnabled", true);
	}

	private static CallSession missed() {
		return CallSession.builder()
				.id("call-1")
				.callerId("alice")
				.receiverId("bob")
				.callType(CallType.VIDEO)
				.status(CallStatus.MISSED)
				.endedAt(Instant.ofEpochMilli(1714557630000L))
				.version(1)
				.build();
	}

	@Test
	void notifiesTheReceiverKeyedByReceiver() {
		service.publishMissedCall(missed());

		ArgumentCaptor<NotificationMessage> message = ArgumentCaptor.forClass(NotificationMessage.class);
		verify(kafkaTemplate).send(eq("call.missed.notification"), eq("bob"), message.capture());
		assertThat(message.getValue().getCustomerId()).isEqualTo("bob");
		assertThat(message.getValue().getNotificationId()).isEqualTo(3001L);
		assertThat(message.getValue().getChannel()).isEqualTo(NotificationChannel.INAPP);
		assertThat(message.getValue().getMap())
				.containsEntry("callId", "call-1")
				.containsEntry("callerId", "alice")
				.containsEntry("callType", "video")
				.containsEntry("missedAt", "1714557630000");
	}

	@Test
	void disabledNotificationsAreNotSent() {
		ReflectionTestUtils.setField(service, "notificationEnabled", false);

		service.publishMissedCall(missed());

		verify(kafkaTemplate, never()).send(anyString(), anyString(), any(NotificationMessage.class));
	}

	@Test
	void kafkaFailureDoesNotPropagate() {
		when(kafkaTemplate.send(anyString(), anyString(), any(NotificationMessage.class)))
				.thenThrow(new IllegalStateException("broker down"));

		service.publishMissedCall(missed());

		verify(kafkaTemplate).send(anyString(), anyString(), any(NotificationMessage.class));
	}
}
