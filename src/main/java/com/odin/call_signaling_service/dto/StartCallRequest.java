package com.odin.call_signaling_service.dto;

import com.odin.call_signaling_service.enums.CallType;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class StartCallRequest {
	private String receiverId;
	private CallType callType;
}
