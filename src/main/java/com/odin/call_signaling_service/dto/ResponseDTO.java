package com.odin.call_signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ResponseDTO {

	private Integer statusCode;
	private String status;
	private String message;
	private Object data;

	public static ResponseDTO ok(Object data) {
		return new ResponseDTO(200, "SUCCESS", null, data);
	}

	public static ResponseDTO error(int statusCode, String status, String message) {
		return new ResponseDTO(statusCode, status, message, null);
	}
}
