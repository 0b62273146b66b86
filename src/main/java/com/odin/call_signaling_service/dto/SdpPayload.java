package com.odin.call_signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session description as produced by the peer connection; "offer" or "answer".
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SdpPayload {
    private String type;
    private String sdp;

    public static SdpPayload offer(String sdp) {
        return new SdpPayload("offer", sdp);
    }

    public static SdpPayload answer(String sdp) {
        return new SdpPayload("answer", sdp);
    }
}
