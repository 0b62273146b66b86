package com.odin.call_signaling_service.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.utility.CallWebSocketHandler;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CallWebSocketHandler callWebSocketHandler;

    public WebSocketConfig(CallWebSocketHandler callWebSocketHandler) {
        this.callWebSocketHandler = callWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(callWebSocketHandler, ApplicationConstants.CALL)
                .setAllowedOrigins("*");

        log.info("WebSocket handlers registered - Path: {}, Handler: CallWebSocketHandler", ApplicationConstants.CALL);
    }
}
