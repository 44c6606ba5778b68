package com.jz.crm.config;

import com.jz.crm.notify.OperatorSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final OperatorSocketHandler operatorSocketHandler;

    // ws://host/ws/{operatorId}/{sector}
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(operatorSocketHandler, "/ws/*/*").setAllowedOriginPatterns("*");
    }
}
