package com.fieldops.dismantle.config;

import com.fieldops.dismantle.realtime.ChatSessionHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatSessionHandler chatSessionHandler;
    private final ChatProperties     properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatSessionHandler, properties.getWebsocket().getPath())
                .addInterceptors(new IdentityHandshakeInterceptor())
                .setAllowedOriginPatterns(properties.getWebsocket().getAllowedOrigins());
    }
}
