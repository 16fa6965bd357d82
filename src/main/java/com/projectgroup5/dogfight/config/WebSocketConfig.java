package com.projectgroup5.dogfight.config;

import com.projectgroup5.dogfight.websocket.GameWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.*;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket配置 - 服务器权威的实时通信层
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    // 单条客户端消息的上限，输入/开火消息远小于这个值
    private static final int MAX_TEXT_MESSAGE_BYTES = 64 * 1024;

    private final GameWebSocketHandler gameWebSocketHandler;
    private final GameProperties properties;

    public WebSocketConfig(GameWebSocketHandler gameWebSocketHandler, GameProperties properties) {
        this.gameWebSocketHandler = gameWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(gameWebSocketHandler, "/ws/game")
                .setAllowedOrigins("*");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        // 心跳检查由 GameWebSocketHandler 负责，容器只兜底回收彻底失联的连接
        container.setMaxSessionIdleTimeout(properties.getNetwork().getHeartbeatTimeoutMillis() * 3);
        return container;
    }
}
