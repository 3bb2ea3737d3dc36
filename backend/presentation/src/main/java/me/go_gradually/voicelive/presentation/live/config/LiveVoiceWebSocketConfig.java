package me.go_gradually.voicelive.presentation.live.config;

import me.go_gradually.voicelive.presentation.live.websocket.LiveVoiceWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class LiveVoiceWebSocketConfig implements WebSocketConfigurer {
    public static final String LIVE_VOICE_PATH = "/api/live/voice";

    private final LiveVoiceWebSocketHandler liveVoiceWebSocketHandler;

    public LiveVoiceWebSocketConfig(LiveVoiceWebSocketHandler liveVoiceWebSocketHandler) {
        this.liveVoiceWebSocketHandler = liveVoiceWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(liveVoiceWebSocketHandler, LIVE_VOICE_PATH)
                .setAllowedOriginPatterns("*");
    }

    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(1_048_576);
        container.setMaxBinaryMessageBufferSize(1_048_576);
        // 세션 수명은 SessionLifecycleSupervisor가 관리하므로 컨테이너 유휴 타임아웃은 넉넉히 둔다.
        container.setMaxSessionIdleTimeout(600_000L);
        return container;
    }
}
