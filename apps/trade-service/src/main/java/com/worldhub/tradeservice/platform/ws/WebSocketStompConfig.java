package com.worldhub.tradeservice.platform.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * 交易 STOMP 通道
 * ----------------------------------------
 *   - /ws                : 连接端点（另有 SockJS 回退）
 *   - /app/trade.xxx     : 客户端交易指令
 *   - /user/queue/trade  : 点对点推送给交易双方
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    public static final String ENDPOINT = "/ws";

    private final WebSocketAuthChannelInterceptor authInterceptor;
    private final String[] allowedOrigins;
    private final long heartbeatMs;

    public WebSocketStompConfig(WebSocketAuthChannelInterceptor authInterceptor,
                                @Value("${trade.ws.allowed-origins:*}") String[] allowedOrigins,
                                @Value("${trade.ws.heartbeat-ms:10000}") long heartbeatMs) {
        this.authInterceptor = authInterceptor;
        this.allowedOrigins = allowedOrigins;
        this.heartbeatMs = heartbeatMs;
    }

    @Bean(name = "tradeWsHeartbeatScheduler")
    public TaskScheduler tradeWsHeartbeatScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("trade-ws-hb-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins);
        registry.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins).withSockJS();
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        // 只有点对点队列，没有广播 topic
        registry.enableSimpleBroker("/queue")
                .setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs})
                .setTaskScheduler(tradeWsHeartbeatScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(authInterceptor);
    }
}
