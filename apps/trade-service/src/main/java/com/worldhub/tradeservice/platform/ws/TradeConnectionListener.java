package com.worldhub.tradeservice.platform.ws;

import com.worldhub.tradeservice.trade.domain.repository.PlayerDirectory;
import com.worldhub.tradeservice.trade.service.TradeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 监听 STOMP 连接/断开事件，维护在线玩家目录与交易生命周期。
 * - 连接：登记到 PlayerDirectory（名字来自 JWT 的 preferred_username）；
 * - 断开：同一用户可能有多个连接，最后一个连接断开时才取消交易并注销。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradeConnectionListener {

    private final PlayerDirectory playerDirectory;
    private final TradeService tradeService;

    /** userId -> 当前存活的 STOMP sessionId */
    private final Map<String, Set<String>> connections = new ConcurrentHashMap<>();
    /** sessionId -> userId（断开事件不一定带 Principal） */
    private final Map<String, String> sessionOwners = new ConcurrentHashMap<>();

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal principal = accessor.getUser();
        String sessionId = accessor.getSessionId();
        if (principal == null || sessionId == null) {
            log.warn("收到 SessionConnectEvent 但缺少用户或会话信息，session={}", sessionId);
            return;
        }
        String userId = principal.getName();
        connections.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(sessionId);
        sessionOwners.put(sessionId, userId);
        playerDirectory.register(userId, displayNameOf(principal));
        log.info("玩家连接: userId={}, session={}", userId, sessionId);
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        String userId = sessionId == null ? null : sessionOwners.remove(sessionId);
        if (userId == null && event.getUser() != null) {
            userId = event.getUser().getName();
        }
        if (userId == null) {
            log.debug("忽略未登记的断开事件: session={}", sessionId);
            return;
        }
        if (!releaseConnection(userId, sessionId)) {
            log.debug("玩家仍有其他连接，保留交易: userId={}", userId);
            return;
        }
        tradeService.onDisconnect(userId);
        playerDirectory.unregister(userId);
        log.info("玩家断开: userId={}, session={}", userId, sessionId);
    }

    /**
     * 释放一个连接
     * @return true 表示该用户已没有存活连接
     */
    private boolean releaseConnection(String userId, String sessionId) {
        boolean[] last = {false};
        connections.computeIfPresent(userId, (k, sessions) -> {
            sessions.remove(sessionId);
            if (sessions.isEmpty()) {
                last[0] = true;
                return null;
            }
            return sessions;
        });
        // 未登记过的用户（例如服务重启前的连接）也按最后一个连接处理
        return last[0] || !connections.containsKey(userId);
    }

    static String displayNameOf(Principal principal) {
        if (principal instanceof JwtAuthenticationToken token) {
            String preferred = token.getToken().getClaimAsString("preferred_username");
            if (StringUtils.isNotBlank(preferred)) {
                return preferred;
            }
        }
        return principal.getName();
    }
}
