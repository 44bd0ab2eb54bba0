package com.worldhub.tradeservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.stereotype.Component;

/**
 * STOMP CONNECT 认证
 *
 * Principal 名称取 JWT subject（稳定的 userId），交易索引和 /user/queue/trade 推送都按它寻址；
 * 展示名由 TradeConnectionListener 从 preferred_username 读取。
 * 没有令牌或令牌无效时不设置用户，交易指令会被控制器忽略。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private static final String BEARER = "Bearer ";

    private final JwtDecoder jwtDecoder;
    private final JwtGrantedAuthoritiesConverter authoritiesConverter = new JwtGrantedAuthoritiesConverter();

    public WebSocketAuthChannelInterceptor(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getCommand() != StompCommand.CONNECT) {
            return message;
        }
        String token = bearerToken(accessor);
        if (token == null) {
            log.debug("STOMP CONNECT 未携带令牌: sessionId={}", accessor.getSessionId());
            return message;
        }
        try {
            Jwt jwt = jwtDecoder.decode(token);
            accessor.setUser(new JwtAuthenticationToken(jwt, authoritiesConverter.convert(jwt), jwt.getSubject()));
            log.debug("STOMP CONNECT 认证通过: userId={}, sessionId={}", jwt.getSubject(), accessor.getSessionId());
        } catch (JwtException e) {
            log.debug("STOMP CONNECT 令牌无效: sessionId={}, reason={}", accessor.getSessionId(), e.getMessage());
        }
        return message;
    }

    /**
     * 取 CONNECT 帧里的令牌：优先 Authorization: Bearer xxx，其次 access_token。
     * @return 令牌本身；没有时返回 null
     */
    static String bearerToken(StompHeaderAccessor accessor) {
        String auth = StringUtils.defaultIfBlank(
                accessor.getFirstNativeHeader("Authorization"),
                accessor.getFirstNativeHeader("authorization"));
        if (StringUtils.startsWithIgnoreCase(auth, BEARER)) {
            return StringUtils.trimToNull(auth.substring(BEARER.length()));
        }
        return StringUtils.trimToNull(accessor.getFirstNativeHeader("access_token"));
    }
}
