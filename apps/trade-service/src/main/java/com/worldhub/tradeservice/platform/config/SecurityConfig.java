package com.worldhub.tradeservice.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 最小化的安全配置（Resource Server）
 * -------------------------------------------------------
 * 作为下游资源服务器验证网关透传的 JWT。
 *  - /actuator/**、/public/** 放行；
 *  - /ws 握手放行，身份在 STOMP CONNECT 帧中由 WebSocketAuthChannelInterceptor 校验；
 *  - 其余路径要求已认证。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**", "/public/**").permitAll()
                        .requestMatchers("/ws/**", "/ws").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(jwt -> { }));
        return http.build();
    }
}
