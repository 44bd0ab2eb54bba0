package com.worldhub.tradeservice.trade.interfaces.ws;

import com.worldhub.tradeservice.platform.transport.Envelope;
import com.worldhub.tradeservice.trade.domain.enums.Severity;
import com.worldhub.tradeservice.trade.domain.notify.TradeNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 通过 STOMP 点对点推送交易通知：/user/{userId}/queue/trade。
 * 推送失败只记日志，不影响交易状态机。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompTradeNotifier implements TradeNotifier {

    public static final String TRADE_QUEUE = "/queue/trade";

    public static final String TYPE_OPENED = "OPENED";
    public static final String TYPE_CLOSED = "CLOSED";
    public static final String TYPE_TEXT = "TEXT";

    private final SimpMessagingTemplate messaging;

    @Override
    public void sendTradeOpened(String userId, String partnerName) {
        push(userId, Envelope.event(TYPE_OPENED, Map.of("partnerName", partnerName)));
    }

    @Override
    public void sendTradeClosed(String userId, String reason) {
        push(userId, Envelope.event(TYPE_CLOSED, Map.of("reason", reason)));
    }

    @Override
    public void sendText(String userId, String message, Severity severity) {
        push(userId, Envelope.event(TYPE_TEXT, Map.of("message", message, "severity", severity.name())));
    }

    /**
     * 推送任意信封（快照、错误等）
     */
    public void push(String userId, Envelope<?> envelope) {
        try {
            messaging.convertAndSendToUser(userId, TRADE_QUEUE, envelope);
        } catch (MessagingException e) {
            log.warn("交易消息推送失败: userId={}, type={}", userId, envelope.type(), e);
        }
    }
}
