package com.worldhub.tradeservice.trade.interfaces.ws;

import com.worldhub.tradeservice.platform.transport.Envelope;
import com.worldhub.tradeservice.trade.domain.model.OfferTarget;
import com.worldhub.tradeservice.trade.domain.model.TradeResult;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import com.worldhub.tradeservice.trade.domain.model.TradeSnapshot;
import com.worldhub.tradeservice.trade.interfaces.ws.dto.TradeCommands.OfferCmd;
import com.worldhub.tradeservice.trade.interfaces.ws.dto.TradeCommands.RequestCmd;
import com.worldhub.tradeservice.trade.interfaces.ws.dto.TradeCommands.SimpleCmd;
import com.worldhub.tradeservice.trade.service.TradeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Map;

/**
 * 交易 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/trade.* 指令并调用 TradeService；
 * 成功后向双方推送最新快照（STATE），失败时向调用方推送 ERROR（code + message）。
 * 文字提示由 TradeService 通过 TradeNotifier 发出，这里不重复。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class TradeWsController {

    private final TradeService tradeService;
    private final StompTradeNotifier notifier;

    @MessageMapping("/trade.request")
    public void request(RequestCmd cmd, SimpMessageHeaderAccessor sha) {
        String userId = currentUser(sha);
        if (userId == null) return;
        handle(userId, tradeService.requestTrade(userId, cmd.getTargetName()));
    }

    @MessageMapping("/trade.offer")
    public void offer(OfferCmd cmd, SimpMessageHeaderAccessor sha) {
        String userId = currentUser(sha);
        if (userId == null) return;
        OfferTarget target;
        try {
            target = toTarget(cmd);
        } catch (IllegalArgumentException e) {
            sendError(userId, "INVALID_OFFER", e.getMessage());
            return;
        }
        handle(userId, tradeService.updateOffer(userId, target, cmd.getQuantity()));
    }

    @MessageMapping("/trade.confirm")
    public void confirm(SimpMessageHeaderAccessor sha) {
        String userId = currentUser(sha);
        if (userId == null) return;
        // 确认前先记下对方，交换完成后会话已从索引中移除
        String partnerId = tradeService.getSession(userId).map(s -> s.partnerOf(userId)).orElse(null);
        TradeResult result = tradeService.confirm(userId);
        if (!result.ok()) {
            sendError(userId, result.error().name(), result.message());
        }
        pushSnapshot(userId);
        if (partnerId != null) pushSnapshot(partnerId);
    }

    @MessageMapping("/trade.cancel")
    public void cancel(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        String userId = currentUser(sha);
        if (userId == null) return;
        TradeResult result = tradeService.cancel(userId, cmd == null ? null : cmd.getReason());
        if (!result.ok()) sendError(userId, result.error().name(), result.message());
    }

    @MessageMapping("/trade.reject")
    public void reject(SimpMessageHeaderAccessor sha) {
        String userId = currentUser(sha);
        if (userId == null) return;
        TradeResult result = tradeService.reject(userId);
        if (!result.ok()) sendError(userId, result.error().name(), result.message());
    }

    /**
     * slot=0 或 gold=true 表示金币，其他为背包格子
     */
    static OfferTarget toTarget(OfferCmd cmd) {
        if (cmd.isGold()) return OfferTarget.gold();
        if (cmd.getSlot() == null) {
            throw new IllegalArgumentException("缺少报价格子");
        }
        return OfferTarget.fromLegacySlot(cmd.getSlot());
    }

    private void handle(String userId, TradeResult result) {
        if (!result.ok()) {
            sendError(userId, result.error().name(), result.message());
            return;
        }
        tradeService.getSession(userId).ifPresent(this::pushSnapshotToBoth);
    }

    private void pushSnapshotToBoth(TradeSession session) {
        pushSnapshot(session.getInitiatorId());
        pushSnapshot(session.getTargetId());
    }

    private void pushSnapshot(String userId) {
        tradeService.snapshot(userId).ifPresent(s -> notifier.push(userId, Envelope.<TradeSnapshot>state("SNAPSHOT", s)));
    }

    private void sendError(String userId, String code, String message) {
        notifier.push(userId, Envelope.error(code, Map.of("code", code, "message", message == null ? "" : message)));
    }

    private static String currentUser(SimpMessageHeaderAccessor sha) {
        Principal user = sha.getUser();
        if (user == null) {
            log.warn("收到未认证的交易指令: session={}", sha.getSessionId());
            return null;
        }
        return user.getName();
    }
}
