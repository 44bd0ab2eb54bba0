package com.worldhub.tradeservice.trade.service.impl;

import com.worldhub.tradeservice.trade.application.ExchangeExecutor;
import com.worldhub.tradeservice.trade.application.OfferValidator;
import com.worldhub.tradeservice.trade.application.TradeSessionRegistry;
import com.worldhub.tradeservice.trade.domain.TradeException;
import com.worldhub.tradeservice.trade.domain.constants.TradeMessages;
import com.worldhub.tradeservice.trade.domain.enums.Severity;
import com.worldhub.tradeservice.trade.domain.enums.TradeError;
import com.worldhub.tradeservice.trade.domain.model.ExchangeResult;
import com.worldhub.tradeservice.trade.domain.model.OfferTarget;
import com.worldhub.tradeservice.trade.domain.model.OfferedItem;
import com.worldhub.tradeservice.trade.domain.model.TradeOffer;
import com.worldhub.tradeservice.trade.domain.model.TradeResult;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import com.worldhub.tradeservice.trade.domain.model.TradeSnapshot;
import com.worldhub.tradeservice.trade.domain.notify.TradeNotifier;
import com.worldhub.tradeservice.trade.domain.repository.PlayerDirectory;
import com.worldhub.tradeservice.trade.service.TradeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 交易服务实现：会话状态机 + 报价协商。
 * ----------------------------------------
 * 并发约定：
 *  - 发起交易的准入由 TradeSessionRegistry.register 原子完成（任一方忙则快速失败，不排队）；
 *  - 同一会话上的报价/确认/取消在 synchronized(session) 内执行，
 *    交换在 confirm 的锁内同步跑完，其他操作看不到中间状态；
 *  - 进入锁后再次确认会话仍在索引中且未结束，防止对已关闭会话的迟到操作。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeServiceImpl implements TradeService {

    private final TradeSessionRegistry registry;
    private final OfferValidator validator;
    private final ExchangeExecutor executor;
    private final PlayerDirectory playerDirectory;
    private final TradeNotifier notifier;

    // ========== 发起 ==========

    @Override
    public TradeResult requestTrade(String initiatorId, String targetName) {
        String targetId = StringUtils.isBlank(targetName)
                ? null
                : playerDirectory.findUserByName(targetName.trim()).orElse(null);
        if (targetId == null) {
            return failAndNotify(initiatorId, TradeError.TARGET_UNAVAILABLE, TradeMessages.formatTargetOffline(targetName));
        }
        if (targetId.equals(initiatorId)) {
            return failAndNotify(initiatorId, TradeError.SELF_TRADE, TradeMessages.SELF_TRADE);
        }
        if (registry.isUserInTrade(initiatorId)) {
            return failAndNotify(initiatorId, TradeError.USER_BUSY, TradeMessages.ALREADY_TRADING);
        }
        if (registry.isUserInTrade(targetId)) {
            return failAndNotify(initiatorId, TradeError.USER_BUSY,
                    TradeMessages.formatTargetBusy(playerDirectory.getDisplayName(targetId)));
        }

        String initiatorName = playerDirectory.getDisplayName(initiatorId);
        String resolvedTargetName = playerDirectory.getDisplayName(targetId);
        TradeSession session = new TradeSession(initiatorId, initiatorName, targetId, resolvedTargetName, now());

        // 检查与登记之间可能有并发请求抢先，register 失败按"忙"处理
        if (!registry.register(session)) {
            String msg = registry.isUserInTrade(initiatorId)
                    ? TradeMessages.ALREADY_TRADING
                    : TradeMessages.formatTargetBusy(resolvedTargetName);
            return failAndNotify(initiatorId, TradeError.USER_BUSY, msg);
        }

        notifier.sendTradeOpened(initiatorId, resolvedTargetName);
        notifier.sendText(initiatorId, TradeMessages.formatTradeStartedWith(resolvedTargetName), Severity.INFO);
        notifier.sendTradeOpened(targetId, initiatorName);
        notifier.sendText(targetId, TradeMessages.formatTradeInvitedBy(initiatorName), Severity.INFO);

        log.info("交易会话已创建: tradeId={}, {}({}) -> {}({})",
                session.getTradeId(), initiatorName, initiatorId, resolvedTargetName, targetId);
        return TradeResult.ok(TradeMessages.formatRequestSent(resolvedTargetName));
    }

    // ========== 报价 ==========

    @Override
    public TradeResult updateOffer(String userId, OfferTarget target, long quantity) {
        Objects.requireNonNull(target, "target");
        TradeSession session = registry.get(userId).orElse(null);
        if (session == null) {
            return failAndNotify(userId, TradeError.NO_SESSION, TradeMessages.NO_SESSION);
        }
        if (quantity < 0) {
            return failAndNotify(userId, TradeError.INVALID_OFFER, TradeMessages.NEGATIVE_QUANTITY);
        }

        synchronized (session) {
            if (!isLive(session, userId)) {
                return failAndNotify(userId, TradeError.NO_SESSION, TradeMessages.NO_SESSION);
            }
            String selfText;
            try {
                selfText = applyOfferChange(session, userId, target, quantity);
            } catch (TradeException e) {
                return failAndNotify(userId, e.getError(), e.getMessage());
            }
            // 任意一方报价变动，双方确认一律作废
            session.reopenNegotiation();
            session.touch(now());

            notifier.sendText(userId, selfText, Severity.INFO);
            notifier.sendText(session.partnerOf(userId),
                    TradeMessages.formatPartnerOfferChanged(session.nameOf(userId)), Severity.INFO);
            log.debug("报价已更新: tradeId={}, user={}, target={}, quantity={}",
                    session.getTradeId(), userId, target, quantity);
            return TradeResult.ok(TradeMessages.OFFER_UPDATED);
        }
    }

    /**
     * 把一次报价修改写入会话，返回给报价方看的提示。
     */
    private String applyOfferChange(TradeSession session, String userId, OfferTarget target, long quantity) {
        TradeOffer offer = session.offerOf(userId);
        if (target instanceof OfferTarget.Slot slotTarget) {
            int slot = slotTarget.slot();
            if (quantity == 0) {
                offer.remove(slot);
                return TradeMessages.formatOfferItemRemoved(slot);
            }
            OfferedItem item = validator.checkItem(userId, offer, slot, quantity);
            offer.put(item);
            return TradeMessages.formatOfferItem(item.slot(), item.quantity());
        }
        if (quantity > 0) {
            validator.checkGold(userId, quantity);
        }
        offer.setGold(quantity);
        return quantity == 0 ? TradeMessages.OFFER_GOLD_REMOVED : TradeMessages.formatOfferGold(quantity);
    }

    // ========== 确认 ==========

    @Override
    public TradeResult confirm(String userId) {
        TradeSession session = registry.get(userId).orElse(null);
        if (session == null) {
            return failAndNotify(userId, TradeError.NO_SESSION, TradeMessages.NO_SESSION);
        }

        synchronized (session) {
            if (!isLive(session, userId)) {
                return failAndNotify(userId, TradeError.NO_SESSION, TradeMessages.NO_SESSION);
            }
            // 重复确认：幂等，不会触发第二次交换
            if (!session.confirm(userId)) {
                return TradeResult.ok(TradeMessages.ALREADY_CONFIRMED);
            }
            session.touch(now());
            notifier.sendText(userId, TradeMessages.CONFIRMED_SELF, Severity.INFO);
            notifier.sendText(session.partnerOf(userId),
                    TradeMessages.formatPartnerConfirmed(session.nameOf(userId)), Severity.INFO);

            if (!session.bothConfirmed()) {
                return TradeResult.ok(TradeMessages.CONFIRMATION_RECORDED);
            }
            return commit(session);
        }
    }

    @Override
    public TradeResult ready(String userId) {
        return confirm(userId);
    }

    /**
     * 双方都已确认：同步执行交换并根据结果切换状态。调用方持有 session 锁。
     */
    private TradeResult commit(TradeSession session) {
        ExchangeResult result = executor.execute(session);

        if (result.completed()) {
            session.complete();
            registry.clear(session.getInitiatorId());
            for (String id : participants(session)) {
                notifier.sendText(id, TradeMessages.TRADE_COMPLETED, Severity.INFO);
                notifier.sendTradeClosed(id, TradeMessages.TRADE_COMPLETED);
            }
            log.info("交易完成: tradeId={}", session.getTradeId());
            return TradeResult.ok(TradeMessages.TRADE_COMPLETED);
        }

        if (result.fatal()) {
            // 资源状态可能不一致，关闭会话，不允许继续重试
            session.cancel();
            registry.clear(session.getInitiatorId());
            for (String id : participants(session)) {
                notifier.sendText(id, result.message(), Severity.ERROR);
                notifier.sendTradeClosed(id, result.message());
            }
            log.error("交易因回滚失败被关闭: tradeId={}", session.getTradeId());
            return TradeResult.fail(result.error(), result.message());
        }

        // 可恢复失败：清空确认，保留会话供双方调整后重试
        session.resetConfirmations();
        for (String id : participants(session)) {
            notifier.sendText(id, result.message(), Severity.WARN);
        }
        log.warn("交易提交失败，等待重试: tradeId={}, error={}, reason={}",
                session.getTradeId(), result.error(), result.message());
        return TradeResult.fail(result.error(), result.message());
    }

    // ========== 取消 ==========

    @Override
    public TradeResult cancel(String userId, String reason) {
        TradeSession session = registry.get(userId).orElse(null);
        if (session == null) {
            return failAndNotify(userId, TradeError.NO_SESSION, TradeMessages.NO_SESSION);
        }
        String message = StringUtils.isBlank(reason) ? TradeMessages.TRADE_CANCELLED : reason;
        synchronized (session) {
            if (!isLive(session, userId)) {
                return failAndNotify(userId, TradeError.NO_SESSION, TradeMessages.NO_SESSION);
            }
            close(session, message);
        }
        return TradeResult.ok(message);
    }

    @Override
    public TradeResult reject(String userId) {
        return cancel(userId, TradeMessages.TRADE_REJECTED);
    }

    @Override
    public void onDisconnect(String userId) {
        TradeSession session = registry.get(userId).orElse(null);
        if (session == null) {
            return;
        }
        synchronized (session) {
            if (isLive(session, userId)) {
                log.info("玩家断线，取消交易: tradeId={}, user={}", session.getTradeId(), userId);
                close(session, TradeMessages.PARTNER_DISCONNECTED);
            }
        }
    }

    @Override
    public boolean expireIfIdle(String userId, long idleSince) {
        TradeSession session = registry.get(userId).orElse(null);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            if (!isLive(session, userId) || session.getLastUpdate() > idleSince) {
                return false;
            }
            log.info("交易长时间无操作，自动取消: tradeId={}, lastUpdate={}", session.getTradeId(), session.getLastUpdate());
            close(session, TradeMessages.TRADE_EXPIRED);
            return true;
        }
    }

    /** 结束会话（不移动任何资源），通知双方并清理索引。调用方持有 session 锁。 */
    private void close(TradeSession session, String message) {
        session.cancel();
        registry.clear(session.getInitiatorId());
        for (String id : participants(session)) {
            notifier.sendTradeClosed(id, message);
        }
        log.info("交易会话已关闭: tradeId={}, reason={}", session.getTradeId(), message);
    }

    // ========== 查询 ==========

    @Override
    public Optional<TradeSession> getSession(String userId) {
        return registry.get(userId);
    }

    @Override
    public boolean isUserInTrade(String userId) {
        return registry.isUserInTrade(userId);
    }

    @Override
    public Optional<TradeSnapshot> snapshot(String userId) {
        return registry.get(userId).map(session -> {
            synchronized (session) {
                return TradeSnapshot.of(session);
            }
        });
    }

    // ========== 工具 ==========

    private boolean isLive(TradeSession session, String userId) {
        return !session.isTerminal() && registry.get(userId).orElse(null) == session;
    }

    private TradeResult failAndNotify(String userId, TradeError error, String message) {
        notifier.sendText(userId, message, Severity.WARN);
        return TradeResult.fail(error, message);
    }

    private static List<String> participants(TradeSession session) {
        return List.of(session.getInitiatorId(), session.getTargetId());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
