package com.worldhub.tradeservice.trade.application;

import com.worldhub.tradeservice.trade.domain.TradeException;
import com.worldhub.tradeservice.trade.domain.constants.TradeMessages;
import com.worldhub.tradeservice.trade.domain.enums.TradeError;
import com.worldhub.tradeservice.trade.domain.model.ExchangeResult;
import com.worldhub.tradeservice.trade.domain.model.OfferEntry;
import com.worldhub.tradeservice.trade.domain.model.OfferedGold;
import com.worldhub.tradeservice.trade.domain.model.OfferedItem;
import com.worldhub.tradeservice.trade.domain.model.ReconciliationRecord;
import com.worldhub.tradeservice.trade.domain.model.SlotChange;
import com.worldhub.tradeservice.trade.domain.model.TradeOffer;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import com.worldhub.tradeservice.trade.domain.repository.CurrencyStore;
import com.worldhub.tradeservice.trade.domain.repository.InventoryStore;
import com.worldhub.tradeservice.trade.domain.repository.PlayerDirectory;
import com.worldhub.tradeservice.trade.domain.repository.ReconciliationJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * ExchangeExecutor
 * -------------------------------------------------------
 * 双方确认后执行物品/金币交换，用"分阶段提交 + 撤销账本"模拟多 key 事务：
 *  1. 复核：以存储中的实时数据重新校验双方报价，失败则不做任何修改；
 *  2. 扣除：依次从每一方扣除其报价的物品与金币，每成功一步登记逆操作；
 *  3. 交付：把对方的报价交给每一方，失败时先撤销已交付部分，再撤销扣除阶段；
 *  4. 完成：返回成功，由调用方切换会话状态并清理索引。
 *
 * 先扣后给：任何时刻都不会出现"既保留原物又拿到对方物品"的状态。
 * 撤销失败属于致命错误（ROLLBACK_FAILURE），写入对账日志等待人工处理，不重试。
 *
 * 调用方需保证同一会话的 execute 串行执行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExchangeExecutor {

    private final InventoryStore inventoryStore;
    private final CurrencyStore currencyStore;
    private final OfferValidator validator;
    private final PlayerDirectory playerDirectory;
    private final ReconciliationJournal journal;

    public ExchangeResult execute(TradeSession session) {
        log.info("开始执行交易: tradeId={}, initiator={}, target={}",
                session.getTradeId(), session.getInitiatorId(), session.getTargetId());

        // 1) 复核
        try {
            validator.revalidate(session);
        } catch (TradeException e) {
            log.warn("交易复核未通过: tradeId={}, reason={}", session.getTradeId(), e.getMessage());
            return ExchangeResult.failed(e.getError(), e.getMessage());
        }

        List<String> participants = List.of(session.getInitiatorId(), session.getTargetId());

        // 2) 扣除阶段
        UndoLedger withdrawals = new UndoLedger();
        for (String userId : participants) {
            if (!withdraw(userId, session.offerOf(userId), withdrawals)) {
                String reason = TradeMessages.formatReserveFailed(playerDirectory.getDisplayName(userId));
                return abort(session, TradeError.VALIDATION_STALE, reason, withdrawals);
            }
        }

        // 3) 交付阶段：每一方收到对方的报价
        UndoLedger deliveries = new UndoLedger();
        for (String userId : participants) {
            TradeOffer incoming = session.offerOf(session.partnerOf(userId));
            if (!deliver(userId, incoming, deliveries)) {
                String reason = TradeMessages.formatDeliveryBlocked(playerDirectory.getDisplayName(userId));
                return abort(session, TradeError.DELIVERY_BLOCKED, reason, deliveries, withdrawals);
            }
        }

        log.info("交易执行成功: tradeId={}, withdrawals={}, deliveries={}",
                session.getTradeId(), withdrawals.size(), deliveries.size());
        return ExchangeResult.completed(TradeMessages.TRADE_COMPLETED);
    }

    private boolean withdraw(String userId, TradeOffer offer, UndoLedger ledger) {
        for (OfferEntry entry : offer.entries()) {
            if (entry instanceof OfferedItem item) {
                boolean removed = attempt("扣除物品", userId,
                        () -> inventoryStore.removeItem(userId, item.slot(), item.quantity()));
                if (!removed) {
                    return false;
                }
                ledger.record(
                        "归还物品: user=" + userId + ", slot=" + item.slot() + ", itemId=" + item.itemId() + ", qty=" + item.quantity(),
                        () -> inventoryStore.restoreItem(userId, item.slot(), item.itemId(), item.quantity()));
            } else if (entry instanceof OfferedGold gold) {
                boolean removed = attempt("扣除金币", userId, () -> currencyStore.removeGold(userId, gold.amount()));
                if (!removed) {
                    return false;
                }
                ledger.record("归还金币: user=" + userId + ", amount=" + gold.amount(), () -> {
                    currencyStore.addGold(userId, gold.amount());
                    return true;
                });
            }
        }
        return true;
    }

    private boolean deliver(String userId, TradeOffer incoming, UndoLedger ledger) {
        for (OfferEntry entry : incoming.entries()) {
            if (entry instanceof OfferedItem item) {
                List<SlotChange> changes = new ArrayList<>();
                boolean added = attempt("交付物品", userId,
                        () -> changes.addAll(inventoryStore.addItem(userId, item.itemId(), item.quantity())));
                if (!added) {
                    return false;
                }
                ledger.record(
                        "收回交付物品: user=" + userId + ", itemId=" + item.itemId() + ", qty=" + item.quantity() + ", slots=" + changes,
                        () -> takeBack(userId, item.itemId(), changes));
            } else if (entry instanceof OfferedGold gold) {
                boolean added = attempt("交付金币", userId, () -> {
                    currencyStore.addGold(userId, gold.amount());
                    return true;
                });
                if (!added) {
                    return false;
                }
                ledger.record("收回交付金币: user=" + userId + ", amount=" + gold.amount(),
                        () -> currencyStore.removeGold(userId, gold.amount()));
            }
        }
        return true;
    }

    /**
     * 撤销一次交付：从本次写入的格子里逐个扣回加入的数量。
     * 格子已不是该物品或数量不够时，差额改为按物品ID扣回。
     */
    private boolean takeBack(String userId, int itemId, List<SlotChange> changes) {
        int unmatched = 0;
        for (int i = changes.size() - 1; i >= 0; i--) {
            SlotChange change = changes.get(i);
            boolean matches = inventoryStore.getSlot(userId, change.slot())
                    .filter(c -> c.itemId() == itemId && c.quantity() >= change.added())
                    .isPresent();
            if (matches && inventoryStore.removeItem(userId, change.slot(), change.added())) {
                continue;
            }
            unmatched += change.added();
        }
        if (unmatched == 0) {
            return true;
        }
        log.warn("交付格子已变化，按物品ID收回: user={}, itemId={}, qty={}", userId, itemId, unmatched);
        return inventoryStore.removeItemByItemId(userId, itemId, unmatched);
    }

    /** 执行一步正向操作；存储层异常视为该步失败 */
    private boolean attempt(String action, String userId, BooleanSupplier op) {
        try {
            return op.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("{}失败（存储异常）: user={}", action, userId, e);
            return false;
        }
    }

    /**
     * 按传入顺序撤销各账本（先交付、后扣除）。全部撤销成功则返回原始失败原因；
     * 否则记录对账日志并返回 ROLLBACK_FAILURE。
     */
    private ExchangeResult abort(TradeSession session, TradeError error, String reason, UndoLedger... ledgers) {
        List<String> unreversed = new ArrayList<>();
        for (UndoLedger ledger : ledgers) {
            unreversed.addAll(ledger.rollback());
        }
        if (unreversed.isEmpty()) {
            log.warn("交易已中止并回滚: tradeId={}, error={}, reason={}", session.getTradeId(), error, reason);
            return ExchangeResult.failed(error, reason);
        }

        ReconciliationRecord record = new ReconciliationRecord(
                session.getTradeId(),
                session.getInitiatorId(),
                session.getTargetId(),
                reason,
                List.copyOf(unreversed),
                System.currentTimeMillis());
        log.error("交易回滚失败，需要人工对账: tradeId={}, reason={}, unreversed={}",
                session.getTradeId(), reason, unreversed);
        try {
            journal.append(record);
        } catch (RuntimeException e) {
            log.error("对账记录写入失败，请以本条日志为准: record={}", record, e);
        }
        return ExchangeResult.failed(TradeError.ROLLBACK_FAILURE, TradeMessages.ROLLBACK_FAILED);
    }
}
