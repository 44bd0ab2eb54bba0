package com.worldhub.tradeservice.trade.domain.model;

import com.worldhub.tradeservice.trade.domain.enums.TradeState;

import java.util.List;

/**
 * 交易会话的只读快照（推送给客户端 / REST 查询用）。
 * 不暴露可变内部状态。
 */
public record TradeSnapshot(String tradeId,
                            TradeState state,
                            Side initiator,
                            Side target,
                            long createdAt,
                            long lastUpdate) {

    /**
     * 单方视图：身份、报价与确认标记。
     */
    public record Side(String userId, String name, List<OfferedItem> items, long gold, boolean confirmed) {
    }

    public static TradeSnapshot of(TradeSession s) {
        return new TradeSnapshot(
                s.getTradeId(),
                s.getState(),
                side(s, s.getInitiatorId()),
                side(s, s.getTargetId()),
                s.getCreatedAt(),
                s.getLastUpdate());
    }

    private static Side side(TradeSession s, String userId) {
        TradeOffer offer = s.offerOf(userId);
        return new Side(userId, s.nameOf(userId), List.copyOf(offer.items()), offer.gold(), s.isConfirmed(userId));
    }
}
