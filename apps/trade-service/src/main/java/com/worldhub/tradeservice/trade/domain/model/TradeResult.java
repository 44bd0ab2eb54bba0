package com.worldhub.tradeservice.trade.domain.model;

import com.worldhub.tradeservice.trade.domain.enums.TradeError;

/**
 * 交易操作结果（ok + 错误分类 + 给玩家看的描述）。
 */
public record TradeResult(boolean ok, TradeError error, String message) {

    public static TradeResult ok(String message) {
        return new TradeResult(true, null, message);
    }

    public static TradeResult fail(TradeError error, String message) {
        return new TradeResult(false, error, message);
    }
}
