package com.worldhub.tradeservice.trade.domain;

import com.worldhub.tradeservice.trade.domain.enums.TradeError;

/**
 * 交易业务校验失败。
 * 携带错误分类，由 TradeServiceImpl 转换为 TradeResult 并反馈给玩家。
 */
public class TradeException extends RuntimeException {

    private final TradeError error;

    public TradeException(TradeError error, String message) {
        super(message);
        this.error = error;
    }

    public TradeError getError() {
        return error;
    }
}
