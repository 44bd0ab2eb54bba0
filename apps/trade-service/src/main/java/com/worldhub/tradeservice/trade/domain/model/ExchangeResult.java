package com.worldhub.tradeservice.trade.domain.model;

import com.worldhub.tradeservice.trade.domain.enums.TradeError;

/**
 * 原子交换的执行结果。
 * completed=false 时 error 一定非空；error=ROLLBACK_FAILURE 表示资源状态可能已不一致。
 */
public record ExchangeResult(boolean completed, TradeError error, String message) {

    public static ExchangeResult completed(String message) {
        return new ExchangeResult(true, null, message);
    }

    public static ExchangeResult failed(TradeError error, String message) {
        return new ExchangeResult(false, error, message);
    }

    public boolean fatal() {
        return error != null && error.isFatal();
    }
}
