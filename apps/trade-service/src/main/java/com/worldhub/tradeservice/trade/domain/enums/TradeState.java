package com.worldhub.tradeservice.trade.domain.enums;

/**
 * 交易会话生命周期状态
 * - PENDING   ：已发起，双方尚未确认（或报价变更后回到此状态）
 * - ACTIVE    ：至少一方已确认
 * - COMPLETED ：交换成功（终态）
 * - CANCELLED ：取消 / 拒绝 / 断线 / 超时 / 回滚失败（终态）
 */
public enum TradeState {
    PENDING,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
