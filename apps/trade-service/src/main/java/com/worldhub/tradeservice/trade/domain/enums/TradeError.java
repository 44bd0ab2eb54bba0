package com.worldhub.tradeservice.trade.domain.enums;

/**
 * 交易错误分类。
 * 除 ROLLBACK_FAILURE 外都可恢复：只反馈给发起操作的玩家，不改动会话（提交失败时清空确认标记除外）。
 */
public enum TradeError {
    /** 调用方当前没有交易会话 */
    NO_SESSION,
    /** 任意一方已在交易中 */
    USER_BUSY,
    /** 目标玩家不在线 */
    TARGET_UNAVAILABLE,
    /** 不能和自己交易 */
    SELF_TRADE,
    /** 空格子 / 数量不足 / 格子物品不一致 / 非法数量 */
    INVALID_OFFER,
    /** 金币余额不足 */
    INSUFFICIENT_GOLD,
    /** 提交时复核发现报价已不可行 */
    VALIDATION_STALE,
    /** 接收方背包已满 */
    DELIVERY_BLOCKED,
    /** 回滚本身失败：可能出现资源复制或丢失，需人工对账（致命） */
    ROLLBACK_FAILURE;

    public boolean isFatal() {
        return this == ROLLBACK_FAILURE;
    }
}
