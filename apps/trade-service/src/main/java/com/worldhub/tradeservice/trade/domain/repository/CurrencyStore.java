package com.worldhub.tradeservice.trade.domain.repository;

/**
 * 玩家金币存储接口。
 */
public interface CurrencyStore {

    /** 当前余额（不存在视为 0） */
    long getGold(String userId);

    /**
     * 扣除金币
     * @return false 表示余额不足（不做任何修改）
     */
    boolean removeGold(String userId, long amount);

    /**
     * 增加金币
     * @return 新余额
     */
    long addGold(String userId, long amount);
}
