package com.worldhub.tradeservice.trade.domain.repository;

import com.worldhub.tradeservice.trade.domain.model.SlotChange;
import com.worldhub.tradeservice.trade.domain.model.SlotContent;

import java.util.List;
import java.util.Optional;

/**
 * InventoryStore
 * ----------------------------------------
 * 玩家背包存储接口（按格子存放物品）。
 * - 各方法只保证单 key 内的一致性，不提供跨玩家事务；
 * - 当前实现为 Redis（RedisInventoryStore）。
 */
public interface InventoryStore {

    /**
     * 读取某个格子的实时内容
     * @param userId 玩家ID
     * @param slot   格子号
     * @return 物品与数量；空格子返回 empty
     */
    Optional<SlotContent> getSlot(String userId, int slot);

    /**
     * 从指定格子移除若干个物品
     * @return false 表示格子为空或数量不足（不做任何修改）
     */
    boolean removeItem(String userId, int slot, int quantity);

    /**
     * 加入物品（优先叠加到同类物品上，再占用空格子）
     * @return 被修改的格子、新数量及各格加入的数量；空列表表示空间不足（不做任何修改）
     */
    List<SlotChange> addItem(String userId, int itemId, int quantity);

    /**
     * 把物品放回原格子，仅用于撤销一次扣除。
     * 原格子为空或仍是同一物品时直接放回；已被其他物品占用时退化为 {@link #addItem}。
     * @return false 表示无处可放
     */
    boolean restoreItem(String userId, int slot, int itemId, int quantity);

    /**
     * 按物品ID移除若干个物品（可跨多个格子），仅用于撤销一次交付。
     * @return false 表示总数不足（不做任何修改）
     */
    boolean removeItemByItemId(String userId, int itemId, int quantity);
}
