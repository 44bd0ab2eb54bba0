package com.worldhub.tradeservice.trade.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一方当前的报价：按格子去重的物品 + 金币。
 * 不做库存校验（由 OfferValidator 负责），只维护"同一格子不能悄悄换成别的物品"这一条约束。
 */
public class TradeOffer {

    /** slot -> 物品条目，保持报价顺序 */
    private final Map<Integer, OfferedItem> items = new LinkedHashMap<>();

    private long gold;

    public OfferedItem item(int slot) {
        return items.get(slot);
    }

    public Collection<OfferedItem> items() {
        return Collections.unmodifiableCollection(items.values());
    }

    /**
     * 写入或替换某个格子的报价。
     * @throws IllegalStateException 该格子已经报了另一种物品（必须先清掉）
     */
    public void put(OfferedItem item) {
        OfferedItem existing = items.get(item.slot());
        if (existing != null && existing.itemId() != item.itemId()) {
            throw new IllegalStateException("slot " + item.slot() + " already offers item " + existing.itemId());
        }
        items.put(item.slot(), item);
    }

    /** 移除某个格子的报价；不存在也视为成功 */
    public void remove(int slot) {
        items.remove(slot);
    }

    public long gold() {
        return gold;
    }

    public void setGold(long gold) {
        if (gold < 0) {
            throw new IllegalArgumentException("gold must not be negative: " + gold);
        }
        this.gold = gold;
    }

    /** 全部条目：物品在前，金币（若有）在后 */
    public List<OfferEntry> entries() {
        List<OfferEntry> out = new ArrayList<>(items.values());
        if (gold > 0) {
            out.add(new OfferedGold(gold));
        }
        return out;
    }

    public boolean isEmpty() {
        return items.isEmpty() && gold == 0;
    }

    @Override
    public String toString() {
        return "TradeOffer{items=" + items.values() + ", gold=" + gold + '}';
    }
}
