package com.worldhub.tradeservice.trade.infrastructure.redis.repo;

import com.worldhub.tradeservice.config.TradeProperties;
import com.worldhub.tradeservice.infrastructure.redis.RedisOps;
import com.worldhub.tradeservice.trade.domain.model.SlotChange;
import com.worldhub.tradeservice.trade.domain.model.SlotContent;
import com.worldhub.tradeservice.trade.domain.repository.InventoryStore;
import com.worldhub.tradeservice.trade.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * RedisInventoryStore
 * -------------------------------------------------------
 * 玩家背包的 Redis 仓储实现。
 * - Hash：world:player:{userId}:inventory，字段 slot_{n}，值 "itemId:quantity"；
 * - 空格子不保留字段（数量归零即 HDEL）；
 * - 多格子写入先在内存中规划，全部放得下才一次性 HSET，放不下不做任何修改。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisInventoryStore implements InventoryStore {

    private final RedisOps ops;
    private final TradeProperties properties;

    @Override
    public Optional<SlotContent> getSlot(String userId, int slot) {
        String raw = ops.hGetStr(RedisKeys.inventory(userId), RedisKeys.slotField(slot));
        return Optional.ofNullable(SlotContent.parse(raw));
    }

    @Override
    public boolean removeItem(String userId, int slot, int quantity) {
        if (quantity <= 0) return false;
        SlotContent current = getSlot(userId, slot).orElse(null);
        if (current == null || current.quantity() < quantity) {
            return false;
        }
        writeSlot(userId, slot, current.itemId(), current.quantity() - quantity);
        return true;
    }

    @Override
    public List<SlotChange> addItem(String userId, int itemId, int quantity) {
        if (quantity <= 0) return Collections.emptyList();
        List<SlotChange> plan = planAdd(loadSlots(userId), itemId, quantity);
        if (plan.isEmpty()) {
            log.debug("背包空间不足: userId={}, itemId={}, quantity={}", userId, itemId, quantity);
            return plan;
        }
        Map<String, String> writes = new LinkedHashMap<>();
        for (SlotChange change : plan) {
            writes.put(RedisKeys.slotField(change.slot()), new SlotContent(itemId, change.newQuantity()).format());
        }
        ops.hSetAllStr(RedisKeys.inventory(userId), writes);
        return plan;
    }

    @Override
    public boolean restoreItem(String userId, int slot, int itemId, int quantity) {
        if (quantity <= 0) return false;
        SlotContent current = getSlot(userId, slot).orElse(null);
        if (current == null) {
            writeSlot(userId, slot, itemId, quantity);
            return true;
        }
        if (current.itemId() == itemId) {
            writeSlot(userId, slot, itemId, current.quantity() + quantity);
            return true;
        }
        // 原格子已被其他物品占用，按普通加入处理
        log.warn("原格子已被占用，改为堆叠放回: userId={}, slot={}, itemId={}", userId, slot, itemId);
        return !addItem(userId, itemId, quantity).isEmpty();
    }

    @Override
    public boolean removeItemByItemId(String userId, int itemId, int quantity) {
        if (quantity <= 0) return false;
        TreeMap<Integer, SlotContent> slots = loadSlots(userId);
        int total = slots.values().stream()
                .filter(c -> c.itemId() == itemId)
                .mapToInt(SlotContent::quantity)
                .sum();
        if (total < quantity) {
            return false;
        }
        // 从编号最大的格子开始扣，优先撤掉最后放入的堆叠
        int remaining = quantity;
        for (Map.Entry<Integer, SlotContent> e : slots.descendingMap().entrySet()) {
            if (remaining == 0) break;
            SlotContent c = e.getValue();
            if (c.itemId() != itemId) continue;
            int take = Math.min(remaining, c.quantity());
            writeSlot(userId, e.getKey(), itemId, c.quantity() - take);
            remaining -= take;
        }
        return true;
    }

    /**
     * 规划一次加入：先补满同类物品的未满堆叠，再按格子号占用空格子。
     * @return 需要写入的格子；放不下时返回空列表
     */
    List<SlotChange> planAdd(TreeMap<Integer, SlotContent> slots, int itemId, int quantity) {
        int maxStack = properties.getInventory().getMaxStack();
        int maxSlots = properties.getInventory().getMaxSlots();
        int remaining = quantity;
        List<SlotChange> plan = new ArrayList<>();

        for (Map.Entry<Integer, SlotContent> e : slots.entrySet()) {
            if (remaining == 0) break;
            SlotContent c = e.getValue();
            if (c.itemId() != itemId || c.quantity() >= maxStack) continue;
            int add = Math.min(maxStack - c.quantity(), remaining);
            plan.add(new SlotChange(e.getKey(), c.quantity() + add, add));
            remaining -= add;
        }
        for (int slot = 1; slot <= maxSlots && remaining > 0; slot++) {
            if (slots.containsKey(slot)) continue;
            int put = Math.min(maxStack, remaining);
            plan.add(new SlotChange(slot, put, put));
            remaining -= put;
        }
        return remaining > 0 ? Collections.emptyList() : plan;
    }

    private TreeMap<Integer, SlotContent> loadSlots(String userId) {
        TreeMap<Integer, SlotContent> out = new TreeMap<>();
        ops.hGetAllStr(RedisKeys.inventory(userId)).forEach((field, raw) -> {
            if (!field.startsWith("slot_")) return;
            SlotContent c = SlotContent.parse(raw);
            if (c == null) return;
            try {
                out.put(Integer.parseInt(field.substring("slot_".length())), c);
            } catch (NumberFormatException e) {
                log.warn("忽略无法解析的背包字段: userId={}, field={}", userId, field);
            }
        });
        return out;
    }

    private void writeSlot(String userId, int slot, int itemId, int quantity) {
        String key = RedisKeys.inventory(userId);
        if (quantity <= 0) {
            ops.hDelStr(key, RedisKeys.slotField(slot));
        } else {
            ops.hSetStr(key, RedisKeys.slotField(slot), new SlotContent(itemId, quantity).format());
        }
    }
}
