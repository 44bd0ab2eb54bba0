package com.worldhub.tradeservice.support;

import com.worldhub.tradeservice.trade.domain.model.SlotChange;
import com.worldhub.tradeservice.trade.domain.model.SlotContent;
import com.worldhub.tradeservice.trade.domain.repository.InventoryStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 内存背包：与 Redis 实现相同的堆叠规则，另外提供故障注入开关。
 */
public class InMemoryInventoryStore implements InventoryStore {

    private final int maxSlots;
    private final int maxStack;
    private final Map<String, TreeMap<Integer, SlotContent>> inventories = new HashMap<>();
    private final Set<String> blockAdd = new HashSet<>();
    private final Set<String> failRestore = new HashSet<>();
    private final Set<String> failRemove = new HashSet<>();

    public InMemoryInventoryStore() {
        this(30, 20);
    }

    public InMemoryInventoryStore(int maxSlots, int maxStack) {
        this.maxSlots = maxSlots;
        this.maxStack = maxStack;
    }

    public void put(String userId, int slot, int itemId, int quantity) {
        slots(userId).put(slot, new SlotContent(itemId, quantity));
    }

    public void clearSlot(String userId, int slot) {
        slots(userId).remove(slot);
    }

    /** 背包快照（格子 -> 内容），用于前后对比 */
    public Map<Integer, SlotContent> snapshot(String userId) {
        return new TreeMap<>(slots(userId));
    }

    public int count(String userId, int itemId) {
        return slots(userId).values().stream()
                .filter(c -> c.itemId() == itemId)
                .mapToInt(SlotContent::quantity)
                .sum();
    }

    public void blockAddFor(String userId) {
        blockAdd.add(userId);
    }

    public void failRestoreFor(String userId) {
        failRestore.add(userId);
    }

    public void failRemoveFor(String userId) {
        failRemove.add(userId);
    }

    @Override
    public Optional<SlotContent> getSlot(String userId, int slot) {
        return Optional.ofNullable(slots(userId).get(slot));
    }

    @Override
    public boolean removeItem(String userId, int slot, int quantity) {
        if (failRemove.contains(userId)) return false;
        SlotContent c = slots(userId).get(slot);
        if (quantity <= 0 || c == null || c.quantity() < quantity) return false;
        write(userId, slot, c.itemId(), c.quantity() - quantity);
        return true;
    }

    @Override
    public List<SlotChange> addItem(String userId, int itemId, int quantity) {
        if (quantity <= 0 || blockAdd.contains(userId)) return Collections.emptyList();
        TreeMap<Integer, SlotContent> slots = slots(userId);
        List<SlotChange> plan = new ArrayList<>();
        int remaining = quantity;
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
        if (remaining > 0) return Collections.emptyList();
        for (SlotChange change : plan) {
            write(userId, change.slot(), itemId, change.newQuantity());
        }
        return plan;
    }

    @Override
    public boolean restoreItem(String userId, int slot, int itemId, int quantity) {
        if (failRestore.contains(userId)) return false;
        SlotContent c = slots(userId).get(slot);
        if (c == null) {
            write(userId, slot, itemId, quantity);
            return true;
        }
        if (c.itemId() == itemId) {
            write(userId, slot, itemId, c.quantity() + quantity);
            return true;
        }
        return !addItem(userId, itemId, quantity).isEmpty();
    }

    @Override
    public boolean removeItemByItemId(String userId, int itemId, int quantity) {
        if (count(userId, itemId) < quantity) return false;
        int remaining = quantity;
        for (Map.Entry<Integer, SlotContent> e : new TreeMap<>(slots(userId)).descendingMap().entrySet()) {
            if (remaining == 0) break;
            SlotContent c = e.getValue();
            if (c.itemId() != itemId) continue;
            int take = Math.min(remaining, c.quantity());
            write(userId, e.getKey(), itemId, c.quantity() - take);
            remaining -= take;
        }
        return true;
    }

    private TreeMap<Integer, SlotContent> slots(String userId) {
        return inventories.computeIfAbsent(userId, k -> new TreeMap<>());
    }

    private void write(String userId, int slot, int itemId, int quantity) {
        if (quantity <= 0) {
            slots(userId).remove(slot);
        } else {
            slots(userId).put(slot, new SlotContent(itemId, quantity));
        }
    }
}
