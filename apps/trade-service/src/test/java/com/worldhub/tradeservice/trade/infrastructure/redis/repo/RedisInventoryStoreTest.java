package com.worldhub.tradeservice.trade.infrastructure.redis.repo;

import com.worldhub.tradeservice.config.TradeProperties;
import com.worldhub.tradeservice.support.InMemoryRedisOps;
import com.worldhub.tradeservice.trade.domain.model.SlotChange;
import com.worldhub.tradeservice.trade.domain.model.SlotContent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class RedisInventoryStoreTest {

    private static final String KEY = "world:player:u1:inventory";

    private InMemoryRedisOps ops;
    private TradeProperties properties;
    private RedisInventoryStore store;

    @BeforeEach
    public void setUp() {
        ops = new InMemoryRedisOps();
        properties = new TradeProperties();
        store = new RedisInventoryStore(ops, properties);
    }

    @Test
    public void shouldReadSlotInStorageFormat() {
        ops.hSetStr(KEY, "slot_3", "42:5");
        ops.hSetStr(KEY, "slot_4", "garbage");

        Assertions.assertEquals(new SlotContent(42, 5), store.getSlot("u1", 3).orElseThrow());
        Assertions.assertTrue(store.getSlot("u1", 4).isEmpty());
        Assertions.assertTrue(store.getSlot("u1", 5).isEmpty());
    }

    @Test
    public void shouldRemovePartiallyAndDeleteEmptiedSlot() {
        ops.hSetStr(KEY, "slot_1", "7:3");

        Assertions.assertTrue(store.removeItem("u1", 1, 2));
        Assertions.assertEquals("7:1", ops.hash(KEY).get("slot_1"));
        Assertions.assertFalse(store.removeItem("u1", 1, 2));
        Assertions.assertTrue(store.removeItem("u1", 1, 1));
        Assertions.assertFalse(ops.hash(KEY).containsKey("slot_1"));
    }

    @Test
    public void shouldStackOntoExistingBeforeUsingEmptySlots() {
        ops.hSetStr(KEY, "slot_1", "9:15");
        ops.hSetStr(KEY, "slot_2", "5:1");

        List<SlotChange> changes = store.addItem("u1", 9, 10);

        Assertions.assertEquals(List.of(new SlotChange(1, 20, 5), new SlotChange(3, 5, 5)), changes);
        Assertions.assertEquals("9:20", ops.hash(KEY).get("slot_1"));
        Assertions.assertEquals("9:5", ops.hash(KEY).get("slot_3"));
    }

    @Test
    public void shouldLeaveInventoryUntouchedWhenItDoesNotFit() {
        properties.getInventory().setMaxSlots(2);
        ops.hSetStr(KEY, "slot_1", "9:18");
        ops.hSetStr(KEY, "slot_2", "5:1");
        Map<String, String> before = new HashMap<>(ops.hash(KEY));

        List<SlotChange> changes = store.addItem("u1", 9, 5);

        Assertions.assertTrue(changes.isEmpty());
        Assertions.assertEquals(before, ops.hash(KEY));
    }

    @Test
    public void shouldRestoreIntoOriginalSlot() {
        ops.hSetStr(KEY, "slot_1", "9:5");

        Assertions.assertTrue(store.restoreItem("u1", 4, 9, 2));

        Assertions.assertEquals("9:2", ops.hash(KEY).get("slot_4"));
        Assertions.assertEquals("9:5", ops.hash(KEY).get("slot_1"));
    }

    @Test
    public void shouldFallBackToStackingWhenOriginalSlotIsTaken() {
        ops.hSetStr(KEY, "slot_4", "5:1");

        Assertions.assertTrue(store.restoreItem("u1", 4, 9, 2));

        Assertions.assertEquals("5:1", ops.hash(KEY).get("slot_4"));
        Assertions.assertEquals("9:2", ops.hash(KEY).get("slot_1"));
    }

    @Test
    public void shouldRemoveByItemIdFromHighestSlotFirst() {
        ops.hSetStr(KEY, "slot_1", "9:20");
        ops.hSetStr(KEY, "slot_3", "9:5");

        Assertions.assertTrue(store.removeItemByItemId("u1", 9, 8));

        Assertions.assertFalse(ops.hash(KEY).containsKey("slot_3"));
        Assertions.assertEquals("9:17", ops.hash(KEY).get("slot_1"));
        Assertions.assertFalse(store.removeItemByItemId("u1", 9, 18));
        Assertions.assertEquals("9:17", ops.hash(KEY).get("slot_1"));
    }
}
