package com.worldhub.tradeservice.trade.infrastructure.redis.repo;

import com.worldhub.tradeservice.infrastructure.redis.RedisOps;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;

public class RedisCurrencyStoreTest {

    private static final String KEY = "world:player:u1:stats";

    private final RedisOps ops = Mockito.mock(RedisOps.class);
    private final RedisCurrencyStore store = new RedisCurrencyStore(ops);

    @Test
    public void shouldTreatMissingOrInvalidGoldAsZero() {
        Mockito.when(ops.hGetStr(KEY, "gold")).thenReturn(null, "abc", "250");

        Assertions.assertEquals(0L, store.getGold("u1"));
        Assertions.assertEquals(0L, store.getGold("u1"));
        Assertions.assertEquals(250L, store.getGold("u1"));
    }

    @Test
    public void shouldRemoveGoldThroughAtomicScript() {
        Mockito.when(ops.evalStr(eq(RedisCurrencyStore.REMOVE_GOLD_LUA), eq(List.of(KEY)),
                eq(List.of("gold", "40")), eq(Long.class))).thenReturn(1L);

        Assertions.assertTrue(store.removeGold("u1", 40));
    }

    @Test
    public void shouldReportInsufficientBalance() {
        Mockito.when(ops.evalStr(any(), anyList(), anyList(), eq(Long.class))).thenReturn(0L);

        Assertions.assertFalse(store.removeGold("u1", 40));
        Assertions.assertFalse(store.removeGold("u1", 0));
        Mockito.verify(ops, Mockito.times(1)).evalStr(any(), anyList(), anyList(), eq(Long.class));
    }

    @Test
    public void shouldIncrementGold() {
        Mockito.when(ops.hIncrByStr(KEY, "gold", 15L)).thenReturn(65L);

        Assertions.assertEquals(65L, store.addGold("u1", 15));
    }
}
