package com.worldhub.tradeservice.trade.application;

import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

public class TradeSessionRegistryTest {

    @Test
    public void shouldIndexSessionUnderBothParticipants() {
        TradeSessionRegistry registry = new TradeSessionRegistry();
        TradeSession session = new TradeSession("u1", "Alice", "u2", "Bob", 1000L);

        Assertions.assertTrue(registry.register(session));

        Assertions.assertSame(session, registry.get("u1").orElseThrow());
        Assertions.assertSame(session, registry.get("u2").orElseThrow());
        Assertions.assertTrue(registry.isUserInTrade("u1"));
        Assertions.assertEquals(1, registry.size());
    }

    @Test
    public void shouldRejectRegistrationWhenEitherParticipantIsBusy() {
        TradeSessionRegistry registry = new TradeSessionRegistry();
        registry.register(new TradeSession("u1", "Alice", "u2", "Bob", 1000L));

        Assertions.assertFalse(registry.register(new TradeSession("u3", "Carol", "u2", "Bob", 1000L)));
        Assertions.assertFalse(registry.register(new TradeSession("u1", "Alice", "u4", "Dave", 1000L)));
        Assertions.assertFalse(registry.isUserInTrade("u3"));
        Assertions.assertFalse(registry.isUserInTrade("u4"));
    }

    @Test
    public void shouldClearBothSidesFromEitherParticipant() {
        TradeSessionRegistry registry = new TradeSessionRegistry();
        registry.register(new TradeSession("u1", "Alice", "u2", "Bob", 1000L));

        registry.clear("u2");

        Assertions.assertTrue(registry.get("u1").isEmpty());
        Assertions.assertTrue(registry.get("u2").isEmpty());
        Assertions.assertEquals(0, registry.size());
        // 重复清理无副作用
        registry.clear("u1");
    }

    @Test
    public void shouldAdmitOnlyOneConcurrentRequestForSameTarget() throws Exception {
        TradeSessionRegistry registry = new TradeSessionRegistry();
        int requesters = 16;
        ExecutorService pool = Executors.newFixedThreadPool(requesters);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < requesters; i++) {
            String initiator = "p" + i;
            results.add(pool.submit(() -> {
                start.await();
                return registry.register(new TradeSession(initiator, initiator, "target", "Target", 1000L));
            }));
        }
        start.countDown();
        int admitted = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) admitted++;
        }
        pool.shutdownNow();

        Assertions.assertEquals(1, admitted);
        Assertions.assertEquals(1, registry.size());
    }
}
