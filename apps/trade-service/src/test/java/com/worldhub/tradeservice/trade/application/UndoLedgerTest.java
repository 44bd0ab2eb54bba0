package com.worldhub.tradeservice.trade.application;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class UndoLedgerTest {

    @Test
    public void shouldRevertInReverseOrder() {
        List<String> reverted = new ArrayList<>();
        UndoLedger ledger = new UndoLedger();
        ledger.record("a", () -> reverted.add("a"));
        ledger.record("b", () -> reverted.add("b"));
        ledger.record("c", () -> reverted.add("c"));

        List<String> failed = ledger.rollback();

        Assertions.assertTrue(failed.isEmpty());
        Assertions.assertEquals(List.of("c", "b", "a"), reverted);
        Assertions.assertEquals(0, ledger.size());
    }

    @Test
    public void shouldContinueAfterFailedStepAndReportIt() {
        List<String> reverted = new ArrayList<>();
        UndoLedger ledger = new UndoLedger();
        ledger.record("a", () -> reverted.add("a"));
        ledger.record("b", () -> false);
        ledger.record("c", () -> {
            throw new IllegalStateException("boom");
        });
        ledger.record("d", () -> reverted.add("d"));

        List<String> failed = ledger.rollback();

        Assertions.assertEquals(List.of("b", "c"), failed);
        Assertions.assertEquals(List.of("d", "a"), reverted);
    }

    @Test
    public void shouldNotRevertTwice() {
        int[] calls = {0};
        UndoLedger ledger = new UndoLedger();
        ledger.record("a", () -> ++calls[0] > 0);

        ledger.rollback();
        ledger.rollback();

        Assertions.assertEquals(1, calls[0]);
        Assertions.assertEquals(0, ledger.size());
    }
}
