package com.worldhub.tradeservice.support;

import com.worldhub.tradeservice.trade.domain.model.ReconciliationRecord;
import com.worldhub.tradeservice.trade.domain.repository.ReconciliationJournal;

import java.util.ArrayList;
import java.util.List;

public class InMemoryReconciliationJournal implements ReconciliationJournal {

    private final List<ReconciliationRecord> records = new ArrayList<>();

    @Override
    public void append(ReconciliationRecord record) {
        records.add(0, record);
    }

    @Override
    public List<ReconciliationRecord> recent(int limit) {
        return List.copyOf(records.subList(0, Math.min(limit, records.size())));
    }

    public List<ReconciliationRecord> all() {
        return records;
    }
}
