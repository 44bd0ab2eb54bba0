package com.worldhub.tradeservice.trade.domain.repository;

import com.worldhub.tradeservice.trade.domain.model.ReconciliationRecord;

import java.util.List;

/**
 * 对账日志：记录回滚失败的交易，等待管理员人工处理。只追加，不自动重试。
 */
public interface ReconciliationJournal {

    void append(ReconciliationRecord record);

    /** 最近的若干条记录（新的在前） */
    List<ReconciliationRecord> recent(int limit);
}
