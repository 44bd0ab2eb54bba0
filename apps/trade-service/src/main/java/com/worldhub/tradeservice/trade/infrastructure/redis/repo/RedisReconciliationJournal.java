package com.worldhub.tradeservice.trade.infrastructure.redis.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worldhub.tradeservice.infrastructure.redis.RedisOps;
import com.worldhub.tradeservice.trade.domain.model.ReconciliationRecord;
import com.worldhub.tradeservice.trade.domain.repository.ReconciliationJournal;
import com.worldhub.tradeservice.trade.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 对账日志：List world:trade:reconcile，每条记录一段 JSON，新记录 LPUSH 到最前。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisReconciliationJournal implements ReconciliationJournal {

    private final RedisOps ops;
    private final ObjectMapper objectMapper;

    @Override
    public void append(ReconciliationRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化对账记录失败: tradeId=" + record.tradeId(), e);
        }
        ops.lPushStr(RedisKeys.reconcileJournal(), json);
    }

    @Override
    public List<ReconciliationRecord> recent(int limit) {
        if (limit <= 0) return Collections.emptyList();
        List<ReconciliationRecord> out = new ArrayList<>();
        for (String json : ops.lRangeStr(RedisKeys.reconcileJournal(), 0, limit - 1L)) {
            try {
                out.add(objectMapper.readValue(json, ReconciliationRecord.class));
            } catch (JsonProcessingException e) {
                log.warn("跳过无法解析的对账记录: {}", json, e);
            }
        }
        return out;
    }
}
