package com.worldhub.tradeservice.trade.domain.model;

import java.util.List;

/**
 * 回滚失败时写入对账日志的记录，供管理员人工修复。
 *
 * @param tradeId         交易ID
 * @param initiatorId     发起方
 * @param targetId        目标方
 * @param reason          触发回滚的原因
 * @param unreversedSteps 未能撤销的步骤描述（按原执行顺序）
 * @param createdAt       记录时间（epoch millis）
 */
public record ReconciliationRecord(String tradeId,
                                   String initiatorId,
                                   String targetId,
                                   String reason,
                                   List<String> unreversedSteps,
                                   long createdAt) {
}
