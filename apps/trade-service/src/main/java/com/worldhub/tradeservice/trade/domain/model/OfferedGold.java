package com.worldhub.tradeservice.trade.domain.model;

/**
 * 报价中的金币条目。
 *
 * @param amount 金币数量（> 0）
 */
public record OfferedGold(long amount) implements OfferEntry {

    public OfferedGold {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
    }
}
