package com.worldhub.tradeservice.trade.domain.model;

/**
 * 报价中的物品条目。
 *
 * @param slot     报价方自己背包中的格子号
 * @param itemId   报价时该格子中的物品ID
 * @param quantity 报价数量（> 0）
 */
public record OfferedItem(int slot, int itemId, int quantity) implements OfferEntry {

    public OfferedItem {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
    }
}
