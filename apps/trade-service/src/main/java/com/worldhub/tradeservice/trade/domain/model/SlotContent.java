package com.worldhub.tradeservice.trade.domain.model;

/**
 * 背包格子的实时内容。
 */
public record SlotContent(int itemId, int quantity) {

    /**
     * 解析存储格式 "itemId:quantity"；空值或格式错误返回 null。
     */
    public static SlotContent parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String[] parts = raw.trim().split(":");
        if (parts.length != 2) return null;
        try {
            int itemId = Integer.parseInt(parts[0].trim());
            int quantity = Integer.parseInt(parts[1].trim());
            return quantity > 0 ? new SlotContent(itemId, quantity) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String format() {
        return itemId + ":" + quantity;
    }
}
