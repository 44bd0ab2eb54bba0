package com.worldhub.tradeservice.trade.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 * 背包与属性 Key 与世界服其他模块共用，格式不能随意改动。
 */
public final class RedisKeys {

    private static final String PFX = "world:";

    private RedisKeys() {}

    // ---- 玩家背包（Hash：slot_{n} -> "itemId:quantity"） ----
    public static String inventory(String userId) {
        return PFX + "player:" + userId + ":inventory";
    }

    public static String slotField(int slot) {
        return "slot_" + slot;
    }

    // ---- 玩家属性（Hash，金币字段为 gold） ----
    public static String stats(String userId) {
        return PFX + "player:" + userId + ":stats";
    }

    public static final String GOLD_FIELD = "gold";

    // ---- 在线目录 ----
    /** 小写名字 -> userId */
    public static String onlineNames() {
        return PFX + "online:names";
    }

    /** userId -> 展示名 */
    public static String onlineIds() {
        return PFX + "online:ids";
    }

    // ---- 对账日志（List，新记录在左） ----
    public static String reconcileJournal() {
        return PFX + "trade:reconcile";
    }
}
