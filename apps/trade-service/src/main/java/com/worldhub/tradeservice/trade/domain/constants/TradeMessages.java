package com.worldhub.tradeservice.trade.domain.constants;

/**
 * 交易相关的消息常量
 * 统一管理所有玩家可见的提示文字，避免硬编码
 *
 * 使用示例：
 *   notifier.sendText(userId, TradeMessages.NO_SESSION, Severity.WARN);
 *   notifier.sendText(partnerId, TradeMessages.formatPartnerOfferChanged(name), Severity.INFO);
 */
public final class TradeMessages {

    private TradeMessages() {
        // 工具类，禁止实例化
    }

    // ========== 发起交易 ==========

    /** 目标玩家不在线（需要格式化，传入玩家名） */
    public static final String TARGET_OFFLINE = "玩家 %s 不在线";

    /** 不能和自己交易 */
    public static final String SELF_TRADE = "不能和自己交易";

    /** 发起方已在交易中 */
    public static final String ALREADY_TRADING = "你已经有一个进行中的交易";

    /** 目标方已在交易中（需要格式化） */
    public static final String TARGET_BUSY = "%s 正在和其他人交易";

    /** 交易请求已发出（需要格式化） */
    public static final String REQUEST_SENT = "已向 %s 发起交易请求";

    /** 发起方收到的开场提示 */
    public static final String TRADE_STARTED_WITH = "你开始与 %s 交易";

    /** 目标方收到的开场提示 */
    public static final String TRADE_INVITED_BY = "%s 想和你交易";

    public static String formatTargetOffline(String name) {
        return String.format(TARGET_OFFLINE, name);
    }

    public static String formatTargetBusy(String name) {
        return String.format(TARGET_BUSY, name);
    }

    public static String formatRequestSent(String name) {
        return String.format(REQUEST_SENT, name);
    }

    public static String formatTradeStartedWith(String name) {
        return String.format(TRADE_STARTED_WITH, name);
    }

    public static String formatTradeInvitedBy(String name) {
        return String.format(TRADE_INVITED_BY, name);
    }

    // ========== 报价 ==========

    /** 当前没有交易 */
    public static final String NO_SESSION = "你当前没有进行中的交易";

    public static final String NEGATIVE_QUANTITY = "数量不能为负数";

    public static final String INVALID_SLOT = "无效的格子：%d";

    public static final String SLOT_EMPTY = "该格子是空的";

    public static final String NOT_ENOUGH_IN_SLOT = "该格子中没有这么多物品";

    public static final String SLOT_OFFER_CONFLICT = "该格子已报价其他物品，请先撤下";

    public static final String NOT_ENOUGH_GOLD = "你没有这么多金币";

    public static final String OFFER_UPDATED = "报价已更新";

    public static final String OFFER_ITEM = "你报价了格子 %d 中的 %d 个物品";

    public static final String OFFER_ITEM_REMOVED = "你撤下了格子 %d 的报价";

    public static final String OFFER_GOLD = "你报价了 %d 金币";

    public static final String OFFER_GOLD_REMOVED = "你撤下了金币报价";

    /** 通知对方：报价已变动（需要格式化，传入修改方名字） */
    public static final String PARTNER_OFFER_CHANGED = "%s 修改了报价";

    public static String formatInvalidSlot(int slot) {
        return String.format(INVALID_SLOT, slot);
    }

    public static String formatOfferItem(int slot, int quantity) {
        return String.format(OFFER_ITEM, slot, quantity);
    }

    public static String formatOfferItemRemoved(int slot) {
        return String.format(OFFER_ITEM_REMOVED, slot);
    }

    public static String formatOfferGold(long amount) {
        return String.format(OFFER_GOLD, amount);
    }

    public static String formatPartnerOfferChanged(String name) {
        return String.format(PARTNER_OFFER_CHANGED, name);
    }

    // ========== 确认 / 结束 ==========

    public static final String CONFIRMED_SELF = "你已确认交易";

    public static final String PARTNER_CONFIRMED = "%s 已确认交易";

    public static final String CONFIRMATION_RECORDED = "确认已记录";

    public static final String ALREADY_CONFIRMED = "你已经确认过了";

    public static final String TRADE_COMPLETED = "交易完成";

    public static final String TRADE_CANCELLED = "交易已取消";

    public static final String TRADE_REJECTED = "交易被拒绝";

    public static final String PARTNER_DISCONNECTED = "对方已断开连接，交易取消";

    public static final String TRADE_EXPIRED = "交易长时间无操作，已自动取消";

    public static String formatPartnerConfirmed(String name) {
        return String.format(PARTNER_CONFIRMED, name);
    }

    // ========== 提交失败 ==========

    public static final String STALE_SLOT_EMPTY = "%s 已不再持有格子 %d 中的物品";

    public static final String STALE_SLOT_CHANGED = "%s 修改了格子 %d";

    public static final String STALE_GOLD = "%s 已没有足够的金币";

    public static final String RESERVE_FAILED = "无法扣除 %s 报价的资源";

    public static final String DELIVERY_BLOCKED = "%s 的背包空间不足";

    public static final String ROLLBACK_FAILED = "交易出现异常，已提交管理员核查";

    public static String formatStaleSlotEmpty(String name, int slot) {
        return String.format(STALE_SLOT_EMPTY, name, slot);
    }

    public static String formatStaleSlotChanged(String name, int slot) {
        return String.format(STALE_SLOT_CHANGED, name, slot);
    }

    public static String formatStaleGold(String name) {
        return String.format(STALE_GOLD, name);
    }

    public static String formatReserveFailed(String name) {
        return String.format(RESERVE_FAILED, name);
    }

    public static String formatDeliveryBlocked(String name) {
        return String.format(DELIVERY_BLOCKED, name);
    }
}
