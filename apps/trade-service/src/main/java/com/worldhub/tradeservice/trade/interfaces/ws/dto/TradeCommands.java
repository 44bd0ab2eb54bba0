package com.worldhub.tradeservice.trade.interfaces.ws.dto;

import lombok.Data;

/**
 * 客户端 -> 服务端的交易指令
 */
public class TradeCommands {

    /** /app/trade.request */
    @Data
    public static class RequestCmd {
        /** 目标玩家名字（不区分大小写） */
        private String targetName;
    }

    /**
     * /app/trade.offer
     * 物品报价给 slot；金币报价给 gold=true，或沿用旧客户端的 slot=0。
     * quantity 为该条目的最终数量，0 表示撤回。
     */
    @Data
    public static class OfferCmd {
        private Integer slot;
        private boolean gold;
        private long quantity;
    }

    /** /app/trade.confirm、/app/trade.cancel、/app/trade.reject */
    @Data
    public static class SimpleCmd {
        /** 取消原因（可选，仅 cancel 使用） */
        private String reason;
    }
}
