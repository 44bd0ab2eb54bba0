package com.worldhub.tradeservice.trade.domain.notify;

import com.worldhub.tradeservice.trade.domain.enums.Severity;

/**
 * 交易相关的客户端通知出口，所有玩家可见的反馈都经由此接口。
 * 实现不得向调用方抛出投递异常（连接已断开的玩家直接丢弃）。
 */
public interface TradeNotifier {

    /** 打开交易窗口 */
    void sendTradeOpened(String userId, String partnerName);

    /** 关闭交易窗口 */
    void sendTradeClosed(String userId, String reason);

    /** 文本提示 */
    void sendText(String userId, String message, Severity severity);
}
