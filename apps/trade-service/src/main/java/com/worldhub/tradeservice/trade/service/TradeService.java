package com.worldhub.tradeservice.trade.service;

import com.worldhub.tradeservice.trade.domain.model.OfferTarget;
import com.worldhub.tradeservice.trade.domain.model.TradeResult;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import com.worldhub.tradeservice.trade.domain.model.TradeSnapshot;

import java.util.Optional;

/**
 * 玩家间交易服务：发起、报价、确认、取消。
 * 所有失败都以 {@link TradeResult} 返回，并已通过 TradeNotifier 反馈给发起操作的玩家。
 */
public interface TradeService {

    /**
     * 发起交易请求
     * @param initiatorId 发起方用户ID
     * @param targetName  目标玩家名（不区分大小写）
     */
    TradeResult requestTrade(String initiatorId, String targetName);

    /**
     * 修改报价
     * @param userId   报价方
     * @param target   格子或金币
     * @param quantity 0 表示撤下该条目；> 0 表示报价数量
     */
    TradeResult updateOffer(String userId, OfferTarget target, long quantity);

    /** 确认交易；双方都确认后立即执行交换 */
    TradeResult confirm(String userId);

    /** confirm 的别名（旧客户端的"交易就绪"指令） */
    TradeResult ready(String userId);

    /**
     * 取消交易
     * @param reason 为空时使用默认提示
     */
    TradeResult cancel(String userId, String reason);

    /** 拒绝交易 */
    TradeResult reject(String userId);

    /** 连接断开时的清理钩子（没有交易时什么都不做） */
    void onDisconnect(String userId);

    /**
     * 若该用户的会话自 idleSince 起没有任何操作，则取消它
     * @return true 表示本次取消了会话
     */
    boolean expireIfIdle(String userId, long idleSince);

    Optional<TradeSession> getSession(String userId);

    boolean isUserInTrade(String userId);

    /** 当前会话的只读快照 */
    Optional<TradeSnapshot> snapshot(String userId);
}
