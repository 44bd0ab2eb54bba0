package com.worldhub.tradeservice.trade.application;

import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TradeSessionRegistry
 * -------------------------------------------------------
 * 用户ID -> 交易会话 的内存索引（进程内单例 Bean，由 Spring 注入，不使用静态全局）。
 * - 一个会话总是同时挂在两名参与者名下，或都不挂；
 * - 每个用户同一时间最多一个会话；
 * - 登记/清除两步写在同一把锁里，读操作无锁。
 */
@Slf4j
@Component
public class TradeSessionRegistry {

    private final Map<String, TradeSession> sessionsByUser = new ConcurrentHashMap<>();

    /**
     * 原子登记：两名参与者都空闲时才写入。
     * @return false 表示任意一方已有会话（不做任何修改）
     */
    public synchronized boolean register(TradeSession session) {
        String a = session.getInitiatorId();
        String b = session.getTargetId();
        if (sessionsByUser.containsKey(a) || sessionsByUser.containsKey(b)) {
            return false;
        }
        sessionsByUser.put(a, session);
        sessionsByUser.put(b, session);
        return true;
    }

    public Optional<TradeSession> get(String userId) {
        if (userId == null) return Optional.empty();
        return Optional.ofNullable(sessionsByUser.get(userId));
    }

    public boolean isUserInTrade(String userId) {
        return userId != null && sessionsByUser.containsKey(userId);
    }

    /**
     * 清除该用户所在会话的双方映射（一次完成，不留半边映射）。
     * 只删除仍指向同一会话的条目，避免误删对方之后新建的会话。
     */
    public synchronized void clear(String userId) {
        TradeSession session = sessionsByUser.get(userId);
        if (session == null) {
            return;
        }
        sessionsByUser.remove(session.getInitiatorId(), session);
        sessionsByUser.remove(session.getTargetId(), session);
        log.debug("交易会话已移出索引: tradeId={}", session.getTradeId());
    }

    /** 当前所有会话（去重） */
    public Collection<TradeSession> activeSessions() {
        Set<TradeSession> distinct = new LinkedHashSet<>(sessionsByUser.values());
        return distinct;
    }

    public int size() {
        return activeSessions().size();
    }
}
