package com.worldhub.tradeservice.trade.application;

import com.worldhub.tradeservice.config.TradeProperties;
import com.worldhub.tradeservice.trade.domain.model.TradeSession;
import com.worldhub.tradeservice.trade.service.TradeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * IdleTradeReaper
 * -------------------------------------------------
 * 空闲交易回收：周期扫描所有未结束的会话，
 * lastUpdate 早于 (now - trade.session.idle-timeout) 的会话按"超时"取消。
 *
 * - 应用就绪后启动（ApplicationReady）；idle-timeout <= 0 时不启动；
 * - 真正的取消走 TradeService.expireIfIdle，在会话锁内再判断一次，
 *   扫描与取消之间有新操作的会话不会被误杀。
 */
@Slf4j
@Component
public class IdleTradeReaper {

    private final TradeSessionRegistry registry;
    private final TradeService tradeService;
    private final TradeProperties properties;
    private final ScheduledThreadPoolExecutor scheduler;

    public IdleTradeReaper(TradeSessionRegistry registry,
                           TradeService tradeService,
                           TradeProperties properties,
                           @Qualifier("tradeReaperScheduler") ScheduledThreadPoolExecutor scheduler) {
        this.registry = registry;
        this.tradeService = tradeService;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        Duration idle = properties.getSession().getIdleTimeout();
        if (idle == null || idle.isZero() || idle.isNegative()) {
            log.info("空闲交易回收已关闭（trade.session.idle-timeout={}）", idle);
            return;
        }
        long intervalMs = Math.max(1000L, properties.getSession().getReapInterval().toMillis());
        scheduler.scheduleAtFixedRate(this::reapSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("空闲交易回收已启动: idleTimeout={}, interval={}ms", idle, intervalMs);
    }

    /**
     * 扫描一轮并取消空闲会话。
     * @param nowMillis 当前时间（epoch millis）
     * @return 本轮取消的会话数
     */
    public int reapIdle(long nowMillis) {
        long idleSince = nowMillis - properties.getSession().getIdleTimeout().toMillis();
        int reaped = 0;
        for (TradeSession session : List.copyOf(registry.activeSessions())) {
            if (session.isTerminal() || session.getLastUpdate() > idleSince) {
                continue;
            }
            if (tradeService.expireIfIdle(session.getInitiatorId(), idleSince)) {
                reaped++;
            }
        }
        if (reaped > 0) {
            log.info("空闲交易回收完成: reaped={}, remaining={}", reaped, registry.size());
        }
        return reaped;
    }

    private void reapSafely() {
        try {
            reapIdle(System.currentTimeMillis());
        } catch (RuntimeException e) {
            // 周期任务中抛出异常会导致后续不再调度
            log.error("空闲交易回收异常", e);
        }
    }
}
