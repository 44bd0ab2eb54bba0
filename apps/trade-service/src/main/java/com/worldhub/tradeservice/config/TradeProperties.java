package com.worldhub.tradeservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 交易服务相关配置。
 *
 * 支持通过 application.yml 或环境变量覆盖，例如：
 *   trade.session.idle-timeout=5m
 *   trade.inventory.max-slots=30
 */
@Component
@ConfigurationProperties(prefix = "trade")
public class TradeProperties {

    private final Session session = new Session();

    private final Inventory inventory = new Inventory();

    public Session getSession() {
        return session;
    }

    public Inventory getInventory() {
        return inventory;
    }

    /**
     * 会话回收策略
     */
    public static class Session {

        /**
         * 无操作多久后自动取消交易；0 或负数表示不回收
         */
        private Duration idleTimeout = Duration.ofMinutes(5);

        /**
         * 回收任务的扫描间隔
         */
        private Duration reapInterval = Duration.ofSeconds(30);

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getReapInterval() {
            return reapInterval;
        }

        public void setReapInterval(Duration reapInterval) {
            this.reapInterval = reapInterval;
        }
    }

    /**
     * 背包规格
     */
    public static class Inventory {

        /**
         * 背包格子数（格子号 1..maxSlots）
         */
        private int maxSlots = 30;

        /**
         * 单格最大堆叠数
         */
        private int maxStack = 20;

        public int getMaxSlots() {
            return maxSlots;
        }

        public void setMaxSlots(int maxSlots) {
            this.maxSlots = maxSlots;
        }

        public int getMaxStack() {
            return maxStack;
        }

        public void setMaxStack(int maxStack) {
            this.maxStack = maxStack;
        }
    }
}
