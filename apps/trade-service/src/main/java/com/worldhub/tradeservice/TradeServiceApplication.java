package com.worldhub.tradeservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * trade-service 启动入口。
 * 玩家间交易（协商 + 原子交换）的独立服务进程，交易会话仅存在于本进程内存中。
 */
@SpringBootApplication
public class TradeServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeServiceApplication.class, args);
    }
}
