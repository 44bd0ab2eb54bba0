package com.worldhub.tradeservice.platform.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 空闲交易回收用的定时线程池（守护线程 trade-reaper-N）。
 * 队列满时丢弃任务，下一轮扫描会补上。
 */
@Slf4j
@Configuration
public class ReaperSchedulerConfig {

    @Bean(name = "tradeReaperScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor tradeReaperScheduler(
            @Value("${scheduler.reaper.corePoolSize:1}") int corePoolSize) {
        BasicThreadFactory threads = new BasicThreadFactory.Builder()
                .namingPattern("trade-reaper-%d")
                .daemon(true)
                .uncaughtExceptionHandler((t, e) -> log.error("回收线程异常退出: thread={}", t.getName(), e))
                .build();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                Math.max(1, corePoolSize), threads, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        return executor;
    }
}
