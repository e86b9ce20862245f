package com.mudhub.realtime.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 后台定时任务线程池：连接清理与 SSE 心跳。
 *
 * 线程命名为 janitor-N，守护线程；任务满时丢弃；取消的任务从队列中移除。
 */
@Configuration
public class JanitorSchedulerConfig {

    @Value("${scheduler.janitor.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "janitorScheduler")
    public ScheduledThreadPoolExecutor janitorScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "janitor-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
