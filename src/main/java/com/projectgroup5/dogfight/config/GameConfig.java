package com.projectgroup5.dogfight.config;

import com.projectgroup5.dogfight.game.LevelLayout;
import com.projectgroup5.dogfight.game.LevelLayoutLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 模拟线程池、出站发送线程池、关卡数据
 */
@Configuration
public class GameConfig {

    @Bean
    public LevelLayout levelLayout(LevelLayoutLoader loader, GameProperties properties) {
        return loader.load(properties.getSimulation().getLevelName());
    }

    // 每个房间同一时刻最多占用一个线程（GameRoom.advance 自带互斥）
    @Bean
    public ThreadPoolTaskExecutor simulationExecutor() {
        int cores = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(2, cores));
        executor.setMaxPoolSize(Math.max(2, cores));
        executor.setQueueCapacity(1024);
        executor.setThreadNamePrefix("sim-");
        executor.initialize();
        return executor;
    }

    // 显式命名为 taskScheduler，@Scheduled 不会用到 WebSocket 自带的调度器
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("tick-");
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor outboundExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("ws-out-");
        executor.initialize();
        return executor;
    }
}
