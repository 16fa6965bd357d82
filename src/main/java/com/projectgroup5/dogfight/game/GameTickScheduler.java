package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.config.GameProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 游戏主循环调度器
 * 定时检查每个房间的时钟，把到期的固定步交给模拟线程池执行；
 * 每个房间单独 try/catch，一个房间出错不影响其它房间
 */
@Component
public class GameTickScheduler {
    private static final Logger logger = LoggerFactory.getLogger(GameTickScheduler.class);

    private final GameRoomManager roomManager;
    private final TaskExecutor simulationExecutor;
    private final GameProperties properties;

    public GameTickScheduler(GameRoomManager roomManager,
                             @Qualifier("simulationExecutor") TaskExecutor simulationExecutor,
                             GameProperties properties) {
        this.roomManager = roomManager;
        this.simulationExecutor = simulationExecutor;
        this.properties = properties;
    }

    @Scheduled(fixedRateString = "${dogfight.simulation.poll-interval-millis:10}")
    public void pump() {
        for (GameRoom room : roomManager.getRooms()) {
            simulationExecutor.execute(() -> runRoom(room, System.nanoTime()));
        }
    }

    void runRoom(GameRoom room, long nowNanos) {
        try {
            room.advance(nowNanos);
        } catch (RuntimeException e) {
            int faults = room.recordFault();
            logger.error("Room {} tick failed ({} in a row)", room.getRoomId(), faults, e);
            if (faults >= properties.getSimulation().getMaxConsecutiveFaults()) {
                logger.error("Room {} exceeded {} consecutive faults, shutting down",
                        room.getRoomId(), properties.getSimulation().getMaxConsecutiveFaults());
                roomManager.shutdownRoom(room.getRoomId(), "room stopped after repeated errors");
            }
        }
    }

    @Scheduled(fixedRate = 1000)
    public void cleanupIdleRooms() {
        roomManager.removeIdleRooms(System.currentTimeMillis());
    }
}
