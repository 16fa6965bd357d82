package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.system.CollectibleSpawner;
import com.projectgroup5.dogfight.game.system.CombatResolver;
import com.projectgroup5.dogfight.game.system.PhaseController;
import com.projectgroup5.dogfight.game.system.ShieldRegenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 房间管理器：按 roomId 维护所有活跃房间
 * 房间之间互不引用，各自拥有自己的 GameWorld
 */
@Component
public class GameRoomManager {
    private static final Logger logger = LoggerFactory.getLogger(GameRoomManager.class);

    // roomId -> GameRoom
    private final Map<Long, GameRoom> rooms = new ConcurrentHashMap<>();

    private final GameProperties properties;
    private final LevelLayout levelLayout;
    private final CombatResolver combatResolver;
    private final ShieldRegenerator shieldRegenerator;
    private final CollectibleSpawner collectibleSpawner;
    private final PhaseController phaseController;

    public GameRoomManager(GameProperties properties,
                           LevelLayout levelLayout,
                           CombatResolver combatResolver,
                           ShieldRegenerator shieldRegenerator,
                           CollectibleSpawner collectibleSpawner,
                           PhaseController phaseController) {
        this.properties = properties;
        this.levelLayout = levelLayout;
        this.combatResolver = combatResolver;
        this.shieldRegenerator = shieldRegenerator;
        this.collectibleSpawner = collectibleSpawner;
        this.phaseController = phaseController;
    }

    /**
     * 第一个加入的连接创建房间
     */
    public GameRoom getOrCreateRoom(long roomId) {
        return rooms.computeIfAbsent(roomId, id -> {
            GameRoom room = new GameRoom(id, levelLayout, properties,
                    combatResolver, shieldRegenerator, collectibleSpawner, phaseController);
            logger.info("Created room {} on level {}", id, levelLayout.getName());
            return room;
        });
    }

    public Optional<GameRoom> getRoom(long roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Collection<GameRoom> getRooms() {
        return rooms.values();
    }

    /**
     * 关闭并移除房间，连接会收到 error 后被关闭
     */
    public void shutdownRoom(long roomId, String reason) {
        GameRoom room = rooms.remove(roomId);
        if (room != null) {
            room.shutdown(reason);
        }
    }

    /**
     * 移除空置超过宽限期的房间
     *
     * @return 被移除的房间 id
     */
    public List<Long> removeIdleRooms(long nowMillis) {
        List<Long> removed = new ArrayList<>();
        for (GameRoom room : rooms.values()) {
            if (room.isIdle(nowMillis) && rooms.remove(room.getRoomId(), room)) {
                room.shutdown("room idle");
                removed.add(room.getRoomId());
                logger.info("Removed idle room {}", room.getRoomId());
            }
        }
        return removed;
    }
}
