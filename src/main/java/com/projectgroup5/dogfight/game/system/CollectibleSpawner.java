package com.projectgroup5.dogfight.game.system;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.CollectibleEntity;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.protocol.PickupMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 道具：先走重生计时，再判定拾取
 * 每个道具有自己的计时器，被拾取后 respawnTime 秒重新出现
 */
@Component
public class CollectibleSpawner {
    private static final Logger logger = LoggerFactory.getLogger(CollectibleSpawner.class);

    private final GameProperties properties;

    public CollectibleSpawner(GameProperties properties) {
        this.properties = properties;
    }

    public void update(GameWorld world, double dt) {
        for (CollectibleEntity collectible : world.getCollectibles().values()) {
            if (collectible.active) {
                continue;
            }
            collectible.respawnRemaining -= dt;
            if (collectible.respawnRemaining <= GameWorld.TIMER_EPSILON) {
                collectible.active = true;
                collectible.respawnRemaining = 0;
                logger.debug("Room {} collectible {} respawned", world.getRoomId(), collectible.id);
            }
        }

        GameProperties.Collectibles config = properties.getCollectibles();
        double reach = config.getPickupRadius() + properties.getCombat().getPlayerColliderRadius();
        for (PlayerEntity player : world.getPlayers().values()) {
            if (!player.alive) {
                continue;
            }
            for (CollectibleEntity collectible : world.getCollectibles().values()) {
                if (collectible.active && player.position.distance(collectible.position) <= reach) {
                    pickUp(world, player, collectible, config);
                }
            }
        }
    }

    private void pickUp(GameWorld world, PlayerEntity player, CollectibleEntity collectible,
                        GameProperties.Collectibles config) {
        collectible.active = false;
        collectible.respawnRemaining = config.getRespawnTime();
        switch (collectible.type) {
            case MISSILE_REFILL -> player.missiles = Math.min(player.maxMissiles,
                    player.missiles + config.getMissileRefillAmount());
            case LASER_UPGRADE -> player.laserUpgrade = true;
        }
        world.emit(new PickupMessage(player.id, collectible.id, collectible.type.name(), world.getTick()));
        logger.debug("Room {} player {} picked up {} ({})",
                world.getRoomId(), player.id, collectible.id, collectible.type);
    }
}
