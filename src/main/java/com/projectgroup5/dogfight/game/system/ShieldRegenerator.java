package com.projectgroup5.dogfight.game.system;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import org.springframework.stereotype.Component;

/**
 * 护盾回复：最后一次受伤 regenDelay 秒后，每秒回复 regenRate，不超过上限
 */
@Component
public class ShieldRegenerator {

    private final GameProperties properties;

    public ShieldRegenerator(GameProperties properties) {
        this.properties = properties;
    }

    public void regenerate(GameWorld world, double dt) {
        GameProperties.Shield shield = properties.getShield();
        double now = world.getSimTime();
        for (PlayerEntity player : world.getPlayers().values()) {
            if (!player.alive || player.health >= player.maxHealth) {
                continue;
            }
            if (now - player.lastDamageTime >= shield.getRegenDelay() - GameWorld.TIMER_EPSILON) {
                player.health = Math.min(player.maxHealth, player.health + shield.getRegenRate() * dt);
            }
        }
    }
}
