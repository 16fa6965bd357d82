package com.projectgroup5.dogfight.game.system;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.game.ProjectileEntity;
import com.projectgroup5.dogfight.game.Vectors;
import com.projectgroup5.dogfight.physics.SphereCollider;
import com.projectgroup5.dogfight.physics.SweepHit;
import com.projectgroup5.dogfight.physics.SweptShapeQuery;
import com.projectgroup5.dogfight.protocol.HitMessage;
import com.projectgroup5.dogfight.protocol.KillMessage;
import com.projectgroup5.dogfight.protocol.RespawnMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * 战斗判定：复活计时、弹体推进、扫掠命中、伤害与击杀、寿命
 * 本身无状态，所有数据都在 GameWorld 里
 */
@Component
public class CombatResolver {
    private static final Logger logger = LoggerFactory.getLogger(CombatResolver.class);

    private final GameProperties properties;
    private final SweptShapeQuery sweptShapeQuery;

    public CombatResolver(GameProperties properties, SweptShapeQuery sweptShapeQuery) {
        this.properties = properties;
        this.sweptShapeQuery = sweptShapeQuery;
    }

    public void resolve(GameWorld world, double dt) {
        processRespawns(world, dt);
        resolveProjectiles(world, dt);
    }

    private void processRespawns(GameWorld world, double dt) {
        for (PlayerEntity player : world.getPlayers().values()) {
            if (player.alive) {
                continue;
            }
            player.respawnRemaining -= dt;
            if (player.respawnRemaining <= GameWorld.TIMER_EPSILON) {
                player.respawnAt(world.nextSpawnPoint(), world.getTick(), world.getSimTime());
                world.emit(new RespawnMessage(player.id, Vectors.toArray(player.position), world.getTick()));
                logger.debug("Room {} player {} respawned at {}", world.getRoomId(), player.id, player.position);
            }
        }
    }

    private void resolveProjectiles(GameWorld world, double dt) {
        double playerRadius = properties.getCombat().getPlayerColliderRadius();
        Iterator<ProjectileEntity> it = world.getProjectiles().values().iterator();
        while (it.hasNext()) {
            ProjectileEntity projectile = it.next();
            Point3d from = new Point3d(projectile.previousPosition);

            // 激光和失去所有者的导弹由服务器推进；其余导弹保持所有者上报的位置
            if (projectile.serverSimulated || projectile.orphaned) {
                projectile.position.scaleAdd(projectile.speed * dt, projectile.direction, projectile.position);
            }

            List<SphereCollider> colliders = new ArrayList<>();
            for (PlayerEntity target : world.getPlayers().values()) {
                if (target.alive && !target.id.equals(projectile.ownerId)) {
                    colliders.add(new SphereCollider(target.id, target.position, playerRadius));
                }
            }

            if (!colliders.isEmpty()) {
                Optional<SweepHit> hit = sweptShapeQuery.castSphere(from, projectile.position, projectile.radius, colliders);
                if (hit.isPresent()) {
                    applyHit(world, projectile, world.getPlayers().get(hit.get().getColliderId()));
                    it.remove();
                    continue;
                }
            }

            projectile.remainingLifetime -= dt;
            if (projectile.remainingLifetime <= GameWorld.TIMER_EPSILON) {
                it.remove();
                continue;
            }
            projectile.previousPosition.set(projectile.position);
        }
    }

    private void applyHit(GameWorld world, ProjectileEntity projectile, PlayerEntity target) {
        double amount = Math.min(projectile.damage, target.health);
        target.health = Math.max(0, target.health - projectile.damage);
        target.lastDamageTime = world.getSimTime();
        world.emit(new HitMessage(target.id, amount, projectile.ownerId, projectile.id, world.getTick()));

        if (target.health > 0) {
            return;
        }
        target.alive = false;
        target.velocity.set(0, 0, 0);
        target.deaths++;
        target.respawnRemaining = properties.getCombat().getRespawnDelay();

        PlayerEntity killer = world.getPlayers().get(projectile.ownerId);
        if (killer != null && killer != target) {
            killer.kills++;
        }
        world.emit(new KillMessage(projectile.ownerId, target.id, world.getTick()));
        logger.info("Room {} tick {}: {} killed {} with {}",
                world.getRoomId(), world.getTick(), projectile.ownerId, target.id, projectile.weapon);
    }
}
