package com.projectgroup5.dogfight.game.system;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.CollectibleEntity;
import com.projectgroup5.dogfight.game.GamePhase;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.game.Vectors;
import com.projectgroup5.dogfight.protocol.PhaseChangedMessage;
import com.projectgroup5.dogfight.protocol.RespawnMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 对局阶段状态机：LOBBY → COUNTDOWN → PLAYING → RESULTS → LOBBY
 * 不跳过任何阶段；人数跌破下限不会中止倒计时或对局
 */
@Component
public class PhaseController {
    private static final Logger logger = LoggerFactory.getLogger(PhaseController.class);

    private final GameProperties properties;

    public PhaseController(GameProperties properties) {
        this.properties = properties;
    }

    public void update(GameWorld world, double dt) {
        GameProperties.Phase config = properties.getPhase();
        switch (world.getPhase()) {
            case LOBBY -> {
                if (world.getPlayers().size() >= config.getMinPlayers()) {
                    transition(world, GamePhase.COUNTDOWN, config.getCountdownSeconds(), null);
                }
            }
            case COUNTDOWN -> {
                if (tickDown(world, dt)) {
                    resetMatch(world);
                    transition(world, GamePhase.PLAYING, config.getMatchSeconds(), null);
                }
            }
            case PLAYING -> {
                boolean timeUp = tickDown(world, dt);
                if (timeUp || scoreLimitReached(world, config.getScoreLimit())) {
                    world.getProjectiles().clear();
                    transition(world, GamePhase.RESULTS, config.getResultsSeconds(), findWinner(world));
                }
            }
            case RESULTS -> {
                boolean timeUp = tickDown(world, dt);
                if (world.isRestartRequested()) {
                    logger.info("Room {} restarted by admin", world.getRoomId());
                }
                if (timeUp || world.isRestartRequested()) {
                    world.setRestartRequested(false);
                    transition(world, GamePhase.LOBBY, 0, null);
                }
            }
        }
    }

    /** @return 计时是否走完 */
    private static boolean tickDown(GameWorld world, double dt) {
        double remaining = world.getPhaseTimer() - dt;
        if (remaining <= GameWorld.TIMER_EPSILON) {
            world.setPhaseTimer(0);
            return true;
        }
        world.setPhaseTimer(remaining);
        return false;
    }

    private static boolean scoreLimitReached(GameWorld world, int scoreLimit) {
        for (PlayerEntity player : world.getPlayers().values()) {
            if (player.kills >= scoreLimit) {
                return true;
            }
        }
        return false;
    }

    /** 击杀最多者胜，平局看死亡数少的，再平局按加入顺序 */
    static String findWinner(GameWorld world) {
        PlayerEntity best = null;
        for (PlayerEntity player : world.getPlayers().values()) {
            if (best == null
                    || player.kills > best.kills
                    || (player.kills == best.kills && player.deaths < best.deaths)) {
                best = player;
            }
        }
        return best == null ? null : best.id;
    }

    private void resetMatch(GameWorld world) {
        for (PlayerEntity player : world.getPlayers().values()) {
            player.kills = 0;
            player.deaths = 0;
            player.missiles = player.maxMissiles;
            player.laserUpgrade = false;
            player.lastLaserTime = Double.NEGATIVE_INFINITY;
            player.lastMissileTime = Double.NEGATIVE_INFINITY;
            player.respawnAt(world.nextSpawnPoint(), world.getTick(), world.getSimTime());
            world.emit(new RespawnMessage(player.id, Vectors.toArray(player.position), world.getTick()));
        }
        world.getProjectiles().clear();
        for (CollectibleEntity collectible : world.getCollectibles().values()) {
            collectible.active = true;
            collectible.respawnRemaining = 0;
        }
    }

    private void transition(GameWorld world, GamePhase next, double timer, String winnerId) {
        GamePhase previous = world.getPhase();
        world.setPhase(next);
        world.setPhaseTimer(timer);
        world.emit(new PhaseChangedMessage(next.name(), previous.name(), timer, winnerId, world.getTick()));
        if (winnerId != null) {
            logger.info("Room {} phase {} -> {} at tick {}, winner {}",
                    world.getRoomId(), previous, next, world.getTick(), winnerId);
        } else {
            logger.info("Room {} phase {} -> {} at tick {}", world.getRoomId(), previous, next, world.getTick());
        }
    }
}
