package com.projectgroup5.dogfight.game.system;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.GamePhase;
import com.projectgroup5.dogfight.game.GameWorld;
import com.projectgroup5.dogfight.game.PlayerEntity;
import com.projectgroup5.dogfight.game.ProjectileEntity;
import com.projectgroup5.dogfight.game.ShipClass;
import com.projectgroup5.dogfight.game.ShipMotionModel;
import com.projectgroup5.dogfight.game.Vectors;
import com.projectgroup5.dogfight.game.Weapon;
import com.projectgroup5.dogfight.identity.PlayerIdentity;
import com.projectgroup5.dogfight.protocol.ChatBroadcastMessage;
import com.projectgroup5.dogfight.protocol.ChatMessage;
import com.projectgroup5.dogfight.protocol.ClientMessage;
import com.projectgroup5.dogfight.protocol.FireMessage;
import com.projectgroup5.dogfight.protocol.InputMessage;
import com.projectgroup5.dogfight.protocol.MissileUpdateMessage;
import com.projectgroup5.dogfight.protocol.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 输入接收（每个房间一个）
 *
 * socket 线程调用 submit / connect / disconnect，只做结构校验和序号检查然后入队；
 * tick 线程在每个 tick 开始时调用 applyPending，按到达顺序把命令作用到世界上。
 * 所有拒绝都以 ValidationException 的形式记录日志后丢弃，连接保持打开。
 */
public class InputIngestor {
    private static final Logger logger = LoggerFactory.getLogger(InputIngestor.class);

    private enum Kind { JOIN, LEAVE, RESTART, MESSAGE }

    private static final class Pending {
        final Kind kind;
        final String connectionId;
        final String playerId;
        final String playerName;
        final ShipClass shipClass;
        final ClientMessage message;

        Pending(Kind kind, String connectionId, String playerId, String playerName,
                ShipClass shipClass, ClientMessage message) {
            this.kind = kind;
            this.connectionId = connectionId;
            this.playerId = playerId;
            this.playerName = playerName;
            this.shipClass = shipClass;
            this.message = message;
        }
    }

    private final long roomId;
    private final GameProperties properties;
    private final ShipMotionModel motionModel;

    private final Queue<Pending> inbox = new ConcurrentLinkedQueue<>();
    // connectionId -> 最后接受的 input 序号
    private final Map<String, Long> lastSeq = new ConcurrentHashMap<>();
    // connectionId -> playerId
    private final Map<String, String> connectionPlayers = new ConcurrentHashMap<>();

    public InputIngestor(long roomId, GameProperties properties, ShipMotionModel motionModel) {
        this.roomId = roomId;
        this.properties = properties;
        this.motionModel = motionModel;
    }

    // ==================== socket 线程 ====================

    /**
     * 同一个玩家同时只能有一个连接写入：旧连接先被摘掉，之后它发来的消息一律拒绝
     *
     * @return 被顶掉的旧连接 id
     */
    public List<String> connect(String connectionId, PlayerIdentity identity, ShipClass shipClass) {
        List<String> displaced = new ArrayList<>();
        synchronized (connectionPlayers) {
            for (Map.Entry<String, String> entry : connectionPlayers.entrySet()) {
                if (entry.getValue().equals(identity.getId()) && !entry.getKey().equals(connectionId)) {
                    displaced.add(entry.getKey());
                }
            }
            for (String old : displaced) {
                connectionPlayers.remove(old);
                lastSeq.remove(old);
            }
            lastSeq.put(connectionId, 0L);
            connectionPlayers.put(connectionId, identity.getId());
        }
        if (!displaced.isEmpty()) {
            logger.info("Room {} player {} took over from connection(s) {}", roomId, identity.getId(), displaced);
        }
        inbox.add(new Pending(Kind.JOIN, connectionId, identity.getId(), identity.getDisplayName(), shipClass, null));
        return displaced;
    }

    public void disconnect(String connectionId) {
        String playerId;
        synchronized (connectionPlayers) {
            lastSeq.remove(connectionId);
            playerId = connectionPlayers.remove(connectionId);
        }
        if (playerId != null) {
            inbox.add(new Pending(Kind.LEAVE, connectionId, playerId, null, null, null));
        }
    }

    public void requestRestart() {
        inbox.add(new Pending(Kind.RESTART, null, null, null, null, null));
    }

    /**
     * @return 是否入队；被拒绝的消息已经记录了 WARN
     */
    public boolean submit(String connectionId, ClientMessage message) {
        try {
            enqueue(connectionId, message);
            return true;
        } catch (ValidationException e) {
            logger.warn("Room {} rejected {} from {}: {}", roomId,
                    message == null ? "null message" : message.getMessageType(), connectionId, e.getMessage());
            return false;
        }
    }

    private void enqueue(String connectionId, ClientMessage message) {
        if (message == null) {
            throw new ValidationException("message is null");
        }
        String playerId = connectionPlayers.get(connectionId);
        if (playerId == null) {
            throw new ValidationException("connection has not joined this room");
        }
        switch (message.getMessageType()) {
            case INPUT, FIRE, MISSILE_UPDATE, CHAT -> message.validate();
            default -> throw new ValidationException("unexpected message type " + message.getMessageType());
        }
        if (message instanceof InputMessage) {
            long seq = ((InputMessage) message).getSeq();
            // 序号检查和更新必须是原子的
            lastSeq.compute(connectionId, (id, previous) -> {
                if (previous == null) {
                    throw new ValidationException("connection has not joined this room");
                }
                if (seq <= previous) {
                    throw new ValidationException("non-increasing input seq " + seq + " (last " + previous + ")");
                }
                return seq;
            });
        }
        inbox.add(new Pending(Kind.MESSAGE, connectionId, playerId, null, null, message));
    }

    public int getPendingCount() {
        return inbox.size();
    }

    // ==================== tick 线程 ====================

    public void applyPending(GameWorld world) {
        Pending pending;
        while ((pending = inbox.poll()) != null) {
            try {
                apply(world, pending);
            } catch (ValidationException e) {
                logger.warn("Room {} tick {} dropped {} from {}: {}", world.getRoomId(), world.getTick(),
                        describe(pending), pending.playerId, e.getMessage());
            }
        }
    }

    private void apply(GameWorld world, Pending pending) {
        switch (pending.kind) {
            case JOIN -> applyJoin(world, pending);
            case LEAVE -> applyLeave(world, pending);
            case RESTART -> applyRestart(world);
            case MESSAGE -> {
                switch (pending.message.getMessageType()) {
                    case INPUT -> applyInput(world, pending.playerId, (InputMessage) pending.message);
                    case FIRE -> applyFire(world, pending.playerId, (FireMessage) pending.message);
                    case MISSILE_UPDATE -> applyMissileUpdate(world, pending.playerId, (MissileUpdateMessage) pending.message);
                    case CHAT -> applyChat(world, pending.playerId, (ChatMessage) pending.message);
                    default -> throw new ValidationException("unexpected message type " + pending.message.getMessageType());
                }
            }
        }
    }

    private void applyJoin(GameWorld world, Pending pending) {
        PlayerEntity existing = world.getPlayers().get(pending.playerId);
        if (existing != null) {
            logger.info("Room {} player {} reconnected", world.getRoomId(), pending.playerId);
            return;
        }
        PlayerEntity player = new PlayerEntity(pending.playerId, pending.playerName, pending.shipClass);
        player.respawnAt(world.nextSpawnPoint(), world.getTick(), world.getSimTime());
        world.getPlayers().put(player.id, player);
        if (world.getHostPlayerId() == null) {
            world.setHostPlayerId(player.id);
        }
        logger.info("Room {} player {} ({}) joined as {}, {} players",
                world.getRoomId(), player.name, player.id, player.shipClass, world.getPlayers().size());
    }

    private void applyLeave(GameWorld world, Pending pending) {
        // 同一个玩家在别的连接上重连了
        if (connectionPlayers.containsValue(pending.playerId)) {
            logger.debug("Room {} player {} still has a live connection", world.getRoomId(), pending.playerId);
            return;
        }
        PlayerEntity removed = world.getPlayers().remove(pending.playerId);
        if (removed == null) {
            return;
        }
        int orphaned = 0;
        for (ProjectileEntity projectile : world.getProjectiles().values()) {
            if (projectile.ownerId.equals(removed.id) && !projectile.serverSimulated) {
                projectile.orphaned = true;
                orphaned++;
            }
        }
        if (removed.id.equals(world.getHostPlayerId())) {
            world.setHostPlayerId(world.getPlayers().isEmpty()
                    ? null : world.getPlayers().keySet().iterator().next());
        }
        logger.info("Room {} player {} left ({} missiles orphaned), {} players",
                world.getRoomId(), removed.id, orphaned, world.getPlayers().size());
    }

    private void applyRestart(GameWorld world) {
        if (world.getPhase() != GamePhase.RESULTS) {
            throw new ValidationException("restart is only allowed in RESULTS, phase is " + world.getPhase());
        }
        world.setRestartRequested(true);
    }

    void applyInput(GameWorld world, String playerId, InputMessage input) {
        PlayerEntity player = world.getPlayers().get(playerId);
        if (player == null || !player.alive) {
            logger.debug("Room {} ignoring input {} from inactive player {}", world.getRoomId(), input.getSeq(), playerId);
            return;
        }
        GameProperties.Movement movement = properties.getMovement();

        Vector3d velocity = Vectors.vector(input.getVelocity());
        if (!motionModel.withinSpeedCap(player.shipClass, velocity, movement.getSpeedTolerance())) {
            throw new ValidationException("speed " + velocity.length() + " exceeds cap");
        }
        Point3d position = Vectors.point(input.getPosition());
        if (!motionModel.insideArena(position)) {
            throw new ValidationException("position outside arena");
        }
        if (Vectors.length(input.getRotation()) < Vectors.EPSILON) {
            throw new ValidationException("zero rotation quaternion");
        }
        Quat4d rotation = Vectors.quat(input.getRotation());
        rotation.normalize();

        long ticksSince = Math.max(1L, world.getTick() - player.lastInputTick);
        double maxDisplacement = player.shipClass.getMaxSpeed() * (1.0 + movement.getSpeedTolerance())
                * ticksSince * world.getTickSeconds() + movement.getDisplacementSlack();
        double displacement = position.distance(player.position);
        if (displacement > maxDisplacement) {
            throw new ValidationException(String.format("moved %.2f in %d ticks, limit %.2f",
                    displacement, ticksSince, maxDisplacement));
        }

        // 燃料按两次输入之间的模拟时间结算；燃料耗尽时加力标记无效
        motionModel.updateBoost(player.boost, input.isBoost(), true, world.getSimTime(),
                ticksSince * world.getTickSeconds());

        player.position.set(position);
        player.rotation.set(rotation);
        player.velocity.set(velocity);
        player.lastAckedInputSeq = input.getSeq();
        player.lastInputTick = world.getTick();
    }

    void applyFire(GameWorld world, String playerId, FireMessage fire) {
        if (world.getPhase() != GamePhase.PLAYING) {
            logger.debug("Room {} ignoring fire from {} during {}", world.getRoomId(), playerId, world.getPhase());
            return;
        }
        PlayerEntity shooter = world.getPlayers().get(playerId);
        if (shooter == null || !shooter.alive) {
            throw new ValidationException("shooter is not alive");
        }
        Weapon weapon = Weapon.fromWire(fire.getWeapon());

        Vector3d direction = Vectors.vector(fire.getDirection());
        if (direction.length() < Vectors.EPSILON) {
            throw new ValidationException("zero fire direction");
        }
        direction.normalize();

        Point3d muzzle = Vectors.point(fire.getPosition());
        GameProperties.Movement movement = properties.getMovement();
        if (muzzle.distance(shooter.position) > movement.getMuzzleTolerance()) {
            throw new ValidationException("muzzle too far from ship");
        }

        GameProperties.Combat combat = properties.getCombat();
        double now = world.getSimTime();
        switch (weapon) {
            case LASER -> {
                if (now - shooter.lastLaserTime < combat.getLaserFireInterval() - GameWorld.TIMER_EPSILON) {
                    throw new ValidationException("laser fire rate exceeded");
                }
                shooter.lastLaserTime = now;
                int damage = shooter.laserUpgrade ? combat.getUpgradedLaserDamage() : combat.getLaserDamage();
                ProjectileEntity laser = new ProjectileEntity(world.nextProjectileId(), shooter.id, Weapon.LASER,
                        muzzle, direction, combat.getLaserSpeed(), damage, combat.getLaserRadius(),
                        combat.getLaserLifetime(), world.getTick(), true);
                world.getProjectiles().put(laser.id, laser);
            }
            case MISSILE -> {
                if (shooter.missiles <= 0) {
                    throw new ValidationException("no missiles left");
                }
                if (now - shooter.lastMissileTime < combat.getMissileFireInterval() - GameWorld.TIMER_EPSILON) {
                    throw new ValidationException("missile fire rate exceeded");
                }
                String id = shooter.id + ":m" + fire.getClientId();
                if (world.getProjectiles().containsKey(id)) {
                    throw new ValidationException("duplicate missile id " + id);
                }
                shooter.missiles--;
                shooter.lastMissileTime = now;
                ProjectileEntity missile = new ProjectileEntity(id, shooter.id, Weapon.MISSILE,
                        muzzle, direction, combat.getMissileSpeed(), combat.getMissileDamage(),
                        combat.getMissileRadius(), combat.getMissileLifetime(), world.getTick(), false);
                world.getProjectiles().put(missile.id, missile);
            }
        }
    }

    void applyMissileUpdate(GameWorld world, String playerId, MissileUpdateMessage update) {
        ProjectileEntity missile = world.getProjectiles().get(update.getId());
        if (missile == null) {
            // 已经命中或过期
            logger.debug("Room {} missile {} no longer exists", world.getRoomId(), update.getId());
            return;
        }
        if (!missile.ownerId.equals(playerId)) {
            throw new ValidationException("player " + playerId + " does not own " + missile.id);
        }
        if (missile.serverSimulated || missile.orphaned) {
            throw new ValidationException(missile.id + " is not owner-driven");
        }
        Vector3d direction = Vectors.vector(update.getDirection());
        if (direction.length() < Vectors.EPSILON) {
            throw new ValidationException("zero missile direction");
        }
        direction.normalize();

        Point3d reported = Vectors.point(update.getPosition());
        if (!motionModel.insideArena(reported)) {
            throw new ValidationException(missile.id + " reported outside arena");
        }
        // 扫掠从上一个位置到上报位置，位移必须符合导弹速度
        GameProperties.Movement movement = properties.getMovement();
        long ticksSince = Math.max(1L, world.getTick() - missile.lastReportTick);
        double maxDisplacement = missile.speed * (1.0 + movement.getSpeedTolerance())
                * ticksSince * world.getTickSeconds() + movement.getDisplacementSlack();
        double displacement = reported.distance(missile.position);
        if (displacement > maxDisplacement) {
            throw new ValidationException(String.format("%s moved %.2f in %d ticks, limit %.2f",
                    missile.id, displacement, ticksSince, maxDisplacement));
        }

        missile.position.set(reported);
        missile.direction.set(direction);
        missile.lastReportTick = world.getTick();
    }

    void applyChat(GameWorld world, String playerId, ChatMessage chat) {
        String text = chat.getText() == null ? "" : chat.getText().trim();
        if (text.isEmpty()) {
            throw new ValidationException("empty chat message");
        }
        if (text.length() > properties.getNetwork().getMaxChatLength()) {
            throw new ValidationException("chat message longer than " + properties.getNetwork().getMaxChatLength());
        }
        PlayerEntity sender = world.getPlayers().get(playerId);
        String name = sender == null ? playerId : sender.name;
        world.emit(new ChatBroadcastMessage(playerId, name, text, world.getTick()));
    }

    private static String describe(Pending pending) {
        return pending.kind == Kind.MESSAGE ? pending.message.getMessageType().name() : pending.kind.name();
    }
}
