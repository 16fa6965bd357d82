package com.projectgroup5.dogfight.game;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

/**
 * 玩家实体（服务器权威）
 * 只有房间的 tick 线程会写这些字段
 */
public class PlayerEntity {
    public final String id;
    public final String name;
    public final ShipClass shipClass;

    public final Point3d position = new Point3d();
    public final Quat4d rotation = Vectors.identity();
    public final Vector3d velocity = new Vector3d();
    public final BoostTank boost;

    public double health;
    public double maxHealth;
    public int kills;
    public int deaths;
    public int missiles;
    public int maxMissiles;
    public boolean laserUpgrade;
    public boolean alive;

    // 模拟时间（秒）
    public double lastDamageTime;
    public double lastLaserTime = Double.NEGATIVE_INFINITY;
    public double lastMissileTime = Double.NEGATIVE_INFINITY;
    public double respawnRemaining;

    public long lastAckedInputSeq;
    // 上一次接受移动输入的 tick，用于位移上限检查
    public long lastInputTick;

    public PlayerEntity(String id, String name, ShipClass shipClass) {
        this.id = id;
        this.name = name;
        this.shipClass = shipClass;
        this.maxHealth = shipClass.getMaxHealth();
        this.health = maxHealth;
        this.maxMissiles = shipClass.getMaxMissiles();
        this.missiles = maxMissiles;
        this.boost = new BoostTank(shipClass.getMaxBoostFuel());
        this.alive = true;
    }

    /** 复活 / 重置到出生点：满血、满燃料、静止、朝向复位 */
    public void respawnAt(Point3d spawn, long tick, double simTime) {
        position.set(spawn);
        velocity.set(0, 0, 0);
        rotation.set(Vectors.identity());
        health = maxHealth;
        boost.refill();
        alive = true;
        respawnRemaining = 0;
        lastInputTick = tick;
        lastDamageTime = simTime;
    }
}
