package com.projectgroup5.dogfight.game;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * 弹体实体
 * serverSimulated=true：激光，服务器积分位置并判定碰撞
 * serverSimulated=false：追踪导弹，位置由发射者客户端上报，服务器转发
 */
public class ProjectileEntity {
    public final String id;
    public final String ownerId;
    public final Weapon weapon;
    public final Point3d position;
    // 上一个 tick 结束时的位置，扫掠检测的起点
    public final Point3d previousPosition;
    public final Vector3d direction;
    public final double speed;
    public final int damage;
    public final double radius;
    public final long spawnTick;
    public final boolean serverSimulated;

    public double remainingLifetime;
    // 发射者已断线，导弹沿最后航向外推直到寿命结束
    public boolean orphaned;
    // 所有者最后一次上报位置的 tick，用来限制两次上报之间的位移
    public long lastReportTick;

    public ProjectileEntity(String id, String ownerId, Weapon weapon,
                            Point3d position, Vector3d direction,
                            double speed, int damage, double radius,
                            double lifetime, long spawnTick, boolean serverSimulated) {
        this.id = id;
        this.ownerId = ownerId;
        this.weapon = weapon;
        this.position = new Point3d(position);
        this.previousPosition = new Point3d(position);
        this.direction = new Vector3d(direction);
        this.speed = speed;
        this.damage = damage;
        this.radius = radius;
        this.remainingLifetime = lifetime;
        this.spawnTick = spawnTick;
        this.serverSimulated = serverSimulated;
        this.lastReportTick = spawnTick;
    }
}
