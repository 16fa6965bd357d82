package com.projectgroup5.dogfight.game;

import com.projectgroup5.dogfight.config.GameProperties;

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

/**
 * 飞船移动积分规则
 * 客户端预测和服务器边界检查共用同一套参数（加速度、加力、阻尼、限速、场地范围）。
 * 加力只放大加速度，不提高限速，所以服务器的速度和位移上限不受加力影响。
 */
public class ShipMotionModel {

    private final double dragPerFrame;
    private final double arenaHalfExtent;
    private final double boostDrainRate;
    private final double boostRegenRate;
    private final double boostRegenDelay;
    private final double boostMultiplier;

    public ShipMotionModel(double dragPerFrame, double arenaHalfExtent) {
        this(withDrag(dragPerFrame), arenaHalfExtent);
    }

    public ShipMotionModel(GameProperties.Movement movement, double arenaHalfExtent) {
        this.dragPerFrame = movement.getDragPerFrame();
        this.arenaHalfExtent = arenaHalfExtent;
        this.boostDrainRate = movement.getBoostDrainRate();
        this.boostRegenRate = movement.getBoostRegenRate();
        this.boostRegenDelay = movement.getBoostRegenDelay();
        this.boostMultiplier = movement.getBoostMultiplier();
    }

    private static GameProperties.Movement withDrag(double dragPerFrame) {
        GameProperties.Movement movement = new GameProperties.Movement();
        movement.setDragPerFrame(dragPerFrame);
        return movement;
    }

    /**
     * 更新加力燃料：想加力、有推力且还有燃料时消耗，否则在延迟之后回充
     *
     * @param now 模拟时间（秒）
     * @return 这一步是否处于加力状态
     */
    public boolean updateBoost(BoostTank tank, boolean wantsBoost, boolean thrusting, double now, double dt) {
        if (wantsBoost && thrusting && tank.getFuel() > 0) {
            tank.setBoosting(true);
            tank.setFuel(Math.max(0, tank.getFuel() - boostDrainRate * dt));
            tank.setLastBoostTime(now);
        } else {
            tank.setBoosting(false);
            if (now - tank.getLastBoostTime() >= boostRegenDelay - GameWorld.TIMER_EPSILON) {
                tank.setFuel(Math.min(tank.getCapacity(), tank.getFuel() + boostRegenRate * dt));
            }
        }
        return tank.isBoosting();
    }

    public void integrate(ShipClass shipClass, Quat4d rotation, Vector3d localThrust,
                          Point3d position, Vector3d velocity, double dt) {
        integrate(shipClass, rotation, localThrust, false, position, velocity, dt);
    }

    /**
     * 推进一步
     *
     * @param localThrust 机体坐标系下的推力方向（x 右、y 上、-z 前），长度不限
     */
    public void integrate(ShipClass shipClass, Quat4d rotation, Vector3d localThrust, boolean boosting,
                          Point3d position, Vector3d velocity, double dt) {
        if (localThrust.lengthSquared() > 0) {
            Vector3d thrust = new Vector3d(localThrust);
            rotate(rotation, thrust);
            thrust.normalize();
            double acceleration = shipClass.getAcceleration() * (boosting ? boostMultiplier : 1.0);
            thrust.scale(acceleration * dt);
            velocity.add(thrust);
        }

        double maxSpeed = shipClass.getMaxSpeed();
        if (velocity.lengthSquared() > maxSpeed * maxSpeed) {
            velocity.normalize();
            velocity.scale(maxSpeed);
        }

        // 阻尼按 60fps 帧换算
        velocity.scale(Math.pow(dragPerFrame, dt * 60.0));

        position.scaleAdd(dt, velocity, position);
        clampToArena(position, velocity);
    }

    public boolean withinSpeedCap(ShipClass shipClass, Vector3d velocity, double tolerance) {
        double cap = shipClass.getMaxSpeed() * (1.0 + tolerance);
        return velocity.lengthSquared() <= cap * cap;
    }

    public boolean insideArena(Point3d position) {
        return Math.abs(position.x) <= arenaHalfExtent
                && Math.abs(position.y) <= arenaHalfExtent
                && Math.abs(position.z) <= arenaHalfExtent;
    }

    public double getArenaHalfExtent() {
        return arenaHalfExtent;
    }

    private void clampToArena(Point3d position, Vector3d velocity) {
        if (position.x > arenaHalfExtent || position.x < -arenaHalfExtent) {
            position.x = Math.max(-arenaHalfExtent, Math.min(arenaHalfExtent, position.x));
            velocity.x = 0;
        }
        if (position.y > arenaHalfExtent || position.y < -arenaHalfExtent) {
            position.y = Math.max(-arenaHalfExtent, Math.min(arenaHalfExtent, position.y));
            velocity.y = 0;
        }
        if (position.z > arenaHalfExtent || position.z < -arenaHalfExtent) {
            position.z = Math.max(-arenaHalfExtent, Math.min(arenaHalfExtent, position.z));
            velocity.z = 0;
        }
    }

    public static void rotate(Quat4d rotation, Vector3d v) {
        Matrix3d m = new Matrix3d();
        m.set(rotation);
        m.transform(v);
    }
}
