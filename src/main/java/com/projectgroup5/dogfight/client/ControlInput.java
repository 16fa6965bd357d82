package com.projectgroup5.dogfight.client;

import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

/**
 * 一帧的操控输入：机体坐标系推力方向 + 目标朝向 + 是否按住加力
 */
public class ControlInput {
    private final Vector3d thrust;
    private final Quat4d rotation;
    private final boolean boost;

    public ControlInput(Vector3d thrust, Quat4d rotation) {
        this(thrust, rotation, false);
    }

    public ControlInput(Vector3d thrust, Quat4d rotation, boolean boost) {
        this.thrust = new Vector3d(thrust);
        this.rotation = new Quat4d(rotation);
        this.boost = boost;
    }

    public boolean isBoost() {
        return boost;
    }

    public Vector3d getThrust() {
        return thrust;
    }

    public Quat4d getRotation() {
        return rotation;
    }
}
