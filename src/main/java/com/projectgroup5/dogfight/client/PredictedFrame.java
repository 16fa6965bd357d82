package com.projectgroup5.dogfight.client;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

/**
 * 按输入序号记录的预测结果，用来和服务器确认的位置比较
 */
public class PredictedFrame {
    private final long seq;
    private final Point3d position;
    private final Vector3d velocity;
    private final Quat4d rotation;

    public PredictedFrame(long seq, Point3d position, Vector3d velocity, Quat4d rotation) {
        this.seq = seq;
        this.position = new Point3d(position);
        this.velocity = new Vector3d(velocity);
        this.rotation = new Quat4d(rotation);
    }

    public long getSeq() {
        return seq;
    }

    public Point3d getPosition() {
        return position;
    }

    public Vector3d getVelocity() {
        return velocity;
    }

    public Quat4d getRotation() {
        return rotation;
    }

    void shift(Vector3d correction) {
        position.add(correction);
    }
}
