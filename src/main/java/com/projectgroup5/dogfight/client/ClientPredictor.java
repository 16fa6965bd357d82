package com.projectgroup5.dogfight.client;

import com.projectgroup5.dogfight.game.BoostTank;
import com.projectgroup5.dogfight.game.ShipClass;
import com.projectgroup5.dogfight.game.ShipMotionModel;
import com.projectgroup5.dogfight.game.Vectors;
import com.projectgroup5.dogfight.protocol.InputMessage;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * 本地飞船预测
 * 输入立即作用到影子副本上，同时记下每个序号的预测结果，等服务器确认后再比较
 */
public class ClientPredictor {

    private final ShipClass shipClass;
    private final ShipMotionModel motionModel;
    private final int historySize;

    private final Point3d position = new Point3d();
    private final Vector3d velocity = new Vector3d();
    private final Quat4d rotation = Vectors.identity();
    private final BoostTank boost;
    // 预测侧的模拟时间（秒），加力回充延迟用
    private double clock;

    private final Deque<PredictedFrame> frames = new ArrayDeque<>();
    private long lastSeq;

    public ClientPredictor(ShipClass shipClass, ShipMotionModel motionModel, int historySize) {
        this.shipClass = shipClass;
        this.motionModel = motionModel;
        this.historySize = historySize;
        this.boost = new BoostTank(shipClass.getMaxBoostFuel());
    }

    /**
     * 应用一帧输入
     *
     * @return 需要发给服务器的 input 消息
     */
    public InputMessage applyInput(ControlInput input, double dt) {
        rotation.set(input.getRotation());
        rotation.normalize();
        clock += dt;
        boolean thrusting = input.getThrust().lengthSquared() > 0;
        boolean boosting = motionModel.updateBoost(boost, input.isBoost(), thrusting, clock, dt);
        motionModel.integrate(shipClass, rotation, input.getThrust(), boosting, position, velocity, dt);

        long seq = ++lastSeq;
        frames.addLast(new PredictedFrame(seq, position, velocity, rotation));
        while (frames.size() > historySize) {
            frames.removeFirst();
        }
        InputMessage message = new InputMessage(seq, Vectors.toArray(position), Vectors.toArray(rotation),
                Vectors.toArray(velocity));
        message.setBoost(boosting);
        return message;
    }

    /** @return 该序号的预测；已丢弃或不存在时为 null */
    public PredictedFrame frameAt(long seq) {
        for (PredictedFrame frame : frames) {
            if (frame.getSeq() == seq) {
                return frame;
            }
        }
        return null;
    }

    public void discardUpTo(long seq) {
        Iterator<PredictedFrame> it = frames.iterator();
        while (it.hasNext() && it.next().getSeq() <= seq) {
            it.remove();
        }
    }

    /** 把当前基线和未确认的预测整体平移，后续预测从校正后的位置继续 */
    public void shiftBaseline(Vector3d correction) {
        position.add(correction);
        for (PredictedFrame frame : frames) {
            frame.shift(correction);
        }
    }

    /** 复活或重新同步时直接跳到服务器给的状态；序号继续递增 */
    public void resetTo(Point3d newPosition, Quat4d newRotation, Vector3d newVelocity) {
        position.set(newPosition);
        rotation.set(newRotation);
        velocity.set(newVelocity);
        frames.clear();
    }

    /** 复活时燃料加满 */
    public void refillBoost() {
        boost.refill();
    }

    public double getBoostFuel() {
        return boost.getFuel();
    }

    public boolean isBoosting() {
        return boost.isBoosting();
    }

    public Point3d getPosition() {
        return new Point3d(position);
    }

    public Vector3d getVelocity() {
        return new Vector3d(velocity);
    }

    public Quat4d getRotation() {
        return new Quat4d(rotation);
    }

    public long getLastSeq() {
        return lastSeq;
    }

    public int getPendingFrameCount() {
        return frames.size();
    }
}
