package com.projectgroup5.dogfight.client;

import com.projectgroup5.dogfight.protocol.InputMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

/**
 * 预测校正状态机 {PREDICTED, RECONCILING, SYNCED}
 *
 * 收到权威状态时，把服务器在 ackedSeq 处的位置和当时的预测比较：
 * 误差不超过阈值则不做任何修正；超过阈值则把预测基线平移到服务器位置，
 * 渲染位置在 blendMillis 内用 smoothstep 从旧位置过渡过去。
 */
public class Reconciler {
    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final ClientPredictor predictor;
    private final double threshold;
    private final long blendMillis;

    private PredictionState state = PredictionState.SYNCED;
    private long lastAppliedTick = -1;

    // 渲染位置 = 预测位置 + visualOffset * (1 - smoothstep)
    private final Vector3d visualOffset = new Vector3d();
    private long blendStartMillis;

    public Reconciler(ClientPredictor predictor, double threshold, long blendMillis) {
        this.predictor = predictor;
        this.threshold = threshold;
        this.blendMillis = blendMillis;
    }

    public InputMessage applyInput(ControlInput input, double dt) {
        if (state == PredictionState.SYNCED) {
            state = PredictionState.PREDICTED;
        }
        return predictor.applyInput(input, dt);
    }

    /**
     * @return 是否触发了校正
     */
    public boolean onAuthoritativeState(long tick, long ackedSeq, Point3d serverPosition, long nowMillis) {
        if (tick <= lastAppliedTick) {
            logger.debug("Dropping stale authoritative state for tick {} (last {})", tick, lastAppliedTick);
            return false;
        }
        lastAppliedTick = tick;
        update(nowMillis);

        PredictedFrame frame = predictor.frameAt(ackedSeq);
        if (frame == null) {
            // 还没有被确认的输入，或者早已丢弃
            return false;
        }
        Vector3d error = new Vector3d();
        error.sub(serverPosition, frame.getPosition());
        predictor.discardUpTo(ackedSeq);

        double magnitude = error.length();
        if (magnitude <= threshold) {
            if (state != PredictionState.RECONCILING) {
                state = predictor.getPendingFrameCount() == 0 ? PredictionState.SYNCED : PredictionState.PREDICTED;
            }
            return false;
        }

        Point3d before = renderedPosition(nowMillis);
        predictor.shiftBaseline(error);
        visualOffset.sub(before, predictor.getPosition());
        blendStartMillis = nowMillis;
        state = PredictionState.RECONCILING;
        logger.debug("Prediction off by {} at seq {}, blending over {} ms", magnitude, ackedSeq, blendMillis);
        return true;
    }

    /** 推进过渡；过渡结束后回到 SYNCED */
    public void update(long nowMillis) {
        if (state == PredictionState.RECONCILING && blendProgress(nowMillis) >= 1.0) {
            visualOffset.set(0, 0, 0);
            state = PredictionState.SYNCED;
        }
    }

    public Point3d renderedPosition(long nowMillis) {
        Point3d rendered = predictor.getPosition();
        if (state == PredictionState.RECONCILING) {
            double remaining = 1.0 - smoothstep(blendProgress(nowMillis));
            rendered.scaleAdd(remaining, visualOffset, rendered);
        }
        return rendered;
    }

    /** 复活等硬跳转：不做过渡 */
    public void reset(Point3d position, Quat4d rotation, Vector3d velocity) {
        predictor.resetTo(position, rotation, velocity);
        visualOffset.set(0, 0, 0);
        state = PredictionState.SYNCED;
    }

    private double blendProgress(long nowMillis) {
        if (blendMillis <= 0) {
            return 1.0;
        }
        double t = (nowMillis - blendStartMillis) / (double) blendMillis;
        return Math.max(0.0, Math.min(1.0, t));
    }

    static double smoothstep(double t) {
        return t * t * (3.0 - 2.0 * t);
    }

    public PredictionState getState() {
        return state;
    }

    public long getLastAppliedTick() {
        return lastAppliedTick;
    }

    public ClientPredictor getPredictor() {
        return predictor;
    }
}
