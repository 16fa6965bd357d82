package com.projectgroup5.dogfight.game;

/**
 * 固定步长时钟
 * 累积真实流逝时间，每次 advance 返回应执行的模拟步数（0、1 或多步），
 * 追帧步数有上限，超出部分直接丢弃，防止负载过高时越追越慢
 */
public class SimulationClock {

    private final long stepNanos;
    private final int maxCatchUpSteps;

    private boolean primed;
    private long lastNanos;
    private long accumulatorNanos;
    private long droppedSteps;

    public SimulationClock(long stepNanos, int maxCatchUpSteps) {
        if (stepNanos <= 0 || maxCatchUpSteps < 1) {
            throw new IllegalArgumentException("stepNanos and maxCatchUpSteps must be positive");
        }
        this.stepNanos = stepNanos;
        this.maxCatchUpSteps = maxCatchUpSteps;
    }

    public int advance(long nowNanos) {
        if (!primed) {
            primed = true;
            lastNanos = nowNanos;
            return 0;
        }
        long elapsed = Math.max(0, nowNanos - lastNanos);
        lastNanos = nowNanos;
        accumulatorNanos += elapsed;

        long due = accumulatorNanos / stepNanos;
        if (due > maxCatchUpSteps) {
            droppedSteps += due - maxCatchUpSteps;
            accumulatorNanos %= stepNanos;
            return maxCatchUpSteps;
        }
        accumulatorNanos -= due * stepNanos;
        return (int) due;
    }

    public long getStepNanos() {
        return stepNanos;
    }

    public long getDroppedSteps() {
        return droppedSteps;
    }
}
