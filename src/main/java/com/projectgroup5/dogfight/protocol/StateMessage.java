package com.projectgroup5.dogfight.protocol;

import com.projectgroup5.dogfight.replication.StateDelta;

/**
 * 每 tick 一条：相对于连接上次确认快照的增量
 */
public class StateMessage extends ServerMessage {
    private StateDelta delta;

    public StateMessage() {
    }

    public StateMessage(StateDelta delta) {
        this.delta = delta;
    }

    public StateDelta getDelta() {
        return delta;
    }

    public void setDelta(StateDelta delta) {
        this.delta = delta;
    }
}
