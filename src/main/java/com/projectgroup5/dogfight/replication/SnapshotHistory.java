package com.projectgroup5.dogfight.replication;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 最近 N 个 tick 的快照，按 tick 插入顺序淘汰最旧的
 * 只在房间 tick 线程（服务器）或客户端消息线程中使用，不做同步
 */
public class SnapshotHistory {

    private final int capacity;
    private final LinkedHashMap<Long, WorldSnapshot> snapshots = new LinkedHashMap<>();

    public SnapshotHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void put(WorldSnapshot snapshot) {
        snapshots.put(snapshot.getTick(), snapshot);
        Iterator<Map.Entry<Long, WorldSnapshot>> it = snapshots.entrySet().iterator();
        while (snapshots.size() > capacity && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    /** @return 该 tick 的快照，已淘汰或从未存在时为 null */
    public WorldSnapshot get(long tick) {
        return snapshots.get(tick);
    }

    public boolean contains(long tick) {
        return snapshots.containsKey(tick);
    }

    public int size() {
        return snapshots.size();
    }

    public void clear() {
        snapshots.clear();
    }
}
