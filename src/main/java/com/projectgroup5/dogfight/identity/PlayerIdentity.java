package com.projectgroup5.dogfight.identity;

import java.util.Objects;

/**
 * 身份层给出的玩家标识：不透明 id + 显示名
 * reconnectToken 只发给本人，可能为 null（不支持重连的身份层）
 */
public class PlayerIdentity {
    private final String id;
    private final String displayName;
    private final String reconnectToken;

    public PlayerIdentity(String id, String displayName) {
        this(id, displayName, null);
    }

    public PlayerIdentity(String id, String displayName, String reconnectToken) {
        this.id = Objects.requireNonNull(id, "id");
        this.displayName = displayName == null ? id : displayName;
        this.reconnectToken = reconnectToken;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getReconnectToken() {
        return reconnectToken;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlayerIdentity that = (PlayerIdentity) o;
        return id.equals(that.id) && displayName.equals(that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName);
    }

    @Override
    public String toString() {
        return displayName + "(" + id + ")";
    }
}
