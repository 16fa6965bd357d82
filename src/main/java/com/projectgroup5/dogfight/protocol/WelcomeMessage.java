package com.projectgroup5.dogfight.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 只发给刚加入的连接；token 是下次重连用的私有令牌
 */
public class WelcomeMessage extends ServerMessage {
    private String playerId;
    private long roomId;
    private int tickRate;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String token;

    public WelcomeMessage() {
    }

    public WelcomeMessage(String playerId, long roomId, int tickRate) {
        this(playerId, roomId, tickRate, null);
    }

    public WelcomeMessage(String playerId, long roomId, int tickRate, String token) {
        this.playerId = playerId;
        this.roomId = roomId;
        this.tickRate = tickRate;
        this.token = token;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public long getRoomId() {
        return roomId;
    }

    public void setRoomId(long roomId) {
        this.roomId = roomId;
    }

    public int getTickRate() {
        return tickRate;
    }

    public void setTickRate(int tickRate) {
        this.tickRate = tickRate;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }
}
