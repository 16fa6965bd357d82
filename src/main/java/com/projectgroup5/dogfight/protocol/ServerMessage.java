package com.projectgroup5.dogfight.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 服务器消息基类：每 tick 的状态增量 + 离散事件
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WelcomeMessage.class, name = "welcome"),
        @JsonSubTypes.Type(value = StateMessage.class, name = "state"),
        @JsonSubTypes.Type(value = HitMessage.class, name = "hit"),
        @JsonSubTypes.Type(value = KillMessage.class, name = "kill"),
        @JsonSubTypes.Type(value = RespawnMessage.class, name = "respawn"),
        @JsonSubTypes.Type(value = PickupMessage.class, name = "pickup"),
        @JsonSubTypes.Type(value = PhaseChangedMessage.class, name = "phase"),
        @JsonSubTypes.Type(value = ChatBroadcastMessage.class, name = "chat"),
        @JsonSubTypes.Type(value = ErrorMessage.class, name = "error")
})
public abstract class ServerMessage {
}
