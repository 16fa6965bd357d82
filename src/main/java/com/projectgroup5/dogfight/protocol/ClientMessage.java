package com.projectgroup5.dogfight.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 客户端消息基类，按 "type" 字段区分具体类型
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinMessage.class, name = "join"),
        @JsonSubTypes.Type(value = InputMessage.class, name = "input"),
        @JsonSubTypes.Type(value = FireMessage.class, name = "fire"),
        @JsonSubTypes.Type(value = MissileUpdateMessage.class, name = "missileUpdate"),
        @JsonSubTypes.Type(value = ChatMessage.class, name = "chat"),
        @JsonSubTypes.Type(value = AckMessage.class, name = "ack"),
        @JsonSubTypes.Type(value = ResyncRequestMessage.class, name = "resync"),
        @JsonSubTypes.Type(value = PingMessage.class, name = "ping"),
        @JsonSubTypes.Type(value = LeaveMessage.class, name = "leave")
})
public abstract class ClientMessage {

    @JsonIgnore
    public abstract ClientMessageType getMessageType();

    /** 结构校验，不合法时抛 ValidationException */
    public void validate() {
    }

    protected static void requireVector(String field, double[] value, int length) {
        if (value == null || value.length != length) {
            throw new ValidationException(field + " must have " + length + " components");
        }
        for (double v : value) {
            if (!Double.isFinite(v)) {
                throw new ValidationException(field + " contains a non-finite component");
            }
        }
    }
}
