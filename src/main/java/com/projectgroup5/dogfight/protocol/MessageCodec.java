package com.projectgroup5.dogfight.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

/**
 * JSON 编解码（文本帧）
 * 入站消息在边界处解析为具体类型并做结构校验
 */
@Component
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ClientMessage decodeClient(String json) {
        ClientMessage message;
        try {
            message = objectMapper.readValue(json, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed message: " + e.getOriginalMessage(), e);
        }
        if (message == null) {
            throw new ValidationException("empty message");
        }
        message.validate();
        return message;
    }

    public ServerMessage decodeServer(String json) throws SnapshotDecodeException {
        try {
            ServerMessage message = objectMapper.readValue(json, ServerMessage.class);
            if (message == null) {
                throw new SnapshotDecodeException("empty server message");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new SnapshotDecodeException("unparsable server message: " + e.getOriginalMessage(), e);
        }
    }

    public String encode(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }
}
