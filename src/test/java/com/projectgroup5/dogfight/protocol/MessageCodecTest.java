package com.projectgroup5.dogfight.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private ObjectMapper mapper;
    private MessageCodec codec;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        codec = new MessageCodec(mapper);
    }

    @Test
    void testDecodeJoin() {
        ClientMessage msg = codec.decodeClient(
                "{\"type\":\"join\",\"roomId\":7,\"name\":\"Ace\",\"shipClass\":\"rogue\",\"token\":\"abc\"}");
        assertEquals(ClientMessageType.JOIN, msg.getMessageType());
        JoinMessage join = (JoinMessage) msg;
        assertEquals(7L, join.getRoomId());
        assertEquals("Ace", join.getName());
        assertEquals("rogue", join.getShipClass());
        assertEquals("abc", join.getToken());
    }

    @Test
    void testDecodeInput() {
        InputMessage input = (InputMessage) codec.decodeClient("{\"type\":\"input\",\"seq\":3,"
                + "\"position\":[1,2,3],\"rotation\":[0,0,0,1],\"velocity\":[0,0,-5]}");
        assertEquals(3L, input.getSeq());
        assertArrayEquals(new double[]{1, 2, 3}, input.getPosition());
        assertArrayEquals(new double[]{0, 0, 0, 1}, input.getRotation());
    }

    @Test
    void testUnknownFieldsAreIgnored() {
        ClientMessage msg = codec.decodeClient("{\"type\":\"ping\",\"clientTime\":123}");
        assertEquals(ClientMessageType.PING, msg.getMessageType());
    }

    @Test
    void testUnknownTypeIsRejected() {
        assertThrows(ValidationException.class, () -> codec.decodeClient("{\"type\":\"teleport\"}"));
    }

    @Test
    void testMissingTypeIsRejected() {
        assertThrows(ValidationException.class, () -> codec.decodeClient("{\"seq\":1}"));
    }

    @Test
    void testMalformedJsonIsRejected() {
        assertThrows(ValidationException.class, () -> codec.decodeClient("{\"type\":\"input\","));
        assertThrows(ValidationException.class, () -> codec.decodeClient("null"));
    }

    @Test
    void testStructuralValidation() {
        assertThrows(ValidationException.class, () -> codec.decodeClient(
                "{\"type\":\"input\",\"seq\":1,\"position\":[1,2],\"rotation\":[0,0,0,1],\"velocity\":[0,0,0]}"));
        assertThrows(ValidationException.class, () -> codec.decodeClient(
                "{\"type\":\"input\",\"seq\":0,\"position\":[1,2,3],\"rotation\":[0,0,0,1],\"velocity\":[0,0,0]}"));
        assertThrows(ValidationException.class, () -> codec.decodeClient(
                "{\"type\":\"fire\",\"weapon\":\"plasma\",\"position\":[0,0,0],\"direction\":[0,0,1]}"));
        assertThrows(ValidationException.class, () -> codec.decodeClient(
                "{\"type\":\"fire\",\"weapon\":\"missile\",\"position\":[0,0,0],\"direction\":[0,0,1]}"));
        assertThrows(ValidationException.class, () -> codec.decodeClient("{\"type\":\"chat\",\"text\":\"  \"}"));
        assertThrows(ValidationException.class, () -> codec.decodeClient("{\"type\":\"join\",\"roomId\":0}"));
        assertThrows(ValidationException.class, () -> codec.decodeClient("{\"type\":\"ack\",\"tick\":-1}"));
    }

    @Test
    void testMissileFireWithClientId() {
        FireMessage fire = (FireMessage) codec.decodeClient(
                "{\"type\":\"fire\",\"weapon\":\"missile\",\"position\":[0,0,0],\"direction\":[0,0,1],\"clientId\":4}");
        assertEquals(4, fire.getClientId());
    }

    @Test
    void testEncodeServerMessageCarriesType() throws Exception {
        JsonNode node = mapper.readTree(codec.encode(new WelcomeMessage("pl-1", 9L, 20)));
        assertEquals("welcome", node.get("type").asText());
        assertEquals("pl-1", node.get("playerId").asText());
        assertEquals(9L, node.get("roomId").asLong());
        assertEquals(20, node.get("tickRate").asInt());
    }

    @Test
    void testDecodeServerMessage() throws Exception {
        ServerMessage msg = codec.decodeServer(codec.encode(new ErrorMessage("room is full")));
        assertTrue(msg instanceof ErrorMessage);
        assertEquals("room is full", ((ErrorMessage) msg).getMessage());
    }

    @Test
    void testDecodeServerGarbage() {
        assertThrows(SnapshotDecodeException.class, () -> codec.decodeServer("{\"type\":\"state\",\"delta\":"));
        assertThrows(SnapshotDecodeException.class, () -> codec.decodeServer("{\"type\":\"nope\"}"));
    }
}
