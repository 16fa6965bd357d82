package com.projectgroup5.dogfight.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.game.GameRoom;
import com.projectgroup5.dogfight.game.ShipClass;
import com.projectgroup5.dogfight.game.TestWorlds;
import com.projectgroup5.dogfight.game.Vectors;
import com.projectgroup5.dogfight.game.system.CollectibleSpawner;
import com.projectgroup5.dogfight.game.system.CombatResolver;
import com.projectgroup5.dogfight.game.system.PhaseController;
import com.projectgroup5.dogfight.game.system.ShieldRegenerator;
import com.projectgroup5.dogfight.identity.PlayerIdentity;
import com.projectgroup5.dogfight.physics.AnalyticSweptShapeQuery;
import com.projectgroup5.dogfight.protocol.MessageCodec;
import com.projectgroup5.dogfight.protocol.ServerMessage;
import com.projectgroup5.dogfight.replication.ConnectionSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 服务器房间和客户端会话通过 JSON 文本直接相连
 */
class ClientServerLoopTest {

    private MessageCodec codec;
    private GameRoom room;
    private ClientGameSession session;
    private final List<ServerMessage> events = new ArrayList<>();
    private final List<String> serverFrames = new ArrayList<>();
    private long now = 1000;

    @BeforeEach
    void setUp() {
        GameProperties properties = new GameProperties();
        codec = new MessageCodec(new ObjectMapper());
        room = new GameRoom(1L, TestWorlds.level(), properties,
                new CombatResolver(properties, new AnalyticSweptShapeQuery()),
                new ShieldRegenerator(properties), new CollectibleSpawner(properties),
                new PhaseController(properties));

        session = new ClientGameSession("pl-a", ShipClass.FIGHTER, 500.0, properties, codec,
                json -> room.submit("c1", codec.decodeClient(json)), events::add, () -> now);

        room.attach(new ConnectionSink() {
            @Override
            public String getConnectionId() {
                return "c1";
            }

            @Override
            public void send(ServerMessage message) {
                String json = codec.encode(message);
                serverFrames.add(json);
                session.onServerText(json);
            }

            @Override
            public void close(String reason) {
            }
        }, new PlayerIdentity("pl-a", "Ace"), ShipClass.FIGHTER);
    }

    private ControlInput forward() {
        return new ControlInput(new Vector3d(0, 0, -1), Vectors.identity());
    }

    @Test
    @DisplayName("Client mirror matches the server snapshot every tick")
    void testMirrorTracksServer() {
        room.step();
        assertEquals(room.getLatestSnapshot(), session.getWorld());
        assertTrue(serverFrames.get(0).contains("\"full\":true"));

        for (int i = 0; i < 20; i++) {
            session.control(forward(), 0.05);
            room.step();
            now += 50;
            assertEquals(room.getLatestSnapshot(), session.getWorld());
        }
        // 确认过基线之后发的是增量
        assertTrue(serverFrames.get(serverFrames.size() - 1).contains("\"full\":false"));
    }

    @Test
    void testLocalPredictionAgreesWithServer() {
        room.step();
        Point3d spawn = session.getReconciler().getPredictor().getPosition();
        assertEquals(new Point3d(0, 0, 0), spawn);

        for (int i = 0; i < 10; i++) {
            session.control(forward(), 0.05);
            room.step();
            now += 50;
        }
        double[] serverPosition = room.getLatestSnapshot().getPlayers().get("pl-a").getPosition();
        assertArrayEquals(serverPosition, Vectors.toArray(session.renderedPosition()), 1e-9);
        assertEquals(PredictionState.SYNCED, session.getReconciler().getState());
        assertEquals(10L, room.getLatestSnapshot().getPlayers().get("pl-a").getLastAckedInputSeq());
    }

    @Test
    void testCorruptFrameTriggersResync() {
        room.step();
        session.onServerText("{\"type\":\"state\",\"delta\":{\"tick\":99,\"base\":98,\"full\":false}}");
        assertTrue(session.getMirror().isAwaitingResync());

        room.step();
        assertFalse(session.getMirror().isAwaitingResync());
        assertEquals(room.getLatestSnapshot(), session.getWorld());
    }
}
