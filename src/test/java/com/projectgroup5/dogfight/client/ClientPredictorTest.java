package com.projectgroup5.dogfight.client;

import com.projectgroup5.dogfight.game.ShipClass;
import com.projectgroup5.dogfight.game.ShipMotionModel;
import com.projectgroup5.dogfight.game.Vectors;
import com.projectgroup5.dogfight.protocol.InputMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

class ClientPredictorTest {

    private static final double DT = 0.05;

    private ClientPredictor predictor;

    @BeforeEach
    void setUp() {
        predictor = new ClientPredictor(ShipClass.FIGHTER, new ShipMotionModel(0.97, 500.0), 4);
    }

    private static ControlInput forward() {
        return new ControlInput(new Vector3d(0, 0, -1), Vectors.identity());
    }

    @Test
    void testInputMovesShipImmediately() {
        InputMessage msg = predictor.applyInput(forward(), DT);
        assertEquals(1L, msg.getSeq());
        assertTrue(predictor.getPosition().z < 0);
        assertTrue(predictor.getVelocity().z < 0);
        assertArrayEquals(Vectors.toArray(predictor.getPosition()), msg.getPosition(), 1e-12);
        msg.validate();
    }

    @Test
    void testSequenceNumbersIncrease() {
        for (int i = 1; i <= 3; i++) {
            assertEquals(i, predictor.applyInput(forward(), DT).getSeq());
        }
        assertEquals(3L, predictor.getLastSeq());
    }

    @Test
    void testMatchesServerMotionModel() {
        ShipMotionModel model = new ShipMotionModel(0.97, 500.0);
        Point3d position = new Point3d();
        Vector3d velocity = new Vector3d();
        for (int i = 0; i < 10; i++) {
            model.integrate(ShipClass.FIGHTER, Vectors.identity(), new Vector3d(0, 0, -1), position, velocity, DT);
            predictor.applyInput(forward(), DT);
        }
        assertTrue(position.epsilonEquals(predictor.getPosition(), 1e-12));
    }

    @Test
    void testBoostIsPredictedAndReported() {
        ClientPredictor plain = new ClientPredictor(ShipClass.FIGHTER, new ShipMotionModel(0.97, 500.0), 4);
        ControlInput boost = new ControlInput(new Vector3d(0, 0, -1), Vectors.identity(), true);
        InputMessage msg = null;
        for (int i = 0; i < 5; i++) {
            msg = predictor.applyInput(boost, DT);
            plain.applyInput(forward(), DT);
        }
        assertTrue(msg.isBoost());
        assertTrue(predictor.isBoosting());
        assertEquals(195.0, predictor.getBoostFuel(), 1e-9);
        assertTrue(predictor.getPosition().z < plain.getPosition().z);

        // 没有推力时按住加力也不算加力
        InputMessage idle = predictor.applyInput(new ControlInput(new Vector3d(), Vectors.identity(), true), DT);
        assertFalse(idle.isBoost());

        predictor.refillBoost();
        assertEquals(200.0, predictor.getBoostFuel(), 1e-12);
    }

    @Test
    void testHistoryIsBounded() {
        for (int i = 0; i < 10; i++) {
            predictor.applyInput(forward(), DT);
        }
        assertEquals(4, predictor.getPendingFrameCount());
        assertNull(predictor.frameAt(6));
        assertNotNull(predictor.frameAt(7));
    }

    @Test
    void testDiscardAndShift() {
        for (int i = 0; i < 3; i++) {
            predictor.applyInput(forward(), DT);
        }
        Point3d third = new Point3d(predictor.frameAt(3).getPosition());
        predictor.discardUpTo(2);
        assertEquals(1, predictor.getPendingFrameCount());

        predictor.shiftBaseline(new Vector3d(1, 0, 0));
        assertEquals(third.x + 1, predictor.frameAt(3).getPosition().x, 1e-12);
        assertEquals(third.x + 1, predictor.getPosition().x, 1e-12);
    }

    @Test
    void testResetKeepsSequence() {
        predictor.applyInput(forward(), DT);
        predictor.resetTo(new Point3d(5, 5, 5), new Quat4d(0, 0, 0, 1), new Vector3d());
        assertEquals(new Point3d(5, 5, 5), predictor.getPosition());
        assertEquals(0, predictor.getPendingFrameCount());
        assertEquals(2L, predictor.applyInput(forward(), DT).getSeq());
    }
}
