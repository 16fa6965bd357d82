package com.projectgroup5.dogfight;

import com.projectgroup5.dogfight.game.GameRoomManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DogfightServerApplicationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private GameRoomManager roomManager;

    @Test
    void testContextStartsAndListsRooms() {
        roomManager.getOrCreateRoom(12L);
        ResponseEntity<String> response = restTemplate.getForEntity("/api/rooms", String.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().contains("\"roomId\":12"));
    }
}
