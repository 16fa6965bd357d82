package com.projectgroup5.dogfight.controller;

import com.projectgroup5.dogfight.config.GameProperties;
import com.projectgroup5.dogfight.dto.RoomSummaryDto;
import com.projectgroup5.dogfight.dto.ScoreEntryDto;
import com.projectgroup5.dogfight.game.GamePhase;
import com.projectgroup5.dogfight.game.GameRoom;
import com.projectgroup5.dogfight.game.GameRoomManager;
import com.projectgroup5.dogfight.replication.PlayerState;
import com.projectgroup5.dogfight.replication.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/rooms")
@CrossOrigin(origins = "*")
public class RoomController {

    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    private final GameRoomManager roomManager;
    private final GameProperties properties;

    public RoomController(GameRoomManager roomManager, GameProperties properties) {
        this.roomManager = roomManager;
        this.properties = properties;
    }

    // 所有活跃房间
    @GetMapping
    public ResponseEntity<List<RoomSummaryDto>> listRooms() {
        List<RoomSummaryDto> rooms = new ArrayList<>();
        for (GameRoom room : roomManager.getRooms()) {
            rooms.add(toDto(room));
        }
        rooms.sort(Comparator.comparingLong(RoomSummaryDto::getRoomId));
        return ResponseEntity.ok(rooms);
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<RoomSummaryDto> getRoom(@PathVariable("roomId") long roomId) {
        return roomManager.getRoom(roomId)
                .map(room -> ResponseEntity.ok(toDto(room)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * 管理员重开：只在结算阶段生效，下一 tick 回到大厅
     */
    @PostMapping("/{roomId}/restart")
    public ResponseEntity<?> restart(@PathVariable("roomId") long roomId,
                                     @RequestHeader(name = "X-Admin-Token", required = false) String adminToken) {
        if (!isAdmin(adminToken)) {
            logger.warn("Rejected restart of room {}: bad admin token", roomId);
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Invalid admin token");
        }
        Optional<GameRoom> room = roomManager.getRoom(roomId);
        if (room.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        WorldSnapshot snapshot = room.get().getLatestSnapshot();
        if (snapshot == null || !GamePhase.RESULTS.name().equals(snapshot.getPhase())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("Room is not showing results");
        }
        room.get().requestRestart();
        logger.info("Admin restart requested for room {}", roomId);
        return ResponseEntity.accepted().build();
    }

    private boolean isAdmin(String adminToken) {
        String expected = properties.getAdmin().getToken();
        if (expected == null || expected.isEmpty() || adminToken == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                adminToken.getBytes(StandardCharsets.UTF_8));
    }

    private RoomSummaryDto toDto(GameRoom room) {
        RoomSummaryDto dto = new RoomSummaryDto();
        dto.setRoomId(room.getRoomId());
        dto.setConnections(room.getConnectionCount());
        List<ScoreEntryDto> players = new ArrayList<>();
        WorldSnapshot snapshot = room.getLatestSnapshot();
        if (snapshot == null) {
            dto.setPhase(GamePhase.LOBBY.name());
        } else {
            dto.setPhase(snapshot.getPhase());
            dto.setPhaseTimer(snapshot.getPhaseTimer());
            dto.setTick(snapshot.getTick());
            for (PlayerState player : snapshot.getPlayers().values()) {
                players.add(ScoreEntryDto.from(player));
            }
        }
        dto.setPlayers(players);
        return dto;
    }
}
