package com.memoryscramble.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.memoryscramble.domain.BoardFile;
import com.memoryscramble.domain.ContestPolicy;
import com.memoryscramble.domain.GameSession;
import com.memoryscramble.domain.MemoryGameException;
import com.memoryscramble.domain.MemoryGameException.Failure;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

class GameRegistryTest {

  private GameRegistry registry;

  @BeforeEach
  void setUp() throws IOException {
    registry =
        new GameRegistry(
            new ByteArrayResource("2 2\nA A\nB B\n".getBytes(StandardCharsets.UTF_8)),
            "Default",
            ContestPolicy.REJECT,
            false);
    registry.loadDefault();
  }

  @Test
  void loadDefault_registersConfiguredBoard() {
    GameSession game = registry.get("default");
    assertEquals("default", registry.defaultGameId());
    assertEquals(ContestPolicy.REJECT, game.policy());
    assertEquals(2, game.view().width());
    assertEquals(List.of("default"), registry.ids());
  }

  @Test
  void loadDefault_rejectsMalformedBoard() {
    GameRegistry bad =
        new GameRegistry(
            new ByteArrayResource("2 2\nA A B\n".getBytes(StandardCharsets.UTF_8)),
            "default",
            ContestPolicy.WAIT,
            true);
    MemoryGameException e = assertThrows(MemoryGameException.class, bad::loadDefault);
    assertEquals(Failure.INVALID_BOARD_FILE, e.failure());
  }

  @Test
  void create_normalizesIdAndRejectsDuplicates() {
    registry.create(" Room-1 ", BoardFile.parse("2 1\nX X"));
    assertEquals(List.of("default", "room-1"), registry.ids());

    MemoryGameException e =
        assertThrows(
            MemoryGameException.class,
            () -> registry.create("room-1", BoardFile.parse("2 1\nY Y")));
    assertEquals(Failure.GAME_EXISTS, e.failure());
  }

  @Test
  void create_rejectsBadIds() {
    for (String id : new String[] {"", "   ", "a b", "über", "x".repeat(33)}) {
      MemoryGameException e =
          assertThrows(
              MemoryGameException.class, () -> registry.create(id, BoardFile.parse("2 1\nX X")));
      assertEquals(Failure.INVALID_GAME_ID, e.failure(), id);
    }
  }

  @Test
  void get_unknownGame() {
    MemoryGameException e = assertThrows(MemoryGameException.class, () -> registry.get("nope"));
    assertEquals(Failure.GAME_NOT_FOUND, e.failure());
    e = assertThrows(MemoryGameException.class, () -> registry.get(null));
    assertEquals(Failure.GAME_NOT_FOUND, e.failure());
  }

  @Test
  void reset_swapsInFreshSessionAndClosesOld() throws Exception {
    GameSession old = registry.get("default");
    old.flip("p1", 0, 0);
    old.flip("p1", 1, 0);

    GameSession fresh = registry.reset("default");

    assertNotSame(old, fresh);
    assertSame(fresh, registry.get("default"));
    assertTrue(old.isClosed());
    assertEquals(2, fresh.view().remainingPairs());
    assertTrue(fresh.scores().isEmpty());
    MemoryGameException e =
        assertThrows(MemoryGameException.class, () -> old.flip("p1", 0, 1));
    assertEquals(Failure.GAME_CLOSED, e.failure());
  }

  @Test
  void reset_unknownGame() {
    MemoryGameException e = assertThrows(MemoryGameException.class, () -> registry.reset("nope"));
    assertEquals(Failure.GAME_NOT_FOUND, e.failure());
  }

  @Test
  void remove_dropsGameButNeverTheDefault() {
    GameSession room = registry.create("room", BoardFile.parse("2 1\nX X"));

    registry.remove("room");

    assertTrue(room.isClosed());
    assertEquals(List.of("default"), registry.ids());
    assertThrows(IllegalStateException.class, () -> registry.remove("default"));
    MemoryGameException e = assertThrows(MemoryGameException.class, () -> registry.remove("room"));
    assertEquals(Failure.GAME_NOT_FOUND, e.failure());
  }

  @Test
  void closeAll_closesEverySession() {
    GameSession def = registry.get("default");
    registry.closeAll();
    assertTrue(def.isClosed());
    assertTrue(registry.ids().isEmpty());
  }
}
