package com.memoryscramble.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.memoryscramble.domain.BoardBroadcast;
import com.memoryscramble.domain.BoardView;
import com.memoryscramble.domain.ContestPolicy;
import com.memoryscramble.domain.FlipResult;
import com.memoryscramble.domain.FlipResult.Outcome;
import com.memoryscramble.domain.MemoryGameException;
import com.memoryscramble.domain.MemoryGameException.Failure;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

class GameCommandsTest {

  private final List<BoardBroadcast> published = new CopyOnWriteArrayList<>();
  private final ExecutorService pool = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private GameCommands commands(ContestPolicy policy, long flipWait, long watchTimeout)
      throws Exception {
    GameRegistry registry =
        new GameRegistry(
            new ByteArrayResource("2 2\nA A\nB B\n".getBytes(StandardCharsets.UTF_8)),
            "default",
            policy,
            false);
    registry.loadDefault();
    return new GameCommands(registry, published::add, flipWait, watchTimeout);
  }

  @Test
  void flip_publishesNewView() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);

    commands.flip("default", "p1", 0, 0);

    assertEquals(1, published.size());
    BoardBroadcast b = published.get(0);
    assertEquals("default", b.gameId());
    assertEquals("p1", b.lastPlayer());
    assertNull(b.messages());
    assertTrue(b.view().cell(0, 0).faceUp());
  }

  @Test
  void resolvedPair_isAnnounced() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);

    commands.flip("default", "p1", 0, 0);
    FlipResult r = commands.flip("default", "p1", 1, 0);

    assertEquals(Outcome.MATCHED, r.outcome());
    assertEquals(List.of("p1: Matched A!"), published.get(1).messages());
    assertEquals(1, published.get(1).view().scores().get("p1"));
  }

  @Test
  void failedFlip_publishesNothing() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);
    commands.flip("default", "p1", 0, 0);
    published.clear();

    MemoryGameException e =
        assertThrows(MemoryGameException.class, () -> commands.flip("default", "p2", 0, 0));

    assertEquals(Failure.CONTESTED, e.failure());
    assertTrue(published.isEmpty());
  }

  @Test
  void contestedFlip_givesUpAfterConfiguredWait() throws Exception {
    GameCommands commands = commands(ContestPolicy.WAIT, 50, 1000);
    commands.flip("default", "p1", 0, 0);

    MemoryGameException e =
        assertThrows(MemoryGameException.class, () -> commands.flip("default", "p2", 0, 0));
    assertEquals(Failure.CONTESTED, e.failure());
  }

  @Test
  void unknownGame() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);
    MemoryGameException e =
        assertThrows(MemoryGameException.class, () -> commands.look("nope", "p1"));
    assertEquals(Failure.GAME_NOT_FOUND, e.failure());
  }

  @Test
  void watch_timesOutWithCurrentView() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 50);
    BoardView view = commands.watch("default", "w");
    assertEquals(0, view.version());
  }

  @Test
  void reset_wakesWatchersWithFreshBoard() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 5000);
    commands.flip("default", "p1", 0, 0);
    commands.flip("default", "p1", 1, 0);

    Future<BoardView> watcher = pool.submit(() -> commands.watch("default", "w"));
    Thread.sleep(100);
    BoardView fresh = commands.reset("default", "p2");

    BoardView seen = watcher.get(5, TimeUnit.SECONDS);
    assertEquals(2, seen.remainingPairs());
    assertEquals(fresh.version(), seen.version());
    assertEquals(List.of("p2 reset the game"), published.get(published.size() - 1).messages());
  }

  @Test
  void reset_movesWaitingFlipToNewGame() throws Exception {
    GameCommands commands = commands(ContestPolicy.WAIT, 5000, 1000);
    commands.flip("default", "p1", 0, 0);

    Future<FlipResult> waiting = pool.submit(() -> commands.flip("default", "p2", 0, 0));
    Thread.sleep(100);
    commands.reset("default", "p1");

    FlipResult r = waiting.get(5, TimeUnit.SECONDS);
    assertEquals(Outcome.FIRST, r.outcome());
    assertEquals("p2", commands.look("default", "p2").cell(0, 0).controlledBy());
  }

  @Test
  void replace_publishesMessage() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);

    BoardView v = commands.replace("default", "p1", "A", "Z");

    assertEquals(1, v.version());
    assertEquals(List.of("p1 replaced A with Z"), published.get(0).messages());
  }

  @Test
  void replaceWithSameCard_publishesNothing() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);

    BoardView v = commands.replace("default", "p1", "A", "A");

    assertEquals(0, v.version());
    assertTrue(published.isEmpty());
  }

  @Test
  void create_listAndRemove() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);

    BoardView v = commands.create("room", "3 2\nx y z\nz y x\n");

    assertEquals("room", v.gameId());
    assertEquals(3, v.remainingPairs());
    assertEquals(List.of("default", "room"), commands.games());
    commands.remove("room");
    assertEquals(List.of("default"), commands.games());
  }

  @Test
  void create_fromCardSet() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);

    BoardView v = commands.create("cards", 2, 2, List.of("x", "y"));

    assertEquals(2, v.remainingPairs());
    assertEquals(2, v.height());
    MemoryGameException e =
        assertThrows(
            MemoryGameException.class, () -> commands.create("more", 3, 3, List.of("x", "y")));
    assertEquals(Failure.INVALID_CARD_SET, e.failure());
  }

  @Test
  void create_rejectsMalformedBoardText() throws Exception {
    GameCommands commands = commands(ContestPolicy.REJECT, 1000, 1000);
    MemoryGameException e =
        assertThrows(MemoryGameException.class, () -> commands.create("room", "3 2\nx y"));
    assertEquals(Failure.INVALID_BOARD_FILE, e.failure());
  }
}
