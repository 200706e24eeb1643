package com.memoryscramble.application;

import com.memoryscramble.application.port.BoardPublisher;
import com.memoryscramble.domain.BoardBroadcast;
import com.memoryscramble.domain.BoardDefinition;
import com.memoryscramble.domain.BoardFile;
import com.memoryscramble.domain.BoardView;
import com.memoryscramble.domain.FlipResult;
import com.memoryscramble.domain.GameSession;
import com.memoryscramble.domain.MemoryGameException;
import com.memoryscramble.domain.MemoryGameException.Failure;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Command surface for transports: {@code look}, {@code flip}, {@code watch} plus game management.
 *
 * <p>Every successful mutation is published through {@link BoardPublisher} after the session has
 * released its lock. Publications from concurrent flips may arrive out of order; subscribers keep
 * the view with the highest {@code version}.
 *
 * <p>A session closed by a reset while a caller was blocked in it is transparent here: a flip is
 * retried against the new session, a watch returns the new session's view.
 */
@Service
public class GameCommands {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final GameRegistry registry;
  private final BoardPublisher publisher;
  private final Duration flipWait;
  private final Duration watchTimeout;

  public GameCommands(
      GameRegistry registry,
      BoardPublisher publisher,
      @Value("${memory.flip-wait-timeout:30000}") long flipWaitMillis,
      @Value("${memory.watch-timeout:30000}") long watchTimeoutMillis) {
    this.registry = registry;
    this.publisher = publisher;
    this.flipWait = Duration.ofMillis(flipWaitMillis);
    this.watchTimeout = Duration.ofMillis(watchTimeoutMillis);
  }

  public BoardView look(String gameId, String player) {
    return registry.get(gameId).look(player);
  }

  /**
   * Flip a card, waiting for a contested card as the contest policy allows.
   *
   * @throws MemoryGameException see {@link GameSession#flip(String, int, int, Duration)}
   * @throws InterruptedException if the caller was interrupted while waiting
   */
  public FlipResult flip(String gameId, String player, int x, int y) throws InterruptedException {
    while (true) {
      GameSession session = registry.get(gameId);
      FlipResult r;
      try {
        r = session.flip(player, x, y, flipWait);
      } catch (MemoryGameException e) {
        if (e.failure() == Failure.GAME_CLOSED) {
          log.debug("Game {} closed under {}, retrying flip", gameId, player);
          continue;
        }
        throw e;
      }
      BoardBroadcast b = BoardBroadcast.of(session.view()).withLastMove(player);
      if (r.matched() != null) {
        b = b.withMessages(List.of(player + ": " + r.message()));
      }
      publisher.publish(b);
      return r;
    }
  }

  /** Wait for the next change of the game, at most {@code memory.watch-timeout}. */
  public BoardView watch(String gameId, String player) throws InterruptedException {
    GameSession session = registry.get(gameId);
    try {
      return session.watch(player, watchTimeout);
    } catch (MemoryGameException e) {
      if (e.failure() == Failure.GAME_CLOSED) {
        return registry.get(gameId).look(player);
      }
      throw e;
    }
  }

  public BoardView replace(String gameId, String player, String from, String to) {
    BoardView v = registry.get(gameId).replace(player, from, to);
    if (from.equals(to)) {
      return v;
    }
    publisher.publish(
        BoardBroadcast.of(v)
            .withLastMove(player)
            .withMessages(List.of(player + " replaced " + from + " with " + to)));
    return v;
  }

  /** Start the game over with a reshuffled board. */
  public BoardView reset(String gameId, String player) {
    BoardView v = registry.reset(gameId).look(player);
    publisher.publish(
        BoardBroadcast.of(v).withLastMove(player).withMessages(List.of(player + " reset the game")));
    return v;
  }

  /**
   * Create a game from board file text.
   *
   * @throws MemoryGameException {@code INVALID_BOARD_FILE}, {@code INVALID_GAME_ID}, {@code
   *     GAME_EXISTS}
   */
  public BoardView create(String gameId, String boardText) {
    BoardDefinition def = BoardFile.parse(boardText);
    GameSession session = registry.create(gameId, def);
    return session.view();
  }

  /** Create a game from a card set; each card is placed twice at random. */
  public BoardView create(String gameId, int width, int height, Collection<String> cards) {
    return registry.create(gameId, BoardDefinition.of(width, height, cards)).view();
  }

  public void remove(String gameId) {
    registry.remove(gameId);
  }

  public List<String> games() {
    return registry.ids();
  }

  public String defaultGameId() {
    return registry.defaultGameId();
  }
}
