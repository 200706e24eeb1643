package com.memoryscramble.domain;

import com.memoryscramble.domain.FlipResult.Outcome;
import com.memoryscramble.domain.MemoryGameException.Failure;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One running game: a {@link Board}, the players' scores and the cards each player currently
 * holds.
 *
 * <p>Every mutation (board, scores, pending selections) happens under a single {@link
 * ReentrantLock} and ends by publishing a new {@link BoardView}. Reads return the last published
 * view and never take the lock.
 *
 * <p>Two calls may suspend: a first flip of a card held by another player under {@link
 * ContestPolicy#WAIT}, and {@link #watch}. A player already holding a card never waits, so no two
 * players can wait on each other. Both wait on a separate condition, never while holding
 * the mutation lock. Each mutation signals all waiters after the mutation lock is released; a
 * woken waiter re-checks its own condition (a contested flip is re-evaluated from scratch).
 */
public class GameSession {
  private static final Logger log = LoggerFactory.getLogger(GameSession.class);
  private static final Duration MAX_WAIT = Duration.ofDays(1);

  /** A card a player turned face-up and has not yet resolved. */
  public record Selection(int x, int y, String card) {}

  private final String gameId;
  private final Board board;
  private final ContestPolicy policy;

  private final ReentrantLock lock = new ReentrantLock();
  private final ReentrantLock signalLock = new ReentrantLock();
  private final Condition changed = signalLock.newCondition();

  /** Guarded by {@link #lock}. */
  private final Map<String, Integer> scores = new HashMap<>();
  /** Guarded by {@link #lock}; at most two entries per player. */
  private final Map<String, List<Selection>> pending = new HashMap<>();

  private volatile BoardView view;
  private volatile boolean closed;

  public GameSession(String gameId, Board board, ContestPolicy policy) {
    this.gameId = Objects.requireNonNull(gameId, "gameId");
    this.board = Objects.requireNonNull(board, "board");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.view = BoardView.of(gameId, board, scores, 0);
  }

  public String gameId() {
    return gameId;
  }

  public ContestPolicy policy() {
    return policy;
  }

  /** Current view of the game. Never blocks. */
  public BoardView look(String player) {
    requirePlayer(player);
    return view;
  }

  /** Last published view. */
  public BoardView view() {
    return view;
  }

  public long version() {
    return view.version();
  }

  public Map<String, Integer> scores() {
    return view.scores();
  }

  public boolean isFinished() {
    return view.finished();
  }

  public boolean isClosed() {
    return closed;
  }

  public List<Selection> pending(String player) {
    lock.lock();
    try {
      return List.copyOf(pending.getOrDefault(player, List.of()));
    } finally {
      lock.unlock();
    }
  }

  /** Flip without an upper bound on the time spent waiting for a contested card. */
  public FlipResult flip(String player, int x, int y) throws InterruptedException {
    return flip(player, x, y, null);
  }

  /**
   * Flip the card at (x, y) for {@code player}.
   *
   * <p>A face-down card is turned up and held by the player. If it is the player's second card the
   * pair is resolved at once: equal cards are removed and score a point, different cards go back
   * face-down. Flipping a card the player already holds puts it back face-down.
   *
   * @param maxWait upper bound for waiting on a contested card; {@code null} or zero waits as long
   *     as needed
   * @throws MemoryGameException {@code OUT_OF_BOUNDS}, {@code NO_CARD}, {@code CONTESTED} (policy
   *     {@code REJECT}, a second card held by another player, or the wait ran out), {@code
   *     INVARIANT_VIOLATION}, {@code GAME_CLOSED}
   * @throws InterruptedException if interrupted while waiting; nothing was changed
   */
  public FlipResult flip(String player, int x, int y, Duration maxWait)
      throws InterruptedException {
    requirePlayer(player);
    long deadline = deadline(maxWait);

    while (true) {
      long seen;
      FlipResult result = null;
      lock.lock();
      try {
        checkOpen();
        Space s = board.get(x, y);
        if (!s.hasCard()) {
          throw new MemoryGameException(Failure.NO_CARD, "No card at (" + x + ", " + y + ")");
        }
        if (s.controlled() && !s.controlledBy(player)) {
          // only first cards wait; a held card is never blocked on another player
          if (policy == ContestPolicy.REJECT || holdsFirstCard(player)) {
            throw contested(x, y, s.controller());
          }
          seen = view.version();
        } else {
          result = apply(player, x, y, s);
          seen = -1;
        }
      } finally {
        lock.unlock();
      }

      if (result != null) {
        signalChange();
        return result;
      }
      log.debug("Game {}: {} waits for ({}, {})", gameId, player, x, y);
      if (!awaitChange(seen, deadline)) {
        throw contested(x, y, board.get(x, y).controller());
      }
    }
  }

  /** Block until the next change of this game, then return the new view. */
  public BoardView watch(String player) throws InterruptedException {
    return watch(player, null);
  }

  /**
   * Block until the next change of this game.
   *
   * @param timeout {@code null} or zero waits as long as needed; otherwise the unchanged view is
   *     returned once it elapses
   * @throws MemoryGameException {@code GAME_CLOSED} if the game was closed meanwhile
   */
  public BoardView watch(String player, Duration timeout) throws InterruptedException {
    requirePlayer(player);
    checkOpen();
    long seen = view.version();
    awaitChange(seen, deadline(timeout));
    checkOpen();
    return view;
  }

  /**
   * Rename card {@code from} to {@code to} everywhere, including held cards, in one atomic step.
   *
   * @throws MemoryGameException {@code NO_CARD} if {@code from} is not on the board, {@code
   *     INVALID_CARD_SET} for a blank identifier, {@code INVARIANT_VIOLATION} if {@code to} is
   *     already in play (the board is left unchanged)
   */
  public BoardView replace(String player, String from, String to) {
    requirePlayer(player);
    if (from == null || from.isBlank() || to == null || to.isBlank()) {
      throw new MemoryGameException(
          Failure.INVALID_CARD_SET, "Card identifiers must be non-empty and not whitespace");
    }
    BoardView result;
    lock.lock();
    try {
      checkOpen();
      Board.Edit edit = board.edit();
      if (edit.replaceCard(from, to) == 0) {
        throw new MemoryGameException(Failure.NO_CARD, "No card '" + from + "' on the board");
      }
      if (from.equals(to)) {
        return view;
      }
      edit.commit();
      pending.replaceAll(
          (p, held) -> {
            List<Selection> renamed = new ArrayList<>(held.size());
            for (Selection sel : held) {
              renamed.add(from.equals(sel.card()) ? new Selection(sel.x(), sel.y(), to) : sel);
            }
            return renamed;
          });
      result = publish();
    } finally {
      lock.unlock();
    }
    signalChange();
    log.info("Game {}: {} replaced '{}' with '{}'", gameId, player, from, to);
    return result;
  }

  /**
   * Stop the game. Waiting callers wake up and fail with {@code GAME_CLOSED}, as does every later
   * mutating call.
   */
  public void close() {
    lock.lock();
    try {
      if (closed) return;
      closed = true;
      publish();
    } finally {
      lock.unlock();
    }
    signalChange();
  }

  /** Apply a flip to a card that is not held by another player. Caller holds the lock. */
  private FlipResult apply(String player, int x, int y, Space s) {
    List<Selection> held = pending.computeIfAbsent(player, p -> new ArrayList<>(2));
    Board.Edit edit = board.edit();

    if (s.controlledBy(player)) {
      edit.flip(x, y).commit();
      held.removeIf(sel -> sel.x() == x && sel.y() == y);
      publish();
      return new FlipResult(x, y, s.card(), Outcome.PUT_BACK, score(player));
    }

    if (!s.faceUp()) {
      edit.flip(x, y);
    }
    edit.setControl(x, y, player);
    Selection first = held.isEmpty() ? null : held.get(0);
    if (first != null && !edit.get(first.x(), first.y()).controlledBy(player)) {
      // stale selection, start a new turn
      first = null;
    }

    if (first == null) {
      edit.commit();
      held.clear();
      held.add(new Selection(x, y, s.card()));
      scores.putIfAbsent(player, 0);
      publish();
      log.debug("Game {}: {} flipped {} at ({}, {})", gameId, player, s.card(), x, y);
      return new FlipResult(x, y, s.card(), Outcome.FIRST, score(player));
    }

    boolean match = first.card().equals(s.card());
    if (match) {
      edit.clearControl(first.x(), first.y())
          .clearControl(x, y)
          .remove(first.x(), first.y())
          .remove(x, y);
    } else {
      edit.flip(first.x(), first.y()).flip(x, y);
    }
    edit.commit();

    held.clear();
    if (match) {
      scores.merge(player, 1, Integer::sum);
    }
    BoardView v = publish();
    if (match) {
      log.info("Game {}: {} matched {} (score {})", gameId, player, s.card(), score(player));
      if (v.finished()) {
        log.info("Game {}: all pairs matched, scores {}", gameId, v.scores());
      }
    } else {
      log.debug("Game {}: {} missed {} vs {}", gameId, player, first.card(), s.card());
    }
    return new FlipResult(
        x, y, s.card(), match ? Outcome.MATCHED : Outcome.MISMATCHED, score(player));
  }

  /** Caller holds the lock. */
  private boolean holdsFirstCard(String player) {
    List<Selection> held = pending.get(player);
    if (held == null || held.isEmpty()) return false;
    Selection first = held.get(0);
    return board.get(first.x(), first.y()).controlledBy(player);
  }

  private int score(String player) {
    return scores.getOrDefault(player, 0);
  }

  /** Caller holds the lock. */
  private BoardView publish() {
    BoardView v = BoardView.of(gameId, board, scores, view.version() + 1);
    view = v;
    return v;
  }

  private void signalChange() {
    signalLock.lock();
    try {
      changed.signalAll();
    } finally {
      signalLock.unlock();
    }
  }

  /**
   * Wait until the published version differs from {@code seen}.
   *
   * @return false if the deadline passed first
   */
  private boolean awaitChange(long seen, long deadline) throws InterruptedException {
    signalLock.lock();
    try {
      while (view.version() == seen) {
        if (deadline == Long.MAX_VALUE) {
          changed.await();
        } else {
          long left = deadline - System.nanoTime();
          if (left <= 0) return false;
          changed.awaitNanos(left);
        }
      }
      return true;
    } finally {
      signalLock.unlock();
    }
  }

  private static long deadline(Duration d) {
    if (d == null || d.isZero() || d.isNegative()) return Long.MAX_VALUE;
    Duration bounded = d.compareTo(MAX_WAIT) > 0 ? MAX_WAIT : d;
    return System.nanoTime() + bounded.toNanos();
  }

  private void checkOpen() {
    if (closed) {
      throw new MemoryGameException(Failure.GAME_CLOSED, "Game " + gameId + " was closed");
    }
  }

  private static MemoryGameException contested(int x, int y, String controller) {
    String holder = controller == null ? "another player" : controller;
    return new MemoryGameException(
        Failure.CONTESTED, "Card at (" + x + ", " + y + ") is held by " + holder);
  }

  private static void requirePlayer(String player) {
    if (player == null || player.isBlank()) {
      throw new IllegalArgumentException("Player id must not be empty");
    }
  }

  @Override
  public String toString() {
    return "GameSession(" + gameId + ", " + board + ")";
  }
}
