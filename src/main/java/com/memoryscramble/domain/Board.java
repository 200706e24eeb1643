package com.memoryscramble.domain;

import com.memoryscramble.domain.MemoryGameException.Failure;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Grid of {@link Space}s for one game.
 *
 * <p>Cells live in a single row-major array ({@code index = y * width + x}). The published array is
 * never written after publication: every change is staged on a copy through an {@link Edit}, the
 * copy is validated on {@link Edit#commit()} and only then swapped in. Readers therefore always see
 * a complete, valid snapshot without locking.
 *
 * <p>Invariants, checked on every commit:
 * - the grid holds exactly {@code width * height} non-null spaces
 * - every card still on the board occurs in exactly two cells
 * - card identifiers are non-empty and not whitespace only
 * - a controlled space is face-up, an empty space is face-down and uncontrolled
 *
 * <p>Mutators are not synchronized. Callers serialize them with their own lock (see
 * {@link GameSession}).
 */
public class Board {
  private final int width;
  private final int height;

  private volatile Space[] cells;

  private Board(int width, int height, Space[] cells) {
    this.width = width;
    this.height = height;
    checkRep(cells);
    this.cells = cells;
  }

  /**
   * Build a shuffled board where each card of {@code cards} appears exactly twice.
   *
   * @throws MemoryGameException {@code INVALID_DIMENSIONS} or {@code INVALID_CARD_SET}
   */
  public static Board create(int width, int height, Collection<String> cards) {
    return create(width, height, cards, ThreadLocalRandom.current());
  }

  /** Same as {@link #create(int, int, Collection)} with an explicit source of randomness. */
  public static Board create(int width, int height, Collection<String> cards, Random rnd) {
    int size = checkDimensions(width, height);
    if (cards == null || cards.isEmpty()) {
      throw new MemoryGameException(Failure.INVALID_CARD_SET, "Card set must not be empty");
    }
    Set<String> seen = new HashSet<>();
    for (String c : cards) {
      checkCard(c);
      if (!seen.add(c)) {
        throw new MemoryGameException(Failure.INVALID_CARD_SET, "Duplicate card '" + c + "'");
      }
    }
    if (cards.size() * 2 != size) {
      throw new MemoryGameException(
          Failure.INVALID_CARD_SET,
          "A " + width + "x" + height + " board needs " + size / 2 + " distinct cards, got "
              + cards.size());
    }

    List<String> deck = new ArrayList<>(size);
    for (String c : cards) {
      deck.add(c);
      deck.add(c);
    }
    Collections.shuffle(deck, rnd);
    return of(width, height, deck);
  }

  /**
   * Build a board from an explicit row-major layout. Every identifier must occur exactly twice.
   *
   * @throws MemoryGameException {@code INVALID_DIMENSIONS} or {@code INVALID_CARD_SET}
   */
  public static Board of(int width, int height, List<String> layout) {
    int size = checkDimensions(width, height);
    if (layout == null || layout.size() != size) {
      throw new MemoryGameException(
          Failure.INVALID_CARD_SET,
          "Expected " + size + " cards for a " + width + "x" + height + " board, got "
              + (layout == null ? 0 : layout.size()));
    }
    Map<String, Integer> counts = new TreeMap<>();
    Space[] initial = new Space[size];
    for (int i = 0; i < size; i++) {
      String c = layout.get(i);
      checkCard(c);
      counts.merge(c, 1, Integer::sum);
      initial[i] = Space.faceDown(c);
    }
    counts.forEach(
        (c, n) -> {
          if (n != 2) {
            throw new MemoryGameException(
                Failure.INVALID_CARD_SET,
                "Card '" + c + "' appears " + n + " times, must appear exactly 2 times");
          }
        });
    return new Board(width, height, initial);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public boolean inBounds(int x, int y) {
    return x >= 0 && x < width && y >= 0 && y < height;
  }

  /**
   * Snapshot of the space at (x, y).
   *
   * @throws MemoryGameException {@code OUT_OF_BOUNDS}
   */
  public Space get(int x, int y) {
    return cells[index(x, y)];
  }

  /** Point-in-time, row-major view of every cell. */
  public List<Space> cells() {
    return Collections.unmodifiableList(Arrays.asList(cells));
  }

  /** Card identifier to number of cells still holding it. */
  public Map<String, Integer> cardCounts() {
    Map<String, Integer> counts = new TreeMap<>();
    for (Space s : cells) {
      if (s.hasCard()) counts.merge(s.card(), 1, Integer::sum);
    }
    return counts;
  }

  public int remainingPairs() {
    return cardCounts().size();
  }

  /** Toggle face-up/face-down; turning a card face-down releases its control. */
  public void flip(int x, int y) {
    edit().flip(x, y).commit();
  }

  public void setControl(int x, int y, String player) {
    edit().setControl(x, y, player).commit();
  }

  public void clearControl(int x, int y) {
    edit().clearControl(x, y).commit();
  }

  /** Retire a matched pair in one step. */
  public void removePair(int x1, int y1, int x2, int y2) {
    edit().remove(x1, y1).remove(x2, y2).commit();
  }

  /** Start a staged change against the current snapshot. */
  public Edit edit() {
    return new Edit(cells);
  }

  /**
   * Staged change of several cells. Nothing is visible until {@link #commit()} succeeds; a failed
   * operation or validation leaves the board as it was.
   */
  public final class Edit {
    private final Space[] base;
    private final Space[] staged;
    private boolean committed;

    private Edit(Space[] base) {
      this.base = base;
      this.staged = base.clone();
    }

    public Space get(int x, int y) {
      return staged[index(x, y)];
    }

    public Edit flip(int x, int y) {
      int i = index(x, y);
      Space s = requireCard(i, x, y);
      staged[i] = s.withFaceUp(!s.faceUp());
      return this;
    }

    public Edit setControl(int x, int y, String player) {
      if (player == null || player.isBlank()) {
        throw new IllegalArgumentException("player must be non-empty");
      }
      int i = index(x, y);
      Space s = requireCard(i, x, y);
      if (!s.faceUp()) {
        throw new MemoryGameException(
            Failure.NOT_FACE_UP, "Card at (" + x + ", " + y + ") must be face-up to control");
      }
      staged[i] = s.withController(player);
      return this;
    }

    public Edit clearControl(int x, int y) {
      int i = index(x, y);
      staged[i] = requireCard(i, x, y).withController(null);
      return this;
    }

    /** Empty the cell. The pair invariant only holds again once the partner is removed too. */
    public Edit remove(int x, int y) {
      int i = index(x, y);
      Space s = requireCard(i, x, y);
      if (!s.faceUp()) {
        throw new MemoryGameException(
            Failure.NOT_FACE_UP, "Card at (" + x + ", " + y + ") must be face-up to remove");
      }
      staged[i] = Space.EMPTY;
      return this;
    }

    /** Rename every occurrence of {@code from}; returns how many cells changed. */
    public int replaceCard(String from, String to) {
      checkCard(to);
      int n = 0;
      for (int i = 0; i < staged.length; i++) {
        if (from.equals(staged[i].card())) {
          staged[i] = staged[i].withCard(to);
          n++;
        }
      }
      return n;
    }

    /**
     * Validate the staged cells and publish them.
     *
     * @throws MemoryGameException {@code INVARIANT_VIOLATION}, in which case nothing is published
     * @throws IllegalStateException if the edit was already committed or the board changed since
     *     it was opened
     */
    public void commit() {
      if (committed) throw new IllegalStateException("Edit already committed");
      if (cells != base) throw new IllegalStateException("Board changed during edit");
      checkRep(staged);
      committed = true;
      cells = staged;
    }

    private Space requireCard(int i, int x, int y) {
      Space s = staged[i];
      if (!s.hasCard()) {
        throw new MemoryGameException(Failure.NO_CARD, "No card at (" + x + ", " + y + ")");
      }
      return s;
    }
  }

  private int index(int x, int y) {
    if (!inBounds(x, y)) {
      throw new MemoryGameException(
          Failure.OUT_OF_BOUNDS,
          "Position (" + x + ", " + y + ") out of bounds (" + width + "x" + height + ")");
    }
    return y * width + x;
  }

  private void checkRep(Space[] grid) {
    if (grid.length != width * height) {
      throw violation("Grid holds " + grid.length + " cells, expected " + width * height);
    }
    Map<String, Integer> counts = new TreeMap<>();
    for (int i = 0; i < grid.length; i++) {
      Space s = grid[i];
      int x = i % width;
      int y = i / width;
      if (s == null) throw violation("Missing space at (" + x + ", " + y + ")");
      if (!s.hasCard()) {
        if (s.faceUp() || s.controlled()) {
          throw violation("Empty space at (" + x + ", " + y + ") must be face-down and free");
        }
        continue;
      }
      if (s.card().isBlank()) throw violation("Blank card at (" + x + ", " + y + ")");
      if (s.controlled() && (!s.faceUp() || s.controller().isBlank())) {
        throw violation("Space (" + x + ", " + y + ") controlled but not face-up");
      }
      counts.merge(s.card(), 1, Integer::sum);
    }
    for (Map.Entry<String, Integer> e : counts.entrySet()) {
      if (e.getValue() != 2) {
        throw violation(
            "Card '" + e.getKey() + "' appears " + e.getValue() + " times, must appear exactly 2");
      }
    }
  }

  private static MemoryGameException violation(String message) {
    return new MemoryGameException(Failure.INVARIANT_VIOLATION, message);
  }

  private static int checkDimensions(int width, int height) {
    if (width <= 0 || height <= 0) {
      throw new MemoryGameException(
          Failure.INVALID_DIMENSIONS,
          "Dimensions must be positive, got " + width + "x" + height);
    }
    try {
      return Math.multiplyExact(width, height);
    } catch (ArithmeticException e) {
      throw new MemoryGameException(
          Failure.INVALID_DIMENSIONS, "Board " + width + "x" + height + " is too large", e);
    }
  }

  private static void checkCard(String c) {
    if (c == null || c.isBlank()) {
      throw new MemoryGameException(
          Failure.INVALID_CARD_SET, "Card identifiers must be non-empty and not whitespace");
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Board(" + width + "x" + height + "):");
    Space[] snap = cells;
    for (int i = 0; i < snap.length; i++) {
      if (i % width == 0) sb.append("\n ");
      Space s = snap[i];
      if (!s.hasCard()) sb.append(" [ ]");
      else if (!s.faceUp()) sb.append(" [?]");
      else sb.append(" [").append(s.card()).append(s.controlled() ? "*]" : "]");
    }
    return sb.toString();
  }
}
