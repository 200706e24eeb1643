package com.memoryscramble.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/** Dimensions and row-major card layout a game is created from. */
public record BoardDefinition(int width, int height, List<String> layout) {
  public BoardDefinition {
    layout = List.copyOf(layout);
  }

  /**
   * Definition for a shuffled board holding each of {@code cards} twice.
   *
   * @throws MemoryGameException {@code INVALID_DIMENSIONS} or {@code INVALID_CARD_SET}
   */
  public static BoardDefinition of(int width, int height, Collection<String> cards) {
    Board b = Board.create(width, height, cards);
    return new BoardDefinition(width, height, b.cells().stream().map(Space::card).toList());
  }

  /** Distinct card identifiers, in first-seen order. */
  public Set<String> cards() {
    return new LinkedHashSet<>(layout);
  }

  /** Fresh board: shuffled from the card set, or laid out exactly as defined. */
  public Board newBoard(boolean shuffle, Random rnd) {
    return shuffle ? Board.create(width, height, cards(), rnd) : Board.of(width, height, layout);
  }
}
