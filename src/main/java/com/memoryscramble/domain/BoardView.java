package com.memoryscramble.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable projection of a game handed to observers. Face-down cards are hidden.
 *
 * @param board rows of cells, {@code board.get(y).get(x)}
 * @param version number of successful mutations so far
 */
public record BoardView(
    String gameId,
    int width,
    int height,
    List<List<Cell>> board,
    Map<String, Integer> scores,
    int remainingPairs,
    long version) {

  public record Cell(String card, boolean faceUp, String controlledBy, boolean removed) {
    static Cell of(Space s) {
      if (!s.hasCard()) return new Cell(null, false, null, true);
      return new Cell(s.faceUp() ? s.card() : null, s.faceUp(), s.controller(), false);
    }
  }

  static BoardView of(String gameId, Board board, Map<String, Integer> scores, long version) {
    List<Space> cells = board.cells();
    List<List<Cell>> rows = new ArrayList<>(board.height());
    int pairs = 0;
    for (int y = 0; y < board.height(); y++) {
      List<Cell> row = new ArrayList<>(board.width());
      for (int x = 0; x < board.width(); x++) {
        Space s = cells.get(y * board.width() + x);
        if (s.hasCard()) pairs++;
        row.add(Cell.of(s));
      }
      rows.add(List.copyOf(row));
    }
    return new BoardView(
        gameId,
        board.width(),
        board.height(),
        List.copyOf(rows),
        new TreeMap<>(scores),
        pairs / 2,
        version);
  }

  public Cell cell(int x, int y) {
    return board.get(y).get(x);
  }

  public boolean finished() {
    return remainingPairs == 0;
  }
}
