package com.memoryscramble.domain;

import com.memoryscramble.domain.MemoryGameException.Failure;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Text format for board layouts.
 *
 * <pre>
 * 3 2
 * A B C
 * C B A
 * </pre>
 *
 * The first non-empty line holds {@code width height} (or {@code WIDTHxHEIGHT}); every
 * whitespace-separated token after it is a card identifier in row-major order. Line breaks after
 * the header are not significant.
 */
public final class BoardFile {
  private BoardFile() {}

  public static BoardDefinition parse(InputStream in) throws IOException {
    return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
  }

  /**
   * Parse board text.
   *
   * @throws MemoryGameException {@code INVALID_BOARD_FILE} with a description of the problem
   */
  public static BoardDefinition parse(String text) {
    if (text == null) throw invalid("Board file is empty");
    // UTF-8 byte order mark
    if (text.startsWith("\uFEFF")) text = text.substring(1);

    String[] lines = text.split("\\R");
    int header = 0;
    while (header < lines.length && lines[header].isBlank()) header++;
    if (header == lines.length) throw invalid("Board file is empty");

    String[] dims = lines[header].trim().split("\\s*x\\s*|\\s+");
    if (dims.length != 2) {
      throw invalid("First line must be 'width height', got '" + lines[header].trim() + "'");
    }
    int width;
    int height;
    try {
      width = Integer.parseInt(dims[0]);
      height = Integer.parseInt(dims[1]);
    } catch (NumberFormatException e) {
      throw invalid("Width and height must be integers, got '" + lines[header].trim() + "'");
    }
    if (width <= 0 || height <= 0) {
      throw invalid("Dimensions must be positive, got " + width + "x" + height);
    }

    List<String> cards = new ArrayList<>();
    for (int i = header + 1; i < lines.length; i++) {
      String line = lines[i].trim();
      if (line.isEmpty()) continue;
      for (String token : line.split("\\s+")) {
        cards.add(token);
      }
    }

    long expected = (long) width * height;
    if (cards.size() != expected) {
      throw invalid(
          "Expected " + expected + " cards total, got " + cards.size()
              + " (board is " + width + "x" + height + ")");
    }
    Map<String, Integer> counts = new TreeMap<>();
    cards.forEach(c -> counts.merge(c, 1, Integer::sum));
    for (Map.Entry<String, Integer> e : counts.entrySet()) {
      if (e.getValue() != 2) {
        throw invalid(
            "Card '" + e.getKey() + "' appears " + e.getValue()
                + " times, must appear exactly 2 times");
      }
    }
    return new BoardDefinition(width, height, cards);
  }

  /**
   * Write a board in the format {@link #parse(String)} reads, one line per row.
   *
   * @throws IllegalStateException if pairs were already removed from the board
   */
  public static String format(Board board) {
    StringBuilder sb = new StringBuilder();
    sb.append(board.width()).append(' ').append(board.height()).append('\n');
    List<Space> cells = board.cells();
    for (int y = 0; y < board.height(); y++) {
      for (int x = 0; x < board.width(); x++) {
        Space s = cells.get(y * board.width() + x);
        if (!s.hasCard()) {
          throw new IllegalStateException("Cannot write a board with removed cards");
        }
        if (x > 0) sb.append(' ');
        sb.append(s.card());
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static MemoryGameException invalid(String message) {
    return new MemoryGameException(Failure.INVALID_BOARD_FILE, message);
  }
}
