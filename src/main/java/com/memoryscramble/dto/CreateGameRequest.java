package com.memoryscramble.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Either {@code board}, holding board file text ({@code width height} line, then the cards), or
 * {@code width}, {@code height} and the distinct {@code cards} to shuffle.
 */
public record CreateGameRequest(
    @NotBlank String gameId, String board, Integer width, Integer height, List<String> cards) {

  public boolean hasBoardText() {
    return board != null && !board.isBlank();
  }

  public boolean hasCardSet() {
    return width != null && height != null && cards != null;
  }
}
