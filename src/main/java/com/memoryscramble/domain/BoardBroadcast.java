package com.memoryscramble.domain;

import java.util.List;

public record BoardBroadcast(
    String gameId, BoardView view, String lastPlayer, List<String> messages) {
  public static BoardBroadcast of(BoardView view) {
    return new BoardBroadcast(view.gameId(), view, null, null);
  }

  public BoardBroadcast withLastMove(String player) {
    return new BoardBroadcast(gameId, view, player, messages);
  }

  public BoardBroadcast withMessages(List<String> msgs) {
    return new BoardBroadcast(gameId, view, lastPlayer, msgs);
  }
}
