package com.memoryscramble.dto;

import com.memoryscramble.domain.BoardView;
import java.util.List;

public record BoardUpdateMessage(
    String type, String gameId, String player, List<String> messages, BoardView board) {

  public static BoardUpdateMessage base(BoardView board) {
    return new BoardUpdateMessage("board_update", board.gameId(), null, null, board);
  }

  public BoardUpdateMessage withMessages(List<String> msgs) {
    return new BoardUpdateMessage(type, gameId, player, msgs, board);
  }

  public BoardUpdateMessage withLastMove(String lastPlayer) {
    return new BoardUpdateMessage(type, gameId, lastPlayer, messages, board);
  }
}
