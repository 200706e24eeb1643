package com.memoryscramble.infrastructure;

import com.memoryscramble.application.port.BoardPublisher;
import com.memoryscramble.domain.BoardBroadcast;
import com.memoryscramble.dto.BoardUpdateMessage;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Component
public class StompBoardPublisher implements BoardPublisher {
  private final SimpMessagingTemplate ws;

  public StompBoardPublisher(SimpMessagingTemplate ws) {
    this.ws = ws;
  }

  @Override
  public void publish(BoardBroadcast b) {
    BoardUpdateMessage m = BoardUpdateMessage.base(b.view());
    if (b.lastPlayer() != null) {
      m = m.withLastMove(b.lastPlayer());
    }
    if (b.messages() != null && !b.messages().isEmpty()) {
      m = m.withMessages(b.messages());
    }
    ws.convertAndSend("/topic/games/" + b.gameId(), m);
  }
}
