package com.memoryscramble.application.port;

import com.memoryscramble.domain.BoardBroadcast;

public interface BoardPublisher {
  void publish(BoardBroadcast b);
}
