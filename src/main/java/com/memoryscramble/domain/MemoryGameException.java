package com.memoryscramble.domain;

/** Typed failure raised by the board, the session and the registry. */
public class MemoryGameException extends RuntimeException {

  public enum Failure {
    INVALID_DIMENSIONS,
    INVALID_CARD_SET,
    INVALID_BOARD_FILE,
    OUT_OF_BOUNDS,
    NO_CARD,
    NOT_FACE_UP,
    CONTESTED,
    INVARIANT_VIOLATION,
    GAME_NOT_FOUND,
    GAME_EXISTS,
    INVALID_GAME_ID,
    GAME_CLOSED
  }

  private final Failure failure;

  public MemoryGameException(Failure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public MemoryGameException(Failure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public Failure failure() {
    return failure;
  }
}
