package com.memoryscramble.domain;

/** What a flip does when another player controls the requested card. */
public enum ContestPolicy {
  /** Suspend until the card is released, then retry the flip from scratch. */
  WAIT,
  /** Fail immediately with {@code CONTESTED}. */
  REJECT
}
