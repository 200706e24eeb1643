package com.memoryscramble.domain;

/**
 * Outcome of one successful flip.
 *
 * @param score the flipping player's score after the flip
 */
public record FlipResult(int x, int y, String card, Outcome outcome, int score) {

  public enum Outcome {
    /** First card of a turn, now held by the player. */
    FIRST,
    /** Second card equal to the first; both removed. */
    MATCHED,
    /** Second card differs from the first; both turned face-down. */
    MISMATCHED,
    /** The player flipped a card it already held; it is face-down again. */
    PUT_BACK
  }

  /** {@code true}/{@code false} once a pair was compared, {@code null} otherwise. */
  public Boolean matched() {
    return switch (outcome) {
      case MATCHED -> Boolean.TRUE;
      case MISMATCHED -> Boolean.FALSE;
      default -> null;
    };
  }

  public String message() {
    return switch (outcome) {
      case FIRST -> "Flipped " + card + " at (" + x + ", " + y + ")";
      case MATCHED -> "Matched " + card + "!";
      case MISMATCHED -> "No match with " + card + " at (" + x + ", " + y + ")";
      case PUT_BACK -> "Put back " + card + " at (" + x + ", " + y + ")";
    };
  }
}
