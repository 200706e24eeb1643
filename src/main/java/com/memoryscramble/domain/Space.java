package com.memoryscramble.domain;

/**
 * One cell of a {@link Board}. Immutable; the board replaces a space wholesale on every change.
 *
 * <p>A space with a controller is face-up. A space without a card is face-down and uncontrolled.
 */
public record Space(String card, boolean faceUp, String controller) {
  public static final Space EMPTY = new Space(null, false, null);

  public static Space faceDown(String card) {
    return new Space(card, false, null);
  }

  public boolean hasCard() {
    return card != null;
  }

  public boolean controlled() {
    return controller != null;
  }

  public boolean controlledBy(String player) {
    return controller != null && controller.equals(player);
  }

  public Space withFaceUp(boolean up) {
    // a hidden card cannot stay controlled
    return new Space(card, up, up ? controller : null);
  }

  public Space withController(String player) {
    return new Space(card, faceUp, player);
  }

  public Space withCard(String c) {
    return new Space(c, faceUp, controller);
  }
}
