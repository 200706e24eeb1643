package com.memoryscramble.dto;

public record ErrorMessage(boolean ok, String error, String message) {
  public ErrorMessage(String error, String message) {
    this(false, error, message);
  }
}
