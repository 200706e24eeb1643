package com.memoryscramble.dto;

import com.memoryscramble.domain.FlipResult;

public record FlipResponse(
    boolean ok, String message, String card, Boolean matched, String outcome, int score) {

  public static FlipResponse of(FlipResult r) {
    return new FlipResponse(true, r.message(), r.card(), r.matched(), r.outcome().name(), r.score());
  }
}
