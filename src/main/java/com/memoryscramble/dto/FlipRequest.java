package com.memoryscramble.dto;

import jakarta.validation.constraints.NotBlank;

public record FlipRequest(String gameId, @NotBlank String player, int x, int y) {}
