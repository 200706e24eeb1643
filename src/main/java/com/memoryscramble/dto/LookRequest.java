package com.memoryscramble.dto;

import jakarta.validation.constraints.NotBlank;

public record LookRequest(String gameId, @NotBlank String player) {}
