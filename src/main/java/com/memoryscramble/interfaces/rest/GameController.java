package com.memoryscramble.interfaces.rest;

import com.memoryscramble.application.GameCommands;
import com.memoryscramble.domain.BoardView;
import com.memoryscramble.dto.CreateGameRequest;
import com.memoryscramble.dto.FlipResponse;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.Callable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP surface of the game commands.
 *
 * <p>Every command exists twice: under {@code /games/{gameId}/...} and without the prefix for the
 * default game. {@code flip} and {@code watch} may block, so they run asynchronously and do not hold
 * a container thread while suspended.
 */
@RestController
public class GameController {
  private final GameCommands commands;

  public GameController(GameCommands commands) {
    this.commands = commands;
  }

  @GetMapping("/games")
  public List<String> games() {
    return commands.games();
  }

  @PostMapping("/games")
  public ResponseEntity<BoardView> create(@Valid @RequestBody CreateGameRequest req) {
    BoardView created;
    if (req.hasBoardText()) {
      created = commands.create(req.gameId(), req.board());
    } else if (req.hasCardSet()) {
      created = commands.create(req.gameId(), req.width(), req.height(), req.cards());
    } else {
      throw new IllegalArgumentException("Either board or width, height and cards are required");
    }
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @DeleteMapping("/games/{gameId}")
  public ResponseEntity<Void> remove(@PathVariable String gameId) {
    commands.remove(gameId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/games/{gameId}/look/{player}")
  public BoardView look(@PathVariable String gameId, @PathVariable String player) {
    return commands.look(gameId, player);
  }

  @GetMapping("/look/{player}")
  public BoardView look(@PathVariable String player) {
    return look(commands.defaultGameId(), player);
  }

  @PostMapping("/games/{gameId}/flip/{player}/{x},{y}")
  public Callable<FlipResponse> flip(
      @PathVariable String gameId,
      @PathVariable String player,
      @PathVariable int x,
      @PathVariable int y) {
    return () -> FlipResponse.of(commands.flip(gameId, player, x, y));
  }

  @PostMapping("/flip/{player}/{x},{y}")
  public Callable<FlipResponse> flip(
      @PathVariable String player, @PathVariable int x, @PathVariable int y) {
    return flip(commands.defaultGameId(), player, x, y);
  }

  @GetMapping("/games/{gameId}/watch/{player}")
  public Callable<BoardView> watch(@PathVariable String gameId, @PathVariable String player) {
    return () -> commands.watch(gameId, player);
  }

  @GetMapping("/watch/{player}")
  public Callable<BoardView> watch(@PathVariable String player) {
    return watch(commands.defaultGameId(), player);
  }

  @PostMapping("/games/{gameId}/replace/{player}/{from}/{to}")
  public BoardView replace(
      @PathVariable String gameId,
      @PathVariable String player,
      @PathVariable String from,
      @PathVariable String to) {
    return commands.replace(gameId, player, from, to);
  }

  @PostMapping("/replace/{player}/{from}/{to}")
  public BoardView replace(
      @PathVariable String player, @PathVariable String from, @PathVariable String to) {
    return replace(commands.defaultGameId(), player, from, to);
  }

  @PostMapping("/games/{gameId}/reset/{player}")
  public BoardView reset(@PathVariable String gameId, @PathVariable String player) {
    return commands.reset(gameId, player);
  }

  @PostMapping("/reset/{player}")
  public BoardView reset(@PathVariable String player) {
    return reset(commands.defaultGameId(), player);
  }
}
